package com.policy.field;

import java.util.List;

/**
 * Field lists declared on a policy rule. Omitted read/write lists default
 * to every field ({@code ["*"]}); deny defaults to none.
 *
 * @param read  Readable fields
 * @param write Writable fields
 * @param deny  Fields removed from both, whatever read/write say
 */
public record FieldSpec(List<String> read, List<String> write, List<String> deny) {

    public static final String ALL = "*";
    public static final List<String> ALL_FIELDS = List.of(ALL);

    public FieldSpec {
        read = read == null ? ALL_FIELDS : List.copyOf(read);
        write = write == null ? ALL_FIELDS : List.copyOf(write);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static FieldSpec unrestricted() {
        return new FieldSpec(null, null, null);
    }
}
