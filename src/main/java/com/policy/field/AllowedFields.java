package com.policy.field;

import java.util.List;

/**
 * Effective readable and writable fields after deny has been applied.
 * <p>
 * When read or write is still {@code ["*"]}, the deny list cannot be
 * subtracted up front, so it is carried along and applied per record by
 * {@link FieldFilter#filterDataFields(java.util.Map, List, List)}.
 *
 * @param read  Readable field names, or {@code ["*"]}
 * @param write Writable field names, or {@code ["*"]}
 * @param deny  Denied field names
 */
public record AllowedFields(List<String> read, List<String> write, List<String> deny) {

    public AllowedFields {
        read = read == null ? List.of() : List.copyOf(read);
        write = write == null ? List.of() : List.copyOf(write);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public AllowedFields(List<String> read, List<String> write) {
        this(read, write, List.of());
    }

    /**
     * Nothing readable or writable.
     */
    public static AllowedFields none() {
        return new AllowedFields(List.of(), List.of());
    }

    public static AllowedFields all() {
        return new AllowedFields(FieldSpec.ALL_FIELDS, FieldSpec.ALL_FIELDS);
    }

    public boolean canRead(String field) {
        return permits(read, field);
    }

    public boolean canWrite(String field) {
        return permits(write, field);
    }

    private boolean permits(List<String> fields, String field) {
        return !deny.contains(field) && (fields.contains(FieldSpec.ALL) || fields.contains(field));
    }
}
