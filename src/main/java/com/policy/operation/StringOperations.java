package com.policy.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text: concat, upper, lower, capitalize, trim, substring, replace, split,
 * join, contains, startsWith, endsWith, length. Null inputs read as "".
 */
final class StringOperations {

    private StringOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("concat", StringOperations::concat);
        registry.operation("upper", args -> Args.string(args, 0).toUpperCase(Locale.ROOT));
        registry.operation("lower", args -> Args.string(args, 0).toLowerCase(Locale.ROOT));
        registry.operation("capitalize", args -> capitalize(Args.string(args, 0)));
        registry.operation("trim", args -> Args.string(args, 0).trim());
        registry.operation("substring", StringOperations::substring);
        registry.operation("replace", StringOperations::replace);
        registry.operation("split", StringOperations::split);
        registry.operation("join", StringOperations::join);
        registry.operation("contains", StringOperations::contains);
        registry.operation("startsWith", args -> Args.string(args, 0).startsWith(Args.string(args, 1)));
        registry.operation("endsWith", args -> Args.string(args, 0).endsWith(Args.string(args, 1)));
        registry.operation("length", StringOperations::length);
    }

    private static Object concat(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            sb.append(Args.string(args, i));
        }
        return sb.toString();
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    private static Object substring(List<Object> args) {
        String s = Args.string(args, 0);
        int start = clamp(Args.integer("substring", args, 1), s.length());
        int end = Args.get(args, 2) == null ? s.length() : clamp(Args.integer("substring", args, 2), s.length());
        return start <= end ? s.substring(start, end) : s.substring(end, start);
    }

    private static int clamp(int index, int length) {
        return Math.max(0, Math.min(index, length));
    }

    /**
     * Replaces the first occurrence only.
     */
    private static Object replace(List<Object> args) {
        String s = Args.string(args, 0);
        String search = Args.string(args, 1);
        String replacement = Args.string(args, 2);
        int index = s.indexOf(search);
        if (index < 0) {
            return s;
        }
        return s.substring(0, index) + replacement + s.substring(index + search.length());
    }

    private static Object split(List<Object> args) {
        String s = Args.string(args, 0);
        String separator = Args.string(args, 1);
        List<Object> parts = new ArrayList<>();
        if (separator.isEmpty()) {
            s.codePoints().forEach(cp -> parts.add(new String(Character.toChars(cp))));
        } else {
            Collections.addAll(parts, (Object[]) s.split(Pattern.quote(separator), -1));
        }
        return Collections.unmodifiableList(parts);
    }

    private static Object join(List<Object> args) {
        List<?> items = Args.list(args, 0);
        if (items == null) {
            return "";
        }
        String separator = Args.get(args, 1) == null ? "," : Args.string(args, 1);
        List<String> parts = new ArrayList<>(items.size());
        for (Object item : items) {
            parts.add(item == null ? "" : String.valueOf(item));
        }
        return String.join(separator, parts);
    }

    /**
     * Substring test for strings, membership test for lists.
     */
    private static Object contains(List<Object> args) {
        Object haystack = Args.get(args, 0);
        Object needle = Args.get(args, 1);
        if (haystack instanceof List<?> list) {
            return list.stream().anyMatch(item -> ValueConverter.valuesEqual(item, needle));
        }
        if (haystack == null || needle == null) {
            return false;
        }
        return String.valueOf(haystack).contains(String.valueOf(needle));
    }

    private static Object length(List<Object> args) {
        Object value = Args.get(args, 0);
        if (value instanceof List<?> list) {
            return (long) list.size();
        }
        return (long) Args.string(args, 0).length();
    }
}
