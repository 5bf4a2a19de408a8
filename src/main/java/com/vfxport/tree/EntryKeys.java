package com.vfxport.tree;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for entry keys, which are either quoted strings or {@code 0x} hash literals.
 */
public final class EntryKeys {

    private static final Pattern HASH = Pattern.compile("0x[0-9a-fA-F]+");

    private EntryKeys() {
    }

    public static boolean isHash(String value) {
        return value != null && HASH.matcher(value).matches();
    }

    public static boolean isQuoted(String raw) {
        return raw != null && raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"");
    }

    public static String unquote(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return isQuoted(trimmed) ? trimmed.substring(1, trimmed.length() - 1) : trimmed;
    }

    /** Writes a name the way the file expects it: hashes bare, everything else quoted. */
    public static String format(String name) {
        String bare = unquote(name);
        return isHash(bare) ? bare : "\"" + bare + "\"";
    }

    /**
     * Why {@code name} cannot be written inside a quoted literal, or null when
     * it can. Quotes, backslashes and line breaks would end the literal early.
     */
    public static String literalProblem(String name) {
        if (name == null) {
            return null;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '"' || c == '\\') {
                return "Names cannot contain " + c;
            }
            if (c == '\r' || c == '\n') {
                return "Names cannot contain line breaks";
            }
        }
        return null;
    }

    public static boolean sameKey(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String left = unquote(a);
        String right = unquote(b);
        if (isHash(left) && isHash(right)) {
            return left.toLowerCase(Locale.ROOT).equals(right.toLowerCase(Locale.ROOT));
        }
        return left.equals(right);
    }

    /** Last path segment of a key, or the hash itself. */
    public static String displayName(String key) {
        String bare = unquote(key);
        if (bare == null || isHash(bare)) {
            return bare;
        }
        int slash = bare.lastIndexOf('/');
        return slash >= 0 && slash < bare.length() - 1 ? bare.substring(slash + 1) : bare;
    }
}
