package com.vfxport.external;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds asset paths (string values under {@code assets/} or {@code data/}) in block text.
 */
public final class AssetReferences {

    private static final Pattern STRING_VALUE = Pattern.compile("=\\s*\"([^\"\\r\\n]+)\"");

    private AssetReferences() {
    }

    public static Set<String> find(String blockText) {
        Set<String> paths = new LinkedHashSet<>();
        if (blockText == null) {
            return paths;
        }
        Matcher m = STRING_VALUE.matcher(blockText);
        while (m.find()) {
            String value = m.group(1);
            String lower = value.toLowerCase(Locale.ROOT).replace('\\', '/');
            if ((lower.startsWith("assets/") || lower.startsWith("data/")) && lower.contains(".")) {
                paths.add(value.replace('\\', '/'));
            }
        }
        return paths;
    }
}
