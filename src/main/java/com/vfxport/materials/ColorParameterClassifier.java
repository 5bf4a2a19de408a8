package com.vfxport.materials;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a material shader parameter is a tweakable color or a
 * control value packed into a vec4.
 */
public final class ColorParameterClassifier {

    private static final Pattern FG_BG_COLOR = Pattern.compile("^(fg|bg)color$", Pattern.CASE_INSENSITIVE);

    private static final List<String> CONTROL_SUFFIXES = List.of(
        "strength", "factor", "power", "control",
        "speed", "tile", "modifier", "input",
        "activation", "minmax", "mask", "scale",
        "mult", "offset", "range", "threshold",
        "intensity", "amount", "rate", "size");

    private ColorParameterClassifier() {
    }

    public static boolean isColorParameter(String paramName, double[] values) {
        if (paramName == null || paramName.isEmpty() || values == null || values.length < 3) {
            return false;
        }
        String name = paramName.toLowerCase(Locale.ROOT);
        boolean hasColorIndicator = name.endsWith("color")
            || name.startsWith("tint")
            || FG_BG_COLOR.matcher(paramName).matches();
        if (!hasColorIndicator) {
            return false;
        }
        for (String suffix : CONTROL_SUFFIXES) {
            if (name.endsWith(suffix)) {
                return false;
            }
        }
        return !looksLikeControlValue(values);
    }

    static boolean looksLikeControlValue(double[] values) {
        double r = values[0];
        double g = values[1];
        double b = values[2];
        double a = values.length > 3 ? values[3] : 0;
        if (r > 2 || g > 2 || b > 2) {
            return true;
        }
        // { 8.4, 0, 0, 0 }: a single float
        if (r != 0 && g == 0 && b == 0 && a == 0 && r > 1) {
            return true;
        }
        // { 3, 5, 0, 0 }: a min/max pair
        return r != 0 && g != 0 && b == 0 && a == 0 && (r > 1 || g > 1);
    }
}
