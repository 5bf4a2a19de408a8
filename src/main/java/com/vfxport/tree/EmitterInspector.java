package com.vfxport.tree;

import com.vfxport.models.EmitterAttributes;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls texture references, blend mode and constant colors out of an emitter body.
 */
public final class EmitterInspector {

    private static final Pattern TEXTURE = Pattern.compile(
        ":\\s*string\\s*=\\s*\"([^\"]+\\.(?:tex|dds|tga|png|jpg|jpeg|bmp))\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLEND_MODE = Pattern.compile("blendMode:\\s*u8\\s*=\\s*(\\d+)");
    private static final Pattern COLOR_FIELD = Pattern.compile(
        "(?m)^[ \\t]*(\\w*[cC]olor\\w*):\\s*embed\\s*=\\s*ValueColor\\s*\\{");
    private static final Pattern CONSTANT_VEC4 = Pattern.compile(
        "constantValue:\\s*vec4\\s*=\\s*\\{([^}]*)\\}");

    private EmitterInspector() {
    }

    public static EmitterAttributes inspect(String emitterText) {
        EmitterAttributes attributes = new EmitterAttributes();
        if (emitterText == null) {
            return attributes;
        }
        Matcher texture = TEXTURE.matcher(emitterText);
        while (texture.find()) {
            String path = texture.group(1);
            if (!attributes.getTextures().contains(path)) {
                attributes.getTextures().add(path);
            }
        }
        Matcher blend = BLEND_MODE.matcher(emitterText);
        if (blend.find()) {
            attributes.setBlendMode(Integer.parseInt(blend.group(1)));
        }
        Matcher color = COLOR_FIELD.matcher(emitterText);
        int cursor = 0;
        while (color.find(cursor)) {
            int open = color.end() - 1;
            int close = BlockScanner.findClosingBrace(emitterText, open);
            if (close < 0) {
                break;
            }
            Matcher constant = CONSTANT_VEC4.matcher(emitterText);
            constant.region(open, close);
            if (constant.find()) {
                double[] values = parseVector(constant.group(1));
                if (values != null) {
                    attributes.getColors().putIfAbsent(color.group(1), values);
                }
            }
            cursor = close + 1;
        }
        return attributes;
    }

    /** Parses {@code "r, g, b, a"}; null when any component is not a number. */
    public static double[] parseVector(String components) {
        String[] parts = components.split(",");
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return values;
    }
}
