package com.vfxport.effects;

import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.TextLines;

/**
 * Builds nested ritobin blocks line by line. Output starts at column zero and
 * uses {@code \n}; callers re-indent it into place.
 */
final class BlockWriter {

    private final StringBuilder out = new StringBuilder();
    private int depth;

    BlockWriter open(String header) {
        return line(header + " {").indent();
    }

    BlockWriter close() {
        depth--;
        return line("}");
    }

    BlockWriter line(String text) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(TextLines.INDENT_UNIT.repeat(Math.max(0, depth))).append(text);
        return this;
    }

    BlockWriter hash(String field, String value) {
        return line(field + ": hash = " + EntryKeys.format(literal(value)));
    }

    BlockWriter string(String field, String value) {
        return line(field + ": string = \"" + literal(value) + "\"");
    }

    BlockWriter f32(String field, double value) {
        return line(field + ": f32 = " + TextLines.formatNumber(value));
    }

    BlockWriter hashList(String field, Iterable<String> values) {
        open(field + ": list[hash] =");
        for (String value : values) {
            line(EntryKeys.format(literal(value)));
        }
        return close();
    }

    private static String literal(String value) {
        String problem = EntryKeys.literalProblem(value);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return value;
    }

    private BlockWriter indent() {
        depth++;
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
