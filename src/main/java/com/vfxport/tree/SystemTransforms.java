package com.vfxport.tree;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code transform: mtx44} field of a system block.
 * Only the system's own field counts; a {@code transform} nested inside an
 * emitter is left alone.
 */
public final class SystemTransforms {

    public static final int SIZE = 16;

    private static final Pattern FIELD = Pattern.compile("(?m)^([ \\t]*)transform[ \\t]*:[ \\t]*mtx44[ \\t]*=[ \\t]*\\{");

    private SystemTransforms() {
    }

    public static double[] identity() {
        return new double[] {
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 1, 0,
            0, 0, 0, 1
        };
    }

    /** Row-major values of the system's transform, or empty when it has none or it is unreadable. */
    public static Optional<double[]> read(String systemBlock) {
        return findOwnField(systemBlock).flatMap(span -> parseValues(span.innerText(systemBlock)));
    }

    /**
     * Replaces the system's transform with {@code matrix}, or adds the field
     * just before the block's closing brace when there is none.
     */
    public static String upsert(String systemBlock, double[] matrix) {
        if (matrix == null || matrix.length != SIZE) {
            throw new IllegalArgumentException("Matrix must have " + SIZE + " values");
        }
        String separator = TextLines.separatorOf(systemBlock);
        Optional<BlockSpan> existing = findOwnField(systemBlock);
        if (existing.isPresent()) {
            BlockSpan span = existing.get();
            String field = fieldText(matrix, span.getIndent(), separator);
            return systemBlock.substring(0, span.getStart()) + field + systemBlock.substring(span.getEnd());
        }

        int close = systemBlock.lastIndexOf('}');
        if (close < 0) {
            throw new IllegalArgumentException("System block has no closing brace");
        }
        String baseIndent = TextLines.leadingWhitespace(systemBlock);
        String fieldIndent = baseIndent + TextLines.INDENT_UNIT;
        String field = fieldText(matrix, fieldIndent, separator);
        int lineStart = TextLines.lineStartOf(systemBlock, close);
        if (TextLines.isBlankBetween(systemBlock, lineStart, close)) {
            return systemBlock.substring(0, lineStart) + field + separator + systemBlock.substring(lineStart);
        }
        return systemBlock.substring(0, close) + separator + field + separator + baseIndent
            + systemBlock.substring(close);
    }

    static String fieldText(double[] matrix, String indent, String separator) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("transform: mtx44 = {").append(separator);
        for (int row = 0; row < 4; row++) {
            sb.append(indent).append(TextLines.INDENT_UNIT);
            for (int col = 0; col < 4; col++) {
                if (col > 0) {
                    sb.append(", ");
                }
                sb.append(TextLines.formatNumber(matrix[row * 4 + col]));
            }
            sb.append(separator);
        }
        sb.append(indent).append('}');
        return sb.toString();
    }

    private static Optional<BlockSpan> findOwnField(String systemBlock) {
        int open = systemBlock.indexOf('{');
        if (open < 0) {
            return Optional.empty();
        }
        Matcher m = FIELD.matcher(systemBlock);
        while (m.find()) {
            if (depthAt(systemBlock, open, m.start()) != 1) {
                continue;
            }
            int fieldOpen = m.end() - 1;
            int fieldClose = BlockScanner.findClosingBrace(systemBlock, fieldOpen);
            if (fieldClose < 0) {
                return Optional.empty();
            }
            LineIndex lines = new LineIndex(systemBlock);
            return Optional.of(new BlockSpan(BlockKind.FIELD, "transform", "mtx44", m.start(), fieldOpen,
                fieldClose + 1, lines.lineOf(m.start()), lines.lineOf(fieldClose), m.group(1)));
        }
        return Optional.empty();
    }

    /** Brace depth at {@code offset}, counting from the brace at {@code open}. */
    private static int depthAt(String text, int open, int offset) {
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < offset; i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"' || c == '\n') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth;
    }

    private static Optional<double[]> parseValues(String inner) {
        String[] tokens = inner.trim().split("[,\\s]+");
        if (tokens.length != SIZE) {
            return Optional.empty();
        }
        double[] values = new double[SIZE];
        try {
            for (int i = 0; i < SIZE; i++) {
                values[i] = Double.parseDouble(tokens[i]);
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(values);
    }
}
