package com.vfxport.tree;

import java.math.BigDecimal;

/**
 * Line-level helpers shared by the scanner and the splicing code.
 */
public final class TextLines {

    public static final String INDENT_UNIT = "    ";

    private TextLines() {
    }

    /** The file's own separator: CRLF when the text uses it, LF otherwise. */
    public static String separatorOf(String text) {
        int lf = text.indexOf('\n');
        if (lf > 0 && text.charAt(lf - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }

    public static int lineStartOf(CharSequence text, int offset) {
        int i = Math.min(offset, text.length());
        while (i > 0 && text.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /** Offset just past the line terminator of the line containing {@code offset}. */
    public static int nextLineStart(CharSequence text, int offset) {
        int i = offset;
        while (i < text.length() && text.charAt(i) != '\n') {
            i++;
        }
        return i < text.length() ? i + 1 : i;
    }

    public static boolean isBlankBetween(CharSequence text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Re-bases a block so its first line starts at {@code newIndent}, keeping
     * relative indentation of the lines below it. Blank lines become empty.
     */
    public static String reindent(String block, String newIndent, String separator) {
        String[] lines = block.split("\r?\n", -1);
        int last = lines.length;
        while (last > 1 && lines[last - 1].isBlank()) {
            last--;
        }
        int first = 0;
        while (first < last - 1 && lines[first].isBlank()) {
            first++;
        }
        String base = leadingWhitespace(lines[first]);
        StringBuilder sb = new StringBuilder();
        for (int i = first; i < last; i++) {
            String line = lines[i];
            if (i > first) {
                sb.append(separator);
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith(base)) {
                sb.append(newIndent).append(line.substring(base.length()));
            } else {
                sb.append(newIndent).append(line.stripLeading());
            }
        }
        return sb.toString();
    }

    /**
     * Removes {@code [start, end)} together with the remainder of its last line
     * when that remainder is blank, so no empty line is left behind.
     */
    public static String removeLines(String text, int start, int end) {
        int from = start;
        int lineStart = lineStartOf(text, start);
        if (isBlankBetween(text, lineStart, start)) {
            from = lineStart;
        }
        int to = end;
        int next = nextLineStart(text, end);
        if (isBlankBetween(text, end, next)) {
            to = next;
        }
        return text.substring(0, from) + text.substring(to);
    }

    /** Shortest plain form of a number: {@code 1.0} prints as {@code 1}, {@code 0.50} as {@code 0.5}. */
    public static String formatNumber(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }
}
