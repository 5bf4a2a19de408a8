package com.vfxport.tree;

import java.util.Arrays;

/**
 * Maps character offsets to 1-based line numbers.
 */
public final class LineIndex {

    private final int[] lineStarts;

    public LineIndex(CharSequence text) {
        int[] starts = new int[64];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx >= 0) {
            return idx + 1;
        }
        return -idx - 1;
    }

    /** Offset of the first character of a 1-based line. */
    public int lineStart(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("No line " + line);
        }
        return lineStarts[line - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
