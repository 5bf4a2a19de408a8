package com.vfxport.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds brace-delimited blocks in ritobin text. Every component that needs a
 * block boundary (parsing, extraction, replacement) asks this class, so there
 * is exactly one notion of where a block starts and ends.
 */
public final class BlockScanner {

    private static final Pattern ENTRY_HEADER = Pattern.compile(
        "(?m)^([ \\t]*)(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)[ \\t]*=[ \\t]*([A-Za-z_][A-Za-z0-9_]*)[ \\t]*\\{");

    private BlockScanner() {
    }

    /**
     * Keyed blocks (<code>key = TypeName {</code>) in file order. Matching is
     * non-overlapping: once a block is found, scanning resumes after its
     * closing brace, so nested keyed entries of an outer block are skipped.
     * Blocks whose braces never balance are ignored.
     */
    public static List<BlockSpan> scanEntries(String text) {
        return scanEntries(text, 0, text.length());
    }

    public static List<BlockSpan> scanEntries(String text, int from, int to) {
        return scanEntries(text, from, to, new LineIndex(text));
    }

    public static List<BlockSpan> scanEntries(String text, int from, int to, LineIndex lines) {
        List<BlockSpan> spans = new ArrayList<>();
        Matcher m = ENTRY_HEADER.matcher(text);
        m.region(from, to);
        m.useAnchoringBounds(false);
        int cursor = from;
        while (cursor < to) {
            m.region(cursor, to);
            if (!m.find()) {
                break;
            }
            int open = m.end() - 1;
            int close = findClosingBrace(text, open);
            if (close < 0 || close >= to) {
                cursor = m.end();
                continue;
            }
            String typeName = m.group(3);
            spans.add(new BlockSpan(BlockKind.fromTypeName(typeName), m.group(2), typeName,
                m.start(), open, close + 1, lines.lineOf(m.start()), lines.lineOf(close), m.group(1)));
            cursor = close + 1;
        }
        return spans;
    }

    public static Optional<BlockSpan> findEntry(String text, String key) {
        for (BlockSpan span : scanEntries(text)) {
            if (EntryKeys.sameKey(span.getKey(), key)) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    public static Optional<BlockSpan> findEntry(String text, BlockKind kind, String key) {
        for (BlockSpan span : scanEntries(text)) {
            if (span.getKind() == kind && EntryKeys.sameKey(span.getKey(), key)) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    public static List<BlockSpan> findEntries(String text, BlockKind kind) {
        List<BlockSpan> result = new ArrayList<>();
        for (BlockSpan span : scanEntries(text)) {
            if (span.getKind() == kind) {
                result.add(span);
            }
        }
        return result;
    }

    /** Unkeyed <code>TypeName {</code> blocks inside {@code [from, to)}, non-overlapping. */
    public static List<BlockSpan> scanTyped(String text, String typeName, int from, int to) {
        return scanTyped(text, typeName, from, to, new LineIndex(text));
    }

    public static List<BlockSpan> scanTyped(String text, String typeName, int from, int to, LineIndex lines) {
        Pattern header = Pattern.compile("(?m)^([ \\t]*)" + Pattern.quote(typeName) + "[ \\t]*\\{");
        List<BlockSpan> spans = new ArrayList<>();
        Matcher m = header.matcher(text);
        m.useAnchoringBounds(false);
        int cursor = from;
        while (cursor < to) {
            m.region(cursor, to);
            if (!m.find()) {
                break;
            }
            int open = m.end() - 1;
            int close = findClosingBrace(text, open);
            if (close < 0 || close >= to) {
                cursor = m.end();
                continue;
            }
            spans.add(new BlockSpan(BlockKind.UNKEYED, null, typeName, m.start(), open, close + 1,
                lines.lineOf(m.start()), lines.lineOf(close), m.group(1)));
            cursor = close + 1;
        }
        return spans;
    }

    /**
     * First field block <code>fieldName: type = {</code> inside {@code [from, to)}.
     * The field name is matched case-insensitively.
     */
    public static Optional<BlockSpan> findField(String text, String fieldName, int from, int to) {
        Pattern header = Pattern.compile("(?mi)^([ \\t]*)" + Pattern.quote(fieldName)
            + "[ \\t]*:[^=\\r\\n]*=[ \\t]*(?:[A-Za-z_][A-Za-z0-9_]*[ \\t]*)?\\{");
        Matcher m = header.matcher(text);
        m.useAnchoringBounds(false);
        m.region(from, to);
        if (!m.find()) {
            return Optional.empty();
        }
        int open = m.end() - 1;
        int close = findClosingBrace(text, open);
        if (close < 0 || close >= to) {
            return Optional.empty();
        }
        LineIndex lines = new LineIndex(text);
        return Optional.of(new BlockSpan(BlockKind.FIELD, fieldName, null, m.start(), open, close + 1,
            lines.lineOf(m.start()), lines.lineOf(close), m.group(1)));
    }

    public static Optional<BlockSpan> findField(String text, String fieldName) {
        return findField(text, fieldName, 0, text.length());
    }

    /**
     * Index of the brace closing the one at {@code openIndex}, or -1 when the
     * text ends first. Braces inside double-quoted strings are not counted.
     */
    public static int findClosingBrace(CharSequence text, int openIndex) {
        int depth = 0;
        boolean inString = false;
        for (int i = openIndex; i < text.length(); i++) {
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
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
