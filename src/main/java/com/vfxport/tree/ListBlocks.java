package com.vfxport.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Appending to and removing from brace-delimited lists such as
 * {@code list[pointer] = { ... }} or {@code map[hash,link] = { ... }}.
 */
public final class ListBlocks {

    private ListBlocks() {
    }

    /**
     * Adds {@code item} as the last element of {@code list}. The item takes
     * the indentation of the list's existing elements, or one level deeper
     * than the list header when it is empty; {@code {}} is expanded.
     */
    public static String appendItem(String text, BlockSpan list, String item) {
        String sep = TextLines.separatorOf(text);
        String inner = list.innerText(text);
        if (inner.isBlank()) {
            String block = TextLines.reindent(item, list.getIndent() + TextLines.INDENT_UNIT, sep);
            return text.substring(0, list.getOpenBrace()) + "{" + sep + block + sep + list.getIndent() + "}"
                + text.substring(list.getEnd());
        }
        String block = TextLines.reindent(item, childIndent(text, list), sep);
        int closeLineStart = TextLines.lineStartOf(text, list.getCloseBrace());
        if (closeLineStart > list.getOpenBrace()
            && TextLines.isBlankBetween(text, closeLineStart, list.getCloseBrace())) {
            return text.substring(0, closeLineStart) + block + sep + text.substring(closeLineStart);
        }
        return text.substring(0, list.getCloseBrace()) + sep + block + sep + list.getIndent()
            + text.substring(list.getCloseBrace());
    }

    /**
     * Adds a new {@code header {...}} field holding {@code item} as the last
     * field of {@code parent}.
     */
    public static String appendField(String text, BlockSpan parent, String header, String item) {
        String sep = TextLines.separatorOf(text);
        String fieldIndent = parent.getIndent() + TextLines.INDENT_UNIT;
        String field = fieldIndent + header + "{" + sep
            + TextLines.reindent(item, fieldIndent + TextLines.INDENT_UNIT, sep) + sep
            + fieldIndent + "}";
        int closeLineStart = TextLines.lineStartOf(text, parent.getCloseBrace());
        if (closeLineStart > parent.getOpenBrace()
            && TextLines.isBlankBetween(text, closeLineStart, parent.getCloseBrace())) {
            return text.substring(0, closeLineStart) + field + sep + text.substring(closeLineStart);
        }
        return text.substring(0, parent.getCloseBrace()) + sep + field + sep + parent.getIndent()
            + text.substring(parent.getCloseBrace());
    }

    /**
     * Removes the given item spans (any order) and collapses the list to
     * {@code {}} when nothing but whitespace is left.
     */
    public static String removeItems(String text, BlockSpan list, List<BlockSpan> items) {
        String result = text;
        List<BlockSpan> ordered = new ArrayList<>(items);
        ordered.sort((a, b) -> Integer.compare(b.getStart(), a.getStart()));
        for (BlockSpan item : ordered) {
            result = TextLines.removeLines(result, item.getStart(), item.getEnd());
        }
        int removed = text.length() - result.length();
        int close = list.getCloseBrace() - removed;
        String inner = result.substring(list.getOpenBrace() + 1, close);
        if (!inner.isEmpty() && inner.isBlank()) {
            result = result.substring(0, list.getOpenBrace()) + "{}" + result.substring(close + 1);
        }
        return result;
    }

    /** Indentation of the first element line inside the list. */
    static String childIndent(String text, BlockSpan list) {
        int cursor = TextLines.nextLineStart(text, list.getOpenBrace());
        while (cursor < list.getCloseBrace()) {
            int next = TextLines.nextLineStart(text, cursor);
            String line = text.substring(cursor, Math.min(next, list.getCloseBrace()));
            if (!line.isBlank()) {
                return TextLines.leadingWhitespace(line);
            }
            if (next == cursor) {
                break;
            }
            cursor = next;
        }
        return list.getIndent() + TextLines.INDENT_UNIT;
    }

    public static Optional<BlockSpan> fieldIn(String text, BlockSpan parent, String fieldName) {
        return BlockScanner.findField(text, fieldName, parent.getOpenBrace() + 1, parent.getCloseBrace());
    }
}
