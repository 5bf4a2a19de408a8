package com.vfxport.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Emitter-level edits on the text of a single system block. Every method takes
 * the system block and returns a new one; nothing outside the touched emitter
 * or emitter list changes.
 */
public final class EmitterBlocks {

    public static final String EMITTER_LIST_FIELD = "complexEmitterDefinitionData";
    public static final String EMITTER_LIST_HEADER = EMITTER_LIST_FIELD + ": list[pointer] = ";

    private static final Pattern EMITTER_NAME_FIELD = Pattern.compile(
        "(emitterName:\\s*string\\s*=\\s*)\"[^\"]*\"", Pattern.CASE_INSENSITIVE);

    private EmitterBlocks() {
    }

    public static List<BlockSpan> emitterSpans(String systemText) {
        int open = systemText.indexOf('{');
        if (open < 0) {
            return new ArrayList<>();
        }
        int close = BlockScanner.findClosingBrace(systemText, open);
        int end = close < 0 ? systemText.length() : close;
        return BlockScanner.scanTyped(systemText, PropertyTreeParser.EMITTER_TYPE, open + 1, end);
    }

    public static Optional<BlockSpan> find(String systemText, String emitterName) {
        for (BlockSpan span : emitterSpans(systemText)) {
            if (emitterName.equals(PropertyTreeParser.emitterName(span.text(systemText)))) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> extract(String systemText, String emitterName) {
        if (systemText == null || emitterName == null) {
            return Optional.empty();
        }
        return find(systemText, emitterName).map(span -> span.text(systemText));
    }

    public static Optional<String> remove(String systemText, String emitterName) {
        Optional<BlockSpan> span = find(systemText, emitterName);
        if (span.isEmpty()) {
            return Optional.empty();
        }
        Optional<BlockSpan> list = BlockScanner.findField(systemText, EMITTER_LIST_FIELD);
        if (list.isEmpty()) {
            return Optional.of(TextLines.removeLines(systemText, span.get().getStart(), span.get().getEnd()));
        }
        return Optional.of(ListBlocks.removeItems(systemText, list.get(), List.of(span.get())));
    }

    public static String removeAll(String systemText) {
        List<BlockSpan> spans = emitterSpans(systemText);
        Optional<BlockSpan> list = BlockScanner.findField(systemText, EMITTER_LIST_FIELD);
        if (spans.isEmpty() || list.isEmpty()) {
            return systemText;
        }
        return ListBlocks.removeItems(systemText, list.get(), spans);
    }

    /**
     * Appends an emitter block at the end of the emitter list, re-indenting it
     * to match its new siblings. An empty {@code {}} list is expanded and a
     * missing list is created right after the system header.
     */
    public static String append(String systemText, String emitterText) {
        int systemOpen = systemText.indexOf('{');
        int systemClose = BlockScanner.findClosingBrace(systemText, systemOpen);
        Optional<BlockSpan> list = BlockScanner.findField(systemText, EMITTER_LIST_FIELD, systemOpen + 1,
            systemClose < 0 ? systemText.length() : systemClose);
        if (list.isPresent()) {
            return ListBlocks.appendItem(systemText, list.get(), emitterText);
        }
        String sep = TextLines.separatorOf(systemText);
        String fieldIndent = TextLines.leadingWhitespace(systemText) + TextLines.INDENT_UNIT;
        String field = fieldIndent + EMITTER_LIST_HEADER + "{" + sep
            + TextLines.reindent(emitterText, fieldIndent + TextLines.INDENT_UNIT, sep) + sep
            + fieldIndent + "}" + sep;
        int insertAt = TextLines.nextLineStart(systemText, systemOpen);
        return systemText.substring(0, insertAt) + field + systemText.substring(insertAt);
    }

    /** Rewrites the first {@code emitterName} field of an emitter block. */
    public static String rename(String emitterText, String newName) {
        Matcher m = EMITTER_NAME_FIELD.matcher(emitterText);
        if (!m.find()) {
            return emitterText;
        }
        return emitterText.substring(0, m.start()) + m.group(1) + "\"" + newName + "\"" + emitterText.substring(m.end());
    }

    public static Optional<String> rename(String systemText, String oldName, String newName) {
        Optional<BlockSpan> span = find(systemText, oldName);
        if (span.isEmpty()) {
            return Optional.empty();
        }
        BlockSpan s = span.get();
        String renamed = rename(s.text(systemText), newName);
        return Optional.of(systemText.substring(0, s.getStart()) + renamed + systemText.substring(s.getEnd()));
    }
}
