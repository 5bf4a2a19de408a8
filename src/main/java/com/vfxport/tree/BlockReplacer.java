package com.vfxport.tree;

import java.util.Optional;

/**
 * Splices block text back into a full file. Blocks are always re-located by
 * key at call time, so earlier edits in the same pass cannot leave stale
 * offsets behind.
 */
public final class BlockReplacer {

    public static final String ENTRIES_FIELD = "entries";

    private BlockReplacer() {
    }

    public static Optional<String> replace(String fileText, String key, String newBlock) {
        return BlockScanner.findEntry(fileText, key).map(span -> splice(fileText, span, newBlock));
    }

    public static Optional<String> replace(String fileText, BlockKind kind, String key, String newBlock) {
        return BlockScanner.findEntry(fileText, kind, key).map(span -> splice(fileText, span, newBlock));
    }

    public static Optional<String> remove(String fileText, BlockKind kind, String key) {
        return BlockScanner.findEntry(fileText, kind, key)
            .map(span -> TextLines.removeLines(fileText, span.getStart(), span.getEnd()));
    }

    /**
     * Inserts a new top-level entry as the last item of the
     * {@code entries: map[hash,embed]} block, or at the end of the file when
     * the file has no such block.
     */
    public static String insert(String fileText, String blockText) {
        String sep = TextLines.separatorOf(fileText);
        Optional<BlockSpan> entries = BlockScanner.findField(fileText, ENTRIES_FIELD);
        if (entries.isEmpty()) {
            String prefix = fileText.isEmpty() || fileText.endsWith("\n") ? "" : sep;
            return fileText + prefix + TextLines.reindent(blockText, "", sep) + sep;
        }
        return ListBlocks.appendItem(fileText, entries.get(), blockText);
    }

    static String splice(String fileText, BlockSpan span, String newBlock) {
        return fileText.substring(0, span.getStart()) + newBlock + fileText.substring(span.getEnd());
    }
}
