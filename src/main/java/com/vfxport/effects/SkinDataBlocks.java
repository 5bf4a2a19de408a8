package com.vfxport.effects;

import com.vfxport.tree.BlockKind;
import com.vfxport.tree.BlockScanner;
import com.vfxport.tree.BlockSpan;
import com.vfxport.tree.ListBlocks;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates and grows the lists that hang off the file's
 * {@code SkinCharacterDataProperties} entry.
 */
final class SkinDataBlocks {

    private SkinDataBlocks() {
    }

    static Optional<BlockSpan> skinData(String text) {
        List<BlockSpan> spans = BlockScanner.findEntries(text, BlockKind.SKIN_DATA);
        return spans.isEmpty() ? Optional.empty() : Optional.of(spans.get(0));
    }

    static Optional<BlockSpan> list(String text, String fieldName) {
        return skinData(text).flatMap(skin -> ListBlocks.fieldIn(text, skin, fieldName));
    }

    /**
     * Appends {@code item} to the named list, creating the list as the last
     * field of the skin data block when it does not exist yet.
     *
     * @throws IllegalStateException when the file has no skin data block
     */
    static String append(String text, String fieldName, String header, String item) {
        Optional<BlockSpan> list = list(text, fieldName);
        if (list.isPresent()) {
            return ListBlocks.appendItem(text, list.get(), item);
        }
        BlockSpan skin = skinData(text)
            .orElseThrow(() -> new IllegalStateException("No SkinCharacterDataProperties entry"));
        return ListBlocks.appendField(text, skin, header, item);
    }

    /** First capture group of {@code pattern} in {@code text}, or null. */
    static String capture(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    static double captureNumber(Pattern pattern, String text, double fallback) {
        String raw = capture(pattern, text);
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
