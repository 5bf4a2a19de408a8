package com.vfxport.resources;

import com.vfxport.tree.BlockKind;
import com.vfxport.tree.BlockScanner;
import com.vfxport.tree.BlockSpan;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.ListBlocks;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps {@code resourceMap: map[hash,link]} entries of every ResourceResolver
 * consistent with system names.
 * <p>
 * Each side of an entry is compared to the old name in a fixed order:
 * exact, then case-insensitive, then path suffix (the side ends with
 * {@code "/" + oldName}). Exact and case-insensitive sides are replaced by
 * the new name; a path-suffix side keeps its directory prefix and only the
 * last segment changes. Unmatched sides are left as written.
 */
public final class ResourceMapSynchronizer {

    public static final String RESOURCE_MAP_FIELD = "resourceMap";

    private static final Pattern ENTRY_LINE = Pattern.compile(
        "(?m)^([ \\t]*)(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)([ \\t]*=[ \\t]*)(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)");

    private ResourceMapSynchronizer() {
    }

    public static SideMatch matchSide(String side, String oldName) {
        String bare = EntryKeys.unquote(side);
        String old = EntryKeys.unquote(oldName);
        if (bare == null || old == null || old.isEmpty()) {
            return SideMatch.NONE;
        }
        if (EntryKeys.isHash(bare) && EntryKeys.isHash(old)) {
            return bare.equalsIgnoreCase(old) ? SideMatch.EXACT : SideMatch.NONE;
        }
        if (bare.equals(old)) {
            return SideMatch.EXACT;
        }
        if (bare.toLowerCase(Locale.ROOT).equals(old.toLowerCase(Locale.ROOT))) {
            return SideMatch.CASE_INSENSITIVE;
        }
        if (bare.endsWith("/" + old)) {
            return SideMatch.PATH_SUFFIX;
        }
        return SideMatch.NONE;
    }

    public static EntryMatch match(String key, String value, String oldName) {
        return new EntryMatch(matchSide(key, oldName), matchSide(value, oldName));
    }

    static String rewriteSide(String side, SideMatch match, String oldName, String newName) {
        switch (match) {
            case EXACT:
            case CASE_INSENSITIVE:
                return EntryKeys.format(newName);
            case PATH_SUFFIX:
                String bare = EntryKeys.unquote(side);
                String prefix = bare.substring(0, bare.length() - EntryKeys.unquote(oldName).length());
                return "\"" + prefix + EntryKeys.unquote(newName) + "\"";
            default:
                return side;
        }
    }

    /**
     * Rewrites every entry that references {@code oldName}. Only the matched
     * sides of matched lines change; indentation, spacing and line endings
     * stay as they were.
     */
    public static RenameResult renameReferences(String fileText, String oldName, String newName) {
        List<EntryChange> changes = new ArrayList<>();
        StringBuilder out = new StringBuilder(fileText.length() + 64);
        int copied = 0;
        for (BlockSpan map : resourceMaps(fileText)) {
            Matcher m = ENTRY_LINE.matcher(fileText);
            m.useAnchoringBounds(false);
            m.region(map.getOpenBrace() + 1, map.getCloseBrace());
            while (m.find()) {
                String key = m.group(2);
                String value = m.group(4);
                EntryMatch match = match(key, value, oldName);
                if (match.kind() == MatchKind.NO_MATCH) {
                    continue;
                }
                String newKey = rewriteSide(key, match.getKey(), oldName, newName);
                String newValue = rewriteSide(value, match.getValue(), oldName, newName);
                out.append(fileText, copied, m.start(2))
                    .append(newKey)
                    .append(m.group(3))
                    .append(newValue);
                copied = m.end(4);
                changes.add(new EntryChange(key, value, newKey, newValue, match.kind()));
            }
        }
        out.append(fileText, copied, fileText.length());
        return new RenameResult(out.toString(), changes);
    }

    public static boolean hasEntry(String fileText, String key) {
        for (BlockSpan map : resourceMaps(fileText)) {
            Matcher m = ENTRY_LINE.matcher(fileText);
            m.useAnchoringBounds(false);
            m.region(map.getOpenBrace() + 1, map.getCloseBrace());
            while (m.find()) {
                if (EntryKeys.sameKey(m.group(2), key)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Adds {@code key = value} to the first resource map when no entry with
     * that key exists yet. Files without a ResourceResolver are returned
     * unchanged; so are files whose resolver has no resourceMap field.
     */
    public static String ensureEntry(String fileText, String key, String value) {
        if (hasEntry(fileText, key)) {
            return fileText;
        }
        List<BlockSpan> maps = resourceMaps(fileText);
        if (maps.isEmpty()) {
            return fileText;
        }
        String line = EntryKeys.format(key) + " = " + EntryKeys.format(value);
        return ListBlocks.appendItem(fileText, maps.get(0), line);
    }

    static List<BlockSpan> resourceMaps(String fileText) {
        List<BlockSpan> maps = new ArrayList<>();
        for (BlockSpan resolver : BlockScanner.findEntries(fileText, BlockKind.RESOURCE_RESOLVER)) {
            Optional<BlockSpan> map = BlockScanner.findField(fileText, RESOURCE_MAP_FIELD,
                resolver.getOpenBrace() + 1, resolver.getCloseBrace());
            map.ifPresent(maps::add);
        }
        return maps;
    }

    public static final class EntryChange {
        private final String oldKey;
        private final String oldValue;
        private final String newKey;
        private final String newValue;
        private final MatchKind kind;

        EntryChange(String oldKey, String oldValue, String newKey, String newValue, MatchKind kind) {
            this.oldKey = oldKey;
            this.oldValue = oldValue;
            this.newKey = newKey;
            this.newValue = newValue;
            this.kind = kind;
        }

        public String getOldKey() { return oldKey; }
        public String getOldValue() { return oldValue; }
        public String getNewKey() { return newKey; }
        public String getNewValue() { return newValue; }
        public MatchKind getKind() { return kind; }
    }

    public static final class RenameResult {
        private final String text;
        private final List<EntryChange> changes;

        RenameResult(String text, List<EntryChange> changes) {
            this.text = text;
            this.changes = List.copyOf(changes);
        }

        public String getText() { return text; }
        public List<EntryChange> getChanges() { return changes; }
        public int getChangedCount() { return changes.size(); }
    }
}
