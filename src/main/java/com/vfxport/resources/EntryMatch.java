package com.vfxport.resources;

/**
 * Match result for one resource-map entry: each side is judged on its own,
 * then the pair is reduced to a single {@link MatchKind}.
 */
public final class EntryMatch {

    private final SideMatch key;
    private final SideMatch value;

    public EntryMatch(SideMatch key, SideMatch value) {
        this.key = key;
        this.value = value;
    }

    public SideMatch getKey() { return key; }
    public SideMatch getValue() { return value; }

    public MatchKind kind() {
        if (key == SideMatch.EXACT) {
            return MatchKind.EXACT_KEY;
        }
        if (value == SideMatch.EXACT) {
            return MatchKind.EXACT_VALUE;
        }
        if (key == SideMatch.CASE_INSENSITIVE || value == SideMatch.CASE_INSENSITIVE) {
            return MatchKind.CASE_INSENSITIVE;
        }
        if (key == SideMatch.PATH_SUFFIX || value == SideMatch.PATH_SUFFIX) {
            return MatchKind.PATH_SUFFIX;
        }
        return MatchKind.NO_MATCH;
    }

    @Override
    public String toString() {
        return kind() + "(key=" + key + ", value=" + value + ")";
    }
}
