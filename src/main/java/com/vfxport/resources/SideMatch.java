package com.vfxport.resources;

/**
 * How one side (key or value) of an entry matched the old name.
 */
public enum SideMatch {
    EXACT,
    CASE_INSENSITIVE,
    PATH_SUFFIX,
    NONE;

    public boolean isMatch() {
        return this != NONE;
    }
}
