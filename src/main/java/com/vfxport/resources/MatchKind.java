package com.vfxport.resources;

/**
 * How a resource-map entry relates to a renamed system. Listed in precedence
 * order: the first kind that applies to an entry is the one reported.
 */
public enum MatchKind {
    EXACT_KEY,
    EXACT_VALUE,
    CASE_INSENSITIVE,
    PATH_SUFFIX,
    NO_MATCH
}
