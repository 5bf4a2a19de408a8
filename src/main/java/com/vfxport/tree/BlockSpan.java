package com.vfxport.tree;

/**
 * Character and line extent of one brace-delimited block.
 * The start offset points at the beginning of the header line, so the
 * header's indentation is part of the block text.
 */
public final class BlockSpan {

    private final BlockKind kind;
    private final String key;
    private final String typeName;
    private final int start;
    private final int openBrace;
    private final int end;
    private final int startLine;
    private final int endLine;
    private final String indent;

    public BlockSpan(BlockKind kind, String key, String typeName, int start, int openBrace, int end,
                     int startLine, int endLine, String indent) {
        this.kind = kind;
        this.key = key;
        this.typeName = typeName;
        this.start = start;
        this.openBrace = openBrace;
        this.end = end;
        this.startLine = startLine;
        this.endLine = endLine;
        this.indent = indent == null ? "" : indent;
    }

    public BlockKind getKind() { return kind; }
    public String getKey() { return key; }
    public String getTypeName() { return typeName; }
    public int getStart() { return start; }
    public int getOpenBrace() { return openBrace; }
    /** Exclusive; the closing brace sits at {@code end - 1}. */
    public int getEnd() { return end; }
    public int getCloseBrace() { return end - 1; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getIndent() { return indent; }

    public String text(String source) {
        return source.substring(start, end);
    }

    public String innerText(String source) {
        return source.substring(openBrace + 1, end - 1);
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /** Same span shifted by {@code delta} characters and {@code lineDelta} lines. */
    public BlockSpan shift(int delta, int lineDelta) {
        return new BlockSpan(kind, key, typeName, start + delta, openBrace + delta, end + delta,
            startLine + lineDelta, endLine + lineDelta, indent);
    }

    @Override
    public String toString() {
        return kind + "[" + key + " " + startLine + "-" + endLine + "]";
    }
}
