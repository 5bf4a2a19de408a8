package com.vfxport.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Emitter metadata. The block text is materialized lazily; until then only
 * the name and line span are known.
 */
public class VfxEmitter {
    private String name;
    private String systemKey;
    private int startLine;
    private int endLine;
    private String content;
    private EmitterAttributes attributes;

    public VfxEmitter() {
    }

    public VfxEmitter(String name, String systemKey, int startLine, int endLine) {
        this.name = name;
        this.systemKey = systemKey;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSystemKey() { return systemKey; }
    public void setSystemKey(String systemKey) { this.systemKey = systemKey; }

    public int getStartLine() { return startLine; }
    public void setStartLine(int startLine) { this.startLine = startLine; }

    public int getEndLine() { return endLine; }
    public void setEndLine(int endLine) { this.endLine = endLine; }

    @JsonIgnore
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public EmitterAttributes getAttributes() { return attributes; }
    public void setAttributes(EmitterAttributes attributes) { this.attributes = attributes; }

    public boolean isLoaded() {
        return content != null;
    }

    public VfxEmitter copy() {
        VfxEmitter copy = new VfxEmitter(name, systemKey, startLine, endLine);
        copy.content = content;
        copy.attributes = attributes;
        return copy;
    }
}
