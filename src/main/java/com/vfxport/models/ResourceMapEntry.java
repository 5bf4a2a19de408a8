package com.vfxport.models;

/**
 * One {@code key = value} line of a {@code resourceMap} block, sides kept as written.
 */
public class ResourceMapEntry {
    private String key;
    private String value;
    private int line;

    public ResourceMapEntry() {
    }

    public ResourceMapEntry(String key, String value, int line) {
        this.key = key;
        this.value = value;
        this.line = line;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public int getLine() { return line; }
    public void setLine(int line) { this.line = line; }
}
