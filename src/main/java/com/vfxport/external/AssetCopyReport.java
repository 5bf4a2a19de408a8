package com.vfxport.external;

import java.util.ArrayList;
import java.util.List;

public class AssetCopyReport {
    private final List<String> copied = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    public List<String> getCopied() { return copied; }
    public List<String> getSkipped() { return skipped; }
    public List<String> getFailed() { return failed; }

    public boolean isEmpty() {
        return copied.isEmpty() && skipped.isEmpty() && failed.isEmpty();
    }

    public String summary() {
        return copied.size() + " copied, " + skipped.size() + " skipped, " + failed.size() + " failed";
    }
}
