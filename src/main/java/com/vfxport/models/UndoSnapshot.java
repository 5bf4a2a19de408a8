package com.vfxport.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Set;

/**
 * Full copy of session state taken before a mutation.
 */
public final class UndoSnapshot {
    private final VfxTree tree;
    private final String fileText;
    private final String selectedSystemKey;
    private final Set<DeletedEmitterRecord> deletedEmitters;
    private final long timestamp;
    private final String description;

    public UndoSnapshot(VfxTree tree, String fileText, String selectedSystemKey,
                        Set<DeletedEmitterRecord> deletedEmitters, long timestamp, String description) {
        this.tree = tree;
        this.fileText = fileText;
        this.selectedSystemKey = selectedSystemKey;
        this.deletedEmitters = Set.copyOf(deletedEmitters);
        this.timestamp = timestamp;
        this.description = description;
    }

    @JsonIgnore
    public VfxTree getTree() { return tree; }
    @JsonIgnore
    public String getFileText() { return fileText; }
    public String getSelectedSystemKey() { return selectedSystemKey; }
    @JsonIgnore
    public Set<DeletedEmitterRecord> getDeletedEmitters() { return deletedEmitters; }
    /** Epoch millis. */
    public long getTimestamp() { return timestamp; }
    public String getDescription() { return description; }
}
