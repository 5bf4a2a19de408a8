package com.vfxport.session;

import com.vfxport.models.DeletedEmitterRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A computed but not yet applied edit: the new file text plus the session
 * bookkeeping that goes with it.
 */
public final class SessionChange {

    private final String fileText;
    private final String description;
    private final List<DeletedEmitterRecord> deleted = new ArrayList<>();
    private final List<DeletedEmitterRecord> restored = new ArrayList<>();
    private final List<String> createdKeys = new ArrayList<>();
    private final Map<String, String> renamedKeys = new LinkedHashMap<>();
    private String selectedSystemKey;
    private boolean selects;

    public SessionChange(String fileText, String description) {
        this.fileText = fileText;
        this.description = description;
    }

    public SessionChange deleted(String systemKey, String emitterName) {
        deleted.add(new DeletedEmitterRecord(systemKey, emitterName));
        return this;
    }

    public SessionChange restored(String systemKey, String emitterName) {
        restored.add(new DeletedEmitterRecord(systemKey, emitterName));
        return this;
    }

    public SessionChange created(String systemKey) {
        createdKeys.add(systemKey);
        return this;
    }

    public SessionChange renamed(String oldKey, String newKey) {
        renamedKeys.put(oldKey, newKey);
        return this;
    }

    public SessionChange select(String systemKey) {
        this.selectedSystemKey = systemKey;
        this.selects = true;
        return this;
    }

    public String getFileText() { return fileText; }
    public String getDescription() { return description; }
    public List<DeletedEmitterRecord> getDeleted() { return deleted; }
    public List<DeletedEmitterRecord> getRestored() { return restored; }
    public List<String> getCreatedKeys() { return createdKeys; }
    public Map<String, String> getRenamedKeys() { return renamedKeys; }
    public String getSelectedSystemKey() { return selectedSystemKey; }
    public boolean isSelects() { return selects; }
}
