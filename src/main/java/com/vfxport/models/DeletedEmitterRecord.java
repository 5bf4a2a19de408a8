package com.vfxport.models;

import java.util.Objects;

/**
 * Remembers that an emitter was deleted from a system so bulk ports do not bring it back.
 */
public final class DeletedEmitterRecord {
    private final String systemKey;
    private final String emitterName;

    public DeletedEmitterRecord(String systemKey, String emitterName) {
        this.systemKey = systemKey;
        this.emitterName = emitterName;
    }

    public String getSystemKey() { return systemKey; }
    public String getEmitterName() { return emitterName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeletedEmitterRecord)) return false;
        DeletedEmitterRecord that = (DeletedEmitterRecord) o;
        return Objects.equals(systemKey, that.systemKey) && Objects.equals(emitterName, that.emitterName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemKey, emitterName);
    }

    @Override
    public String toString() {
        return systemKey + ":" + emitterName;
    }
}
