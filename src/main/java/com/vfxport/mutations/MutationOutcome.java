package com.vfxport.mutations;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one mutation attempt. A failed outcome guarantees the session was
 * not touched.
 */
public final class MutationOutcome {

    private final boolean success;
    private final EditErrorKind errorKind;
    private final String message;
    private final String description;
    private final long version;
    private final Map<String, Object> details;

    private MutationOutcome(boolean success, EditErrorKind errorKind, String message,
                            String description, long version, Map<String, Object> details) {
        this.success = success;
        this.errorKind = errorKind;
        this.message = message;
        this.description = description;
        this.version = version;
        this.details = details;
    }

    public static MutationOutcome success(String message, String description, long version) {
        return new MutationOutcome(true, null, message, description, version, new LinkedHashMap<>());
    }

    public static MutationOutcome failure(EditErrorKind kind, String message) {
        return new MutationOutcome(false, kind, message, null, -1, new LinkedHashMap<>());
    }

    public MutationOutcome with(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public boolean isSuccess() { return success; }
    public EditErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
    public String getDescription() { return description; }
    public long getVersion() { return version; }
    public Map<String, Object> getDetails() { return details; }

    @Override
    public String toString() {
        return success ? "OK: " + message : errorKind + ": " + message;
    }
}
