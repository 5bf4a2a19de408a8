package com.vfxport.session;

import com.vfxport.mutations.EditErrorKind;

public final class SaveOutcome {

    private final boolean success;
    private final boolean superseded;
    private final EditErrorKind errorKind;
    private final String message;
    private final boolean restoreOffered;

    private SaveOutcome(boolean success, boolean superseded, EditErrorKind errorKind, String message,
                        boolean restoreOffered) {
        this.success = success;
        this.superseded = superseded;
        this.errorKind = errorKind;
        this.message = message;
        this.restoreOffered = restoreOffered;
    }

    public static SaveOutcome success(String message) {
        return new SaveOutcome(true, false, null, message, false);
    }

    /** A newer edit arrived after the text was captured; nothing was written. */
    public static SaveOutcome superseded() {
        return new SaveOutcome(false, true, null, "Superseded by a newer edit", false);
    }

    public static SaveOutcome failure(EditErrorKind kind, String message) {
        return new SaveOutcome(false, false, kind, message, false);
    }

    /** Compiler rejected the text; the caller may offer restoring the last good backup. */
    public static SaveOutcome compilerFailure(String compilerOutput) {
        return new SaveOutcome(false, false, EditErrorKind.EXTERNAL_TOOL, compilerOutput, true);
    }

    public boolean isSuccess() { return success; }
    public boolean isSuperseded() { return superseded; }
    public EditErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
    public boolean isRestoreOffered() { return restoreOffered; }
}
