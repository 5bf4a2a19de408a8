package com.vfxport.session;

import com.vfxport.mutations.EditErrorKind;

public final class LoadOutcome {

    private final EditSession session;
    private final EditErrorKind errorKind;
    private final String message;

    private LoadOutcome(EditSession session, EditErrorKind errorKind, String message) {
        this.session = session;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static LoadOutcome success(EditSession session, String message) {
        return new LoadOutcome(session, null, message);
    }

    public static LoadOutcome failure(EditErrorKind kind, String message) {
        return new LoadOutcome(null, kind, message);
    }

    public boolean isSuccess() { return session != null; }
    public EditSession getSession() { return session; }
    public EditErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
}
