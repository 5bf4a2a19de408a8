package com.vfxport.mutations;

/**
 * Why an edit, load or save did not happen.
 */
public enum EditErrorKind {
    NOT_FOUND(404),
    INVALID_INPUT(400),
    COLLISION(409),
    MALFORMED(422),
    EXTERNAL_TOOL(502),
    IO(500);

    private final int httpStatus;

    EditErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /** External tool and I/O failures block the user; the rest are status text. */
    public boolean isBlocking() {
        return this == EXTERNAL_TOOL || this == IO;
    }
}
