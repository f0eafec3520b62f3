package com.github.ylgrgyq.phsp;

import static java.util.Objects.requireNonNull;

/**
 * A {@link PhspFormatException} is thrown when the bytes of a phase-space file do not match its layout.
 * There is no recovery or resynchronization after a format error, reading aborts at that point.
 */
public class PhspFormatException extends PhspRuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public PhspFormatException(ErrorKind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind, "kind");
    }

    public PhspFormatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
