package com.github.ylgrgyq.phsp;

/**
 * Base type of every failure raised by this library. Also used to carry an {@link java.io.IOException}
 * out of a lazy record iterator, which can not throw checked exceptions.
 */
public class PhspRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public PhspRuntimeException() {
        super();
    }

    public PhspRuntimeException(String message) {
        super(message);
    }

    public PhspRuntimeException(Throwable throwable) {
        super(throwable);
    }

    public PhspRuntimeException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
