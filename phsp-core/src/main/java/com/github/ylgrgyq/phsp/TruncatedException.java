package com.github.ylgrgyq.phsp;

public final class TruncatedException extends PhspFormatException {
    private static final long serialVersionUID = 1L;

    private final int required;
    private final int available;

    public TruncatedException(String region, int required, int available) {
        super(ErrorKind.Truncated, "Failed to read `" + region + "`. Expected " + required +
                " bytes, but only " + available + " bytes available");
        this.required = required;
        this.available = available;
    }

    public int required() {
        return required;
    }

    public int available() {
        return available;
    }
}
