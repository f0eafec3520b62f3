package com.github.ylgrgyq.phsp;

public final class RecordCountMismatchException extends PhspFormatException {
    private static final long serialVersionUID = 1L;

    private final long declared;
    private final long decoded;

    public RecordCountMismatchException(long declared, long decoded) {
        super(ErrorKind.RecordCountMismatch, "Header declares " + declared + " records, but source ended after " +
                decoded + " complete records");
        this.declared = declared;
        this.decoded = decoded;
    }

    public long declared() {
        return declared;
    }

    public long decoded() {
        return decoded;
    }
}
