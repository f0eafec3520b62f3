package com.github.ylgrgyq.phsp;

import java.util.Arrays;

public final class UnrecognizedTagException extends PhspFormatException {
    private static final long serialVersionUID = 1L;

    private final byte[] tag;

    public UnrecognizedTagException(byte[] tag) {
        super(ErrorKind.UnrecognizedTag, "First " + PhspConstants.TAG_LENGTH + " bytes must specify mode " +
                "(MODE0 or MODE2), but found: " + Arrays.toString(tag));
        this.tag = tag.clone();
    }

    public byte[] tag() {
        return tag.clone();
    }
}
