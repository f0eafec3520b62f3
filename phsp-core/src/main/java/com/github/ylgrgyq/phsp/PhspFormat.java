package com.github.ylgrgyq.phsp;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.github.ylgrgyq.phsp.PhspConstants.*;

/**
 * The two on-disk layouts of a phase-space file, selected by the tag at offset 0.
 * <p>
 * For both layouts the tag, header and padding together take exactly one record width, so records
 * start at {@link #recordRegionStart()} which equals {@link #recordSize()}.
 */
public enum PhspFormat {
    Standard("MODE0", BASE_RECORD_SIZE, 3),
    Extended("MODE2", ZLAST_RECORD_SIZE, 7);

    /**
     * Resolve the format from the leading tag bytes.
     *
     * @param tag the first {@value PhspConstants#TAG_LENGTH} bytes of a file
     * @return the format the tag names
     * @throws UnrecognizedTagException if the bytes match neither tag
     */
    public static PhspFormat detect(byte[] tag) {
        for (PhspFormat format : values()) {
            if (Arrays.equals(format.tag, tag)) {
                return format;
            }
        }
        throw new UnrecognizedTagException(tag);
    }

    /**
     * Choose the layout from the first record to write: records carrying a {@code zlast} field need
     * {@link #Extended}, anything else, including no record at all, is written as {@link #Standard}.
     *
     * @param firstRecord the first record to write, or {@code null} when there is none
     * @return the layout to write with
     */
    public static PhspFormat forFirstRecord(@Nullable PhspRecord firstRecord) {
        if (firstRecord != null && firstRecord.hasZlast()) {
            return Extended;
        }
        return Standard;
    }

    private final byte[] tag;
    private final int recordSize;
    private final int headerPaddingSize;

    PhspFormat(String tag, int recordSize, int headerPaddingSize) {
        this.tag = tag.getBytes(StandardCharsets.US_ASCII);
        this.recordSize = recordSize;
        this.headerPaddingSize = headerPaddingSize;
    }

    public byte[] tag() {
        return tag.clone();
    }

    public String tagName() {
        return new String(tag, StandardCharsets.US_ASCII);
    }

    public int recordSize() {
        return recordSize;
    }

    public int headerPaddingSize() {
        return headerPaddingSize;
    }

    /**
     * Size in bytes of the encoded header including its padding, excluding the tag.
     */
    public int paddedHeaderSize() {
        return HEADER_SIZE + headerPaddingSize;
    }

    /**
     * Byte offset of the first record in a file of this format.
     */
    public long recordRegionStart() {
        return TAG_LENGTH + paddedHeaderSize();
    }

    /**
     * Byte offset of the record at {@code index} in a file of this format.
     */
    public long recordOffset(long index) {
        return recordRegionStart() + index * recordSize;
    }

    public boolean hasZlast() {
        return this == Extended;
    }
}
