package com.github.ylgrgyq.phsp;

import static java.util.Objects.requireNonNull;

/**
 * A builder to build {@link PhspFiles}.
 */
public final class PhspFilesBuilder {
    // a chunk buffer holds chunk size records of at most 32 bytes in one byte array
    static final int MAX_CHUNK_SIZE = Integer.MAX_VALUE / PhspConstants.ZLAST_RECORD_SIZE;

    /**
     * Create a new {@link PhspFilesBuilder} instance with every option set to its default.
     *
     * @return the new {@link PhspFilesBuilder} instance
     */
    public static PhspFilesBuilder newBuilder() {
        return new PhspFilesBuilder();
    }

    private int readChunkSize = PhspReader.DEFAULT_CHUNK_SIZE;
    private int writeChunkSize = PhspWriter.DEFAULT_CHUNK_SIZE;
    private boolean syncOnClose = false;
    private MissingZlastPolicy missingZlastPolicy = MissingZlastPolicy.Reject;
    private float defaultZlast = 0f;

    private PhspFilesBuilder() {}

    /**
     * Set the maximum number of records read and decoded at once by readers.
     * <p>
     * The default value is {@value PhspReader#DEFAULT_CHUNK_SIZE}.
     *
     * @param readChunkSize number of records per read
     * @return this
     */
    public PhspFilesBuilder readChunkSize(int readChunkSize) {
        this.readChunkSize = checkChunkSize("readChunkSize", readChunkSize);
        return this;
    }

    /**
     * Set the maximum number of records buffered by writers before they are written to file.
     * <p>
     * The default value is {@value PhspWriter#DEFAULT_CHUNK_SIZE}.
     *
     * @param writeChunkSize number of records per write
     * @return this
     */
    public PhspFilesBuilder writeChunkSize(int writeChunkSize) {
        this.writeChunkSize = checkChunkSize("writeChunkSize", writeChunkSize);
        return this;
    }

    /**
     * Force written or translated bytes to the underlying storage device before a write or a translation
     * returns. This may cause a huge degradation on performance.
     * <p>
     * The default value is false.
     *
     * @param syncOnClose true to force written bytes to the storage device
     * @return this
     */
    public PhspFilesBuilder syncOnClose(boolean syncOnClose) {
        this.syncOnClose = syncOnClose;
        return this;
    }

    /**
     * Set what writers do with records that have no zlast when they write a {@link PhspFormat#Extended} file.
     * <p>
     * The default value is {@link MissingZlastPolicy#Reject}.
     *
     * @param missingZlastPolicy the policy
     * @return this
     */
    public PhspFilesBuilder missingZlast(MissingZlastPolicy missingZlastPolicy) {
        this.missingZlastPolicy = requireNonNull(missingZlastPolicy, "missingZlastPolicy");
        return this;
    }

    /**
     * Fill records without zlast with {@code defaultZlast} when a {@link PhspFormat#Extended} file is
     * written. Also sets the policy to {@link MissingZlastPolicy#FillDefault}.
     *
     * @param defaultZlast the zlast to write, in cm
     * @return this
     */
    public PhspFilesBuilder defaultZlast(float defaultZlast) {
        this.defaultZlast = defaultZlast;
        this.missingZlastPolicy = MissingZlastPolicy.FillDefault;
        return this;
    }

    /**
     * Create a new instance of {@link PhspFiles}.
     *
     * @return a new instance of {@link PhspFiles}.
     */
    public PhspFiles build() {
        return new PhspFiles(this);
    }

    int readChunkSize() {
        return readChunkSize;
    }

    int writeChunkSize() {
        return writeChunkSize;
    }

    boolean syncOnClose() {
        return syncOnClose;
    }

    MissingZlastPolicy missingZlastPolicy() {
        return missingZlastPolicy;
    }

    float defaultZlast() {
        return defaultZlast;
    }

    static int checkChunkSize(String name, int chunkSize) {
        if (chunkSize <= 0 || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException(name + ": " + chunkSize +
                    " (expect: > 0 and <= " + MAX_CHUNK_SIZE + ")");
        }
        return chunkSize;
    }
}
