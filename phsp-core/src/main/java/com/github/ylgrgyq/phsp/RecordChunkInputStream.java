package com.github.ylgrgyq.phsp;

import javax.annotation.Nullable;
import java.io.IOException;

interface RecordChunkInputStream {
    /**
     * Read the next chunk of records.
     *
     * @return the next chunk, or {@code null} when every declared record has been read
     * @throws IOException                   if any I/O error occur
     * @throws RecordCountMismatchException if the source ends before every declared record has been read
     */
    @Nullable
    RecordChunk nextChunk() throws IOException;
}
