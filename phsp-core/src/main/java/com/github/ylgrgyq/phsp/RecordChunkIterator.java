package com.github.ylgrgyq.phsp;

import java.io.IOException;

final class RecordChunkIterator extends AbstractIterator<RecordChunk> {
    private final RecordChunkInputStream inputStream;

    RecordChunkIterator(RecordChunkInputStream inputStream) {
        this.inputStream = inputStream;
    }

    @Override
    protected RecordChunk makeNext() {
        try {
            final RecordChunk chunk = inputStream.nextChunk();
            if (chunk == null)
                return allDone();
            return chunk;
        } catch (IOException e) {
            throw new PhspRuntimeException(e);
        }
    }
}
