package com.github.ylgrgyq.phsp;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.github.ylgrgyq.phsp.PhspTestingUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PhspReaderTest {
    private final PhspHeader header = new PhspHeader(2, 1, 1.5f, 0.1f, 2.0f);
    private final PhspRecord first = new PhspRecord(0, 1.0f, 0.0f, 0.0f, 0.0f, 1.0f, 1.0f);
    private final PhspRecord second = new PhspRecord(1, -0.5f, 1.0f, 2.0f, 0.1f, 0.9f, -1.0f);
    private Path tempDir;

    @Before
    public void setUp() throws Exception {
        tempDir = createTempDir("phsp_reader_test");
    }

    @Test
    public void testReadStandardFile() throws IOException {
        final Path path = writeRawFile(tempDir, "standard", PhspFormat.Standard, header, Arrays.asList(first, second));
        try (PhspReader reader = PhspReader.open(path)) {
            assertThat(reader.format()).isEqualTo(PhspFormat.Standard);
            assertThat(reader.header()).isEqualTo(header);
            assertThat(readAll(reader)).containsExactly(first, second);
        }
    }

    @Test
    public void testReadExtendedFile() throws IOException {
        final List<PhspRecord> records = Arrays.asList(first.withZlast(10f), second.withZlast(-3.5f));
        final Path path = writeRawFile(tempDir, "extended", PhspFormat.Extended, header, records);
        try (PhspReader reader = PhspReader.open(path)) {
            assertThat(reader.format()).isEqualTo(PhspFormat.Extended);
            assertThat(readAll(reader)).containsExactlyElementsOf(records);
        }
    }

    @Test
    public void testReadAcrossChunks() throws IOException {
        final List<PhspRecord> records = generateRecords(1000, true);
        final Path path = writeRawFile(tempDir, "chunks", PhspFormat.Extended, headerFor(records), records);
        for (int chunkSize : new int[]{1, 7, 999, 1000, 1001, 4096}) {
            try (PhspReader reader = PhspReader.open(path, chunkSize)) {
                assertThat(readAll(reader)).containsExactlyElementsOf(records);
            }
        }
    }

    @Test
    public void testReadEmptyFile() throws IOException {
        final Path path = writeRawFile(tempDir, "empty", PhspFormat.Standard, new PhspHeader(0, 0, 0f, 0f, 0f),
                Collections.emptyList());
        try (PhspReader reader = PhspReader.open(path)) {
            final Iterator<PhspRecord> it = reader.iterator();
            assertThat(it.hasNext()).isFalse();
            assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
            assertThat(reader.trailingBytes()).isZero();
        }
    }

    @Test
    public void testRequestingPastTheEndIsNotAnError() throws IOException {
        final Path path = writeRawFile(tempDir, "end", PhspFormat.Standard, header, Arrays.asList(first, second));
        try (PhspReader reader = PhspReader.open(path)) {
            final Iterator<PhspRecord> it = reader.iterator();
            it.next();
            it.next();
            assertThat(it.hasNext()).isFalse();
            assertThat(it.hasNext()).isFalse();
        }
    }

    @Test
    public void testIgnoreTrailingBytes() throws IOException {
        final byte[] trailing = "garbage after records".getBytes(StandardCharsets.US_ASCII);
        final Path path = writeRawFile(tempDir, "trailing", PhspFormat.Standard, header, Arrays.asList(first, second),
                trailing);
        try (PhspReader reader = PhspReader.open(path)) {
            assertThat(reader.trailingBytes()).isEqualTo(-1);
            assertThat(readAll(reader)).containsExactly(first, second);
            assertThat(reader.trailingBytes()).isEqualTo(trailing.length);
        }
    }

    @Test
    public void testHeaderDeclaresFewerRecords() throws IOException {
        final Path path = writeRawFile(tempDir, "fewer", PhspFormat.Standard, header.withTotalParticles(1),
                Arrays.asList(first, second));
        try (PhspReader reader = PhspReader.open(path)) {
            assertThat(readAll(reader)).containsExactly(first);
            assertThat(reader.trailingBytes()).isEqualTo(28);
        }
    }

    @Test
    public void testRecordCountMismatchRaisedWhenMissingRecordIsRequested() throws IOException {
        final List<PhspRecord> records = generateRecords(9, false);
        final Path path = writeRawFile(tempDir, "mismatch", PhspFormat.Standard, headerFor(records).withTotalParticles(10),
                records);
        try (PhspReader reader = PhspReader.open(path, 4)) {
            final Iterator<PhspRecord> it = reader.iterator();
            for (int i = 0; i < 9; i++) {
                assertThat(it.hasNext()).isTrue();
                assertThat(it.next()).isEqualTo(records.get(i));
            }
            assertThatThrownBy(it::hasNext)
                    .isInstanceOf(RecordCountMismatchException.class)
                    .hasMessage("Header declares 10 records, but source ended after 9 complete records")
                    .satisfies(ex -> {
                        final RecordCountMismatchException mismatch = (RecordCountMismatchException) ex;
                        assertThat(mismatch.kind()).isEqualTo(ErrorKind.RecordCountMismatch);
                        assertThat(mismatch.declared()).isEqualTo(10);
                        assertThat(mismatch.decoded()).isEqualTo(9);
                    });
            assertThat(reader.isOpen()).isFalse();
        }
    }

    @Test
    public void testPartialLastRecordIsAMismatch() throws IOException {
        final byte[] bytes = fileBytes(PhspFormat.Standard, header, Arrays.asList(first, second), new byte[0]);
        final Path path = tempDir.resolve("partial");
        Files.write(path, Arrays.copyOf(bytes, bytes.length - 1));
        try (PhspReader reader = PhspReader.open(path)) {
            final Iterator<PhspRecord> it = reader.iterator();
            assertThat(it.next()).isEqualTo(first);
            assertThatThrownBy(it::next).isInstanceOf(RecordCountMismatchException.class);
        }
    }

    @Test
    public void testUnrecognizedTag() throws IOException {
        final Path path = tempDir.resolve("bad_tag");
        Files.write(path, fileBytes(PhspFormat.Standard, header, Arrays.asList(first, second), new byte[0]));
        final byte[] bytes = Files.readAllBytes(path);
        bytes[4] = '1';
        Files.write(path, bytes);

        assertThatThrownBy(() -> PhspReader.open(path))
                .isInstanceOf(UnrecognizedTagException.class)
                .satisfies(ex -> assertThat(((UnrecognizedTagException) ex).tag())
                        .isEqualTo("MODE1".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    public void testTruncatedTag() throws IOException {
        final Path path = tempDir.resolve("short_tag");
        Files.write(path, "MOD".getBytes(StandardCharsets.US_ASCII));
        assertThatThrownBy(() -> PhspReader.open(path))
                .isInstanceOf(TruncatedException.class)
                .hasMessage("Failed to read `tag`. Expected 5 bytes, but only 3 bytes available");
    }

    @Test
    public void testTruncatedHeader() throws IOException {
        final Path path = tempDir.resolve("short_header");
        // tag and header fields are complete, but the padding is missing
        Files.write(path, Arrays.copyOf(headerBytes("MODE2", 7, header), 25));
        assertThatThrownBy(() -> PhspReader.open(path))
                .isInstanceOf(TruncatedException.class)
                .satisfies(ex -> {
                    final TruncatedException truncated = (TruncatedException) ex;
                    assertThat(truncated.required()).isEqualTo(27);
                    assertThat(truncated.available()).isEqualTo(20);
                });
    }

    @Test
    public void testCloseOnExhaustion() throws IOException {
        final Path path = writeRawFile(tempDir, "exhaust", PhspFormat.Standard, header, Arrays.asList(first, second));
        final PhspReader reader = PhspReader.open(path);
        assertThat(reader.isOpen()).isTrue();
        readAll(reader);
        assertThat(reader.isOpen()).isFalse();
        // closing again is fine
        reader.close();
    }

    @Test
    public void testCloseBeforeExhaustion() throws IOException {
        final List<PhspRecord> records = generateRecords(100, false);
        final Path path = writeRawFile(tempDir, "abandon", PhspFormat.Standard, headerFor(records), records);
        final PhspReader reader = PhspReader.open(path, 10);
        final Iterator<PhspRecord> it = reader.iterator();
        assertThat(it.next()).isEqualTo(records.get(0));
        reader.close();
        assertThat(reader.isOpen()).isFalse();
    }

    @Test
    public void testIterateOnlyOnce() throws IOException {
        final Path path = writeRawFile(tempDir, "once", PhspFormat.Standard, header, Arrays.asList(first, second));
        try (PhspReader reader = PhspReader.open(path)) {
            reader.iterator();
            assertThatThrownBy(reader::iterator)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("can only be iterated once");
        }
    }

    @Test
    public void testStream() throws IOException {
        final List<PhspRecord> records = generateRecords(50, false);
        final Path path = writeRawFile(tempDir, "stream", PhspFormat.Standard, headerFor(records), records);
        final PhspReader reader = PhspReader.open(path, 8);
        try (Stream<PhspRecord> stream = reader.stream()) {
            assertThat(stream.filter(PhspRecord::isNewHistory).collect(Collectors.toList()))
                    .containsExactlyElementsOf(records.stream().filter(PhspRecord::isNewHistory)
                            .collect(Collectors.toList()));
        }
        assertThat(reader.isOpen()).isFalse();
    }

    @Test
    public void testStreamCountReadsEveryRecord() throws IOException {
        final List<PhspRecord> records = generateRecords(3, false);
        final Path path = writeRawFile(tempDir, "short_stream", PhspFormat.Standard,
                headerFor(records).withTotalParticles(10), records);
        final PhspReader reader = PhspReader.open(path, 2);
        try (Stream<PhspRecord> stream = reader.stream()) {
            assertThatThrownBy(stream::count)
                    .isInstanceOf(RecordCountMismatchException.class)
                    .hasMessage("Header declares 10 records, but source ended after 3 complete records");
        }
        assertThat(reader.isOpen()).isFalse();
    }

    @Test
    public void testStreamDoesNotTrustDeclaredCount() throws IOException {
        final List<PhspRecord> records = generateRecords(3, false);
        final Path path = writeRawFile(tempDir, "huge_declared", PhspFormat.Standard,
                headerFor(records).withTotalParticles(Integer.MAX_VALUE), records);
        final PhspReader reader = PhspReader.open(path);
        try (Stream<PhspRecord> stream = reader.stream()) {
            assertThat(stream.spliterator().hasCharacteristics(Spliterator.SIZED)).isFalse();
        }

        final PhspReader another = PhspReader.open(path);
        try (Stream<PhspRecord> stream = another.stream()) {
            assertThatThrownBy(stream::toArray).isInstanceOf(RecordCountMismatchException.class);
        }
        assertThat(another.isOpen()).isFalse();
    }

    @Test
    public void testInvalidChunkSize() throws IOException {
        assertThatThrownBy(() -> PhspReader.open(tempDir.resolve("whatever"), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("chunkSize: 0 (expect: > 0 and <= " + PhspFilesBuilder.MAX_CHUNK_SIZE + ")");

        final List<PhspRecord> records = generateRecords(1, false);
        final Path path = writeRawFile(tempDir, "chunk", PhspFormat.Standard, headerFor(records), records);
        assertThatThrownBy(() -> PhspReader.open(path, 100_000_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("chunkSize: 100000000 (expect: > 0 and <= " + PhspFilesBuilder.MAX_CHUNK_SIZE + ")");
        try (PhspReader reader = PhspReader.open(path, PhspFilesBuilder.MAX_CHUNK_SIZE / 1024)) {
            assertThat(readAll(reader)).containsExactlyElementsOf(records);
        }
    }
}
