package com.github.ylgrgyq.phsp;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static com.github.ylgrgyq.phsp.PhspTestingUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PhspCombinerTest {
    private Path tempDir;

    @Before
    public void setUp() throws Exception {
        tempDir = createTempDir("phsp_combiner_test");
    }

    @Test
    public void testCombineTwoFiles() throws IOException {
        final List<PhspRecord> recordsA = generateRecords(120, false);
        final List<PhspRecord> recordsB = generateRecords(80, false);
        final PhspHeader headerA = new PhspHeader(120, 30, 5.5f, 0.2f, 1000f);
        final PhspHeader headerB = new PhspHeader(80, 50, 6.5f, 0.05f, 500f);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, headerA, recordsA);
        final Path b = writeRawFile(tempDir, "b", PhspFormat.Standard, headerB, recordsB);

        try (CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, b), 16)) {
            assertThat(combined.header()).isEqualTo(new PhspHeader(200, 80, 6.5f, 0.05f, 1500f));
            assertThat(combined.minEnergyAnomaly()).isFalse();
            assertThat(combined.sources()).hasSize(2);

            final List<PhspRecord> expect = new ArrayList<>(recordsA);
            expect.addAll(recordsB);
            assertThat(readAll(combined)).containsExactlyElementsOf(expect);
            assertThat(combined.sources()).allSatisfy(reader -> assertThat(reader.isOpen()).isFalse());
        }
    }

    @Test
    public void testCombineMixedLayouts() throws IOException {
        final List<PhspRecord> standard = generateRecords(10, false);
        final List<PhspRecord> extended = generateRecords(10, true);
        final Path a = writeRawFile(tempDir, "standard", PhspFormat.Standard, headerFor(standard), standard);
        final Path b = writeRawFile(tempDir, "extended", PhspFormat.Extended, headerFor(extended), extended);

        try (CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, b))) {
            final List<PhspRecord> records = readAll(combined);
            assertThat(records.subList(0, 10)).containsExactlyElementsOf(standard)
                    .noneMatch(PhspRecord::hasZlast);
            assertThat(records.subList(10, 20)).containsExactlyElementsOf(extended)
                    .allMatch(PhspRecord::hasZlast);
        }
    }

    @Test
    public void testCombineSameFileTwice() throws IOException {
        final List<PhspRecord> records = generateRecords(5, false);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, headerFor(records), records);

        try (CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, a))) {
            assertThat(combined.header().totalParticles()).isEqualTo(10);
            assertThat(readAll(combined)).hasSize(10);
        }
    }

    @Test
    public void testCombineSingleFile() throws IOException {
        final List<PhspRecord> records = generateRecords(5, true);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Extended, headerFor(records), records);

        try (CombinedPhsp combined = PhspCombiner.combine(Collections.singletonList(a))) {
            assertThat(combined.header()).isEqualTo(headerFor(records));
            assertThat(readAll(combined)).containsExactlyElementsOf(records);
        }
    }

    @Test
    public void testRejectNoSource() {
        assertThatThrownBy(() -> PhspCombiner.combine(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one source");
    }

    @Test
    public void testMinEnergyAnomaly() throws IOException {
        final List<PhspRecord> records = generateRecords(3, false);
        final PhspHeader header = new PhspHeader(3, 0, 1f, PhspCombiner.MIN_ENERGY_SENTINEL, 3f);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, header, records);

        try (CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, a))) {
            assertThat(combined.minEnergyAnomaly()).isTrue();
            assertThat(combined.header().minEnergy()).isEqualTo(PhspCombiner.MIN_ENERGY_SENTINEL);
            // still usable
            assertThat(readAll(combined)).hasSize(6);
        }
    }

    @Test
    public void testFailedSourceAbortsCombination() throws IOException {
        final List<PhspRecord> records = generateRecords(3, false);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, headerFor(records), records);
        final Path bad = tempDir.resolve("bad");
        Files.write(bad, "NOTAPHSPFILE".getBytes());

        assertThatThrownBy(() -> PhspCombiner.combine(Arrays.asList(a, bad)))
                .isInstanceOf(UnrecognizedTagException.class);
        assertThatThrownBy(() -> PhspCombiner.combine(Arrays.asList(a, tempDir.resolve("missing"))))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void testMismatchInLaterSourceIsLazy() throws IOException {
        final List<PhspRecord> recordsA = generateRecords(4, false);
        final List<PhspRecord> recordsB = generateRecords(4, false);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, headerFor(recordsA), recordsA);
        final Path b = writeRawFile(tempDir, "b", PhspFormat.Standard, headerFor(recordsB).withTotalParticles(5),
                recordsB);

        try (CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, b))) {
            assertThat(combined.header().totalParticles()).isEqualTo(9);
            final Iterator<PhspRecord> it = combined.iterator();
            for (int i = 0; i < 8; i++) {
                it.next();
            }
            assertThatThrownBy(it::next).isInstanceOf(RecordCountMismatchException.class);
        }
    }

    @Test
    public void testCloseBeforeExhaustion() throws IOException {
        final List<PhspRecord> records = generateRecords(10, false);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, headerFor(records), records);

        final CombinedPhsp combined = PhspCombiner.combine(Arrays.asList(a, a, a));
        combined.iterator().next();
        combined.close();
        assertThat(combined.sources()).allSatisfy(reader -> assertThat(reader.isOpen()).isFalse());
        assertThatThrownBy(combined::iterator).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testCombinedCountOverflow() throws IOException {
        final PhspHeader huge = new PhspHeader(Integer.MAX_VALUE, 0, 1f, 0f, 1f);
        final Path a = writeRawFile(tempDir, "a", PhspFormat.Standard, huge, Collections.emptyList());

        assertThatThrownBy(() -> PhspCombiner.combine(Arrays.asList(a, a)))
                .isInstanceOf(PhspRuntimeException.class)
                .hasMessageContaining("overflows");
    }
}
