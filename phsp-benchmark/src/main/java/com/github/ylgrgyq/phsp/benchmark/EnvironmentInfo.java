package com.github.ylgrgyq.phsp.benchmark;

import java.io.IOException;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.nio.ByteOrder;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * What a phase-space benchmark result depends on besides its options: the JVM, whether decoding the
 * little-endian records needs a byte swap on this machine, and the file store holding the testing files.
 */
final class EnvironmentInfo {
    private EnvironmentInfo() {}

    static String generateEnvironmentSpec(Path storagePath) throws IOException {
        final FileStore store = Files.getFileStore(existingAncestor(storagePath));
        return "OS: " + System.getProperty("os.name") + " (" + System.getProperty("os.arch") + ")\n" +
                "JDK: " + System.getProperty("java.version") + "\n" +
                "Processors: " + Runtime.getRuntime().availableProcessors() + "\n" +
                "-Xmx: " + Runtime.getRuntime().maxMemory() / 1024 / 1024 + "MB\n" +
                "Garbage collector type: " + garbageCollectors() + "\n" +
                "Native byte order: " + ByteOrder.nativeOrder() +
                (ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN ? "" : ", records are byte swapped") + "\n" +
                "Testing file store: " + store.name() + " (" + store.type() + "), " +
                store.getUsableSpace() / 1024 / 1024 + "MB usable";
    }

    static String garbageCollectors() {
        return ManagementFactory.getGarbageCollectorMXBeans()
                .stream()
                .map(GarbageCollectorMXBean::getName)
                .collect(Collectors.joining(" and "));
    }

    // testing files are put in a directory created by the first test
    private static Path existingAncestor(Path path) {
        Path p = path.toAbsolutePath();
        while (!Files.exists(p) && p.getParent() != null) {
            p = p.getParent();
        }
        return p;
    }
}
