package dev.tana.edge.support;

import dev.tana.edge.api.EdgeConfiguration;
import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.block.InMemoryLedgerDirectory;
import dev.tana.edge.capability.ConsoleSink;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared helpers for suites that run real isolates against contracts written to a temp directory.
 */
public final class EdgeTestSupport {
    private EdgeTestSupport() {}

    public static Path writeContract(Path root, String contractId, String fileName, String source) {
        try {
            Path dir = Files.createDirectories(root.resolve(contractId));
            return Files.writeString(dir.resolve(fileName), source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static EdgeRunner runner(Path contractsRoot, FakeTransport transport, InMemoryLedgerDirectory directory) {
        EdgeConfiguration configuration = EdgeConfiguration.builder()
            .contractsRoot(contractsRoot)
            .build();
        return new EdgeRunner(configuration, new RecordingConsole(), transport, directory);
    }

    /**
     * Console sink that keeps lines in memory instead of logging them.
     */
    public static final class RecordingConsole implements ConsoleSink {
        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void log(String line) {
            lines.add(line);
        }

        @Override
        public void error(String line) {
            lines.add("ERROR " + line);
        }

        public List<String> lines() {
            return List.copyOf(lines);
        }
    }
}
