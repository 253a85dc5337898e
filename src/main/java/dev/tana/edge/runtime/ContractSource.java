package dev.tana.edge.runtime;

import java.nio.file.Path;

/**
 * Contract code as read from disk.
 */
public record ContractSource(Path path, String code) {
    public boolean typescript() {
        return path.getFileName().toString().endsWith(".ts");
    }
}
