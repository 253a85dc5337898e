package dev.tana.edge.runtime;

import dev.tana.edge.api.HttpMethod;
import dev.tana.edge.error.EdgeException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves {@code {root}/{contractId}/{get|post}.{js|ts}}, preferring the precompiled {@code .js}.
 */
public final class ContractLocator {
    private static final Pattern CONTRACT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final Path root;

    public ContractLocator(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public static boolean isValidId(String contractId) {
        return contractId != null && CONTRACT_ID.matcher(contractId).matches() && !contractId.contains("..");
    }

    public ContractSource locate(String contractId, HttpMethod method) {
        if (!isValidId(contractId)) {
            throw EdgeException.validation("Invalid contract id: " + contractId);
        }
        Path directory = root.resolve(contractId);
        String stem = method.fileStem();
        for (String extension : new String[] {".js", ".ts"}) {
            Path candidate = directory.resolve(stem + extension);
            if (Files.isRegularFile(candidate)) {
                return read(candidate);
            }
        }
        throw EdgeException.setup("Contract not found: " + directory.resolve(stem));
    }

    static ContractSource read(Path file) {
        try {
            return new ContractSource(file, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw EdgeException.setup("Failed to read " + file + ": " + ex.getMessage(), ex);
        }
    }
}
