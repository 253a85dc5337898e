package dev.tana.edge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tana.edge.api.EdgeConfiguration;
import dev.tana.edge.error.EdgeException;
import dev.tana.edge.error.ErrorKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EdgeConfigurationLoaderTest {
    @TempDir
    Path dir;

    @Test
    void readsEverySection() throws Exception {
        Path file = Files.writeString(dir.resolve(EdgeConfigurationLoader.DEFAULT_FILE_NAME), String.join("\n",
            "[contracts]",
            "root = \"deploy/contracts\"",
            "typescript = \"tools/typescript.js\"",
            "",
            "[server]",
            "host = \"0.0.0.0\"",
            "port = 9000",
            "workers = 8",
            "",
            "[egress]",
            "allowed_domains = [\"example.org\", \"api.tana.dev\"]",
            "timeout_ms = 2500",
            "",
            "[ledger]",
            "url = \"http://ledger.internal:8080\"",
            ""));

        EdgeConfiguration config = EdgeConfigurationLoader.load(file, Map.of()).build();
        assertEquals(dir.resolve("deploy/contracts").toAbsolutePath().normalize(), config.contractsRoot());
        assertEquals(Optional.of(dir.resolve("tools/typescript.js").toAbsolutePath().normalize()),
            config.typescriptCompiler());
        assertEquals("0.0.0.0", config.host());
        assertEquals(9000, config.port());
        assertEquals(8, config.workerThreads());
        assertEquals(List.of("example.org", "api.tana.dev"), config.allowedDomains());
        assertEquals(Duration.ofMillis(2500), config.fetchTimeout());
        assertEquals(Optional.of("http://ledger.internal:8080"), config.ledgerUrl());
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("empty.toml"), "# nothing here\n");

        EdgeConfiguration config = EdgeConfigurationLoader.load(file, Map.of()).build();
        assertEquals(EdgeConfiguration.DEFAULT_HOST, config.host());
        assertEquals(EdgeConfiguration.DEFAULT_PORT, config.port());
        assertEquals(EdgeConfiguration.DEFAULT_FETCH_TIMEOUT, config.fetchTimeout());
        assertTrue(config.ledgerUrl().isEmpty());
        assertTrue(config.allowedDomains().contains("tana.dev"));
    }

    @Test
    void environmentWinsOverTheFile() throws Exception {
        Path file = Files.writeString(dir.resolve("edge.toml"), String.join("\n",
            "[contracts]",
            "root = \"from-file\"",
            "[ledger]",
            "url = \"http://file:8080\"",
            ""));

        EdgeConfiguration config = EdgeConfigurationLoader.load(file, Map.of(
            EdgeConfigurationLoader.ENV_CONTRACTS_DIR, "/srv/contracts",
            EdgeConfigurationLoader.ENV_LEDGER_URL, "http://env:9090"
        )).build();
        assertEquals(Path.of("/srv/contracts"), config.contractsRoot());
        assertEquals(Optional.of("http://env:9090"), config.ledgerUrl());
    }

    @Test
    void nullFileStartsFromDefaults() {
        EdgeConfiguration config = EdgeConfigurationLoader.load(null, Map.of()).build();
        assertEquals(Path.of("contracts"), config.contractsRoot());
    }

    @Test
    void reportsMissingAndMalformedFiles() throws Exception {
        EdgeException missing = assertThrows(EdgeException.class,
            () -> EdgeConfigurationLoader.load(dir.resolve("absent.toml"), Map.of()));
        assertEquals(ErrorKind.SETUP, missing.kind());
        assertTrue(missing.getMessage().startsWith("Configuration file not found: "));

        Path broken = Files.writeString(dir.resolve("broken.toml"), "[server\nport = ");
        EdgeException invalid = assertThrows(EdgeException.class, () -> EdgeConfigurationLoader.load(broken, Map.of()));
        assertTrue(invalid.getMessage().startsWith("Invalid configuration "));

        Path numbers = Files.writeString(dir.resolve("numbers.toml"), "[egress]\nallowed_domains = [1, 2]\n");
        EdgeException wrongType = assertThrows(EdgeException.class, () -> EdgeConfigurationLoader.load(numbers, Map.of()));
        assertTrue(wrongType.getMessage().endsWith("allowed_domains must contain strings"));
    }

    @Test
    void outOfRangeServerNumbersAreConfigurationErrors() throws Exception {
        Path hugePort = Files.writeString(dir.resolve("port.toml"), "[server]\nport = 99999999999\n");
        EdgeException port = assertThrows(EdgeException.class, () -> EdgeConfigurationLoader.load(hugePort, Map.of()));
        assertEquals(ErrorKind.SETUP, port.kind());
        assertTrue(port.getMessage().startsWith("Invalid configuration "));
        assertTrue(port.getMessage().endsWith("server.port must be between 0 and 65535, got 99999999999"));

        Path noWorkers = Files.writeString(dir.resolve("workers.toml"), "[server]\nworkers = 0\n");
        EdgeException workers = assertThrows(EdgeException.class, () -> EdgeConfigurationLoader.load(noWorkers, Map.of()));
        assertEquals(ErrorKind.SETUP, workers.kind());
        assertTrue(workers.getMessage().contains("server.workers must be between 1 and "));
    }
}
