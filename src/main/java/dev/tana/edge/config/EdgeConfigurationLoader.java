package dev.tana.edge.config;

import dev.tana.edge.api.EdgeConfiguration;
import dev.tana.edge.error.EdgeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@code tana-edge.toml} and applies environment overrides on top of it.
 *
 * <pre>
 * [contracts]  root, typescript
 * [server]     host, port, workers
 * [egress]     allowed_domains, timeout_ms
 * [ledger]     url
 * </pre>
 *
 * Relative paths resolve against the directory holding the file. {@code TANA_CONTRACTS_DIR} and
 * {@code TANA_LEDGER_URL} win over the file.
 */
public final class EdgeConfigurationLoader {
    public static final String DEFAULT_FILE_NAME = "tana-edge.toml";
    public static final String ENV_CONTRACTS_DIR = "TANA_CONTRACTS_DIR";
    public static final String ENV_LEDGER_URL = "TANA_LEDGER_URL";

    private EdgeConfigurationLoader() {}

    public static EdgeConfiguration.Builder load(Path file) {
        return load(file, System.getenv());
    }

    /**
     * @param file configuration file, or {@code null} to start from defaults
     */
    public static EdgeConfiguration.Builder load(Path file, Map<String, String> env) {
        EdgeConfiguration.Builder builder = EdgeConfiguration.builder();
        if (file != null) {
            applyFile(builder, file);
        }
        String contractsDir = env.get(ENV_CONTRACTS_DIR);
        if (contractsDir != null && !contractsDir.isBlank()) {
            builder.contractsRoot(Path.of(contractsDir.trim()));
        }
        String ledgerUrl = env.get(ENV_LEDGER_URL);
        if (ledgerUrl != null && !ledgerUrl.isBlank()) {
            builder.ledgerUrl(ledgerUrl.trim());
        }
        return builder;
    }

    private static void applyFile(EdgeConfiguration.Builder builder, Path file) {
        TomlParseResult toml = parse(file);
        Path base = file.toAbsolutePath().getParent();

        TomlTable contracts = toml.getTable("contracts");
        if (contracts != null) {
            String root = contracts.getString("root");
            if (root != null) builder.contractsRoot(base.resolve(root).normalize());
            String typescript = contracts.getString("typescript");
            if (typescript != null) builder.typescriptCompiler(base.resolve(typescript).normalize());
        }

        TomlTable server = toml.getTable("server");
        if (server != null) {
            String host = server.getString("host");
            if (host != null) builder.host(host);
            Long port = server.getLong("port");
            if (port != null) builder.port(boundedInt(port, 0, 65_535, "server.port", file));
            Long workers = server.getLong("workers");
            if (workers != null) builder.workerThreads(boundedInt(workers, 1, Integer.MAX_VALUE, "server.workers", file));
        }

        TomlTable egress = toml.getTable("egress");
        if (egress != null) {
            TomlArray domains = egress.getArray("allowed_domains");
            if (domains != null) builder.allowedDomains(readStrings(domains, file));
            Long timeoutMs = egress.getLong("timeout_ms");
            if (timeoutMs != null) builder.fetchTimeout(Duration.ofMillis(timeoutMs));
        }

        TomlTable ledger = toml.getTable("ledger");
        if (ledger != null) {
            builder.ledgerUrl(ledger.getString("url"));
        }
    }

    private static int boundedInt(long value, int min, int max, String key, Path file) {
        if (value < min || value > max) {
            throw EdgeException.setup("Invalid configuration " + file + ": " + key + " must be between "
                + min + " and " + max + ", got " + value);
        }
        return (int) value;
    }

    private static TomlParseResult parse(Path file) {
        if (!Files.isRegularFile(file)) {
            throw EdgeException.setup("Configuration file not found: " + file);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw EdgeException.setup("Unable to read configuration " + file + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw EdgeException.setup("Invalid configuration " + file + ": " + errors);
        }
        return result;
    }

    private static List<String> readStrings(TomlArray array, Path file) {
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String str)) {
                throw EdgeException.setup("Invalid configuration " + file + ": allowed_domains must contain strings");
            }
            values.add(str);
        }
        return values;
    }
}
