package dev.tana.edge.cli;

import dev.tana.edge.api.EdgeConfiguration;
import dev.tana.edge.config.EdgeConfigurationLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/**
 * Options shared by every subcommand that builds a runner.
 */
final class ConfigOptions {
    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML configuration file (default: ./" + EdgeConfigurationLoader.DEFAULT_FILE_NAME + " when present)."
    )
    Path config;

    @CommandLine.Option(
        names = "--contracts",
        description = "Contracts root directory (overrides config and TANA_CONTRACTS_DIR)."
    )
    Path contracts;

    @CommandLine.Option(
        names = "--typescript",
        description = "Path to typescript.js used to compile .ts sources."
    )
    Path typescript;

    EdgeConfiguration.Builder builder() {
        Path file = config;
        if (file == null) {
            Path candidate = Path.of(EdgeConfigurationLoader.DEFAULT_FILE_NAME);
            file = Files.isRegularFile(candidate) ? candidate : null;
        }
        EdgeConfiguration.Builder builder = EdgeConfigurationLoader.load(file);
        if (contracts != null) {
            builder.contractsRoot(contracts);
        }
        if (typescript != null) {
            builder.typescriptCompiler(typescript);
        }
        return builder;
    }
}
