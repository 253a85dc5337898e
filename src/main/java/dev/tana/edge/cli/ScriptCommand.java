package dev.tana.edge.cli;

import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.api.ScriptResult;
import dev.tana.edge.capability.ConsoleSink;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "script",
    description = "Run a standalone .js or .ts file (top-level await allowed) with the tana modules.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ScriptCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ConfigOptions options = new ConfigOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Script to run.")
    Path file;

    @Override
    public Integer call() {
        try (EdgeRunner runner = new EdgeRunner(options.builder().build(), ConsoleSink.streams(System.out, System.err))) {
            ScriptResult result = runner.runScript(file);
            if (!result.success()) {
                spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(result.error()));
            }
            return result.exitCode();
        }
    }
}
