package dev.tana.edge.cli;

import java.util.Locale;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

@CommandLine.Command(
    name = "tana-edge",
    description = "Run sandboxed contracts behind HTTP or from the command line.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ServeCommand.class,
        InvokeCommand.class,
        ScriptCommand.class
    }
)
final class EdgeCommand implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--log-level",
        scope = CommandLine.ScopeType.INHERIT,
        description = "Log threshold (trace|debug|info|warn|error|fatal|off)."
    )
    void setLogLevel(String value) {
        Level level = Level.toLevel(value.trim().toUpperCase(Locale.ROOT), null);
        if (level == null) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
        Configurator.setRootLevel(level);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: serve, invoke or script");
    }
}
