package dev.tana.edge.capability;

import java.io.PrintStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Destination of guest {@code console.log} / {@code console.error} lines.
 */
public interface ConsoleSink {
    String CONTRACT_LOGGER = "tana.contract";

    void log(String line);

    void error(String line);

    static ConsoleSink logging() {
        Logger logger = LogManager.getLogger(CONTRACT_LOGGER);
        return new ConsoleSink() {
            @Override
            public void log(String line) {
                logger.info(line);
            }

            @Override
            public void error(String line) {
                logger.error(line);
            }
        };
    }

    static ConsoleSink streams(PrintStream out, PrintStream err) {
        return new ConsoleSink() {
            @Override
            public void log(String line) {
                out.println(line);
            }

            @Override
            public void error(String line) {
                err.println(line);
            }
        };
    }
}
