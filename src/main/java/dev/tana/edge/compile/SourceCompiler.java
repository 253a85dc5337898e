package dev.tana.edge.compile;

import dev.tana.edge.error.EdgeException;

/**
 * Turns contract source in a compiled-to-JS language into executable JavaScript.
 */
@FunctionalInterface
public interface SourceCompiler {
    String compile(String source, String fileName);

    /**
     * Compiler used when no TypeScript toolchain is configured: every call fails as a setup error.
     */
    static SourceCompiler unavailable() {
        return (source, fileName) -> {
            throw EdgeException.setup("TypeScript compiler not configured, cannot compile " + fileName
                + " (set [contracts] typescript or ship a precompiled .js)");
        };
    }
}
