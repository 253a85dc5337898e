package dev.tana.edge.cli;

import dev.tana.edge.api.EdgeRunner;
import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        return new String[] { "tana-edge (java) " + EdgeRunner.version() };
    }
}
