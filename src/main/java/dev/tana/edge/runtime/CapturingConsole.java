package dev.tana.edge.runtime;

import dev.tana.edge.capability.ConsoleSink;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every console line of one invocation while forwarding it to the runner's sink.
 */
final class CapturingConsole implements ConsoleSink {
    private final ConsoleSink delegate;
    private final List<String> lines = new ArrayList<>();

    CapturingConsole(ConsoleSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void log(String line) {
        lines.add(line);
        delegate.log(line);
    }

    @Override
    public void error(String line) {
        lines.add(line);
        delegate.error(line);
    }

    List<String> lines() {
        return List.copyOf(lines);
    }
}
