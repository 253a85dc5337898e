package dev.tana.edge.runtime;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;

/**
 * Creates one locked-down GraalJS context per invocation on a shared engine.
 *
 * <p>Guest code sees no host classes, threads, native access, IO or process creation; the only host
 * members it can reach are those annotated with {@link HostAccess.Export}.</p>
 */
public final class IsolateFactory implements AutoCloseable {
    static final String LANGUAGE = "js";

    private static final HostAccess BRIDGE_ONLY = HostAccess.newBuilder(HostAccess.NONE)
        .allowAccessAnnotatedBy(HostAccess.Export.class)
        .build();

    private final Engine engine;

    public IsolateFactory() {
        this.engine = Engine.newBuilder()
            .option("engine.WarnInterpreterOnly", "false")
            .build();
    }

    public Context create() {
        return Context.newBuilder(LANGUAGE)
            .engine(engine)
            .allowAllAccess(false)
            .allowHostAccess(BRIDGE_ONLY)
            .allowHostClassLookup(className -> false)
            .allowCreateThread(false)
            .allowCreateProcess(false)
            .allowNativeAccess(false)
            .allowExperimentalOptions(true)
            .option("js.ecmascript-version", "2022")
            .option("js.console", "false")
            .option("js.print", "false")
            .option("js.load", "false")
            .option("js.graal-builtin", "false")
            .option("js.polyglot-builtin", "false")
            .option("js.java-package-globals", "false")
            .build();
    }

    public String engineVersion() {
        return engine.getVersion();
    }

    @Override
    public void close() {
        engine.close();
    }
}
