package dev.tana.edge.api;

import dev.tana.edge.block.BlockQueries;
import dev.tana.edge.block.HttpLedgerDirectory;
import dev.tana.edge.block.LedgerDirectory;
import dev.tana.edge.capability.CapabilityRegistry;
import dev.tana.edge.capability.ConsoleSink;
import dev.tana.edge.capability.HostCapabilities;
import dev.tana.edge.capability.HostServices;
import dev.tana.edge.compile.SourceCompiler;
import dev.tana.edge.compile.TypeScriptCompiler;
import dev.tana.edge.ledger.TransactionLedger;
import dev.tana.edge.net.DomainAllowlist;
import dev.tana.edge.net.EgressGateway;
import dev.tana.edge.net.HttpTransport;
import dev.tana.edge.net.JdkHttpTransport;
import dev.tana.edge.runtime.ContractDispatcher;
import dev.tana.edge.runtime.ContractLocator;
import dev.tana.edge.runtime.ContractSource;
import dev.tana.edge.runtime.IsolateFactory;
import dev.tana.edge.store.StagedStore;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Public entry point for embedding the contract runtime.
 *
 * <p>A runner owns the process-wide services (store, ledger, egress gateway, block queries), the
 * shared GraalJS engine and the I/O executor used by asynchronous capabilities. Invocations may
 * run concurrently from several threads.</p>
 */
public final class EdgeRunner implements Closeable {
    private static final Logger log = LogManager.getLogger(EdgeRunner.class);

    private final EdgeConfiguration configuration;
    private final HostServices services;
    private final IsolateFactory isolates;
    private final ExecutorService ioExecutor;
    private final SourceCompiler compiler;
    private final ContractDispatcher dispatcher;

    public EdgeRunner(EdgeConfiguration configuration) {
        this(configuration, ConsoleSink.logging());
    }

    public EdgeRunner(EdgeConfiguration configuration, ConsoleSink console) {
        this(configuration, console, new JdkHttpTransport(configuration.fetchTimeout()), defaultDirectory(configuration));
    }

    public EdgeRunner(EdgeConfiguration configuration, ConsoleSink console, HttpTransport transport, LedgerDirectory directory) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.services = new HostServices(
            new StagedStore(),
            new TransactionLedger(),
            new EgressGateway(new DomainAllowlist(configuration.allowedDomains()), transport),
            new BlockQueries(directory)
        );
        this.isolates = new IsolateFactory();
        this.ioExecutor = Executors.newCachedThreadPool(new IoThreadFactory());
        this.compiler = configuration.typescriptCompiler()
            .<SourceCompiler>map(TypeScriptCompiler::new)
            .orElseGet(SourceCompiler::unavailable);
        CapabilityRegistry registry = HostCapabilities.create(services);
        this.dispatcher = new ContractDispatcher(
            isolates,
            registry,
            new ContractLocator(configuration.contractsRoot()),
            compiler,
            services.ledger().gas(),
            ioExecutor,
            console,
            version()
        );
        log.debug("Runner ready: contracts={} capabilities={}", configuration.contractsRoot(), registry.entries().size());
    }

    public InvocationResult invoke(InvocationRequest request) {
        return dispatcher.dispatch(request);
    }

    public ScriptResult runScript(Path script) {
        String code;
        try {
            code = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return ScriptResult.failure("Failed to read " + script + ": " + ex.getMessage(), null);
        }
        return dispatcher.runScript(new ContractSource(script, code));
    }

    public ScriptResult runScript(String fileName, String code) {
        return dispatcher.runScript(new ContractSource(Path.of(fileName), code));
    }

    public EdgeConfiguration configuration() {
        return configuration;
    }

    public HostServices services() {
        return services;
    }

    public static String version() {
        String implementationVersion = EdgeRunner.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : "development";
    }

    @Override
    public void close() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (compiler instanceof TypeScriptCompiler typescript) {
            typescript.close();
        }
        isolates.close();
    }

    private static LedgerDirectory defaultDirectory(EdgeConfiguration configuration) {
        String url = configuration.ledgerUrl().orElse(HttpLedgerDirectory.DEFAULT_URL);
        return new HttpLedgerDirectory(url, configuration.fetchTimeout());
    }

    private static final class IoThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "tana-edge-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
