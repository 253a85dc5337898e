package dev.tana.edge.cli;

import dev.tana.edge.api.EdgeConfiguration;
import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.server.EdgeServer;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;

@CommandLine.Command(
    name = "serve",
    description = "Serve GET|POST /{contractId} over HTTP.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ServeCommand implements Callable<Integer> {
    @CommandLine.Mixin
    ConfigOptions options = new ConfigOptions();

    @CommandLine.Option(names = "--host", description = "Bind address.")
    String host;

    @CommandLine.Option(names = {"-p", "--port"}, description = "Listen port.")
    Integer port;

    @CommandLine.Option(names = "--workers", description = "HTTP worker threads.")
    Integer workers;

    @Override
    public Integer call() throws Exception {
        EdgeConfiguration.Builder builder = options.builder();
        if (host != null) builder.host(host);
        if (port != null) builder.port(port);
        if (workers != null) builder.workerThreads(workers);
        EdgeConfiguration configuration = builder.build();

        EdgeRunner runner = new EdgeRunner(configuration);
        EdgeServer server = EdgeServer.forRunner(runner);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            runner.close();
            stopped.countDown();
        }, "tana-edge-shutdown"));
        server.start();
        stopped.await();
        return 0;
    }
}
