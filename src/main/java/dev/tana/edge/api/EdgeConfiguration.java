package dev.tana.edge.api;

import dev.tana.edge.net.DomainAllowlist;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for an {@link EdgeRunner} and the HTTP front in front of it.
 */
public record EdgeConfiguration(
    Path contractsRoot,
    Optional<Path> typescriptCompiler,
    List<String> allowedDomains,
    Optional<String> ledgerUrl,
    Duration fetchTimeout,
    String host,
    int port,
    int workerThreads
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8180;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);

    public EdgeConfiguration {
        Objects.requireNonNull(contractsRoot, "contractsRoot");
        Objects.requireNonNull(typescriptCompiler, "typescriptCompiler");
        Objects.requireNonNull(ledgerUrl, "ledgerUrl");
        Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        Objects.requireNonNull(host, "host");
        allowedDomains = List.copyOf(allowedDomains);
        if (allowedDomains.isEmpty()) {
            throw new IllegalArgumentException("allowedDomains must not be empty");
        }
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .contractsRoot(contractsRoot)
            .typescriptCompiler(typescriptCompiler.orElse(null))
            .allowedDomains(allowedDomains)
            .ledgerUrl(ledgerUrl.orElse(null))
            .fetchTimeout(fetchTimeout)
            .host(host)
            .port(port)
            .workerThreads(workerThreads);
    }

    public static final class Builder {
        private Path contractsRoot = Path.of("contracts");
        private Path typescriptCompiler;
        private List<String> allowedDomains = new ArrayList<>(DomainAllowlist.DEFAULT_DOMAINS);
        private String ledgerUrl;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder contractsRoot(Path contractsRoot) {
            this.contractsRoot = contractsRoot;
            return this;
        }

        public Builder typescriptCompiler(Path typescriptCompiler) {
            this.typescriptCompiler = typescriptCompiler;
            return this;
        }

        public Builder allowedDomains(List<String> allowedDomains) {
            this.allowedDomains = new ArrayList<>(allowedDomains);
            return this;
        }

        public Builder ledgerUrl(String ledgerUrl) {
            this.ledgerUrl = ledgerUrl == null || ledgerUrl.isBlank() ? null : ledgerUrl;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public EdgeConfiguration build() {
            return new EdgeConfiguration(
                contractsRoot,
                Optional.ofNullable(typescriptCompiler),
                allowedDomains,
                Optional.ofNullable(ledgerUrl),
                fetchTimeout,
                host,
                port,
                workerThreads
            );
        }
    }
}
