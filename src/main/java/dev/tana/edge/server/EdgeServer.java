package dev.tana.edge.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.api.HttpMethod;
import dev.tana.edge.api.InvocationRequest;
import dev.tana.edge.api.InvocationResult;
import dev.tana.edge.runtime.ContractLocator;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * HTTP front for an {@link EdgeRunner}: {@code GET|POST /{contractId}[/{path...}]}.
 *
 * <p>The response status and headers come from the contract result and the body is the result's
 * {@code body} as JSON (raw text when the contract answered with a {@code text/*} content type).
 * Every response allows any origin.</p>
 */
public final class EdgeServer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(EdgeServer.class);

    private final EdgeRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String host;
    private final int port;
    private final int workerThreads;
    private HttpServer httpServer;
    private ExecutorService workers;

    public EdgeServer(EdgeRunner runner, String host, int port, int workerThreads) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.workerThreads = workerThreads;
    }

    public static EdgeServer forRunner(EdgeRunner runner) {
        var configuration = runner.configuration();
        return new EdgeServer(runner, configuration.host(), configuration.port(), configuration.workerThreads());
    }

    public synchronized void start() throws IOException {
        if (httpServer != null) {
            throw new IllegalStateException("server already started");
        }
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerThreads, task -> {
            Thread thread = new Thread(task, "tana-edge-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        httpServer = HttpServer.create(new InetSocketAddress(host, port), 0);
        httpServer.createContext("/", new ContractHandler());
        httpServer.setExecutor(workers);
        httpServer.start();
        log.info("tana-edge listening on http://{}:{} (contracts: {})", host, boundPort(),
            runner.configuration().contractsRoot());
    }

    /**
     * Actual listening port; differs from the configured one when that was {@code 0}.
     */
    public synchronized int boundPort() {
        if (httpServer == null) {
            throw new IllegalStateException("server not started");
        }
        return httpServer.getAddress().getPort();
    }

    public synchronized void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            httpServer = null;
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException ex) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            workers = null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    class ContractHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            long started = System.nanoTime();
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            String contractId = "-";
            int status = 500;
            try {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                if ("OPTIONS".equals(method)) {
                    exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
                    exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "*");
                    exchange.sendResponseHeaders(204, -1);
                    status = 204;
                    return;
                }
                if (!"GET".equals(method) && !"POST".equals(method)) {
                    exchange.getResponseHeaders().set("Allow", "GET, POST, OPTIONS");
                    status = sendError(exchange, 405, "Method not allowed: " + method);
                    return;
                }
                RoutedPath routed;
                try {
                    routed = RoutedPath.parse(exchange.getRequestURI().getRawPath());
                } catch (IllegalArgumentException ex) {
                    status = sendError(exchange, 400, ex.getMessage());
                    return;
                }
                contractId = routed.contractId();
                if (contractId.isEmpty()) {
                    contractId = "-";
                    status = sendError(exchange, 404, "Contract id required: use /{contractId}");
                    return;
                }
                if (!ContractLocator.isValidId(contractId)) {
                    status = sendError(exchange, 400, "Invalid contract id: " + contractId);
                    return;
                }

                InvocationRequest.Builder request = InvocationRequest.builder(contractId)
                    .method(HttpMethod.from(method))
                    .path(routed.path())
                    .query(parseQuery(exchange.getRequestURI().getRawQuery()))
                    .headers(firstValues(exchange))
                    .ip(exchange.getRemoteAddress().getAddress().getHostAddress());
                if ("POST".equals(method)) {
                    JsonNode body;
                    try {
                        body = readBody(exchange.getRequestBody());
                    } catch (JsonProcessingException ex) {
                        status = sendError(exchange, 400, "Invalid JSON body: " + ex.getOriginalMessage());
                        return;
                    }
                    request.body(body);
                }

                InvocationResult result = runner.invoke(request.build());
                status = sendResult(exchange, result);
            } catch (Exception ex) {
                log.warn("Request {} {} failed", method, exchange.getRequestURI(), ex);
                status = sendError(exchange, 500, "Unexpected server error");
            } finally {
                log.info("[METRICS] method={} contract={} status={} duration={}ms",
                    method, contractId, status, (System.nanoTime() - started) / 1_000_000);
                exchange.close();
            }
        }
    }

    private JsonNode readBody(InputStream in) throws IOException {
        byte[] raw = in.readAllBytes();
        if (new String(raw, StandardCharsets.UTF_8).isBlank()) {
            return NullNode.getInstance();
        }
        return mapper.readTree(raw);
    }

    private int sendResult(HttpExchange exchange, InvocationResult result) throws IOException {
        int status = result.status() >= 100 && result.status() <= 599 ? result.status() : InvocationResult.DEFAULT_STATUS;
        String contentType = "application/json";
        for (var header : result.headers().entrySet()) {
            String name = header.getKey();
            if (name.equalsIgnoreCase("Content-Length") || name.equalsIgnoreCase("Transfer-Encoding")) {
                continue;
            }
            if (name.equalsIgnoreCase("Content-Type")) {
                contentType = header.getValue();
                continue;
            }
            exchange.getResponseHeaders().set(name, header.getValue());
        }
        byte[] payload;
        if (contentType.toLowerCase(Locale.ROOT).startsWith("text/") && result.body().isTextual()) {
            payload = result.body().asText().getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(result.body());
        }
        return send(exchange, status, contentType, payload);
    }

    private int sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", message);
        return send(exchange, status, "application/json", mapper.writeValueAsBytes(node));
    }

    private static int send(HttpExchange exchange, int status, String contentType, byte[] payload) throws IOException {
        if (!allowsBody(status)) {
            exchange.sendResponseHeaders(status, -1);
            return status;
        }
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
        if (payload.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
        }
        return status;
    }

    /**
     * 1xx, 204 and 304 responses never carry a body, whatever the contract returned.
     */
    static boolean allowsBody(int status) {
        return status >= 200 && status != 204 && status != 304;
    }

    private static Map<String, String> firstValues(HttpExchange exchange) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : exchange.getRequestHeaders().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || entry.getValue().isEmpty()) continue;
            headers.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().get(0));
        }
        return headers;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> query = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            query.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return query;
    }

    /**
     * {@code /{contractId}/rest/of/path} split into the contract id and the path the contract sees.
     * Both parts are percent-decoded as URI paths, so {@code +} stays a plus sign.
     */
    record RoutedPath(String contractId, String path) {
        /**
         * @throws IllegalArgumentException when the path holds a malformed escape
         */
        static RoutedPath parse(String rawPath) {
            String trimmed = rawPath == null ? "" : rawPath;
            while (trimmed.startsWith("/")) {
                trimmed = trimmed.substring(1);
            }
            int slash = trimmed.indexOf('/');
            String id = slash < 0 ? trimmed : trimmed.substring(0, slash);
            String rest = slash < 0 ? "/" : trimmed.substring(slash);
            return new RoutedPath(decodePath(id), decodePath(rest));
        }

        private static String decodePath(String raw) {
            if (raw.indexOf('%') < 0) {
                return raw;
            }
            try {
                return new URI("http://edge/" + raw).getPath().substring(1);
            } catch (URISyntaxException ex) {
                throw new IllegalArgumentException("Invalid request path: " + ex.getReason(), ex);
            }
        }
    }
}
