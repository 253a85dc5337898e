package dev.tana.edge.net;

import dev.tana.edge.error.EdgeException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The only path from guest code to the network: URLs are parsed, their host checked against the
 * allowlist, and only then fetched.
 */
public final class EgressGateway {
    private static final Logger log = LogManager.getLogger(EgressGateway.class);

    private final DomainAllowlist allowlist;
    private final HttpTransport transport;

    public EgressGateway(DomainAllowlist allowlist, HttpTransport transport) {
        this.allowlist = Objects.requireNonNull(allowlist, "allowlist");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public FetchResult fetch(String url) {
        URI uri = checkAllowed(url);
        int status;
        InputStream body;
        try {
            HttpTransport.Response response = transport.get(uri);
            status = response.status();
            log.debug("fetch {} -> {}", uri, status);
            body = response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw EdgeException.transport("fetch failed: interrupted", ex);
        } catch (IOException ex) {
            throw EdgeException.transport("fetch failed: " + describe(ex), ex);
        }
        try (InputStream in = body) {
            return new FetchResult(status, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw EdgeException.transport("failed to read response body: " + describe(ex), ex);
        }
    }

    /**
     * Parses {@code url} and verifies its host without touching the network.
     *
     * @return the parsed URI
     */
    public URI checkAllowed(String url) {
        URI uri = parse(url);
        String hostname = uri.getHost();
        if (hostname == null || hostname.isEmpty()) {
            throw EdgeException.typeError("Invalid hostname");
        }
        if (hostname.startsWith("[") && hostname.endsWith("]")) {
            hostname = hostname.substring(1, hostname.length() - 1);
        }
        if (!allowlist.allows(hostname)) {
            log.warn("Blocked egress to {}", hostname);
            throw EdgeException.transport(
                "fetch blocked: domain \"" + hostname + "\" not in whitelist. Allowed domains: "
                    + String.join(", ", allowlist.domains()),
                null
            );
        }
        return uri;
    }

    private static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw EdgeException.typeError("Invalid URL: empty input");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException ex) {
            throw EdgeException.typeError("Invalid URL: " + ex.getMessage());
        }
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw EdgeException.typeError("Invalid URL: relative URL without a base");
        }
        String normalized = scheme.toLowerCase(Locale.ROOT);
        if (!normalized.equals("http") && !normalized.equals("https")) {
            throw EdgeException.typeError("Invalid URL: unsupported scheme " + scheme);
        }
        return uri;
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
