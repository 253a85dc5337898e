package dev.tana.edge.block;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tana.edge.error.EdgeException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fetches {@code /balances}, {@code /users} and {@code /transactions} from the ledger HTTP API.
 */
public final class HttpLedgerDirectory implements LedgerDirectory {
    public static final String DEFAULT_URL = "http://localhost:8080";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final String baseUrl;
    private final HttpClient client;
    private final Duration timeout;

    public HttpLedgerDirectory(String baseUrl, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public List<JsonNode> balances() {
        return load("balances");
    }

    @Override
    public List<JsonNode> users() {
        return load("users");
    }

    @Override
    public List<JsonNode> transactions() {
        return load("transactions");
    }

    private List<JsonNode> load(String collection) {
        String body;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/" + collection))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw EdgeException.transport(
                    "Failed to fetch " + collection + ": HTTP " + response.statusCode(), null);
            }
            body = response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw EdgeException.transport("Failed to fetch " + collection + ": interrupted", ex);
        } catch (IOException | IllegalArgumentException ex) {
            throw EdgeException.transport("Failed to fetch " + collection + ": " + ex.getMessage(), ex);
        }
        try {
            JsonNode root = JSON.readTree(body);
            if (root == null || !root.isArray()) {
                throw EdgeException.transport("Failed to parse " + collection + ": expected a JSON array", null);
            }
            List<JsonNode> items = new ArrayList<>(root.size());
            root.forEach(items::add);
            return items;
        } catch (IOException ex) {
            throw EdgeException.transport("Failed to parse " + collection + ": " + ex.getMessage(), ex);
        }
    }
}
