package dev.tana.edge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One inbound call to a contract.
 */
public record InvocationRequest(
    String contractId,
    HttpMethod method,
    String path,
    Map<String, String> query,
    Map<String, String> headers,
    Map<String, String> params,
    String ip,
    JsonNode body
) {
    public InvocationRequest {
        Objects.requireNonNull(contractId, "contractId");
        Objects.requireNonNull(method, "method");
        path = path == null || path.isEmpty() ? "/" : path;
        query = Map.copyOf(query == null ? Map.of() : query);
        headers = Map.copyOf(headers == null ? Map.of() : headers);
        params = Map.copyOf(params == null ? Map.of() : params);
        ip = ip == null || ip.isBlank() ? "127.0.0.1" : ip;
        body = body == null ? NullNode.getInstance() : body;
    }

    public static Builder builder(String contractId) {
        return new Builder(contractId);
    }

    public static InvocationRequest get(String contractId) {
        return builder(contractId).build();
    }

    public static InvocationRequest post(String contractId, JsonNode body) {
        return builder(contractId).method(HttpMethod.POST).body(body).build();
    }

    /**
     * The object handed to the guest {@code Request} constructor (the body travels separately).
     */
    public ObjectNode toGuestJson() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode node = nodes.objectNode();
        node.put("path", path);
        node.put("method", method.name());
        node.set("query", toObject(query));
        node.set("headers", toObject(headers));
        node.set("params", toObject(params));
        node.put("ip", ip);
        return node;
    }

    private static ObjectNode toObject(Map<String, String> values) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        new TreeMap<>(values).forEach(node::put);
        return node;
    }

    public static final class Builder {
        private final String contractId;
        private HttpMethod method = HttpMethod.GET;
        private String path = "/";
        private final Map<String, String> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> params = new LinkedHashMap<>();
        private String ip;
        private JsonNode body;

        private Builder(String contractId) {
            this.contractId = contractId;
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder query(Map<String, String> query) {
            this.query.putAll(query);
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder params(Map<String, String> params) {
            this.params.putAll(params);
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder body(JsonNode body) {
            this.body = body;
            return this;
        }

        public InvocationRequest build() {
            return new InvocationRequest(contractId, method, path, query, headers, params, ip, body);
        }
    }
}
