package dev.tana.edge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.tana.edge.error.ErrorKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a contract invocation produced: status, JSON body, headers and the console lines it wrote.
 */
public record InvocationResult(int status, JsonNode body, Map<String, String> headers, List<String> logs) {
    public static final int DEFAULT_STATUS = 200;
    public static final int ERROR_STATUS = 500;
    public static final String NO_ENTRY_POINT = "No Get or Post function exported";
    public static final String ERROR_KIND_HEADER = "X-Tana-Error-Kind";

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public InvocationResult {
        body = body == null ? NullNode.getInstance() : body;
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers == null ? Map.of() : headers));
        logs = List.copyOf(logs == null ? List.of() : logs);
    }

    /**
     * The 500 result of an invocation that could not complete. The body only carries the message;
     * the failure class travels in {@link #ERROR_KIND_HEADER}.
     */
    public static InvocationResult failure(String message, ErrorKind kind, List<String> logs) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("error", message == null || message.isBlank() ? "Contract execution failed" : message);
        Map<String, String> headers = kind == null ? Map.of() : Map.of(ERROR_KIND_HEADER, kind.tag());
        return new InvocationResult(ERROR_STATUS, body, headers, logs);
    }

    public boolean isError() {
        return status >= 400;
    }

    /**
     * {@code error} field of the body, when the body carries one.
     */
    public String errorMessage() {
        JsonNode error = body.get("error");
        return error != null && error.isTextual() ? error.asText() : null;
    }

    public ErrorKind errorKind() {
        return ErrorKind.fromTag(headers.get(ERROR_KIND_HEADER));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("status", status);
        node.set("body", body);
        ObjectNode headerNode = node.putObject("headers");
        headers.forEach(headerNode::put);
        node.putArray("logs").addAll(logs.stream().map(JsonNodeFactory.instance::textNode).toList());
        return node;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toJson());
        } catch (Exception ex) {
            return "{\"status\":" + ERROR_STATUS + ",\"body\":{\"error\":\"" + ex.getMessage() + "\"}}";
        }
    }
}
