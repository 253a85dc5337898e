package dev.tana.edge.api;

import java.util.Locale;

/**
 * Request methods a contract can export an entry point for.
 */
public enum HttpMethod {
    GET("Get", "get"),
    POST("Post", "post");

    private final String entryPoint;
    private final String fileStem;

    HttpMethod(String entryPoint, String fileStem) {
        this.entryPoint = entryPoint;
        this.fileStem = fileStem;
    }

    /**
     * Name of the exported guest function handling this method.
     */
    public String entryPoint() {
        return entryPoint;
    }

    public String fileStem() {
        return fileStem;
    }

    public static HttpMethod from(String value) {
        if (value == null || value.isBlank()) {
            return GET;
        }
        try {
            return HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported method: " + value);
        }
    }
}
