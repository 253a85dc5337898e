package dev.tana.edge.net;

/**
 * Status and decoded body of an allowed outbound GET.
 */
public record FetchResult(int status, String body) {
    public boolean ok() {
        return status >= 200 && status < 300;
    }
}
