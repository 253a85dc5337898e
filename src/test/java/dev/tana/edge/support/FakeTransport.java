package dev.tana.edge.support;

import dev.tana.edge.net.HttpTransport;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Canned HTTP responses keyed by URL; any other URL fails like a refused connection.
 */
public final class FakeTransport implements HttpTransport {
    private final Map<String, Canned> responses = new ConcurrentHashMap<>();
    private final List<URI> requests = new CopyOnWriteArrayList<>();

    public FakeTransport respond(String url, int status, String body) {
        responses.put(url, new Canned(status, body, false));
        return this;
    }

    public FakeTransport failWhileReading(String url) {
        responses.put(url, new Canned(200, "", true));
        return this;
    }

    public List<URI> requests() {
        return requests;
    }

    @Override
    public Response get(URI uri) throws IOException {
        requests.add(uri);
        Canned canned = responses.get(uri.toString());
        if (canned == null) {
            throw new IOException("Connection refused: " + uri);
        }
        return new Response() {
            @Override
            public int status() {
                return canned.status();
            }

            @Override
            public InputStream body() {
                if (canned.brokenBody()) {
                    return new InputStream() {
                        @Override
                        public int read() throws IOException {
                            throw new IOException("connection reset");
                        }
                    };
                }
                return new ByteArrayInputStream(canned.body().getBytes(StandardCharsets.UTF_8));
            }
        };
    }

    private record Canned(int status, String body, boolean brokenBody) {}
}
