package dev.tana.edge.net;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Outbound GET used by the egress gateway. Connecting and reading the body are separate steps so
 * the two failure modes stay distinguishable.
 */
public interface HttpTransport {
    Response get(URI uri) throws IOException, InterruptedException;

    interface Response {
        int status();

        InputStream body();
    }
}
