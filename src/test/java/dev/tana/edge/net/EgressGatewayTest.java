package dev.tana.edge.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tana.edge.error.EdgeException;
import dev.tana.edge.error.ErrorKind;
import dev.tana.edge.support.FakeTransport;
import java.util.List;
import org.junit.jupiter.api.Test;

class EgressGatewayTest {
    private final FakeTransport transport = new FakeTransport();
    private final EgressGateway gateway = new EgressGateway(DomainAllowlist.defaults(), transport);

    @Test
    void fetchesAllowedHosts() {
        transport.respond("https://api.tana.dev/status", 200, "{\"up\":true}");

        FetchResult result = gateway.fetch("https://api.tana.dev/status");
        assertEquals(200, result.status());
        assertTrue(result.ok());
        assertEquals("{\"up\":true}", result.body());
    }

    @Test
    void nonSuccessStatusIsStillAResult() {
        transport.respond("https://pokeapi.co/missing", 404, "nope");

        FetchResult result = gateway.fetch("https://pokeapi.co/missing");
        assertFalse(result.ok());
        assertEquals(404, result.status());
    }

    @Test
    void blockedHostNeverReachesTheTransport() {
        EdgeException error = assertThrows(EdgeException.class, () -> gateway.fetch("https://evil.example.com/steal"));
        assertEquals(ErrorKind.TRANSPORT, error.kind());
        assertTrue(error.getMessage().startsWith("fetch blocked: domain \"evil.example.com\" not in whitelist."));
        assertTrue(error.getMessage().contains("Allowed domains: pokeapi.co, tana.dev"));
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void malformedUrlsAreTypeErrors() {
        EdgeException spaces = assertThrows(EdgeException.class, () -> gateway.fetch("not a url"));
        assertEquals(EdgeException.GUEST_TYPE_ERROR, spaces.guestName());
        assertTrue(spaces.getMessage().startsWith("Invalid URL: "));

        EdgeException relative = assertThrows(EdgeException.class, () -> gateway.fetch("/relative/path"));
        assertEquals("Invalid URL: relative URL without a base", relative.getMessage());

        EdgeException scheme = assertThrows(EdgeException.class, () -> gateway.fetch("ftp://tana.dev/file"));
        assertEquals("Invalid URL: unsupported scheme ftp", scheme.getMessage());
    }

    @Test
    void bracketedIpv6HostsAreCheckedWithoutBrackets() {
        EgressGateway local = new EgressGateway(new DomainAllowlist(List.of("::1")), transport);
        assertEquals("[::1]", local.checkAllowed("http://[::1]:8080/").getHost());
    }

    @Test
    void separatesConnectAndReadFailures() {
        EdgeException connect = assertThrows(EdgeException.class, () -> gateway.fetch("https://tana.dev/down"));
        assertEquals(ErrorKind.TRANSPORT, connect.kind());
        assertTrue(connect.getMessage().startsWith("fetch failed: "));

        transport.failWhileReading("https://tana.dev/reset");
        EdgeException read = assertThrows(EdgeException.class, () -> gateway.fetch("https://tana.dev/reset"));
        assertEquals("failed to read response body: connection reset", read.getMessage());
    }
}
