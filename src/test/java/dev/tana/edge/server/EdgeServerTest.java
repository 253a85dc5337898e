package dev.tana.edge.server;

import static dev.tana.edge.support.EdgeTestSupport.writeContract;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.block.InMemoryLedgerDirectory;
import dev.tana.edge.support.EdgeTestSupport;
import dev.tana.edge.support.FakeTransport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EdgeServerTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path contracts;

    private EdgeRunner runner;
    private EdgeServer server;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        writeContract(contracts, "hello", "get.js", String.join("\n",
            "import { Response } from 'tana/net';",
            "export function Get(req) {",
            "  return Response.json({ path: req.path, q: req.query.q, agent: req.headers['x-test'] });",
            "}"));
        writeContract(contracts, "hello", "post.js", String.join("\n",
            "export function Post(req, body) {",
            "  return { status: 201, body: { received: body }, headers: { 'X-Contract': 'hello' } };",
            "}"));
        writeContract(contracts, "plain", "get.js", String.join("\n",
            "import { Response } from 'tana/net';",
            "export function Get() { return Response.text('just text'); }"));

        runner = EdgeTestSupport.runner(contracts, new FakeTransport(), new InMemoryLedgerDirectory());
        server = new EdgeServer(runner, "127.0.0.1", 0, 2);
        server.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        baseUrl = "http://127.0.0.1:" + server.boundPort();
    }

    @AfterEach
    void tearDown() {
        server.close();
        runner.close();
    }

    @Test
    void getRoutesToTheContract() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello/items/7?q=search%20term"))
                .header("X-Test", "junit")
                .GET()
                .build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode body = JSON.readTree(response.body());
        assertEquals("/items/7", body.get("path").asText());
        assertEquals("search term", body.get("q").asText());
        assertEquals("junit", body.get("agent").asText());
    }

    @Test
    void postPassesJsonBodyAndContractHeaders() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"n\":5}"))
                .build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(201, response.statusCode());
        assertEquals("hello", response.headers().firstValue("X-Contract").orElse(null));
        assertEquals(5, JSON.readTree(response.body()).get("received").get("n").asInt());
    }

    @Test
    void textResponsesAreSentRaw() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/plain")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("just text", response.body());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
    }

    @Test
    void malformedJsonIsRejectedBeforeInvocation() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello"))
                .POST(HttpRequest.BodyPublishers.ofString("{not json"))
                .build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(400, response.statusCode());
        assertTrue(JSON.readTree(response.body()).get("error").asText().startsWith("Invalid JSON body: "));
    }

    @Test
    void unsupportedMethodsAndMissingIds() throws Exception {
        HttpResponse<String> put = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello"))
                .PUT(HttpRequest.BodyPublishers.ofString("{}"))
                .build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(405, put.statusCode());

        HttpResponse<String> root = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(404, root.statusCode());

        HttpResponse<String> missing = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/ghost")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(500, missing.statusCode());
        assertTrue(JSON.readTree(missing.body()).get("error").asText().startsWith("Contract not found"));
        assertEquals("setup", missing.headers().firstValue("X-Tana-Error-Kind").orElse(null));
    }

    @Test
    void preflightAnswersWithNoContent() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(204, response.statusCode());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }

    @Test
    void queryStringsDecodeFirstValueWins() {
        Map<String, String> query = EdgeServer.parseQuery("a=1&a=2&b=x%2By&flag");
        assertEquals(Map.of("a", "1", "b", "x+y", "flag", ""), query);
    }

    @Test
    void routedPathSplitsIdFromRest() {
        EdgeServer.RoutedPath routed = EdgeServer.RoutedPath.parse("/wallet/balances/usr_1");
        assertEquals("wallet", routed.contractId());
        assertEquals("/balances/usr_1", routed.path());
        assertEquals("/", EdgeServer.RoutedPath.parse("/wallet").path());
        assertEquals("", EdgeServer.RoutedPath.parse("/").contractId());
    }

    @Test
    void noContentStatusesDropTheContractBody() throws Exception {
        writeContract(contracts, "nobody", "get.js",
            "export function Get(req) { return { status: Number(req.query.s), body: { a: 1 } }; }");

        for (String code : new String[] {"204", "304"}) {
            HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + "/nobody?s=" + code)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
            assertEquals(Integer.parseInt(code), response.statusCode());
            assertEquals("", response.body());
        }

        HttpResponse<String> after = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(200, after.statusCode());
    }

    @Test
    void bodyIsOnlyAllowedOutsideNoContentStatuses() {
        assertFalse(EdgeServer.allowsBody(101));
        assertFalse(EdgeServer.allowsBody(204));
        assertFalse(EdgeServer.allowsBody(304));
        assertTrue(EdgeServer.allowsBody(200));
        assertTrue(EdgeServer.allowsBody(500));
    }

    @Test
    void routedPathDecodesLikeAUriPath() {
        EdgeServer.RoutedPath routed = EdgeServer.RoutedPath.parse("/my%20wallet/a+b/c%2Bd");
        assertEquals("my wallet", routed.contractId());
        assertEquals("/a+b/c+d", routed.path());
        assertEquals("/x//y", EdgeServer.RoutedPath.parse("/wallet/x/%2Fy").path());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> EdgeServer.RoutedPath.parse("/wallet/bad%zz"));
        assertTrue(error.getMessage().startsWith("Invalid request path"));
    }

    @Test
    void plusInThePathReachesTheContract() throws Exception {
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/hello/a+b")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("/a+b", JSON.readTree(response.body()).get("path").asText());
    }
}
