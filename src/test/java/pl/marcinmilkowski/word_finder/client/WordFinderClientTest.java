package pl.marcinmilkowski.word_finder.client;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_finder.TestCorpora;
import pl.marcinmilkowski.word_finder.api.WordFinderService;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Remote lookups over both protocols and the silent local fallback.
 */
class WordFinderClientTest {

    private static final Alphabet ACEHIST = Alphabet.of("acehist");
    private static final Duration TIMEOUT = Duration.ofMillis(500);

    private static WordMatcher primary;
    private static WordMatcher fallback;
    private static WordFinderService service;

    @BeforeAll
    static void startService() throws IOException {
        primary = new WordMatcher(TestCorpora.primary());
        fallback = new WordMatcher(TestCorpora.fallback());
        service = new WordFinderService(primary, "127.0.0.1", 0, 0, 4);
        service.start();
    }

    @AfterAll
    static void stopService() {
        service.stop();
    }

    @Test
    @DisplayName("Tool-call source answers remotely with the server's words")
    void testToolCallRemote() {
        WordFinderClient client = new WordFinderClient(
            new ToolCallWordSource("http://127.0.0.1:" + service.getToolPort(), TIMEOUT), fallback);

        LookupResult result = client.findWords(ACEHIST);

        assertEquals(LookupResult.Source.REMOTE, result.source());
        assertNull(result.fallbackReason());
        assertEquals(new HashSet<>(primary.match(ACEHIST)), new HashSet<>(result.words()));
    }

    @Test
    @DisplayName("HTTP query source answers remotely with the server's words")
    void testHttpQueryRemote() {
        WordFinderClient client = new WordFinderClient(
            new HttpQueryWordSource("http://127.0.0.1:" + service.getHttpPort() + "/", TIMEOUT), fallback);

        LookupResult result = client.findWords(ACEHIST);

        assertFalse(result.isFallback());
        assertEquals(new HashSet<>(primary.match(ACEHIST)), new HashSet<>(result.words()));
    }

    @Test
    @DisplayName("Refused connection falls back to the local corpus")
    void testConnectionRefused() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        WordFinderClient client = new WordFinderClient(
            new ToolCallWordSource("http://127.0.0.1:" + port, TIMEOUT), fallback);

        LookupResult result = client.findWords(ACEHIST);

        assertTrue(result.isFallback());
        assertNotNull(result.fallbackReason());
        assertEquals(fallback.match(ACEHIST), result.words());
        assertTrue(result.words().contains("chaise"));
    }

    @Test
    @DisplayName("A listener that never answers is abandoned after the timeout")
    void testTimeout() throws IOException {
        try (ServerSocket silent = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
            WordFinderClient client = new WordFinderClient(
                new HttpQueryWordSource("http://127.0.0.1:" + silent.getLocalPort(), Duration.ofMillis(200)),
                fallback);

            long started = System.nanoTime();
            LookupResult result = client.findWords(ACEHIST);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            assertTrue(result.isFallback());
            assertFalse(result.words().isEmpty());
            assertTrue(elapsedMs < 5000, "took " + elapsedMs + " ms");
        }
    }

    @Test
    @DisplayName("A response body that trickles in past the timeout still falls back in time")
    void testSlowBodyTimeout() throws IOException {
        ExecutorService stubWorkers = Executors.newCachedThreadPool();
        HttpServer stub = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        stub.setExecutor(stubWorkers);
        stub.createContext("/find_words", exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, 100);
            OutputStream os = exchange.getResponseBody();
            os.write('[');
            os.flush();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        stub.start();
        try {
            WordFinderClient client = new WordFinderClient(
                new HttpQueryWordSource("http://127.0.0.1:" + stub.getAddress().getPort(), Duration.ofMillis(300)),
                fallback);

            long started = System.nanoTime();
            LookupResult result = client.findWords(ACEHIST);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            assertTrue(result.isFallback());
            assertEquals(fallback.match(ACEHIST), result.words());
            assertTrue(elapsedMs < 2000, "took " + elapsedMs + " ms");
        } finally {
            stubWorkers.shutdownNow();
            stub.stop(0);
        }
    }

    @Test
    @DisplayName("Error status, error payload and malformed payload all fall back")
    void testBadResponsesFallBack() throws IOException {
        HttpServer stub = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        stub.createContext("/status500/find_words", exchange -> respond(exchange, 500, "Error: boom"));
        stub.createContext("/garbage/find_words", exchange -> respond(exchange, 200, "<html>not json</html>"));
        stub.createContext("/object/find_words", exchange -> respond(exchange, 200, "{\"words\":[]}"));
        stub.createContext("/numbers/find_words", exchange -> respond(exchange, 200, "[1,2,3]"));
        stub.createContext("/tool/jsonrpc", exchange -> respond(exchange, 200, "{\"error\":\"Unknown tool\"}"));
        stub.createContext("/noresult/jsonrpc", exchange -> respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":1}"));
        stub.start();
        try {
            String base = "http://127.0.0.1:" + stub.getAddress().getPort();
            List<RemoteWordSource> sources = List.of(
                new HttpQueryWordSource(base + "/status500", TIMEOUT),
                new HttpQueryWordSource(base + "/garbage", TIMEOUT),
                new HttpQueryWordSource(base + "/object", TIMEOUT),
                new HttpQueryWordSource(base + "/numbers", TIMEOUT),
                new ToolCallWordSource(base + "/tool", TIMEOUT),
                new ToolCallWordSource(base + "/noresult", TIMEOUT));

            for (RemoteWordSource source : sources) {
                LookupResult result = new WordFinderClient(source, fallback).findWords(ACEHIST);
                assertTrue(result.isFallback(), source.describe());
                assertEquals(fallback.match(ACEHIST), result.words(), source.describe());
            }
        } finally {
            stub.stop(0);
        }
    }

    @Test
    @DisplayName("Remote words that are too short or use other letters are dropped")
    void testRemoteWordsRechecked() throws IOException {
        HttpServer stub = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        stub.createContext("/find_words", exchange ->
            respond(exchange, 200, "[\"chaise\",\"cat\",\"zebra\",\"achiest\"]"));
        stub.start();
        try {
            WordFinderClient client = new WordFinderClient(
                new HttpQueryWordSource("http://127.0.0.1:" + stub.getAddress().getPort(), TIMEOUT), fallback);

            LookupResult result = client.findWords(ACEHIST);

            assertFalse(result.isFallback());
            assertEquals(List.of("chaise", "achiest"), result.words());
        } finally {
            stub.stop(0);
        }
    }

    @Test
    @DisplayName("Without a remote endpoint the fallback corpus answers")
    void testLocalOnly() {
        LookupResult result = WordFinderClient.localOnly(fallback).findWords(ACEHIST);

        assertTrue(result.isFallback());
        assertEquals(fallback.match(ACEHIST), result.words());
        assertEquals(result.words().size(), result.distribution().totalWords());
    }

    @Test
    @DisplayName("Source constructors reject blank URLs and non-positive timeouts")
    void testSourceValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ToolCallWordSource(" ", TIMEOUT));
        assertThrows(IllegalArgumentException.class, () -> new HttpQueryWordSource("http://localhost:1", Duration.ZERO));
    }

    private static void respond(HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
