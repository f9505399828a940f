package pl.marcinmilkowski.word_finder.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_finder.TestCorpora;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tool-call listener: bare calls, JSON-RPC envelopes and structured errors.
 */
class ToolCallServerTest {

    private static WordMatcher matcher;
    private static ExecutorService workers;
    private static ToolCallServer server;
    private static HttpClient http;

    @BeforeAll
    static void startServer() throws IOException {
        matcher = new WordMatcher(TestCorpora.primary());
        workers = Executors.newFixedThreadPool(4);
        server = new ToolCallServer(matcher, "127.0.0.1", 0, workers);
        server.start();
        http = HttpClient.newHttpClient();
    }

    @AfterAll
    static void stopServer() {
        server.stop();
        workers.shutdownNow();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Bare find_words call returns the matcher's words")
    void testBareCall() throws Exception {
        HttpResponse<String> response = post("/jsonrpc",
            "{\"name\":\"find_words\",\"input\":{\"letters\":[\"A\",\"C\",\"E\",\"H\",\"I\",\"S\",\"T\"]}}");

        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        List<String> words = body.getJSONArray("result").toJavaList(String.class);
        assertEquals(new HashSet<>(matcher.match(Alphabet.of("acehist"))), new HashSet<>(words));
        assertFalse(body.containsKey("error"));
    }

    @Test
    @DisplayName("The /tools/call alias behaves like /jsonrpc")
    void testToolsCallAlias() throws Exception {
        HttpResponse<String> response = post("/tools/call",
            "{\"name\":\"find_words\",\"input\":{\"letters\":[\"x\",\"y\",\"z\"]}}");

        assertEquals(200, response.statusCode());
        assertTrue(JSON.parseObject(response.body()).getJSONArray("result").isEmpty());
    }

    @Test
    @DisplayName("JSON-RPC envelope is unwrapped and id echoed")
    void testEnvelope() throws Exception {
        HttpResponse<String> response = post("/jsonrpc",
            "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"call_tool\","
                + "\"params\":{\"name\":\"find_words\",\"input\":{\"letters\":[\"a\",\"c\",\"e\",\"h\",\"i\",\"s\",\"t\"]}}}");

        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertEquals("2.0", body.getString("jsonrpc"));
        assertEquals(7, body.getIntValue("id"));
        assertTrue(body.getJSONArray("result").contains("achiest"));
    }

    @Test
    @DisplayName("list_tools describes find_words")
    void testListTools() throws Exception {
        HttpResponse<String> response = post("/jsonrpc", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"list_tools\"}");

        assertEquals(200, response.statusCode());
        JSONArray tools = JSON.parseObject(response.body()).getJSONArray("result");
        assertEquals(1, tools.size());
        assertEquals("find_words", tools.getJSONObject(0).getString("name"));
    }

    @Test
    @DisplayName("Malformed input gives a structured error, not a crash")
    void testMalformedInputs() throws Exception {
        assertError(post("/jsonrpc", ""), 400, "Empty request");
        assertError(post("/jsonrpc", "{not json"), 400, "");
        assertError(post("/jsonrpc", "[1,2]"), 400, "JSON object");
        assertError(post("/jsonrpc", "{\"input\":{\"letters\":[\"a\"]}}"), 400, "name");
        assertError(post("/jsonrpc", "{\"name\":\"find_words\"}"), 400, "input");
        assertError(post("/jsonrpc", "{\"name\":\"find_words\",\"input\":{\"letters\":\"abc\"}}"), 400, "letters");
        assertError(post("/jsonrpc", "{\"name\":\"find_words\",\"input\":{\"letters\":[\"a\",1]}}"), 400, "strings");
        assertError(post("/jsonrpc", "{\"name\":\"find_words\",\"input\":{\"letters\":[\"ab\"]}}"), 400, "single letter");
    }

    @Test
    @DisplayName("Unknown tools and methods answer 404 with an error payload")
    void testUnknownTool() throws Exception {
        assertError(post("/jsonrpc", "{\"name\":\"solve_poker\",\"input\":{}}"), 404, "Unknown tool");
        assertError(post("/jsonrpc", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"shutdown\",\"params\":{}}"),
            404, "Unknown method");
    }

    @Test
    @DisplayName("Errors inside an envelope echo jsonrpc and id")
    void testEnvelopeErrorEchoesId() throws Exception {
        HttpResponse<String> badLetters = post("/jsonrpc",
            "{\"jsonrpc\":\"2.0\",\"id\":42,\"method\":\"call_tool\","
                + "\"params\":{\"name\":\"find_words\",\"input\":{\"letters\":[\"ab\"]}}}");
        assertError(badLetters, 400, "single letter");
        JSONObject body = JSON.parseObject(badLetters.body());
        assertEquals("2.0", body.getString("jsonrpc"));
        assertEquals(42, body.getIntValue("id"));
        assertFalse(body.containsKey("result"));

        HttpResponse<String> unknownMethod = post("/jsonrpc",
            "{\"jsonrpc\":\"2.0\",\"id\":\"req-9\",\"method\":\"shutdown\"}");
        assertError(unknownMethod, 404, "Unknown method");
        assertEquals("req-9", JSON.parseObject(unknownMethod.body()).getString("id"));
    }

    @Test
    @DisplayName("Listener keeps serving after errors")
    void testServesAfterError() throws Exception {
        post("/jsonrpc", "{broken");
        HttpResponse<String> response = post("/jsonrpc",
            "{\"name\":\"find_words\",\"input\":{\"letters\":[\"a\",\"c\",\"e\",\"h\",\"i\",\"s\",\"t\"]}}");
        assertEquals(200, response.statusCode());
    }

    @Test
    @DisplayName("GET on the call endpoint is not allowed; unknown paths are 404")
    void testMethodAndPath() throws Exception {
        HttpRequest get = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + "/jsonrpc"))
            .GET()
            .build();
        assertError(http.send(get, HttpResponse.BodyHandlers.ofString()), 405, "Method not allowed");
        assertError(post("/other", "{}"), 404, "Not Found");
    }

    private static void assertError(HttpResponse<String> response, int status, String fragment) {
        assertEquals(status, response.statusCode(), response.body());
        JSONObject body = JSON.parseObject(response.body());
        String error = body.getString("error");
        assertNotNull(error, response.body());
        assertTrue(error.contains(fragment), "'" + error + "' should mention '" + fragment + "'");
    }
}
