package pl.marcinmilkowski.word_finder.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Structured tool-call listener.
 *
 * Endpoints:
 * - POST /jsonrpc (alias /tools/call) - invoke a tool
 * - GET /health - Health check
 *
 * <p>A bare call looks like</p>
 * <pre>
 * { "name": "find_words", "input": { "letters": ["a", "c", "e"] } }
 * </pre>
 * <p>and may also arrive wrapped in a JSON-RPC envelope, in which case {@code jsonrpc}
 * and {@code id} are echoed back:</p>
 * <pre>
 * { "jsonrpc": "2.0", "id": 1, "method": "call_tool", "params": { "name": ..., "input": ... } }
 * </pre>
 * <p>Success answers {@code {"result": [...]}}, failure answers {@code {"error": "..."}}.
 * The envelope method {@code list_tools} describes the available tools.</p>
 */
public class ToolCallServer extends AbstractApiServer {

    private static final Logger logger = LoggerFactory.getLogger(ToolCallServer.class);

    public static final String RPC_PATH = "/jsonrpc";
    public static final String TOOLS_CALL_PATH = "/tools/call";
    public static final String FIND_WORDS_TOOL = "find_words";

    public ToolCallServer(WordMatcher matcher, String host, int port, Executor executor) {
        super(matcher, host, port, executor);
    }

    @Override
    protected String protocolName() {
        return "tool-call";
    }

    @Override
    protected void registerContexts(HttpServer server) {
        server.createContext(RPC_PATH, wrapHandler(this::handleCall));
        server.createContext(TOOLS_CALL_PATH, wrapHandler(this::handleCall));
        server.createContext("/", wrapHandler(exchange -> {
            throw new BadRequestException(404, "Not Found");
        }));
    }

    private void handleCall(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!RPC_PATH.equals(path) && !TOOLS_CALL_PATH.equals(path)) {
            throw new BadRequestException(404, "Not Found");
        }
        requireMethod(exchange, "POST");

        JSONObject root = parseBody(readRequestBody(exchange));
        Map<String, Object> response = new LinkedHashMap<>();
        if (!root.containsKey("params") && !root.containsKey("method")) {
            response.put("result", invoke(root));
            sendJson(exchange, 200, response);
            return;
        }

        // JSON-RPC envelope: jsonrpc and id are echoed on errors too
        response.put("jsonrpc", root.getOrDefault("jsonrpc", "2.0"));
        response.put("id", root.get("id"));
        int status = 200;
        try {
            response.put("result", answerEnvelope(root));
        } catch (BadRequestException e) {
            logger.debug("Rejected envelope {}: {}", root.get("id"), e.getMessage());
            status = e.getStatus();
            response.put("error", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unhandled exception answering envelope {}", root.get("id"), e);
            status = 500;
            response.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        sendJson(exchange, status, response);
    }

    private Object answerEnvelope(JSONObject root) {
        String method = root.getString("method");
        if ("list_tools".equals(method) || "tools/list".equals(method)) {
            return List.of(describeFindWords());
        }
        if (method != null && !"call_tool".equals(method) && !"tools/call".equals(method)) {
            throw new BadRequestException(404, "Unknown method: " + method);
        }
        Object params = root.get("params");
        if (!(params instanceof JSONObject)) {
            throw new BadRequestException("Missing 'params' object");
        }
        return invoke((JSONObject) params);
    }

    private List<String> invoke(JSONObject call) {
        String name = call.getString("name");
        if (name == null || name.isBlank()) {
            throw new BadRequestException("Missing tool 'name'");
        }
        if (!FIND_WORDS_TOOL.equals(name)) {
            throw new BadRequestException(404, "Unknown tool: " + name);
        }

        Alphabet alphabet = readLetters(call.get("input"));
        logger.info("Finding words with letters: {}", alphabet);
        List<String> words = matcher.match(alphabet);
        logger.info("Found {} valid words", words.size());
        return words;
    }

    private static JSONObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new BadRequestException("Empty request");
        }
        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException | NumberFormatException e) {
            throw new BadRequestException("Malformed JSON: " + e.getMessage());
        }
        if (!(parsed instanceof JSONObject)) {
            throw new BadRequestException("Request must be a JSON object");
        }
        return (JSONObject) parsed;
    }

    /**
     * Extract {@code input.letters} as an alphabet.
     */
    static Alphabet readLetters(Object input) {
        if (!(input instanceof Map)) {
            throw new BadRequestException("Missing 'input' object");
        }
        Object letters = ((Map<?, ?>) input).get("letters");
        if (!(letters instanceof List)) {
            throw new BadRequestException("'letters' must be an array of strings");
        }
        List<String> tokens = new ArrayList<>();
        for (Object entry : (List<?>) letters) {
            if (!(entry instanceof String)) {
                throw new BadRequestException("'letters' must contain only strings, got: " + entry);
            }
            tokens.add((String) entry);
        }
        try {
            return Alphabet.fromLetters(tokens);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
    }

    private static Map<String, Object> describeFindWords() {
        Map<String, Object> letters = new LinkedHashMap<>();
        letters.put("type", "array");
        letters.put("items", Map.of("type", "string"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of("letters", letters));
        schema.put("required", List.of("letters"));

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", FIND_WORDS_TOOL);
        tool.put("description", "Find all valid English words of at least "
            + WordMatcher.MIN_WORD_LENGTH + " letters that can be formed using the given letters");
        tool.put("input_schema", schema);
        return tool;
    }

    @Override
    protected void sendFailure(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        sendJson(exchange, status, error);
    }
}
