package pl.marcinmilkowski.word_finder.client;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import pl.marcinmilkowski.word_finder.api.ToolCallServer;
import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Calls the {@code find_words} tool through a JSON-RPC envelope posted to {@code /jsonrpc}.
 */
public class ToolCallWordSource extends AbstractHttpWordSource {

    private final AtomicLong requestIds = new AtomicLong();

    public ToolCallWordSource(String baseUrl, Duration timeout) {
        super(baseUrl, timeout);
    }

    @Override
    public List<String> findWords(Alphabet alphabet) throws TransportException {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("letters", alphabet.toLetterList());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", ToolCallServer.FIND_WORDS_TOOL);
        params.put("input", input);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jsonrpc", "2.0");
        payload.put("id", requestIds.incrementAndGet());
        payload.put("method", "call_tool");
        payload.put("params", params);

        HttpRequest request = request(ToolCallServer.RPC_PATH)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(JSON.toJSONString(payload), StandardCharsets.UTF_8))
            .build();
        String body = send(request);

        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException e) {
            throw new TransportException("Malformed payload from " + request.uri() + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new TransportException("Malformed payload from " + request.uri() + ": expected a JSON object");
        }
        Map<?, ?> response = (Map<?, ?>) parsed;
        if (response.containsKey("error")) {
            throw new TransportException("Tool error from " + request.uri() + ": " + response.get("error"));
        }
        if (!response.containsKey("result")) {
            throw new TransportException("Malformed payload from " + request.uri() + ": missing 'result'");
        }
        return toWordList(response.get("result"), request.uri().toString());
    }
}
