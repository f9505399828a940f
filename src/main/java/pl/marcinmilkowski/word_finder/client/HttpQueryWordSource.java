package pl.marcinmilkowski.word_finder.client;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import pl.marcinmilkowski.word_finder.api.FindWordsHttpServer;
import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Queries {@code GET /find_words?letters=a,b,c} and reads the JSON array answer.
 */
public class HttpQueryWordSource extends AbstractHttpWordSource {

    public HttpQueryWordSource(String baseUrl, Duration timeout) {
        super(baseUrl, timeout);
    }

    @Override
    public List<String> findWords(Alphabet alphabet) throws TransportException {
        String letters = URLEncoder.encode(String.join(",", alphabet.toLetterList()), StandardCharsets.UTF_8);
        HttpRequest request = request(FindWordsHttpServer.FIND_WORDS_PATH + "?letters=" + letters)
            .header("Accept", "application/json")
            .GET()
            .build();
        String body = send(request);

        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException e) {
            throw new TransportException("Malformed payload from " + request.uri() + ": " + e.getMessage(), e);
        }
        return toWordList(parsed, request.uri().toString());
    }
}
