package pl.marcinmilkowski.word_finder.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Plain HTTP query listener.
 *
 * Endpoints:
 * - GET /find_words?letters=a,c,e,h,i,s,t - JSON array of matching words
 * - GET /health - Health check
 *
 * Any other path answers 404, failures answer 500, both with a plain-text body.
 */
public class FindWordsHttpServer extends AbstractApiServer {

    private static final Logger logger = LoggerFactory.getLogger(FindWordsHttpServer.class);

    public static final String FIND_WORDS_PATH = "/find_words";

    public FindWordsHttpServer(WordMatcher matcher, String host, int port, Executor executor) {
        super(matcher, host, port, executor);
    }

    @Override
    protected String protocolName() {
        return "http-query";
    }

    @Override
    protected void registerContexts(HttpServer server) {
        server.createContext(FIND_WORDS_PATH, wrapHandler(this::handleFindWords));
        server.createContext("/", wrapHandler(this::handleNotFound));
    }

    private void handleFindWords(HttpExchange exchange) throws IOException {
        if (!FIND_WORDS_PATH.equals(exchange.getRequestURI().getPath())) {
            handleNotFound(exchange);
            return;
        }
        requireMethod(exchange, "GET");

        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String lettersParam = params.get("letters");
        if (lettersParam == null) {
            throw new BadRequestException("Missing 'letters' parameter");
        }

        Alphabet alphabet = parseLetters(lettersParam);
        logger.info("HTTP request to find_words: letters={}", alphabet);
        List<String> words = matcher.match(alphabet);
        logger.info("Found {} valid words", words.size());

        sendJson(exchange, 200, words);
    }

    /**
     * Comma-separated single letters, e.g. {@code a,c,e}. An empty value is an empty alphabet.
     */
    static Alphabet parseLetters(String lettersParam) {
        if (lettersParam.isBlank()) {
            return Alphabet.empty();
        }
        try {
            return Alphabet.fromLetters(Arrays.asList(lettersParam.split(",")));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
    }

    private void handleNotFound(HttpExchange exchange) throws IOException {
        sendText(exchange, 404, "Not Found");
    }

    @Override
    protected void sendFailure(HttpExchange exchange, int status, String message) throws IOException {
        sendText(exchange, status, "Error: " + message);
    }
}
