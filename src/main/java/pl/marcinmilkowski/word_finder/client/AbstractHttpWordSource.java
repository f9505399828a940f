package pl.marcinmilkowski.word_finder.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transport shared by both remote protocols. Every request is bounded by the
 * configured timeout, both for connecting and for the whole exchange.
 */
abstract class AbstractHttpWordSource implements RemoteWordSource {

    protected final URI baseUri;
    protected final Duration timeout;
    private final HttpClient httpClient;

    protected AbstractHttpWordSource(String baseUrl, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Remote URL must not be blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        String trimmed = baseUrl.trim();
        this.baseUri = URI.create(trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    protected HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create(baseUri + pathAndQuery))
            .timeout(timeout);
    }

    /**
     * Send and return the body of a 2xx response. The timeout bounds the whole exchange,
     * including a response body that arrives slowly.
     */
    protected String send(HttpRequest request) throws TransportException {
        CompletableFuture<HttpResponse<String>> pending =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TransportException("No complete response from " + request.uri() + " within "
                + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException(describeFailure(request, cause), cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while calling " + request.uri(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new TransportException("HTTP " + status + " from " + request.uri() + ": " + abbreviate(response.body()));
        }
        return response.body();
    }

    /**
     * Require a JSON array of strings.
     */
    protected static List<String> toWordList(Object value, String context) throws TransportException {
        if (!(value instanceof List)) {
            throw new TransportException("Malformed payload from " + context + ": expected a JSON array");
        }
        List<String> words = new ArrayList<>();
        for (Object entry : (List<?>) value) {
            if (!(entry instanceof String)) {
                throw new TransportException("Malformed payload from " + context + ": non-string entry " + entry);
            }
            words.add((String) entry);
        }
        return words;
    }

    private static String describeFailure(HttpRequest request, Throwable e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return "Cannot reach " + request.uri() + ": " + reason;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @Override
    public String describe() {
        return getClass().getSimpleName() + "(" + baseUri + ")";
    }
}
