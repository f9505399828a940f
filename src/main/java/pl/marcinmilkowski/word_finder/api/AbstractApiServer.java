package pl.marcinmilkowski.word_finder.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Shared plumbing for the word lookup listeners: binding, handler wrapping,
 * response writing and query-string parsing.
 *
 * Subclasses register their contexts and decide how failures are rendered
 * (plain text or JSON).
 */
public abstract class AbstractApiServer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractApiServer.class);

    protected final WordMatcher matcher;
    private final String host;
    private final int port;
    private final Executor executor;
    private HttpServer server;

    protected AbstractApiServer(WordMatcher matcher, String host, int port, Executor executor) {
        if (matcher == null) {
            throw new IllegalArgumentException("matcher must not be null");
        }
        this.matcher = matcher;
        this.host = host;
        this.port = port;
        this.executor = executor;
    }

    /** Short protocol name used in logs and health reports. */
    protected abstract String protocolName();

    /** Register the protocol's contexts on a freshly bound server. */
    protected abstract void registerContexts(HttpServer server);

    /** Render an error response in the protocol's format. */
    protected abstract void sendFailure(HttpExchange exchange, int status, String message) throws IOException;

    /**
     * Bind and start serving in the background. Returns once the socket is bound.
     *
     * @throws IOException if the port cannot be bound, e.g. because it is already in use
     */
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException(protocolName() + " listener already started");
        }
        InetSocketAddress address = host == null || host.isBlank()
            ? new InetSocketAddress(port)
            : new InetSocketAddress(host, port);
        HttpServer created = HttpServer.create(address, 0);
        created.createContext("/health", wrapHandler(this::handleHealth));
        registerContexts(created);
        created.setExecutor(executor);
        created.start();
        server = created;
        logger.info("{} listener started on http://localhost:{}", protocolName(), getPort());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("{} listener stopped", protocolName());
            server = null;
        }
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler so that any failure becomes an error response for that exchange only.
     */
    protected HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (BadRequestException e) {
                logger.debug("{} bad request {}: {}", protocolName(), exchange.getRequestURI(), e.getMessage());
                respondWithFailure(exchange, e.getStatus(), e.getMessage());
            } catch (Throwable t) {
                if (isClientConnectionIssue(t)) {
                    logger.debug("Client disconnected: {}", t.getMessage());
                    closeQuietly(exchange);
                    return;
                }
                logger.error("Unhandled exception serving {}", exchange.getRequestURI(), t);
                String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
                respondWithFailure(exchange, 500, message);
            }
        };
    }

    private void respondWithFailure(HttpExchange exchange, int status, String message) {
        try {
            if (exchange.getResponseCode() != -1) {
                logger.warn("Cannot send error response: headers already sent");
                return;
            }
            sendFailure(exchange, status, message);
        } catch (Exception e) {
            if (isClientConnectionIssue(e)) {
                logger.debug("Failed to send error response (client disconnected): {}", e.getMessage());
            } else {
                logger.error("Failed to send error response: {}", e.getMessage());
            }
        } finally {
            closeQuietly(exchange);
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"/health".equals(exchange.getRequestURI().getPath())) {
            throw new BadRequestException(404, "Not Found");
        }
        requireMethod(exchange, "GET");
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "word-finder");
        response.put("protocol", protocolName());
        response.put("port", getPort());
        response.put("corpus_size", matcher.getCorpus().size());
        sendJson(exchange, 200, response);
    }

    protected void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new BadRequestException(405, "Method not allowed");
        }
    }

    private boolean isClientConnectionIssue(Throwable t) {
        Throwable current = t;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("broken pipe")
                    || lower.contains("connection reset")
                    || lower.contains("forcibly closed")
                    || lower.contains("insufficient bytes written to stream")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    protected void closeQuietly(HttpExchange exchange) {
        try {
            exchange.close();
        } catch (Exception e) {
            logger.trace("Exchange close failed: {}", e.getMessage());
        }
    }

    protected Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            String key = URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8);
            String value = keyValue.length == 2 ? URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    protected String readRequestBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    protected void sendJson(HttpExchange exchange, int status, Object data) throws IOException {
        String json = JSON.toJSONString(data, JSONWriter.Feature.WriteMapNullValue);
        sendBody(exchange, status, "application/json", json);
    }

    protected void sendText(HttpExchange exchange, int status, String text) throws IOException {
        sendBody(exchange, status, "text/plain; charset=UTF-8", text);
    }

    private void sendBody(HttpExchange exchange, int status, String contentType, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
