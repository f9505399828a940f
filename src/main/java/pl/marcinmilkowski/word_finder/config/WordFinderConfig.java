package pl.marcinmilkowski.word_finder.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Loads the word finder configuration from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "server": { "host": "0.0.0.0", "http_port": 8080, "tool_port": 8000, "threads": 8 },
 *   "corpus": { "primary": "classpath:/words/primary.txt", "fallback": "classpath:/words/fallback.txt" },
 *   "client": { "remote_url": "http://localhost:8000", "protocol": "TOOL_CALL", "timeout_ms": 3000 }
 * }
 *
 * Every section and key except {@code version} is optional and falls back to the defaults below.
 */
public class WordFinderConfig {
    private static final Logger logger = LoggerFactory.getLogger(WordFinderConfig.class);

    public static final String DEFAULT_RESOURCE = "/word-finder.json";

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final int DEFAULT_TOOL_PORT = 8000;
    public static final int DEFAULT_THREADS = 8;
    public static final String DEFAULT_PRIMARY_CORPUS = "classpath:/words/primary.txt";
    public static final String DEFAULT_FALLBACK_CORPUS = "classpath:/words/fallback.txt";
    public static final String DEFAULT_REMOTE_URL = "http://localhost:8000";
    public static final long DEFAULT_TIMEOUT_MS = 3000;

    /**
     * Wire protocol the client uses for its remote attempt.
     */
    public enum ClientProtocol {
        /** POST /jsonrpc with a find_words tool call */
        TOOL_CALL,
        /** GET /find_words?letters=... */
        HTTP_QUERY
    }

    private final String version;
    private final String host;
    private final int httpPort;
    private final int toolPort;
    private final int threads;
    private final String primaryCorpus;
    private final String fallbackCorpus;
    private final String remoteUrl;
    private final ClientProtocol clientProtocol;
    private final Duration clientTimeout;

    private WordFinderConfig(Builder b) {
        this.version = b.version;
        this.host = b.host;
        this.httpPort = checkPort("server.http_port", b.httpPort);
        this.toolPort = checkPort("server.tool_port", b.toolPort);
        if (b.threads < 1) {
            throw new IllegalArgumentException("'server.threads' must be positive, got " + b.threads);
        }
        this.threads = b.threads;
        this.primaryCorpus = requireText("corpus.primary", b.primaryCorpus);
        this.fallbackCorpus = requireText("corpus.fallback", b.fallbackCorpus);
        this.remoteUrl = b.remoteUrl;
        this.clientProtocol = b.clientProtocol;
        if (b.timeoutMs <= 0) {
            throw new IllegalArgumentException("'client.timeout_ms' must be positive, got " + b.timeoutMs);
        }
        this.clientTimeout = Duration.ofMillis(b.timeoutMs);
    }

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static WordFinderConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        WordFinderConfig config = parse(Files.readString(configPath, StandardCharsets.UTF_8));
        logger.info("Loaded config version {} from {}", config.version, configPath);
        return config;
    }

    /**
     * Load the configuration bundled with the application.
     */
    public static WordFinderConfig loadDefault() throws IOException {
        try (InputStream in = WordFinderConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Config resource not found: " + DEFAULT_RESOURCE);
            }
            WordFinderConfig config = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("Loaded bundled config version {}", config.version);
            return config;
        }
    }

    static WordFinderConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty config");
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in config");
        }

        Builder b = builder().withVersion(parsedVersion);

        JSONObject server = root.getJSONObject("server");
        if (server != null) {
            if (server.containsKey("host")) {
                b.withHost(server.getString("host"));
            }
            b.withHttpPort(readInt(server, "server", "http_port", DEFAULT_HTTP_PORT));
            b.withToolPort(readInt(server, "server", "tool_port", DEFAULT_TOOL_PORT));
            b.withThreads(readInt(server, "server", "threads", DEFAULT_THREADS));
        }

        JSONObject corpus = root.getJSONObject("corpus");
        if (corpus != null) {
            if (corpus.containsKey("primary")) {
                b.withPrimaryCorpus(corpus.getString("primary"));
            }
            if (corpus.containsKey("fallback")) {
                b.withFallbackCorpus(corpus.getString("fallback"));
            }
        }

        JSONObject client = root.getJSONObject("client");
        if (client != null) {
            if (client.containsKey("remote_url")) {
                b.withRemoteUrl(client.getString("remote_url"));
            }
            String protocol = client.getString("protocol");
            if (protocol != null) {
                b.withClientProtocol(parseProtocol(protocol));
            }
            b.withTimeoutMs(readLong(client, "client", "timeout_ms", DEFAULT_TIMEOUT_MS));
        }

        return b.build();
    }

    private static int readInt(JSONObject section, String sectionName, String key, int defaultValue) {
        try {
            return section.getIntValue(key, defaultValue);
        } catch (JSONException | NumberFormatException e) {
            throw new IllegalArgumentException("'" + sectionName + "." + key + "' must be a number, got "
                + section.get(key), e);
        }
    }

    private static long readLong(JSONObject section, String sectionName, String key, long defaultValue) {
        try {
            return section.getLongValue(key, defaultValue);
        } catch (JSONException | NumberFormatException e) {
            throw new IllegalArgumentException("'" + sectionName + "." + key + "' must be a number, got "
                + section.get(key), e);
        }
    }

    /**
     * Accepts the enum names as well as the short forms {@code tool} and {@code http}.
     */
    public static ClientProtocol parseProtocol(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "TOOL", "TOOL_CALL" -> ClientProtocol.TOOL_CALL;
            case "HTTP", "HTTP_QUERY" -> ClientProtocol.HTTP_QUERY;
            default -> throw new IllegalArgumentException(
                "Invalid client protocol: " + value + ". Use 'TOOL_CALL' or 'HTTP_QUERY'");
        };
    }

    private static int checkPort(String key, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("'" + key + "' out of range: " + port);
        }
        return port;
    }

    private static String requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' must not be blank");
        }
        return value;
    }

    public String getVersion() {
        return version;
    }

    public String getHost() {
        return host;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getToolPort() {
        return toolPort;
    }

    public int getThreads() {
        return threads;
    }

    public String getPrimaryCorpus() {
        return primaryCorpus;
    }

    public String getFallbackCorpus() {
        return fallbackCorpus;
    }

    /** Remote listener base URL, or null when the client should answer locally only. */
    public String getRemoteUrl() {
        return remoteUrl;
    }

    public ClientProtocol getClientProtocol() {
        return clientProtocol;
    }

    public Duration getClientTimeout() {
        return clientTimeout;
    }

    /** Copy of this configuration for overriding individual values. */
    public Builder toBuilder() {
        return builder()
            .withVersion(version)
            .withHost(host)
            .withHttpPort(httpPort)
            .withToolPort(toolPort)
            .withThreads(threads)
            .withPrimaryCorpus(primaryCorpus)
            .withFallbackCorpus(fallbackCorpus)
            .withRemoteUrl(remoteUrl)
            .withClientProtocol(clientProtocol)
            .withTimeoutMs(clientTimeout.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for the configuration; starts from the defaults.
     */
    public static class Builder {
        private String version = "1.0";
        private String host = DEFAULT_HOST;
        private int httpPort = DEFAULT_HTTP_PORT;
        private int toolPort = DEFAULT_TOOL_PORT;
        private int threads = DEFAULT_THREADS;
        private String primaryCorpus = DEFAULT_PRIMARY_CORPUS;
        private String fallbackCorpus = DEFAULT_FALLBACK_CORPUS;
        private String remoteUrl = DEFAULT_REMOTE_URL;
        private ClientProtocol clientProtocol = ClientProtocol.TOOL_CALL;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;

        public Builder withVersion(String version) {
            this.version = version;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withHttpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder withToolPort(int toolPort) {
            this.toolPort = toolPort;
            return this;
        }

        public Builder withThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder withPrimaryCorpus(String primaryCorpus) {
            this.primaryCorpus = primaryCorpus;
            return this;
        }

        public Builder withFallbackCorpus(String fallbackCorpus) {
            this.fallbackCorpus = fallbackCorpus;
            return this;
        }

        public Builder withRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl == null || remoteUrl.isBlank() ? null : remoteUrl;
            return this;
        }

        public Builder withClientProtocol(ClientProtocol clientProtocol) {
            this.clientProtocol = clientProtocol;
            return this;
        }

        public Builder withTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public WordFinderConfig build() {
            return new WordFinderConfig(this);
        }
    }
}
