package pl.marcinmilkowski.word_finder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.analysis.LengthDistribution;
import pl.marcinmilkowski.word_finder.api.WordFinderService;
import pl.marcinmilkowski.word_finder.client.HttpQueryWordSource;
import pl.marcinmilkowski.word_finder.client.LookupResult;
import pl.marcinmilkowski.word_finder.client.RemoteWordSource;
import pl.marcinmilkowski.word_finder.client.ToolCallWordSource;
import pl.marcinmilkowski.word_finder.client.WordFinderClient;
import pl.marcinmilkowski.word_finder.config.WordFinderConfig;
import pl.marcinmilkowski.word_finder.corpus.WordListLoader;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Main entry point for the Word Finder application.
 * Starts the lookup listeners or runs a single lookup from the command line.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "server":
                    handleServerCommand(args);
                    break;
                case "find":
                    handleFindCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            System.exit(1);
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        String configPath = null;
        Integer httpPort = null;
        Integer toolPort = null;
        String corpus = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    configPath = requireValue(args, ++i);
                    break;
                case "--http-port":
                    httpPort = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--tool-port":
                    toolPort = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--corpus":
                    corpus = requireValue(args, ++i);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        WordFinderConfig.Builder builder = loadConfig(configPath).toBuilder();
        if (httpPort != null) {
            builder.withHttpPort(httpPort);
        }
        if (toolPort != null) {
            builder.withToolPort(toolPort);
        }
        if (corpus != null) {
            builder.withPrimaryCorpus(corpus);
        }
        WordFinderConfig config = builder.build();

        WordMatcher matcher = new WordMatcher(new WordListLoader(config.getPrimaryCorpus()).load());
        WordFinderService service = new WordFinderService(
            matcher, config.getHost(), config.getHttpPort(), config.getToolPort(), config.getThreads());
        service.start();

        System.out.println("Endpoints:");
        System.out.println("  GET  http://localhost:" + service.getHttpPort() + "/find_words?letters=a,b,c");
        System.out.println("  POST http://localhost:" + service.getToolPort() + "/jsonrpc  (find_words tool)");
        System.out.println("  GET  /health on both ports");
        System.out.println();
        System.out.println("Press Ctrl+C to stop the server.");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\nShutting down...");
            service.stop();
        }));

        // Keep running until interrupted
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleFindCommand(String[] args) throws IOException {
        String configPath = null;
        String letters = null;
        String remoteUrl = null;
        String protocol = null;
        Long timeoutMs = null;
        boolean localOnly = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--letters":
                case "-l":
                    letters = requireValue(args, ++i);
                    break;
                case "--remote":
                case "-r":
                    remoteUrl = requireValue(args, ++i);
                    break;
                case "--protocol":
                    protocol = requireValue(args, ++i);
                    break;
                case "--timeout-ms":
                    timeoutMs = Long.parseLong(requireValue(args, ++i));
                    break;
                case "--local":
                    localOnly = true;
                    break;
                case "--config":
                case "-c":
                    configPath = requireValue(args, ++i);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (letters == null) {
            System.err.println("Error: --letters is required");
            System.err.println("Usage: java -jar word-finder.jar find --letters <letters> [--remote <url>]");
            return;
        }

        WordFinderConfig.Builder builder = loadConfig(configPath).toBuilder();
        if (remoteUrl != null) {
            builder.withRemoteUrl(remoteUrl);
        }
        if (protocol != null) {
            builder.withClientProtocol(WordFinderConfig.parseProtocol(protocol));
        }
        if (timeoutMs != null) {
            builder.withTimeoutMs(timeoutMs);
        }
        if (localOnly) {
            builder.withRemoteUrl(null);
        }
        WordFinderConfig config = builder.build();

        WordFinderClient client = createClient(config);
        Alphabet alphabet = Alphabet.of(letters.replace(",", ""));
        LookupResult result = client.findWords(alphabet);
        LengthDistribution distribution = result.distribution();

        System.out.println("Letters: " + alphabet);
        System.out.println("Source: " + result.source()
            + (result.isFallback() ? " (" + result.fallbackReason() + ")" : ""));
        System.out.println("Found " + distribution.totalWords() + " words");
        for (int length : distribution.lengthsDescending()) {
            System.out.printf("  %d letters: %d%n", length, distribution.distribution().get(length));
        }
        System.out.println();
        for (String word : distribution.longestFirst()) {
            System.out.println("  " + word);
        }
    }

    /**
     * Build the client described by the configuration; the fallback corpus is loaded eagerly.
     */
    public static WordFinderClient createClient(WordFinderConfig config) throws IOException {
        WordMatcher fallback = new WordMatcher(new WordListLoader(config.getFallbackCorpus()).load());
        if (config.getRemoteUrl() == null) {
            return WordFinderClient.localOnly(fallback);
        }
        RemoteWordSource remote = switch (config.getClientProtocol()) {
            case TOOL_CALL -> new ToolCallWordSource(config.getRemoteUrl(), config.getClientTimeout());
            case HTTP_QUERY -> new HttpQueryWordSource(config.getRemoteUrl(), config.getClientTimeout());
        };
        return new WordFinderClient(remote, fallback);
    }

    private static WordFinderConfig loadConfig(String configPath) throws IOException {
        return configPath != null
            ? WordFinderConfig.load(Paths.get(configPath))
            : WordFinderConfig.loadDefault();
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for option " + args[index - 1]);
        }
        return args[index];
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar word-finder.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  server  - Start the tool-call and HTTP lookup listeners");
        System.out.println("  find    - Look up the words for a set of letters");
        System.out.println("  help    - Show this help message");
        System.out.println();
        System.out.println("Server command:");
        System.out.println("  java -jar word-finder.jar server [--config <file>] [--http-port <port>] [--tool-port <port>]");
        System.out.println("    [--corpus <file|classpath:/resource>]");
        System.out.println();
        System.out.println("Find command:");
        System.out.println("  java -jar word-finder.jar find --letters <letters> [--remote <url>] [--protocol tool|http]");
        System.out.println("    [--timeout-ms <ms>] [--local] [--config <file>]");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar word-finder.jar server --http-port 8080 --tool-port 8000");
        System.out.println("  java -jar word-finder.jar find --letters acehist --remote http://localhost:8000");
    }
}
