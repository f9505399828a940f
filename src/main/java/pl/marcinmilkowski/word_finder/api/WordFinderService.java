package pl.marcinmilkowski.word_finder.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tool-call and plain HTTP listeners over one matcher and one worker pool.
 *
 * {@link #start()} returns as soon as both ports are bound; requests are served on
 * pool threads so concurrent queries never wait for each other.
 */
public class WordFinderService {

    private static final Logger logger = LoggerFactory.getLogger(WordFinderService.class);

    private final WordMatcher matcher;
    private final String host;
    private final int httpPort;
    private final int toolPort;
    private final int threads;

    private ExecutorService workers;
    private FindWordsHttpServer httpServer;
    private ToolCallServer toolServer;

    public WordFinderService(WordMatcher matcher, String host, int httpPort, int toolPort, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.matcher = matcher;
        this.host = host;
        this.httpPort = httpPort;
        this.toolPort = toolPort;
        this.threads = threads;
    }

    /**
     * Bind both listeners.
     *
     * @throws IOException if either port cannot be bound; nothing is left running in that case
     */
    public synchronized void start() throws IOException {
        if (workers != null) {
            throw new IllegalStateException("Service already started");
        }
        workers = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        httpServer = new FindWordsHttpServer(matcher, host, httpPort, workers);
        toolServer = new ToolCallServer(matcher, host, toolPort, workers);
        try {
            httpServer.start();
            toolServer.start();
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to start word finder listeners: {}", e.getMessage());
            stop();
            throw e;
        }
        logger.info("Word finder serving {} words: http-query on port {}, tool-call on port {}",
            matcher.getCorpus().size(), httpServer.getPort(), toolServer.getPort());
    }

    public synchronized void stop() {
        if (toolServer != null) {
            toolServer.stop();
            toolServer = null;
        }
        if (httpServer != null) {
            httpServer.stop();
            httpServer = null;
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            workers = null;
        }
    }

    public synchronized int getHttpPort() {
        return httpServer != null ? httpServer.getPort() : httpPort;
    }

    public synchronized int getToolPort() {
        return toolServer != null ? toolServer.getPort() : toolPort;
    }

    public synchronized boolean isRunning() {
        return httpServer != null && httpServer.isRunning() && toolServer != null && toolServer.isRunning();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "word-finder-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
