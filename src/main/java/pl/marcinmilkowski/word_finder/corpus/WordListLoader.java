package pl.marcinmilkowski.word_finder.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a word list, one word per line, into a {@link WordCorpus}.
 *
 * Sources are either a classpath resource ({@code classpath:/words/primary.txt})
 * or a filesystem path. Lines starting with {@code #} are comments.
 * The corpus is read once; later calls to {@link #load()} return the same instance.
 */
public class WordListLoader {

    private static final Logger logger = LoggerFactory.getLogger(WordListLoader.class);

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final String source;
    private WordCorpus corpus;

    public WordListLoader(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Word list source must not be blank");
        }
        this.source = source.trim();
    }

    public static WordListLoader forResource(String resource) {
        return new WordListLoader(CLASSPATH_PREFIX + resource);
    }

    public static WordListLoader forPath(Path path) {
        return new WordListLoader(path.toString());
    }

    public String getSource() {
        return source;
    }

    /**
     * Read and normalize the word list.
     *
     * @return the loaded corpus, never empty
     * @throws CorpusLoadException if the source is missing, unreadable or contains no words
     */
    public synchronized WordCorpus load() throws CorpusLoadException {
        if (corpus != null) {
            return corpus;
        }

        List<String> lines;
        try {
            lines = readLines();
        } catch (CorpusLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new CorpusLoadException("Cannot read word list " + source + ": " + e.getMessage(), e);
        }

        WordCorpus loaded = WordCorpus.of(source, lines);
        if (loaded.isEmpty()) {
            throw new CorpusLoadException("Word list " + source + " contains no usable words");
        }
        if (loaded.droppedEntries() > 0) {
            logger.warn("Dropped {} entries with non a-z characters from {}", loaded.droppedEntries(), source);
        }
        logger.info("Loaded {} words from {}", loaded.size(), source);

        corpus = loaded;
        return corpus;
    }

    private List<String> readLines() throws IOException {
        if (source.startsWith(CLASSPATH_PREFIX)) {
            String resource = source.substring(CLASSPATH_PREFIX.length());
            InputStream in = WordListLoader.class.getResourceAsStream(resource);
            if (in == null) {
                throw new CorpusLoadException("Word list resource not found: " + resource);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return readEntries(reader);
            }
        }

        Path path = Paths.get(source);
        if (!Files.exists(path)) {
            throw new CorpusLoadException("Word list file not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readEntries(reader);
        }
    }

    private static List<String> readEntries(BufferedReader reader) throws IOException {
        List<String> entries = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            entries.add(trimmed);
        }
        return entries;
    }
}
