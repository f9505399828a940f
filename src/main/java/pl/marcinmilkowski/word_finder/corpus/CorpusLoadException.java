package pl.marcinmilkowski.word_finder.corpus;

import java.io.IOException;

/**
 * Thrown when a word list source is missing, unreadable or yields no words.
 * The service cannot start without its corpus.
 */
public class CorpusLoadException extends IOException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
