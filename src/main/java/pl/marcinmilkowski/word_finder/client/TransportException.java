package pl.marcinmilkowski.word_finder.client;

import java.io.IOException;

/**
 * Remote lookup failed: refused connection, timeout, error status or unreadable payload.
 * Only {@link WordFinderClient} catches this, and it answers from the local corpus instead.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
