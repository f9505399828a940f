package pl.marcinmilkowski.word_finder.client;

import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.util.List;

/**
 * One remote lookup over a specific wire protocol.
 */
public interface RemoteWordSource {

    /**
     * Ask the remote listener for the words constructible from {@code alphabet}.
     *
     * @return the words as returned by the listener
     * @throws TransportException on any network, status or payload failure
     */
    List<String> findWords(Alphabet alphabet) throws TransportException;

    /** Endpoint description for logs. */
    String describe();
}
