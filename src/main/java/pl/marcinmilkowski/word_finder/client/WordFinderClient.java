package pl.marcinmilkowski.word_finder.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.query.Alphabet;
import pl.marcinmilkowski.word_finder.query.WordMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Word lookup for the playing agent that always produces an answer.
 *
 * <p>Each query makes exactly one remote attempt. If it fails for any reason (refused
 * connection, timeout, error status, error or malformed payload) the failure is logged
 * and the words are computed in-process from the fallback matcher instead. Callers
 * never see a transport error. Retrying is left to the caller.</p>
 *
 * <p>Remote answers are re-checked against the alphabet; words that are too short or
 * use other letters are dropped.</p>
 */
public class WordFinderClient {

    private static final Logger logger = LoggerFactory.getLogger(WordFinderClient.class);

    private final RemoteWordSource remote;
    private final WordMatcher fallback;

    /**
     * @param remote   remote listener to try first, or null to always answer locally
     * @param fallback matcher over the secondary corpus
     */
    public WordFinderClient(RemoteWordSource remote, WordMatcher fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback matcher must not be null");
        }
        this.remote = remote;
        this.fallback = fallback;
    }

    public static WordFinderClient localOnly(WordMatcher fallback) {
        return new WordFinderClient(null, fallback);
    }

    public LookupResult findWords(Alphabet alphabet) {
        if (remote == null) {
            return LookupResult.fallback(fallback.match(alphabet), "no remote endpoint configured");
        }

        String reason;
        try {
            List<String> words = remote.findWords(alphabet);
            List<String> playable = keepPlayable(words, alphabet);
            logger.debug("Remote {} returned {} words for '{}'", remote.describe(), playable.size(), alphabet);
            return LookupResult.remote(playable);
        } catch (TransportException e) {
            reason = e.getMessage();
        } catch (RuntimeException e) {
            reason = "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        logger.warn("Remote lookup via {} failed ({}), falling back to local corpus {}",
            remote.describe(), reason, fallback.getCorpus().name());
        List<String> words = fallback.match(alphabet);
        logger.info("Found {} valid words using fallback corpus", words.size());
        return LookupResult.fallback(words, reason);
    }

    private List<String> keepPlayable(List<String> words, Alphabet alphabet) {
        List<String> playable = new ArrayList<>(words.size());
        int dropped = 0;
        for (String word : words) {
            if (WordMatcher.isPlayable(word, alphabet)) {
                playable.add(word);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            logger.warn("Dropped {} remote words not constructible from '{}'", dropped, alphabet);
        }
        return playable;
    }
}
