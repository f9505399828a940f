package pl.marcinmilkowski.word_finder.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.corpus.WordCorpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds every corpus word that can be spelled from an alphabet.
 *
 * <p>A word matches when it is at least {@link #MIN_WORD_LENGTH} letters long and all of
 * its letters are in the alphabet (letters may repeat). Each query is one pass over the
 * precomputed letter masks of the corpus, so matching is stateless and safe to call
 * from any number of threads.</p>
 *
 * <pre>
 * WordMatcher matcher = new WordMatcher(corpus);
 * List&lt;String&gt; words = matcher.match(Alphabet.of("acehist"));
 * </pre>
 */
public class WordMatcher {

    private static final Logger logger = LoggerFactory.getLogger(WordMatcher.class);

    /** Shortest playable word. Applied on every lookup path. */
    public static final int MIN_WORD_LENGTH = 4;

    private final WordCorpus corpus;

    public WordMatcher(WordCorpus corpus) {
        if (corpus == null) {
            throw new IllegalArgumentException("corpus must not be null");
        }
        this.corpus = corpus;
    }

    public static List<String> match(Alphabet alphabet, WordCorpus corpus) {
        return new WordMatcher(corpus).match(alphabet);
    }

    /**
     * @return matching words in corpus order; empty when nothing matches
     */
    public List<String> match(Alphabet alphabet) {
        if (alphabet.isEmpty()) {
            return Collections.emptyList();
        }
        int forbidden = ~alphabet.mask();
        List<String> result = new ArrayList<>();
        for (int i = 0; i < corpus.size(); i++) {
            if ((corpus.mask(i) & forbidden) != 0) {
                continue;
            }
            String word = corpus.word(i);
            if (word.length() >= MIN_WORD_LENGTH) {
                result.add(word);
            }
        }
        logger.debug("Alphabet '{}' matched {} of {} words in {}", alphabet, result.size(), corpus.size(), corpus.name());
        return result;
    }

    /**
     * Whether {@code word} would be accepted for {@code alphabet} by any lookup path.
     */
    public static boolean isPlayable(String word, Alphabet alphabet) {
        return word != null && word.length() >= MIN_WORD_LENGTH && alphabet.canSpell(word);
    }

    public WordCorpus getCorpus() {
        return corpus;
    }
}
