package pl.marcinmilkowski.word_finder.agent;

import pl.marcinmilkowski.word_finder.analysis.LengthDistribution;

import java.util.Collection;
import java.util.List;

/**
 * Renders found words as prompt text, grouped by length with the longest group first.
 *
 * <pre>
 * Here are some possible words you can form with the available letters:
 *
 * 7-letter words: achiest
 * 6-letter words: chaise, chaste (and 3 more)
 * </pre>
 */
public class WordListFormatter {

    public static final String HEADER = "Here are some possible words you can form with the available letters:";
    public static final int DEFAULT_WORDS_PER_LENGTH = 10;

    private final int wordsPerLength;

    public WordListFormatter() {
        this(DEFAULT_WORDS_PER_LENGTH);
    }

    public WordListFormatter(int wordsPerLength) {
        if (wordsPerLength < 1) {
            throw new IllegalArgumentException("wordsPerLength must be positive: " + wordsPerLength);
        }
        this.wordsPerLength = wordsPerLength;
    }

    /**
     * @return the rendered section, or an empty string when there are no words
     */
    public String format(Collection<String> words) {
        LengthDistribution distribution = LengthDistribution.of(words);
        if (distribution.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (int length : distribution.lengthsDescending()) {
            List<String> group = distribution.wordsOfLength(length);
            List<String> shown = group.subList(0, Math.min(wordsPerLength, group.size()));
            sb.append('\n').append(length).append("-letter words: ").append(String.join(", ", shown));
            if (group.size() > shown.size()) {
                sb.append(" (and ").append(group.size() - shown.size()).append(" more)");
            }
        }
        return sb.toString();
    }
}
