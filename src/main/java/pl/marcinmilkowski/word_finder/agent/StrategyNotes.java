package pl.marcinmilkowski.word_finder.agent;

import pl.marcinmilkowski.word_finder.analysis.LengthDistribution;

import java.util.Collection;
import java.util.List;

/**
 * Strategic commentary appended on the first move: the length breakdown, the longest
 * words, and what the size of the longest tier implies.
 */
public final class StrategyNotes {

    public static final String HEADER = "# Strategic Analysis for Spelling Bee";

    private StrategyNotes() {
    }

    /**
     * @return the rendered notes, or an empty string when there are no words
     */
    public static String render(Collection<String> words) {
        LengthDistribution distribution = LengthDistribution.of(words);
        if (distribution.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder(HEADER).append("\n\n");
        sb.append("Here's a breakdown of possible words by length:\n");
        for (int length : distribution.lengthsDescending()) {
            sb.append("- ").append(length).append("-letter words: ")
                .append(distribution.distribution().get(length)).append('\n');
        }

        int maxLength = distribution.maxLength();
        List<String> longest = distribution.longestWords();
        sb.append("\n## Strategy for Longest Words (").append(maxLength).append(" letters)\n\n");
        sb.append("There ").append(longest.size() == 1 ? "is 1 word" : "are " + longest.size() + " words")
            .append(" of maximum length ").append(maxLength).append(":\n");
        sb.append(String.join(", ", longest));

        switch (distribution.maxLengthTier()) {
            case SINGLE -> sb.append("\n\nSince there is only one word of maximum length, "
                + "playing it immediately leaves the opponent no longer word and forces a win.");
            case PAIR -> sb.append("\n\nSince there are only two words of maximum length, "
                + "try to make your opponent play one of them, then play the other to win.");
            default -> sb.append("\n\nPlay shorter words first to force the opponent into the longer ones.");
        }
        return sb.toString();
    }
}
