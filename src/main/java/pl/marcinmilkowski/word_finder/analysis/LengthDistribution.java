package pl.marcinmilkowski.word_finder.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Histogram of word lengths for one set of matched words.
 *
 * Reports facts only (how many words share the maximum length); deciding what to
 * play is left to the caller.
 */
public final class LengthDistribution {

    /**
     * How many words share the maximum length.
     */
    public enum MaxLengthTier {
        /** No words at all */
        NONE,
        /** Exactly one longest word: playing it first leaves the opponent nothing longer */
        SINGLE,
        /** Exactly two longest words: whoever is forced to play one loses the other */
        PAIR,
        /** Three or more longest words */
        MANY
    }

    /** Longest words first, ties in alphabetical order. */
    public static final Comparator<String> LONGEST_FIRST =
        Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    private final List<String> words;
    private final SortedMap<Integer, Integer> counts;

    private LengthDistribution(List<String> words) {
        this.words = Collections.unmodifiableList(words);
        TreeMap<Integer, Integer> histogram = new TreeMap<>();
        for (String word : words) {
            histogram.merge(word.length(), 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableSortedMap(histogram);
    }

    public static LengthDistribution of(Collection<String> words) {
        return new LengthDistribution(new ArrayList<>(words));
    }

    /** Length to number of words of that length, ascending by length. */
    public SortedMap<Integer, Integer> distribution() {
        return counts;
    }

    public List<Integer> lengthsDescending() {
        List<Integer> lengths = new ArrayList<>(counts.keySet());
        Collections.reverse(lengths);
        return lengths;
    }

    /** Length of the longest word, 0 when there are none. */
    public int maxLength() {
        return counts.isEmpty() ? 0 : counts.lastKey();
    }

    /** Words of exactly {@code length} letters, in input order. */
    public List<String> wordsOfLength(int length) {
        List<String> result = new ArrayList<>();
        for (String word : words) {
            if (word.length() == length) {
                result.add(word);
            }
        }
        return result;
    }

    public List<String> longestWords() {
        return wordsOfLength(maxLength());
    }

    public List<String> longestFirst() {
        List<String> sorted = new ArrayList<>(words);
        sorted.sort(LONGEST_FIRST);
        return sorted;
    }

    public MaxLengthTier maxLengthTier() {
        if (counts.isEmpty()) {
            return MaxLengthTier.NONE;
        }
        int longest = counts.get(counts.lastKey());
        if (longest == 1) {
            return MaxLengthTier.SINGLE;
        }
        if (longest == 2) {
            return MaxLengthTier.PAIR;
        }
        return MaxLengthTier.MANY;
    }

    public int totalWords() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }
}
