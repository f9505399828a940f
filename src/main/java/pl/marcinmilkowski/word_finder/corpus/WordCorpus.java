package pl.marcinmilkowski.word_finder.corpus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable word list with a precomputed letter mask per word.
 *
 * Words are stored lowercased, restricted to a-z, deduplicated in first-seen order.
 * Bit {@code c - 'a'} of a mask is set when the word contains letter {@code c}.
 */
public final class WordCorpus {

    private final String name;
    private final List<String> words;
    private final int[] masks;
    private final int droppedEntries;

    private WordCorpus(String name, List<String> words, int droppedEntries) {
        this.name = name;
        this.words = Collections.unmodifiableList(words);
        this.masks = new int[words.size()];
        for (int i = 0; i < masks.length; i++) {
            masks[i] = letterMask(words.get(i));
        }
        this.droppedEntries = droppedEntries;
    }

    /**
     * Build a corpus from raw entries, normalizing each one.
     *
     * Entries are trimmed and lowercased; blank entries are skipped, entries with
     * characters outside a-z are dropped and counted.
     */
    public static WordCorpus of(String name, Collection<String> rawEntries) {
        Set<String> kept = new LinkedHashSet<>();
        int dropped = 0;
        for (String raw : rawEntries) {
            if (raw == null) {
                continue;
            }
            String word = raw.trim().toLowerCase(Locale.ROOT);
            if (word.isEmpty()) {
                continue;
            }
            if (!isPlainWord(word)) {
                dropped++;
                continue;
            }
            kept.add(word);
        }
        return new WordCorpus(name, new ArrayList<>(kept), dropped);
    }

    /**
     * Mask of the a-z letters in {@code text}. Other characters are ignored.
     */
    public static int letterMask(CharSequence text) {
        int mask = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= 'a' && c <= 'z') {
                mask |= 1 << (c - 'a');
            }
        }
        return mask;
    }

    static boolean isPlainWord(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return true;
    }

    public String name() {
        return name;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public String word(int index) {
        return words.get(index);
    }

    public int mask(int index) {
        return masks[index];
    }

    /** All words in load order. */
    public List<String> words() {
        return words;
    }

    /** Number of raw entries rejected because they contained non a-z characters. */
    public int droppedEntries() {
        return droppedEntries;
    }

    @Override
    public String toString() {
        return "WordCorpus{" + name + ", " + words.size() + " words}";
    }
}
