package pl.marcinmilkowski.word_finder.query;

import pl.marcinmilkowski.word_finder.corpus.WordCorpus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of letters usable in one round. Lowercased, duplicates collapsed.
 *
 * Letters may be reused any number of times in a word. Characters outside a-z
 * are kept as members but never match a corpus word.
 */
public final class Alphabet {

    private static final Alphabet EMPTY = new Alphabet(new TreeSet<>());

    private final Set<Character> letters;
    private final int mask;

    private Alphabet(TreeSet<Character> letters) {
        this.letters = Collections.unmodifiableSet(letters);
        int m = 0;
        for (char c : letters) {
            if (c >= 'a' && c <= 'z') {
                m |= 1 << (c - 'a');
            }
        }
        this.mask = m;
    }

    public static Alphabet empty() {
        return EMPTY;
    }

    /**
     * Every character of {@code chars} becomes a member; whitespace is ignored.
     */
    public static Alphabet of(String chars) {
        TreeSet<Character> set = new TreeSet<>();
        String lower = chars.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (!Character.isWhitespace(c)) {
                set.add(c);
            }
        }
        return new Alphabet(set);
    }

    /**
     * Build from a list of single-character tokens, as sent over the wire.
     * Tokens are trimmed and blank tokens skipped.
     *
     * @throws IllegalArgumentException if a token is null or longer than one character
     */
    public static Alphabet fromLetters(Collection<String> tokens) {
        TreeSet<Character> set = new TreeSet<>();
        for (String token : tokens) {
            if (token == null) {
                throw new IllegalArgumentException("Letter must not be null");
            }
            String trimmed = token.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() != 1) {
                throw new IllegalArgumentException("Expected a single letter but got '" + token + "'");
            }
            set.add(trimmed.charAt(0));
        }
        return new Alphabet(set);
    }

    public boolean contains(char c) {
        return letters.contains(Character.toLowerCase(c));
    }

    /**
     * Whether every character of {@code word} is a member, case-insensitively.
     */
    public boolean canSpell(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            if (!letters.contains(lower.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /** Letter mask in the same layout as {@link WordCorpus#letterMask(CharSequence)}. */
    public int mask() {
        return mask;
    }

    public boolean isEmpty() {
        return letters.isEmpty();
    }

    public int size() {
        return letters.size();
    }

    /** Members as single-character strings in ascending order. */
    public List<String> toLetterList() {
        List<String> list = new ArrayList<>(letters.size());
        for (char c : letters) {
            list.add(String.valueOf(c));
        }
        return list;
    }

    public boolean isSubsetOf(Alphabet other) {
        return other.letters.containsAll(letters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        return letters.equals(((Alphabet) o).letters);
    }

    @Override
    public int hashCode() {
        return letters.hashCode();
    }

    @Override
    public String toString() {
        return String.join("", toLetterList());
    }
}
