package pl.marcinmilkowski.word_finder.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordListFormatterTest {

    @Test
    @DisplayName("Groups are listed longest first")
    void testFormat() {
        String text = new WordListFormatter().format(List.of("achiest", "chaise", "chase", "cash"));

        assertEquals(WordListFormatter.HEADER + "\n"
            + "\n7-letter words: achiest"
            + "\n6-letter words: chaise"
            + "\n5-letter words: chase"
            + "\n4-letter words: cash", text);
    }

    @Test
    @DisplayName("Long groups are truncated with a remainder count")
    void testTruncation() {
        String text = new WordListFormatter(2).format(List.of("cash", "each", "etch", "itch", "chaise"));

        assertTrue(text.contains("4-letter words: cash, each (and 2 more)"), text);
        assertTrue(text.contains("6-letter words: chaise"), text);
        assertFalse(text.contains("chaise (and"), text);
    }

    @Test
    @DisplayName("No words render nothing")
    void testEmpty() {
        assertEquals("", new WordListFormatter().format(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new WordListFormatter(0));
    }
}
