package pl.marcinmilkowski.word_finder.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AllowedLettersParserTest {

    @Test
    @DisplayName("Letters are read from the announcement line")
    void testParse() {
        Optional<Alphabet> letters = AllowedLettersParser.parse(
            "[GAME] You are Player 0 in Spelling Bee.\nAllowed Letters: ACEhist\nSubmit a word.");

        assertEquals(Optional.of(Alphabet.of("acehist")), letters);
    }

    @Test
    @DisplayName("Observations without an announcement yield nothing")
    void testNoAnnouncement() {
        assertTrue(AllowedLettersParser.parse("[Player 1] [chaise]").isEmpty());
        assertTrue(AllowedLettersParser.parse("").isEmpty());
        assertTrue(AllowedLettersParser.parse(null).isEmpty());
    }
}
