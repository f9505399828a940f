package pl.marcinmilkowski.word_finder.agent;

import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the round's alphabet out of a game observation, e.g. {@code "Allowed Letters: aehktvw"}.
 */
public final class AllowedLettersParser {

    private static final Pattern ALLOWED_LETTERS =
        Pattern.compile("Allowed Letters:\\s*([a-zA-Z]+)", Pattern.CASE_INSENSITIVE);

    private AllowedLettersParser() {
    }

    public static Optional<Alphabet> parse(String observation) {
        if (observation == null || observation.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = ALLOWED_LETTERS.matcher(observation);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(Alphabet.of(m.group(1)));
    }
}
