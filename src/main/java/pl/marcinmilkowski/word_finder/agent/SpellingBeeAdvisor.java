package pl.marcinmilkowski.word_finder.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_finder.analysis.LengthDistribution;
import pl.marcinmilkowski.word_finder.client.LookupResult;
import pl.marcinmilkowski.word_finder.client.WordFinderClient;
import pl.marcinmilkowski.word_finder.query.Alphabet;

import java.util.List;
import java.util.Optional;

/**
 * Turns a Spelling Bee observation into a model prompt enriched with the playable words.
 *
 * <p>The alphabet is taken from the most recent observation that announced it and is kept
 * for later turns. On the first move (the observation introduces the player and contains
 * no earlier moves) strategic notes about the longest words are appended as well.</p>
 *
 * <p>One advisor serves one match; it is not thread-safe.</p>
 */
public class SpellingBeeAdvisor {

    private static final Logger logger = LoggerFactory.getLogger(SpellingBeeAdvisor.class);

    private final WordFinderClient client;
    private final LanguageModel model;
    private final WordListFormatter formatter;

    private Alphabet currentLetters;

    public SpellingBeeAdvisor(WordFinderClient client, LanguageModel model) {
        this(client, model, new WordListFormatter());
    }

    public SpellingBeeAdvisor(WordFinderClient client, LanguageModel model, WordListFormatter formatter) {
        this.client = client;
        this.model = model;
        this.formatter = formatter;
    }

    /**
     * Build the prompt for {@code observation} and return the model's answer.
     */
    public String respond(String observation) {
        return model.generate(buildPrompt(observation));
    }

    /**
     * The text that would be sent to the model for {@code observation}.
     */
    public String buildPrompt(String observation) {
        if (observation == null || observation.isEmpty()) {
            return observation == null ? "" : observation;
        }

        Optional<Alphabet> announced = AllowedLettersParser.parse(observation);
        if (announced.isPresent() && !announced.get().isEmpty()) {
            if (!announced.get().equals(currentLetters)) {
                logger.info("Updating current game letters: {}", announced.get());
            }
            currentLetters = announced.get();
        }

        if (currentLetters == null) {
            logger.info("No game letters available yet, passing observation as-is");
            return observation;
        }

        LookupResult lookup = client.findWords(currentLetters);
        if (lookup.isFallback()) {
            logger.debug("Words for '{}' came from the fallback corpus", currentLetters);
        }
        List<String> words = LengthDistribution.of(lookup.words()).longestFirst();
        logger.info("Found {} valid words for '{}'", words.size(), currentLetters);
        if (words.isEmpty()) {
            return observation;
        }

        StringBuilder prompt = new StringBuilder(observation);
        prompt.append("\n\n").append(formatter.format(words));
        if (isFirstMove(observation)) {
            prompt.append("\n\n").append(StrategyNotes.render(words));
        }
        return prompt.toString();
    }

    public Optional<Alphabet> getCurrentLetters() {
        return Optional.ofNullable(currentLetters);
    }

    static boolean isFirstMove(String observation) {
        return observation.contains("You are Player") && !observation.contains("[Player");
    }
}
