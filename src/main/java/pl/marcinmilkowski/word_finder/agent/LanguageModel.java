package pl.marcinmilkowski.word_finder.agent;

/**
 * The language model that picks the move. Model selection and credentials live behind this call.
 */
@FunctionalInterface
public interface LanguageModel {

    String generate(String prompt);
}
