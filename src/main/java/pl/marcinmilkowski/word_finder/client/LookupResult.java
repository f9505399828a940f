package pl.marcinmilkowski.word_finder.client;

import pl.marcinmilkowski.word_finder.analysis.LengthDistribution;

import java.util.List;

/**
 * Words found for one query and the path that produced them.
 *
 * @param words          matching words, possibly empty, never null
 * @param source         which lookup path answered
 * @param fallbackReason why the remote attempt was abandoned, null unless {@code source} is {@link Source#LOCAL_FALLBACK}
 */
public record LookupResult(List<String> words, Source source, String fallbackReason) {

    public enum Source {
        /** Answered by the remote listener */
        REMOTE,
        /** Answered in-process from the secondary corpus */
        LOCAL_FALLBACK
    }

    public LookupResult {
        words = List.copyOf(words);
    }

    public static LookupResult remote(List<String> words) {
        return new LookupResult(words, Source.REMOTE, null);
    }

    public static LookupResult fallback(List<String> words, String reason) {
        return new LookupResult(words, Source.LOCAL_FALLBACK, reason);
    }

    public boolean isFallback() {
        return source == Source.LOCAL_FALLBACK;
    }

    public LengthDistribution distribution() {
        return LengthDistribution.of(words);
    }
}
