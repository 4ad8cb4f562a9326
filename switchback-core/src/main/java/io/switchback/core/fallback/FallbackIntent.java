package io.switchback.core.fallback;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the canned reply key for an exhausted request.
 */
public final class FallbackIntent {
    private static final Set<String> GREETINGS = Set.of("hello", "hi", "hey", "greetings");
    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");

    public enum Exhaustion {
        /** No backend was available at all. */
        NO_BACKEND,
        /** Backends were available but every one was over its rate limit. */
        RATE_LIMITED,
        /** At least one backend was tried and every attempt failed. */
        ALL_FAILED
    }

    private FallbackIntent() {
    }

    public static String keyFor(String message, Exhaustion exhaustion) {
        if (isGreeting(message)) {
            return FallbackResponses.GREETING;
        }
        if (exhaustion == null) {
            return FallbackResponses.ERROR;
        }
        return switch (exhaustion) {
            case NO_BACKEND -> FallbackResponses.UNAVAILABLE;
            case RATE_LIMITED -> FallbackResponses.BUSY;
            case ALL_FAILED -> FallbackResponses.ERROR;
        };
    }

    static boolean isGreeting(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        for (String word : WORD_SPLIT.split(message.toLowerCase(Locale.ROOT))) {
            if (GREETINGS.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
