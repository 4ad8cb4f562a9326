package io.switchback.core.routing;

import java.time.Duration;
import java.util.List;

/**
 * Result of one cascade. {@code backendUsed} is {@link #FALLBACK} when the canned table answered,
 * in which case {@code fallbackKey} names the entry.
 */
public record CompletionOutcome(
    String text,
    String backendUsed,
    Duration latency,
    boolean success,
    String fallbackKey,
    List<String> attempted
) {
    public static final String FALLBACK = "fallback";

    public CompletionOutcome {
        text = text == null ? "" : text;
        latency = latency == null ? Duration.ZERO : latency;
        attempted = attempted == null ? List.of() : List.copyOf(attempted);
    }

    public static CompletionOutcome served(String text, String backend, Duration latency, List<String> attempted) {
        return new CompletionOutcome(text, backend, latency, true, null, attempted);
    }

    public static CompletionOutcome fallback(String text, String key, Duration latency, List<String> attempted) {
        return new CompletionOutcome(text, FALLBACK, latency, false, key, attempted);
    }
}
