package io.switchback.core.fallback;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canned replies keyed by intent. Immutable once built; each orchestrator owns its own table.
 */
public final class FallbackResponses {
    public static final String GREETING = "greeting";
    public static final String ERROR = "error";
    public static final String UNAVAILABLE = "unavailable";
    public static final String BUSY = "busy";
    public static final String LAST_RESORT = "Service unavailable";

    private final Map<String, String> entries;

    private FallbackResponses(Map<String, String> entries) {
        this.entries = entries;
    }

    public static FallbackResponses of(Map<String, String> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        Map<String, String> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return new FallbackResponses(Map.copyOf(copy));
    }

    public static FallbackResponses defaults() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(GREETING, "Hello! I'm your AI assistant. How can I help you today?");
        entries.put(ERROR, "I'm experiencing some technical difficulties. Please try again later.");
        entries.put(UNAVAILABLE, "The AI service is currently unavailable. Please try again later.");
        entries.put(BUSY, "I'm currently processing other requests. Please try again in a moment.");
        return of(entries);
    }

    /**
     * Resolves {@code key}, then the {@code error} entry, then {@link #LAST_RESORT}.
     */
    public String lookup(String key) {
        String value = key == null ? null : entries.get(key);
        if (value != null) {
            return value;
        }
        return entries.getOrDefault(ERROR, LAST_RESORT);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }
}
