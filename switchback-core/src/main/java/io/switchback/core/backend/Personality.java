package io.switchback.core.backend;

import java.util.Locale;

public enum Personality {
    HELPFUL,
    CREATIVE,
    ANALYTICAL,
    FAST,
    FUNNY;

    /**
     * Resolves a caller supplied tag. Unknown or blank tags resolve to {@link #HELPFUL}.
     */
    public static Personality fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return HELPFUL;
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        for (Personality personality : values()) {
            if (personality.name().equals(normalized)) {
                return personality;
            }
        }
        return HELPFUL;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
