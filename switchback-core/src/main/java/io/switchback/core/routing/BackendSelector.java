package io.switchback.core.routing;

import io.switchback.core.backend.Backend;
import io.switchback.core.backend.BackendKind;
import io.switchback.core.backend.Personality;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Chooses one backend from an already filtered candidate list.
 *
 * <p>Order of preference: personality override (creative to Gemini, analytical to Claude, fast to
 * OpenAI), then the backend that served the previous request, then the static priority list, then
 * any remaining candidate.
 */
public final class BackendSelector {
    public static final List<String> DEFAULT_PRIORITY = List.of("local", "openai", "gemini", "claude");

    private final List<String> priority;
    private final Random random;

    public BackendSelector(List<String> priority) {
        this(priority, new Random());
    }

    public BackendSelector(List<String> priority, Random random) {
        this.priority = priority == null || priority.isEmpty()
            ? DEFAULT_PRIORITY
            : priority.stream().map(BackendSelector::normalize).toList();
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public Optional<Backend> select(Personality personality, List<Backend> candidates, String lastUsed) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        BackendKind preferred = preferredKind(personality);
        if (preferred != null) {
            for (Backend candidate : candidates) {
                if (candidate.kind() == preferred) {
                    return Optional.of(candidate);
                }
            }
        }

        if (lastUsed != null) {
            String sticky = normalize(lastUsed);
            for (Backend candidate : candidates) {
                if (normalize(candidate.name()).equals(sticky)) {
                    return Optional.of(candidate);
                }
            }
        }

        for (String name : priority) {
            for (Backend candidate : candidates) {
                if (normalize(candidate.name()).equals(name)) {
                    return Optional.of(candidate);
                }
            }
        }

        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    private BackendKind preferredKind(Personality personality) {
        if (personality == null) {
            return null;
        }
        return switch (personality) {
            case CREATIVE -> BackendKind.GEMINI;
            case ANALYTICAL -> BackendKind.CLAUDE;
            case FAST -> BackendKind.OPENAI;
            default -> null;
        };
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
