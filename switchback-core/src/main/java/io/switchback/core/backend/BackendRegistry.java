package io.switchback.core.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Backends known to one orchestrator, in registration order. Fixed once built.
 */
public final class BackendRegistry {
    private final Map<String, Backend> backends;

    public BackendRegistry(List<? extends Backend> backends) {
        Map<String, Backend> byName = new LinkedHashMap<>();
        for (Backend backend : backends) {
            String key = normalize(backend.name());
            if (byName.putIfAbsent(key, backend) != null) {
                throw new IllegalArgumentException("duplicate backend name: " + backend.name());
            }
        }
        this.backends = Collections.unmodifiableMap(byName);
    }

    public Optional<Backend> find(String name) {
        return Optional.ofNullable(backends.get(normalize(name)));
    }

    public List<Backend> all() {
        return List.copyOf(backends.values());
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Backend backend : backends.values()) {
            names.add(backend.name());
        }
        return names;
    }

    public List<Backend> available() {
        return backends.values().stream().filter(Backend::isAvailable).toList();
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
