package io.switchback.core.fallback;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the canned reply table from a flat JSON object. A configured file wins over the bundled
 * classpath resource; when neither exists the built-in defaults are used.
 */
public final class FallbackResponseLoader {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackResponseLoader.class);
    public static final String DEFAULT_RESOURCE = "fallback-responses.json";

    private final ObjectMapper mapper;
    private final String resource;

    public FallbackResponseLoader() {
        this(DEFAULT_RESOURCE);
    }

    public FallbackResponseLoader(String resource) {
        this.mapper = new ObjectMapper();
        this.resource = resource;
    }

    public FallbackResponses load(Path file) throws IOException {
        if (file != null && Files.exists(file)) {
            Map<String, String> entries = mapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {
            });
            LOG.info("Loaded {} fallback responses from {}", entries.size(), file);
            return FallbackResponses.of(entries);
        }
        if (file != null) {
            LOG.warn("Fallback responses file {} not found, using bundled responses", file);
        }

        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = FallbackResponseLoader.class.getClassLoader();
        }
        try (InputStream in = resource == null ? null : loader.getResourceAsStream(resource)) {
            if (in != null) {
                Map<String, String> entries = mapper.readValue(in, new TypeReference<Map<String, String>>() {
                });
                LOG.info("Loaded {} fallback responses from classpath:{}", entries.size(), resource);
                return FallbackResponses.of(entries);
            }
        }

        LOG.warn("No fallback responses resource found, using defaults");
        return FallbackResponses.defaults();
    }
}
