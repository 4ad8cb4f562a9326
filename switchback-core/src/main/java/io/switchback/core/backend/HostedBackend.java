package io.switchback.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Shared plumbing for the hosted providers: one JSON POST per call, bounded by a call timeout.
 * Subclasses supply the endpoint, auth headers, payload shape and text extraction.
 */
public abstract class HostedBackend implements Backend {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 300;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final OkHttpClient client;
    private final PersonalityPrompts prompts;
    protected final ObjectMapper mapper;

    protected HostedBackend(
        String name,
        String apiKey,
        String apiBase,
        String model,
        Duration timeout,
        PersonalityPrompts prompts
    ) throws BackendConfigurationException {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendConfigurationException("missing API key for backend " + name);
        }
        if (model == null || model.isBlank()) {
            throw new BackendConfigurationException("missing model for backend " + name);
        }
        HttpUrl base = apiBase == null ? null : HttpUrl.parse(apiBase);
        if (base == null) {
            throw new BackendConfigurationException("invalid api base for backend " + name + ": " + apiBase);
        }
        this.apiKey = apiKey;
        this.apiBase = base;
        this.model = model;
        this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
        Duration callTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofSeconds(30)
            : timeout;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public String model() {
        return model;
    }

    protected String apiKey() {
        return apiKey;
    }

    protected HttpUrl apiBase() {
        return apiBase;
    }

    protected String systemPrompt(Personality personality) {
        return prompts.promptFor(personality);
    }

    @Override
    public Optional<String> generate(GenerationRequest request) throws BackendException {
        Objects.requireNonNull(request, "request must not be null");
        Request httpRequest;
        try {
            RequestBody body = RequestBody.create(mapper.writeValueAsString(payload(request)), JSON);
            Request.Builder builder = new Request.Builder()
                .url(endpoint())
                .post(body)
                .header("Content-Type", "application/json");
            for (Map.Entry<String, String> header : authHeaders().entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            httpRequest = builder.build();
        } catch (IOException e) {
            throw new BackendException(name, "could not encode request: " + e.getMessage(), e);
        }

        try (Response response = client.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new BackendException(name, "HTTP " + response.code() + " " + truncate(raw));
            }
            JsonNode root = parse(raw);
            String text = extractText(root);
            if (text == null || text.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(text.trim());
        } catch (IOException e) {
            throw new BackendException(name, "request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String raw) throws BackendException {
        try {
            JsonNode root = mapper.readTree(raw);
            if (root == null || !root.isObject()) {
                throw new BackendException(name, "malformed payload: expected a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new BackendException(name, "malformed payload: " + e.getMessage(), e);
        }
    }

    protected abstract HttpUrl endpoint();

    protected abstract Map<String, String> authHeaders();

    protected abstract Map<String, Object> payload(GenerationRequest request);

    /**
     * Pulls the completion text out of a successful response. May return null or blank when the
     * provider produced nothing.
     */
    protected abstract String extractText(JsonNode root) throws BackendException;

    private String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_ERROR_BODY ? value : value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
