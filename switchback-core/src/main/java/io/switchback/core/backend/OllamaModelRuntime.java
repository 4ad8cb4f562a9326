package io.switchback.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Runtime backed by an Ollama daemon on the local machine. The model reference is an Ollama model
 * tag such as {@code orca-mini:3b}; loading verifies that the daemon has it.
 */
public final class OllamaModelRuntime implements LocalModelRuntime {
    public static final String DEFAULT_API_BASE = "http://127.0.0.1:11434";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OllamaModelRuntime(String apiBase, Duration timeout) {
        String base = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase;
        this.apiBase = HttpUrl.get(base);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(timeout == null ? Duration.ofSeconds(60) : timeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public LocalModel load(String modelRef) throws IOException {
        Objects.requireNonNull(modelRef, "modelRef must not be null");
        post("show", Map.of("model", modelRef));
        return new OllamaModel(modelRef);
    }

    private JsonNode post(String path, Map<String, Object> payload) throws IOException {
        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("api").addPathSegment(path).build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("ollama /api/" + path + " returned HTTP " + response.code() + " " + raw);
            }
            return mapper.readTree(raw);
        }
    }

    private final class OllamaModel implements LocalModel {
        private final String modelRef;

        private OllamaModel(String modelRef) {
            this.modelRef = modelRef;
        }

        @Override
        public String generate(String prompt, int maxTokens, double temperature) throws IOException {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("num_predict", maxTokens);
            options.put("temperature", temperature);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", modelRef);
            payload.put("prompt", prompt);
            payload.put("stream", false);
            payload.put("options", options);

            JsonNode root = post("generate", payload);
            JsonNode response = root == null ? null : root.get("response");
            if (response == null || !response.isTextual()) {
                throw new IOException("ollama response is missing the response field");
            }
            return response.asText();
        }
    }
}
