package com.versemind.models.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.versemind.common.config.CatalogSettings;
import com.versemind.common.infra.ErrorUtils;
import com.versemind.models.DiscoveredModel;
import com.versemind.models.config.BackendConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link BackendClient} over the backend's HTTP API.
 */
@Slf4j
public class HttpBackendClient implements BackendClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final CatalogSettings settings;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpBackendClient(CatalogSettings settings) {
        this(settings, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(settings.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(settings.getReadTimeoutMs()))
                .build());
    }

    public HttpBackendClient(CatalogSettings settings, OkHttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CompletableFuture<BackendConfig> fetchConfig() {
        String url = settings.endpoint(settings.getConfigPath());
        log.debug("[backend] Requesting {}", url);
        return execute(new Request.Builder().url(url).get().build())
                .thenApply(body -> {
                    try {
                        return BackendConfig.parse(body, objectMapper);
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("Malformed configuration payload: " + e.getOriginalMessage(), e);
                    }
                });
    }

    @Override
    public CompletableFuture<List<DiscoveredModel>> fetchModels(String provider) {
        String url = settings.endpoint(settings.getModelsPath());
        return execute(new Request.Builder().url(url).get().build())
                .thenApply(body -> parseModels(body, provider));
    }

    @Override
    public CompletableFuture<InstallResult> installModel(String modelName) {
        String url = settings.endpoint(settings.getInstallPath());
        String fallbackMessage = "Started downloading model: " + modelName;
        Request request;
        try {
            String json = objectMapper.writeValueAsString(Map.of("model_name", modelName));
            request = new Request.Builder().url(url).post(RequestBody.create(json, JSON)).build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.completedFuture(installFailure(modelName, e));
        }

        return execute(request)
                .thenApply(body -> {
                    try {
                        JsonNode result = objectMapper.readTree(body);
                        boolean success = !(result.has("success") && result.get("success").isBoolean()
                                && !result.get("success").asBoolean());
                        String message = result.hasNonNull("message") ? result.get("message").asText() : fallbackMessage;
                        return new InstallResult(success, message);
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("Malformed install response", e);
                    }
                })
                .exceptionally(err -> installFailure(modelName, err));
    }

    List<DiscoveredModel> parseModels(String body, String provider) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed models payload", e);
        }
        JsonNode models = root == null ? null : root.path("providers").path(provider).path("models");
        if (models == null || !models.isArray()) {
            log.warn("[backend] Backend returned success but no {} models were found", provider);
            return List.of();
        }
        List<DiscoveredModel> result = new ArrayList<>();
        for (JsonNode row : models) {
            result.add(new DiscoveredModel(text(row, "id"), text(row, "description")));
        }
        return result;
    }

    private CompletableFuture<String> execute(Request request) {
        CompletableFuture<String> future = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) throws IOException {
                try (ResponseBody responseBody = response.body()) {
                    String body = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new BackendException(response.code(),
                                "Backend error " + response.code() + " for " + request.url() + ": " + body));
                        return;
                    }
                    future.complete(body);
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static InstallResult installFailure(String modelName, Throwable err) {
        log.error("[backend] Error installing model {}: {}", modelName, ErrorUtils.formatErrorMessage(err));
        return new InstallResult(false, "Failed to install model: " + ErrorUtils.formatErrorMessage(err));
    }
}
