package com.versemind.models.backend;

import com.versemind.common.config.CatalogSettings;
import com.versemind.models.DiscoveredModel;
import com.versemind.models.config.BackendConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpBackendClientTest {

    private MockWebServer server;
    private HttpBackendClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        CatalogSettings settings = new CatalogSettings();
        settings.setApiBaseUrl(server.url("/").toString());
        settings.setReadTimeoutMs(2_000);
        client = new HttpBackendClient(settings);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void fetchConfig_parsesPayload() throws Exception {
        server.enqueue(json(200, """
                {
                  "embedding_models": { "ollama": [ { "id": "bge-m3", "name": "BGE M3", "dimensions": 1024 } ] },
                  "vector_databases": { "faiss": { "name": "FAISS", "local": true } }
                }
                """));

        BackendConfig config = client.fetchConfig().get(5, TimeUnit.SECONDS);

        assertEquals("bge-m3", config.embeddingModelsFor("ollama").get(0).id());
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", request.getMethod());
        assertEquals("/api/config", request.getPath());
    }

    @Test
    void fetchConfig_nonSuccessStatus_failsWithStatus() {
        server.enqueue(json(500, "{\"detail\":\"Config load error\"}"));

        CompletionException error = assertThrows(CompletionException.class, () -> client.fetchConfig().join());

        BackendException cause = assertInstanceOf(BackendException.class, error.getCause());
        assertEquals(500, cause.getStatusCode());
    }

    @Test
    void fetchConfig_malformedPayload_fails() {
        server.enqueue(json(200, "not json"));

        CompletionException error = assertThrows(CompletionException.class, () -> client.fetchConfig().join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void fetchModels_readsProviderRows() throws Exception {
        server.enqueue(json(200, """
                {
                  "providers": {
                    "ollama": {
                      "models": [
                        { "id": "mistral:latest", "description": "Mistral 7B" },
                        { "id": "bge-m3" },
                        { "description": "no id" }
                      ]
                    }
                  }
                }
                """));

        List<DiscoveredModel> models = client.fetchModels("ollama").get(5, TimeUnit.SECONDS);

        assertEquals(List.of(
                new DiscoveredModel("mistral:latest", "Mistral 7B"),
                new DiscoveredModel("bge-m3", null),
                new DiscoveredModel(null, "no id")), models);
        assertEquals("/api/generate/models", server.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    @Test
    void fetchModels_missingProvider_returnsEmpty() throws Exception {
        server.enqueue(json(200, "{\"model_groups\": {}}"));

        assertTrue(client.fetchModels("ollama").get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void installModel_postsModelName() throws Exception {
        server.enqueue(json(200, "{\"success\": true, \"message\": \"Pulling llama3\"}"));

        InstallResult result = client.installModel("llama3").get(5, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertEquals("Pulling llama3", result.message());
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/api/generate/install-model", request.getPath());
        assertEquals("{\"model_name\":\"llama3\"}", request.getBody().readUtf8());
    }

    @Test
    void installModel_defaultMessage() throws Exception {
        server.enqueue(json(200, "{}"));

        InstallResult result = client.installModel("llama3").get(5, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertEquals("Started downloading model: llama3", result.message());
    }

    @Test
    void installModel_explicitFailure() throws Exception {
        server.enqueue(json(200, "{\"success\": false, \"message\": \"Unknown model\"}"));

        InstallResult result = client.installModel("nope").get(5, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertEquals("Unknown model", result.message());
    }

    @Test
    void installModel_httpError_reportedInResult() throws Exception {
        server.enqueue(json(503, "busy"));

        InstallResult result = client.installModel("llama3").get(5, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertTrue(result.message().startsWith("Failed to install model: Backend error 503"));
    }
}
