package com.versemind.models.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Built-in configuration used when the backend cannot be reached.
 */
public final class BackendConfigDefaults {

    private BackendConfigDefaults() {
    }

    static final String DEFAULT_JSON = """
            {
              "model_groups": {
                "ollama": [
                  { "id": "llama3", "name": "Llama 3" },
                  { "id": "gemma3:4b", "name": "Gemma 3 4B" },
                  { "id": "deepseek-r1:14b", "name": "DeepSeek R1 14B" },
                  { "id": "phi4", "name": "Phi-4" },
                  { "id": "mistral", "name": "Mistral" }
                ],
                "openai": [
                  { "id": "gpt-4o", "name": "GPT-4o" },
                  { "id": "gpt-4-turbo", "name": "GPT-4 Turbo" },
                  { "id": "gpt-3.5-turbo", "name": "GPT-3.5 Turbo" }
                ],
                "deepseek": [
                  { "id": "deepseek-chat", "name": "DeepSeek Chat" }
                ]
              },
              "embedding_models": {
                "ollama": [
                  { "id": "bge-large", "name": "BGE Large", "dimensions": 1024 },
                  { "id": "bge-m3", "name": "BGE M3", "dimensions": 1024 }
                ],
                "openai": [
                  { "id": "text-embedding-3-small", "name": "Text Embedding 3 Small", "dimensions": 1536 },
                  { "id": "text-embedding-3-large", "name": "Text Embedding 3 Large", "dimensions": 3072 }
                ],
                "deepseek": [
                  { "id": "deepseek-embedding", "name": "DeepSeek Embedding", "dimensions": 1024 }
                ]
              },
              "vector_databases": {
                "faiss": {
                  "name": "FAISS",
                  "description": "Facebook AI Similarity Search",
                  "local": true
                },
                "chroma": {
                  "name": "Chroma",
                  "description": "Chroma Vector Database",
                  "local": true
                }
              }
            }
            """;

    /**
     * Build a new default configuration.
     */
    public static BackendConfig create() {
        try {
            return BackendConfig.parse(DEFAULT_JSON, new ObjectMapper());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Built-in default configuration is invalid", e);
        }
    }
}
