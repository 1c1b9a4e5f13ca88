package com.versemind.models;

import java.util.List;

/**
 * Curated, hand-maintained model catalog shipped with VerseMind.
 * Order is significant: it is the display order and the alias-match order.
 */
public final class DefaultCatalog {

    private DefaultCatalog() {
    }

    public static final List<ModelEntry> MODELS = List.of(
            // DeepSeek
            chat("deepseek-chat", "DeepSeek Chat", "deepseek").aliases(List.of("deepseek-v3")).build(),
            chat("deepseek-reasoner", "DeepSeek Reasoner", "deepseek")
                    .aliases(List.of("deepseek-r1", "deepseek-r1:14b")).build(),

            // OpenAI
            chat("gpt-3.5-turbo", "GPT-3.5 Turbo", "openai").build(),
            chat("gpt-4-turbo", "GPT-4 Turbo", "openai").build(),
            chat("gpt-4o", "GPT-4o", "openai").build(),

            // Ollama
            local("gemma3:4b", "Gemma 3 4B", "3.3 GB", "6 weeks ago", "gemma3"),
            local("phi4", "Phi-4", "9.1 GB", "3 months ago", null),
            local("llava:v1.6", "Llava v1.6", "4.7 GB", "4 months ago", "llava"),
            local("wizard-math:latest", "Wizard Math", "4.1 GB", "4 months ago", "wizard-math"),
            local("qwen2.5:7b", "Qwen 2.5 7B", "4.7 GB", "4 months ago", "qwen2.5"),
            local("wizardcoder:latest", "Wizard Coder", "3.8 GB", "4 months ago", "wizardcoder"),
            local("openhermes:latest", "Open Hermes", "4.1 GB", "4 months ago", "openhermes"),
            local("mistral:latest", "Mistral", "4.1 GB", "5 months ago", "mistral"),
            local("llama3.2-vision:latest", "Llama 3.2 Vision", "7.9 GB", "5 months ago", "llama3.2-vision"),
            local("codellama:latest", "Code Llama", "3.8 GB", "6 months ago", "codellama"),
            chat("deepseek-r1:14b", "DeepSeek Reasoner (Ollama)", "ollama")
                    .size("6.8 GB").displayNameOverride(true).build(),

            // Embedding models
            ModelEntry.of("bge-large", "BGE-large", "ollama", ModelType.EMBEDDING),
            ModelEntry.of("bge-m3", "Bge-m3", "ollama", ModelType.EMBEDDING));

    private static ModelEntry.ModelEntryBuilder chat(String id, String name, String provider) {
        return ModelEntry.builder().id(id).name(name).provider(provider).type(ModelType.CHAT);
    }

    private static ModelEntry local(String id, String name, String size, String modified, String alias) {
        return chat(id, name, Provider.OLLAMA.id())
                .size(size)
                .modified(modified)
                .aliases(alias != null ? List.of(alias) : List.of())
                .build();
    }
}
