package me.golemcore.krishi.adapter.outbound.embedding;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Default model: text-embedding-3-small (1536 dimensions)
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code krishi.embedding.api-key} - OpenAI API key
 * <li>{@code krishi.embedding.model} - Embedding model name
 * <li>{@code krishi.embedding.dimension} - Vector length of the model
 * </ul>
 *
 * @see me.golemcore.krishi.domain.service.VectorStoreService
 */
@Component
@ConditionalOnProperty(prefix = "krishi.embedding", name = "provider", havingValue = "openai", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final KrishiProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        KrishiProperties.EmbeddingProperties config = properties.getEmbedding();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        try {
            String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank() ? config.getBaseUrl() : null;
            embeddingModel = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .baseUrl(baseUrl)
                    .modelName(getModel())
                    .timeout(config.getTimeout())
                    .build();
            log.info("Embedding model initialized: {}", getModel());
        } catch (RuntimeException e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            try {
                Response<Embedding> response = model.embed(text);
                return response.content().vector();
            } catch (RuntimeException e) {
                throw new ProviderException("Embedding request failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            try {
                Response<List<Embedding>> response = model.embedAll(segments);
                return response.content().stream()
                        .map(Embedding::vector)
                        .toList();
            } catch (RuntimeException e) {
                throw new ProviderException("Batch embedding request failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new ProviderException("Embedding model not available");
        }
        return model;
    }
}
