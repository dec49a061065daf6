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

import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.EmbeddingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Offline embedding stub. Each token is hashed into one signed bucket of a
 * fixed-length vector and the result is L2-normalised, so equal texts always
 * produce equal vectors and texts sharing words score a positive similarity.
 */
@Component
@ConditionalOnProperty(prefix = "krishi.embedding", name = "provider", havingValue = "deterministic")
@Slf4j
public class DeterministicEmbeddingAdapter implements EmbeddingPort {

    static final String MODEL = "deterministic-hash";

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private final int dimension;

    @Autowired
    public DeterministicEmbeddingAdapter(KrishiProperties properties) {
        this(properties.getEmbedding().getDimension());
    }

    public DeterministicEmbeddingAdapter(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive");
        }
        this.dimension = dimension;
        log.info("Deterministic embedding provider active ({} dimensions)", dimension);
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.completedFuture(texts.stream().map(this::vectorize).toList());
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getModel() {
        return MODEL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    float[] vectorize(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            long hash = hash(token);
            int bucket = (int) (hash % dimension);
            vector[bucket] += ((hash >>> 16) & 1) == 0 ? 1.0f : -1.0f;
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    private static long hash(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
