package me.golemcore.krishi.domain.index;

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

import me.golemcore.krishi.domain.exception.ValidationException;

/**
 * Vector math used by the similarity search.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     *
     * @throws ValidationException
     *             when the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new ValidationException("Vectors must not be null");
        }
        if (a.length != b.length) {
            throw new ValidationException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |similarity| slightly past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
