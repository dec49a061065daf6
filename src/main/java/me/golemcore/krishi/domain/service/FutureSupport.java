package me.golemcore.krishi.domain.service;

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

import me.golemcore.krishi.domain.exception.KnowledgeCoreException;
import me.golemcore.krishi.domain.exception.ProviderException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Joins port futures and maps whatever they fail with into the knowledge core
 * error taxonomy.
 */
public final class FutureSupport {

    private FutureSupport() {
    }

    public static <T> T join(CompletableFuture<T> future, String operation) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw translate(e, operation);
        }
    }

    /**
     * Waits for all futures and returns their values in input order.
     */
    public static <T> List<T> joinAll(List<CompletableFuture<T>> futures, String operation) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        join(all, operation);
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public static KnowledgeCoreException translate(Throwable error, String operation) {
        Throwable cause = unwrap(error);
        if (cause instanceof KnowledgeCoreException coreException) {
            return coreException;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderException(operation + " failed: " + message, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
