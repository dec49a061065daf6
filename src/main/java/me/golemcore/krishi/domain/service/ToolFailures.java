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

import me.golemcore.krishi.domain.exception.DeadlineExceededException;
import me.golemcore.krishi.domain.exception.NotFoundException;
import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised while running a tool to a failed {@link ToolResult}.
 */
public final class ToolFailures {

    private ToolFailures() {
    }

    public static ToolResult from(String toolName, Throwable error) {
        Throwable cause = unwrap(error);
        ToolFailureKind kind = kindOf(cause);
        return ToolResult.failure(kind, describe(toolName, kind, cause));
    }

    public static ToolFailureKind kindOf(Throwable error) {
        Throwable cause = unwrap(error);
        // subtype first: a deadline is also a provider failure
        if (cause instanceof DeadlineExceededException || cause instanceof TimeoutException) {
            return ToolFailureKind.TIMEOUT;
        }
        if (cause instanceof ValidationException) {
            return ToolFailureKind.INVALID_ARGUMENT;
        }
        if (cause instanceof NotFoundException) {
            return ToolFailureKind.NOT_FOUND;
        }
        if (cause instanceof ProviderException) {
            return ToolFailureKind.PROVIDER_UNAVAILABLE;
        }
        return ToolFailureKind.EXECUTION_FAILED;
    }

    private static String describe(String toolName, ToolFailureKind kind, Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return switch (kind) {
        case INVALID_ARGUMENT, NOT_FOUND -> message;
        case TIMEOUT -> "Tool " + toolName + " timed out: " + message;
        default -> "Failed to run " + toolName + ": " + message;
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
