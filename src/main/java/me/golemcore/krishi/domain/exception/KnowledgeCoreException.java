package me.golemcore.krishi.domain.exception;

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

/**
 * Base type of every failure that crosses a knowledge core component boundary.
 * Backend and provider specific errors are mapped into one of the subclasses
 * before they leave an adapter.
 */
public abstract class KnowledgeCoreException extends RuntimeException {

    protected KnowledgeCoreException(String message) {
        super(message);
    }

    protected KnowledgeCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
