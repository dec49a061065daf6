package me.golemcore.krishi.domain.model;

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

public enum ToolFailureKind {

    /**
     * A required argument was missing or malformed.
     */
    INVALID_ARGUMENT,

    /**
     * No data exists for the requested entity or window.
     */
    NOT_FOUND,

    /**
     * The embedding provider or backing store was unavailable.
     */
    PROVIDER_UNAVAILABLE,

    /**
     * The call ran out of its time budget.
     */
    TIMEOUT,

    /**
     * Tool execution was denied by policy (unknown or disabled tool).
     */
    POLICY_DENIED,

    /**
     * Any other runtime failure.
     */
    EXECUTION_FAILED
}
