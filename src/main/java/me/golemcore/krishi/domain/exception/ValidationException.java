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

import java.util.List;
import java.util.Objects;

/**
 * Missing or malformed argument. Surfaced immediately and never retried.
 */
public class ValidationException extends KnowledgeCoreException {

    private final List<String> reasons;

    public ValidationException(String message) {
        super(Objects.requireNonNull(message, "message"));
        this.reasons = List.of(message);
    }

    public ValidationException(List<String> reasons) {
        super(String.join("; ", Objects.requireNonNull(reasons, "reasons")));
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("reasons must not be empty");
        }
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
