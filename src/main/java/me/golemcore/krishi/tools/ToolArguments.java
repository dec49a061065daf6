package me.golemcore.krishi.tools;

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

import java.util.Map;

/**
 * Typed access to the loosely typed argument map of a tool call.
 */
final class ToolArguments {

    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    String requireString(String name, String message) {
        String value = optionalString(name, null);
        if (value == null) {
            throw new ValidationException(message);
        }
        return value;
    }

    String optionalString(String name, String fallback) {
        Object value = values.get(name);
        if (value == null) {
            return fallback;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? fallback : text;
    }

    /**
     * Accepts JSON numbers and numeric strings; fractional values are rejected.
     */
    int optionalInt(String name, int fallback) {
        Object value = values.get(name);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        if (value instanceof Number number) {
            double raw = number.doubleValue();
            if (raw != Math.rint(raw) || raw > Integer.MAX_VALUE || raw < Integer.MIN_VALUE) {
                throw new ValidationException(name + " must be a whole number, got " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be a whole number, got '" + value + "'");
        }
    }
}
