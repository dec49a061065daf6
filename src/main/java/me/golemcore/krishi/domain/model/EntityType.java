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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of agricultural entity held in the relationship graph. The wire value
 * is the prefix of every node id.
 */
public enum EntityType {

    CROP("crop"), DISEASE("disease"), PEST("pest"), TREATMENT("treatment"), WEATHER("weather"), LOCATION(
            "location"), SEASON("season"), MARKET_FACTOR("market_factor"), SOIL("soil");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntityType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + raw);
    }
}
