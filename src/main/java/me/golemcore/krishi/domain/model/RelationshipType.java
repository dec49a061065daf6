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

/**
 * Well-known relationship vocabulary. Edges carry the type as a plain string,
 * so graphs may use types outside this list.
 */
public enum RelationshipType {

    GROWS_IN("grows_in"), // crop -> location
    SUSCEPTIBLE_TO("susceptible_to"), // crop -> disease
    AFFECTED_BY("affected_by"), // crop -> pest
    TREATED_WITH("treated_with"), // disease -> treatment
    GROWN_DURING("grown_during"), // crop -> season
    PRICE_AFFECTED_BY("price_affected_by"), // crop -> market factor
    SUITABLE_FOR("suitable_for"), // location/soil -> crop
    TOLERANT_TO("tolerant_to"), // crop -> weather
    HAS_PEST("has_pest"), // disease -> pest
    PREVENTS("prevents"); // treatment -> disease

    public static final String REVERSE_PREFIX = "reverse:";

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public String reverse() {
        return REVERSE_PREFIX + value;
    }

    public static boolean isReverse(String relationshipType) {
        return relationshipType != null && relationshipType.startsWith(REVERSE_PREFIX);
    }

    /**
     * Strips the {@code reverse:} prefix if present.
     */
    public static String baseOf(String relationshipType) {
        return isReverse(relationshipType)
                ? relationshipType.substring(REVERSE_PREFIX.length())
                : relationshipType;
    }

    @Override
    public String toString() {
        return value;
    }
}
