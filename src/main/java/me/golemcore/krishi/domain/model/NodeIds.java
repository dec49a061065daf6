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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier conventions shared by the graph, the metric series and the
 * engine: {@code nodeId = type ":" slug(name)}.
 */
public final class NodeIds {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NodeIds() {
    }

    /**
     * Lowercases, trims and collapses whitespace runs to a single underscore.
     */
    public static String slug(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    public static String nodeId(EntityType type, String name) {
        return type.getValue() + ":" + slug(name);
    }
}
