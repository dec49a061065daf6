package me.golemcore.krishi.domain.engine;

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

import me.golemcore.krishi.domain.model.GovernmentScheme;
import me.golemcore.krishi.domain.model.KnowledgeItem;

import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a government scheme knowledge item into a {@link GovernmentScheme}.
 *
 * <p>
 * Items carrying {@code name}, {@code eligibility}, {@code benefits} or
 * {@code application_process} metadata use those values. Anything missing is
 * recovered from the text: the first line is the name, the remaining lines
 * the description, and each field is the sentence fragment after its header
 * word ("Eligibility:", "Benefits:", "Apply:").
 */
public final class SchemeTextExtractor {

    static final String UNKNOWN_SCHEME = "Unknown Scheme";

    private static final Pattern ELIGIBILITY_HEADER = Pattern.compile("eligibility[:|\\s]", Pattern.CASE_INSENSITIVE);
    private static final Pattern BENEFITS_HEADER = Pattern.compile("benefits[:|\\s]", Pattern.CASE_INSENSITIVE);
    private static final Pattern APPLY_HEADER = Pattern.compile("apply[:|\\s]", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private SchemeTextExtractor() {
    }

    public static GovernmentScheme extract(KnowledgeItem item) {
        String text = item.getText() != null ? item.getText() : "";
        String[] lines = LINE_BREAK.split(text, -1);
        String firstLine = lines.length > 0 ? lines[0].trim() : "";
        String description = String.join(" ", Arrays.asList(lines).subList(Math.min(1, lines.length), lines.length))
                .trim();

        Map<String, Object> metadata = item.getMetadata() != null ? item.getMetadata() : Map.of();
        String name = metadataText(metadata, "name");
        String eligibility = metadataText(metadata, "eligibility");
        String benefits = metadataText(metadata, "benefits");
        String application = metadataText(metadata, "application_process");
        boolean structured = name != null || eligibility != null || benefits != null || application != null;

        if (name == null) {
            name = firstLine.isEmpty() ? UNKNOWN_SCHEME : firstLine;
        }
        if (eligibility == null) {
            eligibility = description.contains("eligibility") || description.contains("eligible")
                    ? fragmentAfter(description, ELIGIBILITY_HEADER)
                    : "";
        }
        if (benefits == null) {
            benefits = description.contains("benefit") || description.contains("provides")
                    ? fragmentAfter(description, BENEFITS_HEADER)
                    : "";
        }
        if (application == null) {
            application = description.contains("apply") || description.contains("application")
                    ? fragmentAfter(description, APPLY_HEADER)
                    : "";
        }

        return GovernmentScheme.builder()
                .sourceId(item.getId())
                .name(name)
                .description(description)
                .eligibility(eligibility)
                .benefits(benefits)
                .applicationProcess(application)
                .structured(structured)
                .build();
    }

    /**
     * Text between the first header match and the next header match or the end,
     * cut at the first full stop.
     */
    static String fragmentAfter(String description, Pattern header) {
        String[] parts = header.split(description, -1);
        if (parts.length < 2) {
            return "";
        }
        String fragment = parts[1];
        int stop = fragment.indexOf('.');
        return (stop >= 0 ? fragment.substring(0, stop) : fragment).trim();
    }

    private static String metadataText(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
