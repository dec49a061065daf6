package me.golemcore.krishi.domain.engine;

import me.golemcore.krishi.domain.model.GovernmentScheme;
import me.golemcore.krishi.domain.model.KnowledgeItem;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemeTextExtractorTest {

    private static KnowledgeItem item(String text, Map<String, Object> metadata) {
        return KnowledgeItem.builder().id("scheme-1").text(text).metadata(metadata).build();
    }

    @Test
    void shouldPreferStructuredMetadata() {
        GovernmentScheme scheme = SchemeTextExtractor.extract(item("PM-KISAN\nIncome support scheme.",
                Map.of("name", "PM-KISAN", "eligibility", "All landholding farmers",
                        "benefits", "Rs 6000 per year", "application_process", "Register at the portal")));

        assertTrue(scheme.structured());
        assertEquals("scheme-1", scheme.sourceId());
        assertEquals("PM-KISAN", scheme.name());
        assertEquals("All landholding farmers", scheme.eligibility());
        assertEquals("Rs 6000 per year", scheme.benefits());
        assertEquals("Register at the portal", scheme.applicationProcess());
        assertEquals("Income support scheme.", scheme.description());
    }

    @Test
    void shouldExtractFieldsFromText() {
        String text = "PM Fasal Bima Yojana\n"
                + "Crop insurance for farmers. eligibility: farmers growing notified crops. "
                + "benefits: cover against yield loss. apply: through the nearest bank branch.";

        GovernmentScheme scheme = SchemeTextExtractor.extract(item(text, Map.of()));

        assertFalse(scheme.structured());
        assertEquals("PM Fasal Bima Yojana", scheme.name());
        assertEquals("farmers growing notified crops", scheme.eligibility());
        assertEquals("cover against yield loss", scheme.benefits());
        assertEquals("through the nearest bank branch", scheme.applicationProcess());
    }

    @Test
    void shouldLeaveFieldsEmptyWithoutTriggerWords() {
        GovernmentScheme scheme = SchemeTextExtractor.extract(item("Soil Health Card\nFree soil testing.", null));

        assertEquals("Soil Health Card", scheme.name());
        assertEquals("", scheme.eligibility());
        assertEquals("", scheme.benefits());
        assertEquals("", scheme.applicationProcess());
    }

    @Test
    void shouldReturnEmptyFragmentWhenHeaderMissing() {
        GovernmentScheme scheme = SchemeTextExtractor.extract(item("Scheme X\nSmall farmers are eligible.",
                Map.of()));

        assertEquals("", scheme.eligibility());
    }

    @Test
    void shouldUseFallbackNameForBlankText() {
        GovernmentScheme scheme = SchemeTextExtractor.extract(item("", Map.of()));

        assertEquals(SchemeTextExtractor.UNKNOWN_SCHEME, scheme.name());
        assertEquals("", scheme.description());
    }

    @Test
    void shouldFillMissingStructuredFieldsFromText() {
        GovernmentScheme scheme = SchemeTextExtractor.extract(item(
                "Kisan Credit Card\nShort term credit. benefits: low interest loans.",
                Map.of("name", "KCC")));

        assertTrue(scheme.structured());
        assertEquals("KCC", scheme.name());
        assertEquals("low interest loans", scheme.benefits());
    }
}
