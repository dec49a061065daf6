package me.golemcore.krishi.adapter.outbound.embedding;

import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    private KrishiProperties properties;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new KrishiProperties();
        adapter = new Langchain4jEmbeddingAdapter(properties);
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailEmbedWithProviderExceptionWithoutApiKey() {
        CompletionException error = assertThrows(CompletionException.class, () -> adapter.embed("rice").join());

        assertInstanceOf(ProviderException.class, error.getCause());
    }

    @Test
    void shouldFailBatchWithoutApiKey() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.embedBatch(List.of("rice")).join());

        assertInstanceOf(ProviderException.class, error.getCause());
    }

    @Test
    void shouldReportConfiguredModelAndDimension() {
        properties.getEmbedding().setModel("text-embedding-3-large");
        properties.getEmbedding().setDimension(3072);

        assertEquals("text-embedding-3-large", adapter.getModel());
        assertEquals(3072, adapter.getDimension());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        properties.getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", adapter.getModel());
    }

    @Test
    void shouldInitializeModelWhenKeyPresent() {
        properties.getEmbedding().setApiKey("sk-test");

        assertTrue(adapter.isAvailable());
    }
}
