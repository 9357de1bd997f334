package org.learningjava.assessrec.config;

import org.junit.jupiter.api.Test;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.learningjava.assessrec.infrastructure.adapter.out.hashing.HashingEmbeddingAdapter;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private final AppConfig config = new AppConfig();

    @Test
    void hashing_provider_is_case_insensitive() {
        EmbeddingPort embedding = config.embedding(" Hashing ", "http://localhost:11434", "nomic-embed-text", 60, 32, 64);

        assertInstanceOf(HashingEmbeddingAdapter.class, embedding);
        assertEquals("hashing-64", embedding.modelId());
    }

    @Test
    void unknown_provider_raises_embedding_exception() {
        EmbeddingException ex = assertThrows(EmbeddingException.class,
                () -> config.embedding("bogus", "http://localhost:11434", "nomic-embed-text", 60, 32, 384));
        assertTrue(ex.getMessage().contains("bogus"));
    }

    @Test
    void non_positive_hashing_dimension_raises_embedding_exception() {
        assertThrows(EmbeddingException.class,
                () -> config.embedding("hashing", "http://localhost:11434", "nomic-embed-text", 60, 32, 0));
    }
}
