package org.learningjava.assessrec.infrastructure.adapter.out.hashing;

import org.junit.jupiter.api.Test;
import org.learningjava.assessrec.domain.error.EmbeddingException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingAdapterTest {

    private final HashingEmbeddingAdapter embedder = new HashingEmbeddingAdapter(128);

    private static double dot(float[] a, float[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    @Test
    void same_text_same_vector_of_configured_dimension() {
        float[] a = embedder.embed("Java developer with SQL");
        float[] b = new HashingEmbeddingAdapter(128).embed("Java developer with SQL");

        assertEquals(128, a.length);
        assertArrayEquals(a, b);
        assertEquals(1.0, dot(a, a), 1e-5);
    }

    @Test
    void overlapping_text_scores_higher_than_unrelated_text() {
        float[] query = embedder.embed("java backend developer");
        float[] near = embedder.embed("Core Java backend developer assessment");
        float[] far = embedder.embed("sales personality questionnaire");

        assertTrue(dot(query, near) > dot(query, far));
    }

    @Test
    void blank_text_is_zero_vector() {
        float[] v = embedder.embed("   ");
        assertEquals(0.0, dot(v, v), 0.0);
    }

    @Test
    void batch_preserves_order_and_empty_batch_is_empty() {
        List<float[]> out = embedder.embedBatch(List.of("alpha", "beta"));

        assertEquals(2, out.size());
        assertArrayEquals(embedder.embed("alpha"), out.get(0));
        assertArrayEquals(embedder.embed("beta"), out.get(1));
        assertTrue(embedder.embedBatch(List.of()).isEmpty());
    }

    @Test
    void tokenize_lowercases_and_keeps_plus_and_hash() {
        assertEquals(List.of("c++", "and", "c#", "developer"), HashingEmbeddingAdapter.tokenize("C++ and C#, Developer!"));
    }

    @Test
    void model_id_names_dimension() {
        assertEquals("hashing-128", embedder.modelId());
        assertThrows(EmbeddingException.class, () -> new HashingEmbeddingAdapter(0));
        assertThrows(EmbeddingException.class, () -> new HashingEmbeddingAdapter(-3));
    }
}
