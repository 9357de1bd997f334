package org.learningjava.assessrec.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.assessrec.domain.error.EmbeddingException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OllamaEmbeddingAdapterTest {

    private MockWebServer server;
    private final ObjectMapper om = new ObjectMapper();

    @BeforeEach
    void start() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stop() throws IOException {
        server.shutdown();
    }

    private OllamaEmbeddingAdapter adapter(int batchSize) {
        return new OllamaEmbeddingAdapter(server.url("/").toString(), "nomic-embed-text",
                Duration.ofSeconds(5), batchSize);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void embedBatch_splits_into_chunks_and_keeps_order() throws Exception {
        server.enqueue(json("{\"embeddings\":[[1,0],[0,1]]}"));
        server.enqueue(json("{\"embeddings\":[[0.5,0.5]]}"));

        List<float[]> out = adapter(2).embedBatch(List.of("a", "b", "c"));

        assertEquals(3, out.size());
        assertArrayEquals(new float[]{1f, 0f}, out.get(0));
        assertArrayEquals(new float[]{0.5f, 0.5f}, out.get(2));

        RecordedRequest first = server.takeRequest();
        assertEquals("/api/embed", first.getPath());
        JsonNode body = om.readTree(first.getBody().readUtf8());
        assertEquals("nomic-embed-text", body.get("model").asText());
        assertEquals(2, body.get("input").size());
        assertEquals(1, om.readTree(server.takeRequest().getBody().readUtf8()).get("input").size());
    }

    @Test
    void dimension_is_learned_from_response() {
        server.enqueue(json("{\"embedding\":[0.1,0.2,0.3]}"));

        OllamaEmbeddingAdapter a = adapter(8);

        assertEquals(3, a.dimension());
        assertEquals("ollama:nomic-embed-text", a.modelId());
    }

    @Test
    void http_error_becomes_embedding_exception() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("model not found"));

        assertThrows(EmbeddingException.class, () -> adapter(8).embed("x"));
    }

    @Test
    void count_mismatch_becomes_embedding_exception() {
        server.enqueue(json("{\"embeddings\":[[1,0]]}"));

        assertThrows(EmbeddingException.class, () -> adapter(8).embedBatch(List.of("a", "b")));
    }

    @Test
    void empty_batch_makes_no_call() {
        assertTrue(adapter(8).embedBatch(List.of()).isEmpty());
        assertEquals(0, server.getRequestCount());
    }
}
