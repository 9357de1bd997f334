package org.learningjava.assessrec.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds text with an Ollama server ({@code POST /api/embed}), several inputs per call.
 */
public class OllamaEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final int batchSize;

    private volatile int dimension = -1; // learned from the first response

    public OllamaEmbeddingAdapter(String baseUrl, String model) {
        this(baseUrl, model, Duration.ofSeconds(60), 32);
    }

    public OllamaEmbeddingAdapter(String baseUrl, String model, Duration timeout, int batchSize) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.batchSize = Math.max(1, batchSize);
        this.http = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    private static String preview(String text) {
        return text.replace("\n", " ").substring(0, Math.min(40, text.length()));
    }

    @Override
    public float[] embed(String text) {
        return embedChunk(List.of(text == null ? "" : text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();

        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> chunk = texts.subList(from, Math.min(from + batchSize, texts.size()));
            out.addAll(embedChunk(chunk));
            if (log.isDebugEnabled()) {
                log.debug("Embedded {}/{} texts with '{}'", out.size(), texts.size(), model);
            }
        }
        return out;
    }

    @Override
    public int dimension() {
        if (dimension < 0) {
            embed("dimension probe");
        }
        return dimension;
    }

    @Override
    public String modelId() {
        return "ollama:" + model;
    }

    private List<float[]> embedChunk(List<String> texts) {
        long t0 = System.nanoTime();
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", model);
            ArrayNode input = body.putArray("input");
            texts.forEach(input::add);

            Request req = new Request.Builder()
                    .url(baseUrl + "/api/embed")
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                long latencyMs = Math.max(1L, Math.round((System.nanoTime() - t0) / 1_000_000.0));

                if (!resp.isSuccessful()) {
                    log.warn("Ollama embed failed: HTTP {} {}", resp.code(), resp.message());
                    throw new IOException("Ollama embed failed: HTTP " + resp.code());
                }
                String s = resp.body() != null ? resp.body().string() : "{}";
                List<float[]> vectors = parse(om.readTree(s));

                if (vectors.size() != texts.size()) {
                    throw new IOException("Ollama returned " + vectors.size() + " embeddings for " + texts.size() + " inputs");
                }
                dimension = vectors.get(0).length;
                log.debug("Embedding dim={} for {} text(s), first='{}...', latencyMs={}",
                        dimension, texts.size(), preview(texts.get(0)), latencyMs);
                return vectors;
            }
        } catch (IOException e) {
            log.error("Embedding failed for model '{}' at {}: {}", model, baseUrl, e.getMessage());
            throw new EmbeddingException("Embedding failed for model '" + model + "' at " + baseUrl +
                    ". Check model is pulled and API reachable.", e);
        }
    }

    // accepts {"embeddings":[[...],...]} and the older single {"embedding":[...]}
    private List<float[]> parse(JsonNode json) throws IOException {
        List<float[]> out = new ArrayList<>();
        if (json.has("embeddings") && json.get("embeddings").isArray()) {
            for (JsonNode e : json.get("embeddings")) out.add(toFloatArray(e));
        } else if (json.has("embedding")) {
            out.add(toFloatArray(json.get("embedding")));
        } else {
            log.warn("Unexpected embeddings payload from Ollama: {}", json);
            throw new IOException("Unexpected embeddings payload from Ollama");
        }
        return out;
    }

    private float[] toFloatArray(JsonNode arr) throws IOException {
        if (arr == null || !arr.isArray() || arr.isEmpty()) {
            throw new IOException("Expected non-empty numeric array, got: " + arr);
        }
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }
}
