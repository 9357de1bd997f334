package org.learningjava.assessrec.infrastructure.adapter.out.hashing;

import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic offline embedder: word unigrams and bigrams hashed into a fixed number of
 * signed buckets, then L2-normalized. No model download, same vector for the same text on
 * every JVM. Good enough for lexical overlap; not a semantic model.
 */
public class HashingEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(HashingEmbeddingAdapter.class);
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}+#]+");
    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimension;

    public HashingEmbeddingAdapter(int dimension) {
        if (dimension <= 0) throw new EmbeddingException("dimension must be positive, got " + dimension);
        this.dimension = dimension;
        log.info("Hashing embedder ready (dim={})", dimension);
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dimension];
        if (text == null || text.isBlank()) return v;

        List<String> tokens = tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            add(v, tokens.get(i), 1f);
            if (i + 1 < tokens.size()) add(v, tokens.get(i) + " " + tokens.get(i + 1), BIGRAM_WEIGHT);
        }
        return normalize(v);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        List<float[]> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embed(t));
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "hashing-" + dimension;
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        for (String t : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private void add(float[] v, String feature, float weight) {
        int h = fnv1a(feature);
        int bucket = Math.floorMod(h, dimension);
        // sign taken from bit 30, bucket from the low bits
        v[bucket] += ((h >>> 30) & 1) == 0 ? weight : -weight;
    }

    private static int fnv1a(String s) {
        int h = 0x811c9dc5;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= 0x01000193;
        }
        return h;
    }

    private static float[] normalize(float[] v) {
        double sum = 0.0;
        for (float x : v) sum += (double) x * x;
        if (sum == 0.0) return v;
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < v.length; i++) v[i] /= norm;
        return v;
    }
}
