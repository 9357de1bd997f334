package org.learningjava.assessrec.application.port;

import java.util.List;

/**
 * Text to fixed-dimension vector. Implementations throw
 * {@link org.learningjava.assessrec.domain.error.EmbeddingException} when the model cannot be used.
 */
public interface EmbeddingPort {
    float[] embed(String text);

    /** Same order as {@code texts}; an empty input yields an empty list. */
    List<float[]> embedBatch(List<String> texts);

    int dimension();

    String modelId();
}
