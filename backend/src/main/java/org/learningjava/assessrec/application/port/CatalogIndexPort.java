package org.learningjava.assessrec.application.port;

import org.learningjava.assessrec.domain.model.retrieval.SearchHit;

import java.nio.file.Path;
import java.util.List;

/**
 * Exact nearest-neighbour index over the catalog, persisted as a vector blob plus a metadata array.
 * <p>
 * Lifecycle: UNBUILT, then READY after {@link #build} or {@link #load}. Read-only once READY;
 * a rebuild swaps the whole state at once.
 */
public interface CatalogIndexPort {

    /**
     * Embeds every snapshot row and writes both artifacts.
     *
     * @return false when the artifacts already exist and {@code force} is false (nothing done)
     */
    boolean build(Path snapshot, boolean force);

    /** Idempotent once READY. */
    void load();

    /** Up to {@code min(topK, size())} hits, descending score, ties by row order. Loads lazily. */
    List<SearchHit> search(float[] queryVector, int topK);

    /** Loads lazily. */
    int size();

    boolean isReady();

    boolean artifactsExist();
}
