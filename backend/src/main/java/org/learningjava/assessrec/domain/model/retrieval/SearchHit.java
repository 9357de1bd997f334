package org.learningjava.assessrec.domain.model.retrieval;

import org.learningjava.assessrec.domain.model.catalog.CatalogItem;

/**
 * Raw nearest-neighbour result: cosine similarity plus the row's metadata.
 */
public record SearchHit(double score, int row, CatalogItem item) {
}
