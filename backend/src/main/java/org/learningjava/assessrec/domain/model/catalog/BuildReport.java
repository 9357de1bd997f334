package org.learningjava.assessrec.domain.model.catalog;

/**
 * Outcome of an index build request.
 *
 * @param built      false when existing artifacts were kept (no force)
 * @param itemCount  rows in the index after the call
 * @param belowMinimum true when itemCount is under the configured minimum
 */
public record BuildReport(boolean built, int itemCount, String modelId, boolean belowMinimum) {
}
