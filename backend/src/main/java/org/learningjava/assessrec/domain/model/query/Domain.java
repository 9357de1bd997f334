package org.learningjava.assessrec.domain.model.query;

/**
 * Topical bucket of an assessment. {@link #OTHER} is never "desired".
 */
public enum Domain {
    TECHNICAL,
    BEHAVIORAL,
    COGNITIVE,
    OTHER
}
