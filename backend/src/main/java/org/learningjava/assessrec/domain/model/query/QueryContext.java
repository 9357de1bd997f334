package org.learningjava.assessrec.domain.model.query;

import java.util.OptionalInt;

/**
 * Everything the pipeline derives from one request's input text.
 *
 * @param rawQuery           the explicit query as received (may be null)
 * @param jdUrl              the job-description URL as received (may be null)
 * @param normalizedText     the combined text actually embedded
 * @param maxDurationMinutes duration bound inferred from the text
 * @param desiredDomains     domains inferred from the text
 */
public record QueryContext(
        String rawQuery,
        String jdUrl,
        String normalizedText,
        OptionalInt maxDurationMinutes,
        DesiredDomains desiredDomains
) {
}
