package org.learningjava.assessrec.application.usecase;

import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.application.port.JobDescriptionPort;
import org.learningjava.assessrec.domain.error.InvalidInputException;
import org.learningjava.assessrec.domain.model.retrieval.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RetrieveCandidatesUseCase {
    private static final Logger log = LoggerFactory.getLogger(RetrieveCandidatesUseCase.class);

    private final CatalogIndexPort index;
    private final EmbeddingPort embedding;
    private final JobDescriptionPort jobDescriptions;

    public RetrieveCandidatesUseCase(CatalogIndexPort index,
                                     EmbeddingPort embedding,
                                     JobDescriptionPort jobDescriptions) {
        this.index = index;
        this.embedding = embedding;
        this.jobDescriptions = jobDescriptions;
    }

    /**
     * Combines the explicit query and the fetched job description into the text to embed.
     * Query first, blank line, then the job description. An empty query string is a valid query.
     *
     * @throws InvalidInputException if neither input is given
     */
    public String normalizeInput(String queryText, String jdUrl) {
        if (jdUrl != null && !jdUrl.isBlank()) {
            log.info("Fetching JD from {}", jdUrl);
            String jdText = jobDescriptions.fetchText(jdUrl);

            if (queryText != null) {
                String combined = queryText.trim() + "\n\n" + jdText;
                log.info("Combined query ({} chars) + JD ({} chars)", queryText.length(), jdText.length());
                return combined;
            }
            log.info("Using fetched JD only ({} chars)", jdText.length());
            return jdText;
        }

        if (queryText != null) {
            log.info("Using query text ({} chars)", queryText.length());
            return queryText.trim();
        }

        throw new InvalidInputException("Either 'query' or 'jdUrl' must be provided");
    }

    /** Embeds once and searches; empty (not an error) when the index holds nothing. */
    public List<Candidate> retrieveCandidates(String normalizedText, int topK) {
        if (index.size() == 0) {
            log.warn("Index is empty; no candidates for '{}'", abbreviate(normalizedText));
            return List.of();
        }

        log.info("Embedding query ({} chars)", normalizedText.length());
        float[] qVec = embedding.embed(normalizedText);
        if (log.isDebugEnabled()) {
            log.debug("Query embedding dim={} sample=[{}]", qVec.length,
                    qVec.length > 2 ? qVec[0] + ", " + qVec[1] + ", " + qVec[2] : "");
        }

        log.info("Searching for top {} candidates", topK);
        List<Candidate> candidates = index.search(qVec, topK).stream()
                .map(Candidate::from)
                .toList();

        log.info("Retrieved {} candidates", candidates.size());
        return candidates;
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 60) + "...";
    }
}
