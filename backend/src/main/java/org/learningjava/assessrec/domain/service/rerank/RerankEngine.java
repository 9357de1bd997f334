package org.learningjava.assessrec.domain.service.rerank;

import org.learningjava.assessrec.domain.model.query.DesiredDomains;
import org.learningjava.assessrec.domain.model.query.Domain;
import org.learningjava.assessrec.domain.model.retrieval.Candidate;
import org.learningjava.assessrec.domain.policy.DomainPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based reranking of retrieved candidates: duration bound, then domain balance.
 * <p>
 * Stateless and deterministic. It never embeds or searches; it only reorders and
 * drops candidates it was given, keeping retrieval rank as the tie-break everywhere.
 */
public class RerankEngine {

    private static final Logger log = LoggerFactory.getLogger(RerankEngine.class);

    // hours are checked before minutes; first pattern with any match wins.
    // \h matches no-break spaces too
    private static final Pattern HOURS = Pattern.compile("(\\d+(?:\\.\\d+)?)[\\s\\h]*hours?", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINUTES = Pattern.compile("(\\d+(?:\\.\\d+)?)[\\s\\h]*mins?", Pattern.CASE_INSENSITIVE);

    private final DomainPolicy policy;

    public RerankEngine(DomainPolicy policy) {
        this.policy = policy;
    }

    /**
     * Maximum duration in minutes stated in the text, e.g. "1.5 hours" → 90, "40 mins" → 40.
     * Fractional results are truncated.
     */
    public OptionalInt inferMaxDuration(String text) {
        if (text == null || text.isEmpty()) return OptionalInt.empty();

        Matcher hours = HOURS.matcher(text);
        if (hours.find()) {
            return OptionalInt.of((int) (Double.parseDouble(hours.group(1)) * 60));
        }
        Matcher minutes = MINUTES.matcher(text);
        if (minutes.find()) {
            return OptionalInt.of((int) Double.parseDouble(minutes.group(1)));
        }
        return OptionalInt.empty();
    }

    public DesiredDomains inferDesiredDomains(String text) {
        return policy.desiredDomains(text);
    }

    public Domain categorizeTestType(String code) {
        return policy.categorize(code);
    }

    /** Keeps candidates with unknown duration or duration ≤ bound; order preserved. */
    public List<Candidate> applyDurationFilter(List<Candidate> candidates, OptionalInt maxMinutes) {
        if (maxMinutes.isEmpty()) return candidates;

        int bound = maxMinutes.getAsInt();
        return candidates.stream()
                .filter(c -> c.durationMinutes() == null || c.durationMinutes() <= bound)
                .toList();
    }

    /**
     * Splits {@code k} slots evenly across the desired domains (technical, behavioral,
     * cognitive in that order), then fills what is left from the full list in rank order.
     */
    public List<Candidate> balanceByDomains(List<Candidate> candidates, DesiredDomains desired, int k) {
        if (k <= 0) return List.of();
        if (!desired.any()) {
            return List.copyOf(candidates.subList(0, Math.min(k, candidates.size())));
        }

        // bucket by row position so equal-valued candidates stay distinct
        Map<Domain, List<Integer>> buckets = new EnumMap<>(Domain.class);
        for (Domain d : Domain.values()) buckets.put(d, new ArrayList<>());
        for (int i = 0; i < candidates.size(); i++) {
            buckets.get(categorizeTestType(candidates.get(i).testType())).add(i);
        }

        int slotsPerDomain = Math.max(1, k / desired.count());
        boolean[] taken = new boolean[candidates.size()];
        List<Candidate> result = new ArrayList<>(Math.min(k, candidates.size()));

        for (Domain domain : desired.inPriorityOrder()) {
            List<Integer> bucket = buckets.get(domain);
            for (int j = 0; j < Math.min(slotsPerDomain, bucket.size()); j++) {
                int idx = bucket.get(j);
                taken[idx] = true;
                result.add(candidates.get(idx));
            }
        }

        for (int i = 0; i < candidates.size() && result.size() < k; i++) {
            if (!taken[i]) {
                taken[i] = true;
                result.add(candidates.get(i));
            }
        }

        return result.size() > k ? List.copyOf(result.subList(0, k)) : List.copyOf(result);
    }

    public List<Candidate> rerank(String queryText, List<Candidate> candidates, int k) {
        OptionalInt maxDuration = inferMaxDuration(queryText);
        DesiredDomains domains = inferDesiredDomains(queryText);

        log.info("Max duration constraint: {} minutes", maxDuration.isPresent() ? maxDuration.getAsInt() : "none");
        log.info("Desired domains: {}", domains);

        List<Candidate> filtered = applyDurationFilter(candidates, maxDuration);
        log.info("After duration filter: {} candidates", filtered.size());

        List<Candidate> balanced = balanceByDomains(filtered, domains, k);
        log.info("After domain balancing: {} results", balanced.size());

        return balanced;
    }
}
