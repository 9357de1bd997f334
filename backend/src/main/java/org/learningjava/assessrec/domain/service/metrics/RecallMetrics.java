package org.learningjava.assessrec.domain.service.metrics;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranking metrics over assessment URLs.
 */
public final class RecallMetrics {

    private RecallMetrics() {
    }

    /** Relevant items found in the first k predictions, divided by the number of relevant items. */
    public static double recallAtK(Set<String> relevant, List<String> predicted, int k) {
        if (relevant == null || relevant.isEmpty()) return 0.0;
        return (double) hits(relevant, predicted, k) / relevant.size();
    }

    /** Relevant items found in the first k predictions, divided by k. */
    public static double precisionAtK(Set<String> relevant, List<String> predicted, int k) {
        if (k <= 0 || relevant == null) return 0.0;
        return (double) hits(relevant, predicted, k) / k;
    }

    public static double meanRecallAtK(Map<String, Set<String>> relevantByQuery,
                                       Map<String, List<String>> predictedByQuery,
                                       int k) {
        if (relevantByQuery.isEmpty()) return 0.0;
        double sum = 0.0;
        for (var e : relevantByQuery.entrySet()) {
            sum += recallAtK(e.getValue(), predictedByQuery.getOrDefault(e.getKey(), List.of()), k);
        }
        return sum / relevantByQuery.size();
    }

    public static double meanPrecisionAtK(Map<String, Set<String>> relevantByQuery,
                                          Map<String, List<String>> predictedByQuery,
                                          int k) {
        if (relevantByQuery.isEmpty()) return 0.0;
        double sum = 0.0;
        for (var e : relevantByQuery.entrySet()) {
            sum += precisionAtK(e.getValue(), predictedByQuery.getOrDefault(e.getKey(), List.of()), k);
        }
        return sum / relevantByQuery.size();
    }

    private static int hits(Set<String> relevant, List<String> predicted, int k) {
        if (predicted == null || predicted.isEmpty()) return 0;
        Set<String> topK = new HashSet<>(predicted.subList(0, Math.min(k, predicted.size())));
        topK.retainAll(relevant);
        return topK.size();
    }
}
