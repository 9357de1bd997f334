package org.learningjava.assessrec.domain.service.rerank;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.assessrec.domain.model.catalog.CatalogItem;
import org.learningjava.assessrec.domain.model.query.DesiredDomains;
import org.learningjava.assessrec.domain.model.query.Domain;
import org.learningjava.assessrec.domain.model.retrieval.Candidate;
import org.learningjava.assessrec.domain.policy.DomainPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class RerankEngineTest {

    private RerankEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RerankEngine(DomainPolicy.fromClasspath());
    }

    // --- helpers -------------------------------------------------------------

    private static Candidate cand(String name, String testType, Integer duration, double score) {
        CatalogItem item = new CatalogItem(name, "https://x/" + name, testType, duration,
                "cat", "desc", List.of(), name);
        return new Candidate(item, score);
    }

    private static List<String> names(List<Candidate> cs) {
        return cs.stream().map(c -> c.item().name()).toList();
    }

    // --- duration inference ----------------------------------------------------

    @Test
    void inferMaxDuration_fractionalHours_areConvertedToMinutes() {
        assertEquals(OptionalInt.of(90), engine.inferMaxDuration("complete within 1.5 hours"));
    }

    @Test
    void inferMaxDuration_minutes() {
        assertEquals(OptionalInt.of(40), engine.inferMaxDuration("should take 40 mins"));
        assertEquals(OptionalInt.of(30), engine.inferMaxDuration("about 30 minutes long"));
    }

    @Test
    void inferMaxDuration_noMatch_isEmpty() {
        assertEquals(OptionalInt.empty(), engine.inferMaxDuration("no time limit mentioned"));
        assertEquals(OptionalInt.empty(), engine.inferMaxDuration(""));
        assertEquals(OptionalInt.empty(), engine.inferMaxDuration(null));
    }

    @Test
    void inferMaxDuration_acceptsNoBreakSpace() {
        assertEquals(OptionalInt.of(40), engine.inferMaxDuration("should take 40\u00a0mins"));
        assertEquals(OptionalInt.of(90), engine.inferMaxDuration("within 1.5\u00a0hours"));
    }

    @Test
    void inferMaxDuration_hoursWinEvenWhenMinutesAppearFirst() {
        assertEquals(OptionalInt.of(120), engine.inferMaxDuration("20 mins of prep, at most 2 hours total"));
    }

    @Test
    void inferMaxDuration_isCaseInsensitive_andTruncates() {
        assertEquals(OptionalInt.of(60), engine.inferMaxDuration("1 HOUR"));
        assertEquals(OptionalInt.of(20), engine.inferMaxDuration("0.345 hours"));
        assertEquals(OptionalInt.of(12), engine.inferMaxDuration("12.9 min"));
    }

    // --- domains -------------------------------------------------------------

    @Test
    void inferDesiredDomains_flagsAreIndependent() {
        DesiredDomains d = engine.inferDesiredDomains("Java developer who can COLLABORATE with the business team");
        assertTrue(d.technical());
        assertTrue(d.behavioral());
        assertFalse(d.cognitive());

        DesiredDomains none = engine.inferDesiredDomains("hello world");
        assertFalse(none.any());

        DesiredDomains cog = engine.inferDesiredDomains("Strong numerical reasoning required");
        assertEquals(new DesiredDomains(false, false, true), cog);
    }

    @Test
    void categorizeTestType_usesFixedTable() {
        assertEquals(Domain.TECHNICAL, engine.categorizeTestType("K"));
        assertEquals(Domain.TECHNICAL, engine.categorizeTestType("V"));
        assertEquals(Domain.BEHAVIORAL, engine.categorizeTestType("P"));
        assertEquals(Domain.BEHAVIORAL, engine.categorizeTestType("L"));
        assertEquals(Domain.COGNITIVE, engine.categorizeTestType("C"));
        assertEquals(Domain.COGNITIVE, engine.categorizeTestType("N"));
        assertEquals(Domain.COGNITIVE, engine.categorizeTestType("R"));
        assertEquals(Domain.TECHNICAL, engine.categorizeTestType(" k "));
        assertEquals(Domain.OTHER, engine.categorizeTestType("S"));
        assertEquals(Domain.OTHER, engine.categorizeTestType(""));
        assertEquals(Domain.OTHER, engine.categorizeTestType(null));
    }

    // --- duration filter -------------------------------------------------------

    @Test
    void applyDurationFilter_keepsUnknownAndWithinBound_preservingOrder() {
        var c45 = cand("a", "K", 45, 0.9);
        var cNone = cand("b", "K", null, 0.8);
        var c20 = cand("c", "P", 20, 0.7);
        var list = List.of(c45, cNone, c20);

        assertEquals(List.of(c45, cNone, c20), engine.applyDurationFilter(list, OptionalInt.of(60)));
        assertEquals(List.of(cNone, c20), engine.applyDurationFilter(list, OptionalInt.of(30)));
        assertSame(list, engine.applyDurationFilter(list, OptionalInt.empty()));
    }

    // --- balancing -------------------------------------------------------------

    @Test
    void balanceByDomains_noDesiredDomain_returnsFirstK() {
        var list = List.of(cand("a", "K", 1, .9), cand("b", "P", 1, .8), cand("c", "C", 1, .7));
        assertEquals(List.of("a", "b"), names(engine.balanceByDomains(list, DesiredDomains.NONE, 2)));
    }

    @Test
    void balanceByDomains_technicalAndBehavioral_splitsEvenly_inBucketRankOrder() {
        List<Candidate> list = new ArrayList<>();
        // interleaved: other, K, P, K, P ...
        list.add(cand("o0", null, 10, 1.0));
        for (int i = 0; i < 7; i++) {
            list.add(cand("k" + i, "K", 10, 0.9 - i * 0.01));
            list.add(cand("p" + i, "P", 10, 0.8 - i * 0.01));
        }
        list.add(cand("c0", "C", 10, 0.1));

        List<Candidate> out = engine.balanceByDomains(list, new DesiredDomains(true, true, false), 10);

        assertEquals(List.of("k0", "k1", "k2", "k3", "k4", "p0", "p1", "p2", "p3", "p4"), names(out));
    }

    @Test
    void balanceByDomains_underfilledBucket_fillsFromFullListInRankOrder() {
        var list = List.of(
                cand("o0", "S", 10, .99),
                cand("k0", "K", 10, .95),
                cand("p0", "P", 10, .90),
                cand("n0", "N", 10, .85),
                cand("o1", null, 10, .80),
                cand("r0", "R", 10, .75),
                cand("c0", "C", 10, .70)
        );

        // technical + cognitive, k=6 -> 3 slots each; only 1 technical exists
        List<Candidate> out = engine.balanceByDomains(list, new DesiredDomains(true, false, true), 6);

        assertEquals(List.of("k0", "n0", "r0", "c0", "o0", "p0"), names(out));
    }

    @Test
    void balanceByDomains_moreDomainsThanSlots_truncatesToK() {
        var list = List.of(cand("k0", "K", 1, .9), cand("p0", "P", 1, .8), cand("c0", "C", 1, .7));

        List<Candidate> out = engine.balanceByDomains(list, new DesiredDomains(true, true, true), 2);

        assertEquals(List.of("k0", "p0"), names(out));
    }

    @Test
    void balanceByDomains_hugeK_returnsOnlyWhatExists() {
        List<Candidate> list = List.of(cand("java", "K", 30, 0.9));

        List<Candidate> out = engine.balanceByDomains(list, new DesiredDomains(true, false, false), Integer.MAX_VALUE);

        assertEquals(List.of("java"), names(out));
    }

    @Test
    void balanceByDomains_equalCandidatesStayDistinct() {
        var dup = cand("same", "K", 10, .5);
        var list = List.of(dup, dup, cand("p", "P", 10, .4));

        List<Candidate> out = engine.balanceByDomains(list, new DesiredDomains(true, false, false), 3);

        assertEquals(3, out.size());
    }

    // --- rerank ------------------------------------------------------------------

    @Test
    void rerank_neverExceedsK_evenWhenFiltersRemoveMost() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 20; i++) list.add(cand("long" + i, "K", 120, 1.0 - i * 0.01));
        list.add(cand("short", "K", 15, 0.1));
        list.add(cand("unknown", "P", null, 0.05));

        List<Candidate> out = engine.rerank("Java developer test under 30 mins", list, 10);

        assertEquals(List.of("short", "unknown"), names(out));
    }

    @Test
    void rerank_outputAtMostK() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 30; i++) list.add(cand("c" + i, i % 2 == 0 ? "K" : "P", 20, 1.0 - i * 0.01));

        assertEquals(5, engine.rerank("team lead with sql skills", list, 5).size());
        assertEquals(10, engine.rerank("anything", list, 10).size());
        assertTrue(engine.rerank("anything", List.of(), 10).isEmpty());
    }
}
