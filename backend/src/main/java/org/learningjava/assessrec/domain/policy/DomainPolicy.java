package org.learningjava.assessrec.domain.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.learningjava.assessrec.domain.model.query.DesiredDomains;
import org.learningjava.assessrec.domain.model.query.Domain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed lookup tables of the reranker: test-type code to domain, and domain keywords.
 * Loaded once from {@code /policy_rules/domains.yml}; immutable afterwards.
 */
public class DomainPolicy {

    private static final Logger log = LoggerFactory.getLogger(DomainPolicy.class);
    private static final String RESOURCE = "/policy_rules/domains.yml";

    private final Map<String, Domain> domainByTestType;
    private final Map<Domain, List<String>> keywordsByDomain;

    public DomainPolicy(DomainConfig config) {
        Map<String, Domain> byType = new HashMap<>();
        Map<Domain, List<String>> byDomain = new EnumMap<>(Domain.class);
        for (DomainRule rule : config.getDomains()) {
            if (rule.getDomain() == null || rule.getDomain() == Domain.OTHER) {
                throw new IllegalArgumentException("Domain rule must name TECHNICAL, BEHAVIORAL or COGNITIVE");
            }
            for (String code : rule.getTestTypes()) {
                byType.put(code.trim().toUpperCase(Locale.ROOT), rule.getDomain());
            }
            byDomain.put(rule.getDomain(), rule.getKeywords().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .toList());
        }
        this.domainByTestType = Map.copyOf(byType);
        this.keywordsByDomain = byDomain;
    }

    public static DomainPolicy fromClasspath() {
        try (InputStream in = DomainPolicy.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Domain policy resource not found: " + RESOURCE);
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            DomainConfig config = mapper.readValue(in, DomainConfig.class);
            DomainPolicy policy = new DomainPolicy(config);
            log.info("Loaded {} domain rules from {}", config.getDomains().size(), RESOURCE);
            return policy;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load domain policy", e);
        }
    }

    /** Absent or unrecognized codes map to {@link Domain#OTHER}. */
    public Domain categorize(String testType) {
        if (testType == null || testType.isBlank()) return Domain.OTHER;
        return domainByTestType.getOrDefault(testType.trim().toUpperCase(Locale.ROOT), Domain.OTHER);
    }

    public DesiredDomains desiredDomains(String text) {
        if (text == null || text.isEmpty()) return DesiredDomains.NONE;
        String lower = text.toLowerCase(Locale.ROOT);
        return new DesiredDomains(
                mentions(lower, Domain.TECHNICAL),
                mentions(lower, Domain.BEHAVIORAL),
                mentions(lower, Domain.COGNITIVE)
        );
    }

    private boolean mentions(String lowerText, Domain domain) {
        return keywordsByDomain.getOrDefault(domain, List.of()).stream().anyMatch(lowerText::contains);
    }
}
