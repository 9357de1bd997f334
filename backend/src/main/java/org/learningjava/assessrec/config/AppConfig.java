package org.learningjava.assessrec.config;

import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.port.CatalogSnapshotPort;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.application.port.JobDescriptionPort;
import org.learningjava.assessrec.application.port.LabeledQueryPort;
import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.learningjava.assessrec.domain.policy.DomainPolicy;
import org.learningjava.assessrec.domain.service.rerank.RerankEngine;
import org.learningjava.assessrec.infrastructure.adapter.out.fs.CsvCatalogSnapshotReader;
import org.learningjava.assessrec.infrastructure.adapter.out.fs.CsvLabeledQueryReader;
import org.learningjava.assessrec.infrastructure.adapter.out.hashing.HashingEmbeddingAdapter;
import org.learningjava.assessrec.infrastructure.adapter.out.index.FileSystemCatalogIndex;
import org.learningjava.assessrec.infrastructure.adapter.out.jd.HttpJobDescriptionFetcher;
import org.learningjava.assessrec.infrastructure.adapter.out.ollama.OllamaEmbeddingAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * The one object graph every request shares: built once at startup, read-only afterwards.
 */
@Configuration
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    //objects with external dependencies
    @Bean
    EmbeddingPort embedding(@Value("${assessrec.embedding.provider:hashing}") String provider,
                            @Value("${assessrec.ollama.url:http://localhost:11434}") String url,
                            @Value("${assessrec.ollama.embedding-model:nomic-embed-text}") String model,
                            @Value("${assessrec.ollama.timeout-seconds:60}") long timeoutSeconds,
                            @Value("${assessrec.ollama.batch-size:32}") int batchSize,
                            @Value("${assessrec.hashing.dimension:384}") int hashingDimension) {
        String p = provider.trim().toLowerCase(Locale.ROOT);
        log.info("Embedding provider: {}", p);
        return switch (p) {
            case "ollama" -> new OllamaEmbeddingAdapter(url, model, Duration.ofSeconds(timeoutSeconds), batchSize);
            case "hashing" -> new HashingEmbeddingAdapter(hashingDimension);
            default -> throw new EmbeddingException("Unknown embedding provider: " + provider
                    + " (expected 'ollama' or 'hashing')");
        };
    }

    @Bean
    JobDescriptionPort jobDescriptions(@Value("${assessrec.jd.timeout-seconds:20}") long timeoutSeconds,
                                       @Value("${assessrec.jd.user-agent:Mozilla/5.0 (compatible; assessrec/1.0)}") String userAgent) {
        return new HttpJobDescriptionFetcher(Duration.ofSeconds(timeoutSeconds), userAgent);
    }

    @Bean
    CatalogSnapshotPort catalogSnapshots() {
        return new CsvCatalogSnapshotReader();
    }

    @Bean
    LabeledQueryPort labeledQueries() {
        return new CsvLabeledQueryReader();
    }

    @Bean
    CatalogIndexPort catalogIndex(@Value("${assessrec.index.vectors-path}") String vectorsPath,
                                  @Value("${assessrec.index.meta-path}") String metaPath,
                                  EmbeddingPort embedding,
                                  CatalogSnapshotPort snapshots) {
        return new FileSystemCatalogIndex(Path.of(vectorsPath), Path.of(metaPath), embedding, snapshots);
    }

    //pure domain services
    @Bean
    DomainPolicy domainPolicy() {
        return DomainPolicy.fromClasspath();
    }

    @Bean
    RerankEngine rerankEngine(DomainPolicy policy) {
        return new RerankEngine(policy);
    }
}
