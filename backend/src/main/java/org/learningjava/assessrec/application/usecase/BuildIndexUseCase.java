package org.learningjava.assessrec.application.usecase;

import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.domain.model.catalog.BuildReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Batch job: catalog snapshot to index artifacts, then a size check.
 */
@Service
public class BuildIndexUseCase {
    private static final Logger log = LoggerFactory.getLogger(BuildIndexUseCase.class);

    private final CatalogIndexPort index;
    private final EmbeddingPort embedding;
    private final Path catalogPath;
    private final int minItems;

    public BuildIndexUseCase(CatalogIndexPort index,
                             EmbeddingPort embedding,
                             @Value("${assessrec.catalog.path}") String catalogPath,
                             @Value("${assessrec.index.min-items:377}") int minItems) {
        this.index = index;
        this.embedding = embedding;
        this.catalogPath = Path.of(catalogPath);
        this.minItems = minItems;
    }

    public BuildReport build(boolean force) {
        if (!Files.isRegularFile(catalogPath)) {
            log.error("Catalog file not found: {}", catalogPath);
            throw new IllegalStateException("Catalog file not found: " + catalogPath + ". Run the crawler first.");
        }

        log.info("=== BUILD INDEX BEGIN === catalog={} model={} force={}", catalogPath, embedding.modelId(), force);
        boolean built = index.build(catalogPath, force);

        int size = index.size();
        boolean belowMinimum = size < minItems;
        if (belowMinimum) {
            log.warn("Only {} items in index (expected at least {})", size, minItems);
        }
        log.info("=== BUILD INDEX END === built={} items={}", built, size);

        return new BuildReport(built, size, embedding.modelId(), belowMinimum);
    }

    public Path catalogPath() {
        return catalogPath;
    }
}
