package org.learningjava.assessrec.config;

import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.usecase.BuildIndexUseCase;
import org.learningjava.assessrec.domain.error.IndexNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Optionally builds, then loads the index once at process start.
 * A missing index is logged, not fatal; {@code /health} answers 503 until it is built.
 */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final CatalogIndexPort index;
    private final BuildIndexUseCase buildIndex;

    @Value("${assessrec.index.build-on-startup:false}")
    private boolean buildOnStartup;
    @Value("${assessrec.index.load-on-startup:true}")
    private boolean loadOnStartup;

    public StartupTasks(CatalogIndexPort index, BuildIndexUseCase buildIndex) {
        this.index = index;
        this.buildIndex = buildIndex;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== StartupTasks BEGIN ===");

        if (buildOnStartup) {
            try {
                var report = buildIndex.build(false);
                log.info("Startup build: built={} items={}", report.built(), report.itemCount());
            } catch (RuntimeException e) {
                log.error("Startup index build failed", e);
            }
        }

        if (loadOnStartup) {
            try {
                index.load();
                log.info("Engine loaded: {} items", index.size());
            } catch (IndexNotFoundException e) {
                log.error("{} Build it with POST /index/build or assessrec.index.build-on-startup=true", e.getMessage());
            }
        }

        log.info("=== StartupTasks END ===");
    }
}
