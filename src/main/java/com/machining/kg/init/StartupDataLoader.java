package com.machining.kg.init;

import com.machining.kg.config.LoaderProperties;
import com.machining.kg.dto.LoadReport;
import com.machining.kg.exception.IndexBuildException;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.service.GraphLoaderService;
import com.machining.kg.service.KnowledgeIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads the configured source tables and builds the index when the application starts.
 * Only active with {@code machining.loader.load-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "machining.loader", name = "load-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StartupDataLoader implements CommandLineRunner {

    private final GraphLoaderService graphLoaderService;
    private final KnowledgeIndexService knowledgeIndexService;
    private final LoaderProperties loaderProperties;

    @Override
    public void run(String... args) {
        log.info("Loading knowledge graph on startup ({})", loaderProperties.getStartupMode());
        try {
            LoadReport report = graphLoaderService.loadConfiguredSources(loaderProperties.getStartupMode());
            log.info("Startup load: {} rows written, {} rows skipped", report.getRowsWritten(), report.getRowsSkipped());
        } catch (StoreUnavailableException e) {
            log.error("Startup load aborted, graph store unavailable: {}", e.getMessage());
            return;
        }

        if (knowledgeIndexService.status().isAvailable() && !knowledgeIndexService.status().isStale()) {
            log.info("Knowledge index already up to date, skipping startup build");
            return;
        }
        try {
            knowledgeIndexService.build();
        } catch (IndexBuildException | StoreUnavailableException e) {
            log.error("Startup index build failed: {}", e.getMessage());
        }
    }
}
