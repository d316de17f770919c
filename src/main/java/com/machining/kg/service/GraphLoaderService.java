package com.machining.kg.service;

import com.machining.kg.config.LoaderProperties;
import com.machining.kg.dto.LoadMode;
import com.machining.kg.dto.LoadReport;
import com.machining.kg.dto.SourceFiles;
import com.machining.kg.dto.TableLoadStats;
import com.machining.kg.dto.WriteCounts;
import com.machining.kg.exception.SchemaViolationException;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.graph.store.GraphStore;
import com.machining.kg.schema.SchemaMapper;
import com.machining.kg.schema.SourceRow;
import com.machining.kg.schema.SourceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads the process and tool tables into the graph.
 * <p>
 * Tables are read sequentially (processes first, so tool recommendations can link to them).
 * Rows are mapped one at a time and written in batches; each batch is its own transaction,
 * so batches committed before a store failure survive it while the in-flight batch rolls back.
 * Rows that fail schema mapping are skipped and counted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphLoaderService {

    private final GraphStore graphStore;
    private final SchemaMapper schemaMapper;
    private final CsvSourceReader csvSourceReader;
    private final LoaderProperties loaderProperties;
    private final ResourceLoader resourceLoader;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Load the tables configured under {@code machining.loader}.
     */
    public LoadReport loadConfiguredSources(LoadMode mode) {
        SourceFiles sources = SourceFiles.builder()
                .processes(resourceLoader.getResource(loaderProperties.getProcessesFile()))
                .tools(resourceLoader.getResource(loaderProperties.getToolsFile()))
                .build();
        return load(sources, mode);
    }

    /**
     * Load source tables into the graph.
     *
     * @param sources tables to read; a null table is skipped
     * @param mode FULL_REBUILD deletes managed nodes first, INCREMENTAL only upserts
     * @return counts of rows, batches and store writes
     * @throws StoreUnavailableException if the store is lost; earlier batches stay committed
     */
    public synchronized LoadReport load(SourceFiles sources, LoadMode mode) {
        LoadReport report = new LoadReport(mode);
        log.info("Starting {} graph load (batch size {})", mode, loaderProperties.getBatchSize());

        try {
            graphStore.verifyConnectivity();

            if (mode == LoadMode.FULL_REBUILD) {
                WriteCounts deleted = graphStore.deleteManagedGraph();
                report.getWrites().add(deleted);
                log.info("Full rebuild: deleted {} nodes and {} relationships",
                        deleted.getNodesDeleted(), deleted.getRelationshipsDeleted());
            }

            if (sources.getProcesses() != null) {
                loadTable(SourceTable.PROCESSES, sources.getProcesses(), report,
                        schemaMapper::mapProcess, graphStore::upsertProcesses);
            }
            if (sources.getTools() != null) {
                loadTable(SourceTable.TOOLS, sources.getTools(), report,
                        schemaMapper::mapTool, graphStore::upsertTools);
            }

            graphStore.ensureIndexes();
        } catch (StoreUnavailableException e) {
            report.setStatus(LoadReport.Status.ABORTED);
            report.setError(e.getMessage());
            finish(report);
            log.error("Graph load aborted after {} committed rows: {}", report.getRowsWritten(), e.getMessage());
            throw new StoreUnavailableException("Graph load aborted: " + e.getMessage(), abortContext(report), e);
        }

        finish(report);
        log.info("Graph load finished in {} ms: {} rows written, {} rows skipped, {} nodes / {} relationships created",
                report.getDurationMs(), report.getRowsWritten(), report.getRowsSkipped(),
                report.getWrites().getNodesCreated(), report.getWrites().getRelationshipsCreated());
        return report;
    }

    private <R> void loadTable(SourceTable table,
                               Resource resource,
                               LoadReport report,
                               Function<SourceRow, R> mapper,
                               Function<List<R>, WriteCounts> writer) {
        TableLoadStats stats = report.table(table.tableName());
        List<R> batch = new ArrayList<>(loaderProperties.getBatchSize());

        try {
            csvSourceReader.read(table, resource, new CsvSourceReader.RowVisitor() {
                @Override
                public void row(SourceRow row) {
                    stats.setRowsRead(stats.getRowsRead() + 1);
                    R mapped;
                    try {
                        mapped = mapper.apply(row);
                    } catch (SchemaViolationException e) {
                        skip(report, stats, e);
                        return;
                    }
                    batch.add(mapped);
                    if (batch.size() >= loaderProperties.getBatchSize()) {
                        flush(table, batch, stats, report, writer);
                    }
                }

                @Override
                public void malformed(SchemaViolationException violation) {
                    stats.setRowsRead(stats.getRowsRead() + 1);
                    skip(report, stats, violation);
                }
            });
        } catch (SchemaViolationException e) {
            // header problem: the whole table is unusable, the other table may still load
            log.error("Rejected {} table: {}", table.tableName(), e.getMessage());
            stats.setFailure(e.getMessage());
            recordViolation(report, e);
            return;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + table.tableName() + " source "
                    + resource.getDescription() + ": " + e.getMessage(), e);
        }

        flush(table, batch, stats, report, writer);
        log.info("Loaded {} table: {} rows read, {} written, {} skipped in {} batches",
                table.tableName(), stats.getRowsRead(), stats.getRowsWritten(), stats.getRowsSkipped(),
                stats.getBatchesCommitted());
    }

    private <R> void flush(SourceTable table,
                           List<R> batch,
                           TableLoadStats stats,
                           LoadReport report,
                           Function<List<R>, WriteCounts> writer) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            WriteCounts counts = writer.apply(batch);
            report.getWrites().add(counts);
            stats.setRowsWritten(stats.getRowsWritten() + batch.size());
            stats.setBatchesCommitted(stats.getBatchesCommitted() + 1);
            log.debug("Committed {} batch #{} ({} rows, {} nodes created)", table.tableName(),
                    stats.getBatchesCommitted(), batch.size(), counts.getNodesCreated());
        } catch (StoreUnavailableException e) {
            log.warn("Rolled back in-flight {} batch of {} rows", table.tableName(), batch.size());
            throw e;
        } finally {
            batch.clear();
        }
    }

    private void skip(LoadReport report, TableLoadStats stats, SchemaViolationException violation) {
        stats.setRowsSkipped(stats.getRowsSkipped() + 1);
        log.warn("Skipping row: {}", violation.getMessage());
        recordViolation(report, violation);
    }

    private void recordViolation(LoadReport report, SchemaViolationException violation) {
        report.setViolationCount(report.getViolationCount() + 1);
        if (report.getViolations().size() < loaderProperties.getMaxReportedViolations()) {
            report.getViolations().add(violation.getMessage());
        }
    }

    private void finish(LoadReport report) {
        report.setDurationMs(Duration.between(report.getStartedAt(), Instant.now()).toMillis());
        if (report.getWrites().containsUpdates()) {
            eventPublisher.publishEvent(new GraphContentChangedEvent(this, report));
        }
    }

    private Map<String, Object> abortContext(LoadReport report) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("mode", report.getMode().name());
        context.put("rowsWritten", report.getRowsWritten());
        context.put("rowsSkipped", report.getRowsSkipped());
        report.getTables().forEach((table, stats) ->
                context.put(table + ".batchesCommitted", stats.getBatchesCommitted()));
        return context;
    }
}
