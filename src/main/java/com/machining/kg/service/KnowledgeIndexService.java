package com.machining.kg.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machining.kg.config.EmbeddingProperties;
import com.machining.kg.config.IndexProperties;
import com.machining.kg.dto.IndexStatus;
import com.machining.kg.dto.ProcessFacts;
import com.machining.kg.exception.IndexBuildException;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.graph.store.GraphStore;
import com.machining.kg.index.IndexCacheStore;
import com.machining.kg.index.KnowledgeIndex;
import com.machining.kg.index.RetrievalUnit;
import com.machining.kg.index.TextTokenizer;
import com.machining.kg.schema.FeatureCategory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds and holds the knowledge index.
 * <p>
 * The index is a derived cache of the graph: it is built on request, after a load
 * (when {@code machining.index.rebuild-after-load} is set), or lazily by the first query
 * that finds none. A load marks it stale; queries never rebuild a fresh index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeIndexService {

    private final GraphStore graphStore;
    private final EmbeddingService embeddingService;
    private final EmbeddingProperties embeddingProperties;
    private final IndexProperties indexProperties;
    private final IndexCacheStore indexCacheStore;
    private final ContentHashService contentHashService;
    private final ObjectMapper objectMapper;

    private volatile KnowledgeIndex current;
    private volatile boolean stale;
    // bumped by every load; a build only counts as fresh if no load arrived after its snapshot
    private final AtomicLong graphVersion = new AtomicLong();

    @PostConstruct
    public void loadCachedIndex() {
        indexCacheStore.load().ifPresent(index -> current = index);
    }

    /**
     * Build the index from the current graph and make it the active one.
     *
     * @throws IndexBuildException if the graph holds no Process nodes
     * @throws StoreUnavailableException if the graph cannot be read
     */
    public synchronized IndexStatus build() {
        long start = System.currentTimeMillis();
        log.info("Building knowledge index");

        long version = graphVersion.get();
        List<ProcessFacts> snapshot = graphStore.processSnapshot();
        if (snapshot.isEmpty()) {
            log.error("Knowledge index build failed: the graph has no Process nodes");
            throw new IndexBuildException("No retrieval units: the graph has no Process nodes");
        }

        KnowledgeIndex previous = current;
        KnowledgeIndex index = new KnowledgeIndex();
        for (ProcessFacts facts : snapshot) {
            addUnit(index, toUnit(facts));
        }

        int[] embeddingStats = embedUnits(index, previous);

        List<String> contentHashes = new ArrayList<>();
        index.getUnits().values().forEach(unit -> contentHashes.add(unit.getContentHash()));
        index.setContentFingerprint(contentHashService.hashTuple(contentHashes));
        index.setLexicalDigest(lexicalDigest(index));
        index.setEmbeddingModel(embeddingService.isConfigured() ? embeddingProperties.getModel() : null);
        index.setBuiltAt(Instant.now());

        current = index;
        stale = graphVersion.get() != version;
        if (stale) {
            log.info("Graph changed while the knowledge index was being built, index stays stale");
        }

        try {
            indexCacheStore.save(index);
        } catch (IOException e) {
            log.warn("Knowledge index built but not cached: {}", e.getMessage());
        }

        long duration = System.currentTimeMillis() - start;
        log.info("Knowledge index built in {} ms: {} units, {} embedded ({} reused), {} lexical-only",
                duration, index.size(), index.getEmbeddedCount(), embeddingStats[0],
                index.size() - index.getEmbeddedCount());

        IndexStatus status = status();
        status.setBuildDurationMs(duration);
        status.setReusedEmbeddings(embeddingStats[0]);
        status.setFailedEmbeddings(embeddingStats[1]);
        return status;
    }

    /**
     * The active index, building it when there is none or it is stale.
     * When the store is down a stale index is still served.
     */
    public KnowledgeIndex ensureIndex() {
        KnowledgeIndex index = current;
        if (index != null && !stale) {
            return index;
        }
        synchronized (this) {
            if (current != null && !stale) {
                return current;
            }
            try {
                build();
            } catch (StoreUnavailableException e) {
                if (current == null) {
                    throw e;
                }
                log.warn("Serving stale knowledge index, rebuild failed: {}", e.getMessage());
            }
            return current;
        }
    }

    public Optional<KnowledgeIndex> currentIndex() {
        return Optional.ofNullable(current);
    }

    public IndexStatus status() {
        KnowledgeIndex index = current;
        if (index == null) {
            return IndexStatus.builder().available(false).stale(stale).build();
        }
        return IndexStatus.builder()
                .available(true)
                .stale(stale)
                .units(index.size())
                .embeddedUnits(index.getEmbeddedCount())
                .lexicalOnlyUnits(index.size() - index.getEmbeddedCount())
                .embeddingModel(index.getEmbeddingModel())
                .lexicalDigest(index.getLexicalDigest())
                .builtAt(index.getBuiltAt())
                .build();
    }

    @EventListener
    public void onGraphContentChanged(GraphContentChangedEvent event) {
        graphVersion.incrementAndGet();
        stale = true;
        log.info("Graph content changed ({} load), knowledge index marked stale", event.getReport().getMode());
        if (!indexProperties.isRebuildAfterLoad()) {
            return;
        }
        try {
            build();
        } catch (IndexBuildException | StoreUnavailableException e) {
            log.error("Knowledge index rebuild after load failed, index stays stale: {}", e.getMessage());
        }
    }

    RetrievalUnit toUnit(ProcessFacts facts) {
        List<String> toolIds = new ArrayList<>();
        facts.getTools().forEach(tool -> toolIds.add(tool.getToolId()));

        String text = describe(facts);
        return RetrievalUnit.builder()
                .unitId(facts.getProcessKey())
                .templateId(facts.getTemplateId())
                .featureName(facts.getFeatureName())
                .featureCategory(facts.getFeatureCategory())
                .stage(facts.getStage())
                .processType(facts.getProcessType())
                .surfaceType(facts.getSurfaceType())
                .toolIds(toolIds)
                .text(text)
                .contentHash(contentHashService.generateHash(text))
                .build();
    }

    private String describe(ProcessFacts facts) {
        StringBuilder text = new StringBuilder();
        line(text, "特征名称 feature", facts.getFeatureName());
        line(text, "特征类别 category", categoryLabel(facts.getFeatureCategory()));
        line(text, "特征ID", facts.getFeatureId());
        line(text, "模板编号 template", facts.getTemplateId());
        line(text, "工艺类型 process type", facts.getProcessType());
        line(text, "工序阶段 stage", facts.getStage());
        line(text, "面类型 surface type", facts.getSurfaceType());
        line(text, "特征面", facts.getFeatureSurface());
        line(text, "组成面", facts.getComponentSurface());
        if (facts.getSidewallFeature() != null) {
            line(text, "侧壁特征 sidewall", facts.getSidewallFeature() ? "是" : "否");
        }
        if (facts.getAllowance() != null) {
            line(text, "余量 allowance", formatNumber(facts.getAllowance()) + "mm");
        }
        for (ToolNode tool : facts.getTools()) {
            line(text, "推荐刀具 tool", describeTool(tool));
        }
        return text.toString().trim();
    }

    static String describeTool(ToolNode tool) {
        StringBuilder text = new StringBuilder(tool.getToolId());
        if (tool.getName() != null) {
            text.append(' ').append(tool.getName());
        }
        if (tool.getDiameter() != null) {
            text.append(" 直径 diameter ").append(formatNumber(tool.getDiameter())).append("mm");
        }
        if (tool.getCornerRadius() != null) {
            text.append(" R角 ").append(formatNumber(tool.getCornerRadius())).append("mm");
        }
        if (tool.getFluteCount() != null) {
            text.append(' ').append(tool.getFluteCount()).append("刃 flutes");
        }
        if (tool.getStickOutLength() != null) {
            text.append(" 伸出长 ").append(formatNumber(tool.getStickOutLength())).append("mm");
        }
        return text.toString();
    }

    static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static void line(StringBuilder text, String label, String value) {
        if (value != null && !value.isBlank()) {
            text.append(label).append(": ").append(value).append('\n');
        }
    }

    private static String categoryLabel(String category) {
        if (category == null) {
            return null;
        }
        try {
            return FeatureCategory.valueOf(category).getLabel();
        } catch (IllegalArgumentException e) {
            return category;
        }
    }

    private void addUnit(KnowledgeIndex index, RetrievalUnit unit) {
        String unitId = unit.getUnitId();
        index.getUnits().put(unitId, unit);

        List<String> tokens = TextTokenizer.tokenize(unit.getText());
        index.getUnitLengths().put(unitId, tokens.size());
        for (String token : tokens) {
            index.getPostings().computeIfAbsent(token, t -> new TreeMap<>()).merge(unitId, 1, Integer::sum);
        }

        List<String> entityNames = new ArrayList<>();
        entityNames.add(unit.getFeatureName());
        entityNames.add(unit.getStage());
        entityNames.add(unit.getProcessType());
        entityNames.add(unit.getSurfaceType());
        entityNames.add(unit.getTemplateId());
        entityNames.addAll(unit.getToolIds());
        for (String name : entityNames) {
            if (name != null && name.length() >= 2) {
                index.getEntities().computeIfAbsent(name.toLowerCase(Locale.ROOT), n -> new TreeSet<>()).add(unitId);
            }
        }
    }

    /**
     * Embed every unit on a bounded pool. Results are collected per unit id in key order,
     * so the outcome does not depend on completion order. A unit whose text is unchanged
     * since the previous build reuses its embedding.
     *
     * @return {reused, failed}
     */
    private int[] embedUnits(KnowledgeIndex index, KnowledgeIndex previous) {
        if (!embeddingService.isConfigured()) {
            log.warn("Embedding service not configured, all {} units are lexical-only", index.size());
            return new int[]{0, 0};
        }

        int reused = 0;
        List<RetrievalUnit> toEmbed = new ArrayList<>();
        for (RetrievalUnit unit : index.getUnits().values()) {
            float[] cached = reusableEmbedding(previous, unit);
            if (cached != null) {
                index.getEmbeddings().put(unit.getUnitId(), cached);
                reused++;
            } else {
                toEmbed.add(unit);
            }
        }
        if (toEmbed.isEmpty()) {
            return new int[]{reused, 0};
        }

        int failed = 0;
        int concurrency = Math.max(1, embeddingProperties.getConcurrency());
        long callTimeout = Math.max(1, embeddingProperties.getTimeoutSeconds()) * 2L;
        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        try {
            SortedMap<String, CompletableFuture<float[]>> pending = new TreeMap<>();
            for (RetrievalUnit unit : toEmbed) {
                pending.put(unit.getUnitId(), CompletableFuture
                        .supplyAsync(() -> embeddingService.embed(unit.getText()), executor)
                        .orTimeout(callTimeout, TimeUnit.SECONDS));
            }
            for (Map.Entry<String, CompletableFuture<float[]>> entry : pending.entrySet()) {
                try {
                    index.getEmbeddings().put(entry.getKey(), entry.getValue().join());
                } catch (CompletionException e) {
                    failed++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Unit {} degraded to lexical-only: {}", entry.getKey(), cause.getMessage());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (failed > 0) {
            log.warn("{} of {} units could not be embedded and are lexical-only", failed, index.size());
        }
        return new int[]{reused, failed};
    }

    private float[] reusableEmbedding(KnowledgeIndex previous, RetrievalUnit unit) {
        if (previous == null || previous.getEmbeddingModel() == null
                || !previous.getEmbeddingModel().equals(embeddingProperties.getModel())) {
            return null;
        }
        RetrievalUnit old = previous.getUnits().get(unit.getUnitId());
        if (old == null || contentHashService.hasContentChanged(unit.getContentHash(), old.getContentHash())) {
            return null;
        }
        return previous.getEmbeddings().get(unit.getUnitId());
    }

    private String lexicalDigest(KnowledgeIndex index) {
        Map<String, Object> lexical = new LinkedHashMap<>();
        lexical.put("units", index.getUnits());
        lexical.put("postings", index.getPostings());
        lexical.put("unitLengths", index.getUnitLengths());
        lexical.put("entities", index.getEntities());
        try {
            return contentHashService.generateHash(objectMapper.writeValueAsString(lexical));
        } catch (JsonProcessingException e) {
            throw new IndexBuildException("Cannot serialise lexical index", e);
        }
    }
}
