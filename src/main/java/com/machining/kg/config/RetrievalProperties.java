package com.machining.kg.config;

import com.machining.kg.resolver.RetrievalMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "machining.retrieval")
public class RetrievalProperties {

    private RetrievalMode defaultMode = RetrievalMode.HYBRID;
    private int topK = 6;

    /**
     * Hybrid score = lexicalWeight * normalised BM25 + semanticWeight * cosine similarity + entity bonus
     */
    private double lexicalWeight = 0.4;
    private double semanticWeight = 0.6;

    /**
     * Added to the hybrid score of units linked to an entity named in the question
     */
    private double entityWeight = 0.2;

    /**
     * Units below this cosine similarity are not semantic candidates
     */
    private double minSimilarity = 0.2;

    /**
     * Upper bound on the items listed in one graph fact
     */
    private int maxFactItems = 50;

    private String staticFallbackMessage = "抱歉，查询系统暂时不可用。";
    private String noKnowledgeMessage = "未在知识库中找到相关信息。";

    /**
     * Colloquial feature names mapped to the names used in the process table
     */
    private Map<String, String> featureAliases = new LinkedHashMap<>(Map.of(
            "圆形通孔", "圆柱通孔",
            "圆孔", "圆柱通孔",
            "矩形孔", "矩形通孔",
            "方孔", "矩形通孔",
            "圆台", "圆柱凸台",
            "矩形槽", "矩形凹槽",
            "方槽", "矩形凹槽",
            "凹槽", "矩形凹槽"));
}
