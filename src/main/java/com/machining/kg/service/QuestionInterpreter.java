package com.machining.kg.service;

import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.dto.GraphFact;
import com.machining.kg.dto.StructuredQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises graph entities, dimensions and intents in a natural-language question.
 * Entity names come from the graph itself, so any feature, stage or tool id that was
 * loaded can be matched; colloquial feature names go through the configured aliases.
 */
@Component
@RequiredArgsConstructor
public class QuestionInterpreter {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";
    private static final String SEPARATOR = "\\s*(?:是|为|=|:|of|is)?\\s*";
    private static final String UNIT = "\\s*(?:mm|毫米)?";

    private static final Pattern DIAMETER = dimension("直径|diameter|dia\\.?|φ|ø");
    private static final Pattern DIAMETER_SUFFIX = Pattern.compile(NUMBER + "\\s*(?:mm|毫米)\\s*(?:的)?\\s*(?:直径|diameter)");
    private static final Pattern LENGTH = dimension("长度|length");
    private static final Pattern WIDTH = dimension("宽度|width");
    private static final Pattern HEIGHT = dimension("高度|height");
    private static final Pattern DEPTH = dimension("深度|depth");

    private static final Pattern FEATURE_CATALOG = Pattern.compile(
            "(?:特征|feature)s?\\s*(?:类型|种类|类别|列表|名称|types?|kinds?|list|names?)"
                    + "|(?:哪些|所有|全部|all|which|list)\\s*(?:的)?\\s*(?:特征|features?)"
                    + "|(?:特征|features?).{0,6}(?:有哪些|都有什么|有什么)");

    private static final Pattern TOOL_KEYWORDS = Pattern.compile("刀具|铣刀|钻头|刀|tools?|cutters?");
    private static final Pattern RECOMMEND_KEYWORDS = Pattern.compile(
            "推荐|建议|怎么加工|如何加工|加工方案|工艺方案|recommend|suggest");

    private static final List<String> DEFAULT_STAGES = List.of("粗加工", "半精加工", "精加工", "清根");

    private static final Map<String, String> SURFACES = new LinkedHashMap<>();

    static {
        SURFACES.put("垂直面", "垂直面");
        SURFACES.put("圆柱面", "圆柱面");
        SURFACES.put("平面", "平面");
        SURFACES.put("锥面", "锥面");
        SURFACES.put("vertical", "垂直面");
        SURFACES.put("cylindrical", "圆柱面");
        SURFACES.put("conical", "锥面");
        SURFACES.put("plane", "平面");
        SURFACES.put("flat", "平面");
    }

    private final RetrievalProperties retrievalProperties;

    /**
     * Entity names known to the graph.
     */
    public record Vocabulary(List<String> featureNames, List<String> stageNames, List<String> toolIds) {
    }

    public StructuredQuery interpret(String question, Vocabulary vocabulary) {
        String text = Normalizer.normalize(question == null ? "" : question, Normalizer.Form.NFKC)
                .toLowerCase(Locale.ROOT);

        StructuredQuery query = StructuredQuery.builder().build();
        query.setFeatureName(matchFeature(text, vocabulary.featureNames()));
        query.setToolId(longestContained(text, vocabulary.toolIds()));

        List<String> stages = new ArrayList<>(DEFAULT_STAGES);
        vocabulary.stageNames().stream().filter(s -> !stages.contains(s)).forEach(stages::add);
        query.setStage(longestContained(text, stages));
        query.setSurface(matchSurface(text));

        Double diameter = firstNumber(text, DIAMETER);
        query.setDiameter(diameter != null ? diameter : firstNumber(text, DIAMETER_SUFFIX));
        query.setLength(firstNumber(text, LENGTH));
        query.setWidth(firstNumber(text, WIDTH));
        Double depth = firstNumber(text, DEPTH);
        Double height = firstNumber(text, HEIGHT);
        query.setHeight(depth != null ? depth : height);
        query.setToolQuestion(TOOL_KEYWORDS.matcher(text).find());

        Set<GraphFact.Kind> intents = query.getIntents();
        if (FEATURE_CATALOG.matcher(text).find()) {
            intents.add(GraphFact.Kind.FEATURE_CATALOG);
        }
        if (query.getToolId() != null) {
            intents.add(GraphFact.Kind.TOOL_DETAILS);
        }
        if (query.getFeatureName() != null) {
            intents.add(GraphFact.Kind.PROCESSES_FOR_FEATURE);
            if (query.isToolQuestion()) {
                intents.add(GraphFact.Kind.TOOLS_FOR_FEATURE);
            }
            if (hasDimensions(query) || RECOMMEND_KEYWORDS.matcher(text).find()) {
                inferDimensions(query);
                intents.add(GraphFact.Kind.MACHINING_RECOMMENDATION);
            }
        } else if (query.getDiameter() != null) {
            intents.add(GraphFact.Kind.TOOLS_BY_DIAMETER);
        }
        return query;
    }

    /**
     * A hole of diameter d is a d x d pocket; without a depth the tool must reach 2d.
     */
    private void inferDimensions(StructuredQuery query) {
        Double diameter = query.getDiameter();
        if (diameter == null) {
            return;
        }
        if (query.getLength() == null) {
            query.setLength(diameter);
        }
        if (query.getWidth() == null) {
            query.setWidth(diameter);
        }
        if (query.getHeight() == null) {
            query.setHeight(diameter * 2);
        }
    }

    private boolean hasDimensions(StructuredQuery query) {
        return query.getDiameter() != null || query.getLength() != null
                || query.getWidth() != null || query.getHeight() != null;
    }

    private String matchFeature(String text, List<String> featureNames) {
        String feature = longestContained(text, featureNames);
        if (feature != null) {
            return feature;
        }
        List<Map.Entry<String, String>> aliases = new ArrayList<>(retrievalProperties.getFeatureAliases().entrySet());
        aliases.sort(Comparator.comparing((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
                .thenComparing(Map.Entry::getKey));
        for (Map.Entry<String, String> alias : aliases) {
            if (text.contains(alias.getKey().toLowerCase(Locale.ROOT))) {
                return alias.getValue();
            }
        }
        return null;
    }

    private String matchSurface(String text) {
        for (Map.Entry<String, String> surface : SURFACES.entrySet()) {
            if (text.contains(surface.getKey())) {
                return surface.getValue();
            }
        }
        return null;
    }

    /**
     * The longest candidate occurring in the text, compared case-insensitively.
     */
    static String longestContained(String text, List<String> candidates) {
        String best = null;
        for (String candidate : new LinkedHashSet<>(candidates)) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            if (text.contains(candidate.toLowerCase(Locale.ROOT))
                    && (best == null || candidate.length() > best.length())) {
                best = candidate;
            }
        }
        return best;
    }

    private static Double firstNumber(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Double.parseDouble(matcher.group(1));
        }
        return null;
    }

    private static Pattern dimension(String keywords) {
        return Pattern.compile("(?:" + keywords + ")" + SEPARATOR + NUMBER + UNIT);
    }
}
