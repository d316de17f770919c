package com.machining.kg.schema;

import com.machining.kg.dto.ProcessRecord;
import com.machining.kg.dto.ToolRecord;
import com.machining.kg.exception.SchemaViolationException;
import com.machining.kg.service.ContentHashService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps source rows to the typed nodes and edges they imply.
 * No I/O: the result depends only on the row.
 */
@Component
@RequiredArgsConstructor
public class SchemaMapper {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TEMPLATE_LIST_SEPARATOR = Pattern.compile("[;|、,]");
    private static final Pattern MM_SUFFIX = Pattern.compile("(?i)\\s*mm$");

    private static final Set<String> TRUE_FLAGS = Set.of("是", "有", "y", "yes", "true", "1");
    private static final Set<String> FALSE_FLAGS = Set.of("否", "无", "n", "no", "false", "0");

    private final ContentHashService contentHashService;

    public ProcessRecord mapProcess(SourceRow row) {
        requireTable(row, SourceTable.PROCESSES);

        String templateId = required(row, ProcessColumn.TEMPLATE_ID);
        String featureId = required(row, ProcessColumn.FEATURE_ID);
        String featureName = required(row, ProcessColumn.FEATURE_NAME);
        String stage = required(row, ProcessColumn.PROCESS_STAGE);
        String processType = required(row, ProcessColumn.PROCESS_TYPE);

        return ProcessRecord.builder()
                .rowNumber(row.getRowNumber())
                .processKey(processKey(templateId, featureId))
                .templateId(templateId)
                .featureId(featureId)
                .componentSurface(optional(row, ProcessColumn.COMPONENT_SURFACE))
                .featureSurface(optional(row, ProcessColumn.FEATURE_SURFACE))
                .surfaceType(optional(row, ProcessColumn.SURFACE_TYPE))
                .sidewallFeature(flag(row, ProcessColumn.SIDEWALL_FEATURE))
                .allowance(optionalNumber(row, ProcessColumn.ALLOWANCE))
                .featureKey(featureKey(featureName))
                .featureName(featureName)
                .featureCategory(FeatureCategory.fromFeatureName(featureName).name())
                .stage(stage)
                .processType(processType)
                .build();
    }

    public ToolRecord mapTool(SourceRow row) {
        requireTable(row, SourceTable.TOOLS);

        String toolId = required(row, ToolColumn.TOOL_ID);
        String name = required(row, ToolColumn.TOOL_NAME);

        double diameter = requiredNumber(row, ToolColumn.DIAMETER);
        if (diameter <= 0) {
            throw violation(row, ToolColumn.DIAMETER, "must be greater than 0 but was " + diameter);
        }
        Double cornerRadius = optionalNumber(row, ToolColumn.CORNER_RADIUS);
        if (cornerRadius != null && cornerRadius < 0) {
            throw violation(row, ToolColumn.CORNER_RADIUS, "must not be negative but was " + cornerRadius);
        }
        double stickOut = requiredNumber(row, ToolColumn.STICK_OUT_LENGTH);
        if (stickOut <= 0) {
            throw violation(row, ToolColumn.STICK_OUT_LENGTH, "must be greater than 0 but was " + stickOut);
        }

        return ToolRecord.builder()
                .rowNumber(row.getRowNumber())
                .toolId(toolId)
                .name(name)
                .diameter(diameter)
                .cornerRadius(cornerRadius == null ? 0.0 : cornerRadius)
                .fluteCount(fluteCount(row))
                .stickOutLength(stickOut)
                .recommendedTemplateIds(templateIds(row))
                .build();
    }

    public String featureKey(String featureName) {
        return contentHashService.hashTuple(List.of("Feature", normalize(featureName)));
    }

    public String processKey(String templateId, String featureId) {
        return contentHashService.hashTuple(List.of("Process", normalize(templateId), normalize(featureId)));
    }

    /**
     * NFKC-normalise, trim and collapse inner whitespace. Blank becomes null.
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFKC);
        normalized = WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
        return normalized.isEmpty() ? null : normalized;
    }

    private void requireTable(SourceRow row, SourceTable expected) {
        if (row.getTable() != expected) {
            throw new IllegalArgumentException("Expected a " + expected.tableName()
                    + " row but got " + row.getTable().tableName());
        }
    }

    private String required(SourceRow row, SourceColumn column) {
        String value = normalize(row.get(column));
        if (value == null) {
            throw violation(row, column, "is required but was blank");
        }
        return value;
    }

    private String optional(SourceRow row, SourceColumn column) {
        return normalize(row.get(column));
    }

    private double requiredNumber(SourceRow row, SourceColumn column) {
        Double value = optionalNumber(row, column);
        if (value == null) {
            throw violation(row, column, "is required but was blank");
        }
        return value;
    }

    private Double optionalNumber(SourceRow row, SourceColumn column) {
        String value = normalize(row.get(column));
        if (value == null) {
            return null;
        }
        try {
            double number = Double.parseDouble(MM_SUFFIX.matcher(value).replaceAll(""));
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw violation(row, column, "is not a finite number: '" + value + "'");
            }
            return number;
        } catch (NumberFormatException e) {
            throw violation(row, column, "is not a number: '" + value + "'");
        }
    }

    private int fluteCount(SourceRow row) {
        double value = requiredNumber(row, ToolColumn.FLUTE_COUNT);
        if (value != Math.rint(value) || value < 1) {
            throw violation(row, ToolColumn.FLUTE_COUNT, "must be a positive integer but was " + value);
        }
        return (int) value;
    }

    private boolean flag(SourceRow row, SourceColumn column) {
        String value = normalize(row.get(column));
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (TRUE_FLAGS.contains(lower)) {
            return true;
        }
        if (FALSE_FLAGS.contains(lower)) {
            return false;
        }
        throw violation(row, column, "is not a yes/no flag: '" + value + "'");
    }

    private List<String> templateIds(SourceRow row) {
        String value = normalize(row.get(ToolColumn.RECOMMENDED_TEMPLATES));
        List<String> ids = new ArrayList<>();
        if (value == null) {
            return ids;
        }
        for (String part : TEMPLATE_LIST_SEPARATOR.split(value)) {
            String id = normalize(part);
            if (id != null && !ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private SchemaViolationException violation(SourceRow row, SourceColumn column, String problem) {
        String table = row.getTable().tableName();
        return new SchemaViolationException(table, row.getRowNumber(), column.canonicalName(),
                String.format("%s row %d: column '%s' %s", table, row.getRowNumber(), column.canonicalName(), problem));
    }
}
