package com.machining.kg.schema;

import java.util.List;
import java.util.Locale;

/**
 * Geometric category of a machining feature, derived from its name.
 * Categories are checked in declaration order, so "螺纹孔" is a hole.
 */
public enum FeatureCategory {

    HOLE("孔特征", List.of("孔", "hole", "bore")),
    SLOT("槽特征", List.of("槽", "slot", "groove", "pocket")),
    FACE("面特征", List.of("台", "面", "face", "boss", "step")),
    THREAD("螺纹特征", List.of("螺纹", "thread")),
    CHAMFER("倒角特征", List.of("倒角", "chamfer")),
    CONTOUR("轮廓特征", List.of());

    private final String label;
    private final List<String> keywords;

    FeatureCategory(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    public String getLabel() {
        return label;
    }

    public static FeatureCategory fromFeatureName(String featureName) {
        if (featureName == null) {
            return CONTOUR;
        }
        String name = featureName.toLowerCase(Locale.ROOT);
        for (FeatureCategory category : values()) {
            for (String keyword : category.keywords) {
                if (name.contains(keyword)) {
                    return category;
                }
            }
        }
        return CONTOUR;
    }
}
