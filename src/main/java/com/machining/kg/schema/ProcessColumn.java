package com.machining.kg.schema;

import java.util.List;

public enum ProcessColumn implements SourceColumn {

    TEMPLATE_ID(true, "模板编号", "template_id", "templateid"),
    FEATURE_ID(true, "特征ID", "feature_id", "featureid"),
    FEATURE_NAME(true, "特征名称", "feature_name", "featurename"),
    COMPONENT_SURFACE(false, "组成面", "component_surface"),
    FEATURE_SURFACE(false, "特征面", "feature_surface"),
    SURFACE_TYPE(false, "面类型", "surface_type"),
    SIDEWALL_FEATURE(false, "侧壁特征", "sidewall_feature"),
    ALLOWANCE(false, "余量", "allowance"),
    PROCESS_STAGE(true, "工序阶段", "process_stage", "stage"),
    PROCESS_TYPE(true, "工艺类型", "process_type");

    private final boolean required;
    private final List<String> headerNames;

    ProcessColumn(boolean required, String... headerNames) {
        this.required = required;
        this.headerNames = List.of(headerNames);
    }

    @Override
    public List<String> headerNames() {
        return headerNames;
    }

    @Override
    public boolean isRequired() {
        return required;
    }
}
