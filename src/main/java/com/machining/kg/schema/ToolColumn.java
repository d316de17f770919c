package com.machining.kg.schema;

import java.util.List;

public enum ToolColumn implements SourceColumn {

    TOOL_ID(true, "刀具id", "tool_id", "toolid"),
    TOOL_NAME(true, "刀具名称", "tool_name", "toolname"),
    DIAMETER(true, "直径", "diameter"),
    CORNER_RADIUS(false, "R角", "corner_radius", "r_angle"),
    FLUTE_COUNT(true, "刃数", "flute_count", "flutes"),
    STICK_OUT_LENGTH(true, "伸出长", "stick_out_length", "extension_length"),
    RECOMMENDED_TEMPLATES(false, "适用模板", "recommended_templates");

    private final boolean required;
    private final List<String> headerNames;

    ToolColumn(boolean required, String... headerNames) {
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
