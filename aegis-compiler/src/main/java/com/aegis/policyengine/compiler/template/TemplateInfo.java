package com.aegis.policyengine.compiler.template;

import com.aegis.policyengine.api.model.FieldPath;

import java.util.List;

/**
 * Summary of extracted templates, for diagnostics and tracing attributes.
 */
public record TemplateInfo(int pathCount, List<FieldPath> paths, int totalConstraints) {

    public TemplateInfo {
        paths = List.copyOf(paths);
    }
}
