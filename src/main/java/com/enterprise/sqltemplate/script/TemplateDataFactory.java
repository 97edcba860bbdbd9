package com.enterprise.sqltemplate.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds per-render template data from request parameters.
 */
public final class TemplateDataFactory {

    private TemplateDataFactory() {}

    /**
     * Single-valued parameters become a {@code String}, multi-valued ones a
     * {@code List<String>}. Parameters without values are skipped. Returns a
     * new mutable map on every call.
     */
    public static Map<String, Object> fromQueryParameters(Map<String, List<String>> parameters) {
        Map<String, Object> data = new HashMap<>();
        if (parameters == null) {
            return data;
        }
        parameters.forEach((name, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            data.put(name, values.size() == 1 ? values.get(0) : Collections.unmodifiableList(new ArrayList<>(values)));
        });
        return data;
    }
}
