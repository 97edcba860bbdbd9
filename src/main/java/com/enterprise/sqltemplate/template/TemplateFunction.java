package com.enterprise.sqltemplate.template;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Functions a SQL template may call, under the names templates use, each
 * with its declared failure policy. Anything not listed here cannot be
 * invoked from a template.
 */
public enum TemplateFunction {

    IS_SET("isSet", FailurePolicy.DEGRADE),
    DEFAULT_OR_VALUE("defaultOrValue", FailurePolicy.DEGRADE),
    IN_FORMAT("inFormat", FailurePolicy.DEGRADE),
    UN_ESCAPE("unEscape", FailurePolicy.DEGRADE),
    SPLIT("split", FailurePolicy.DEGRADE),
    LIMIT_OFFSET("limitOffset", FailurePolicy.DEGRADE),
    SQL_VAL("sqlVal", FailurePolicy.DEGRADE),
    SQL_LIST("sqlList", FailurePolicy.DEGRADE),
    IDENT("ident", FailurePolicy.PROPAGATE);

    private static final Map<String, TemplateFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(TemplateFunction::functionName, Function.identity()));

    private final String functionName;
    private final FailurePolicy failurePolicy;

    TemplateFunction(String functionName, FailurePolicy failurePolicy) {
        this.functionName = functionName;
        this.failurePolicy = failurePolicy;
    }

    public String functionName() {
        return functionName;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public static Optional<TemplateFunction> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
