package com.enterprise.sqltemplate.script;

import com.enterprise.sqltemplate.template.RenderedSql;
import com.enterprise.sqltemplate.template.SqlTemplateRenderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a script template for a request and renders it with the request's
 * parameters. Every call gets its own template data and registry.
 */
public class SqlScriptService {

    private static final Logger log = LoggerFactory.getLogger(SqlScriptService.class);

    private final ScriptTemplateLoader loader;
    private final SqlTemplateRenderer renderer;

    public SqlScriptService(ScriptTemplateLoader loader, SqlTemplateRenderer renderer) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public RenderedSql render(String folder, String script, String httpMethod,
                              Map<String, List<String>> parameters) {
        return render(folder, script, ScriptType.fromHttpMethod(httpMethod), parameters);
    }

    public RenderedSql render(String folder, String script, ScriptType type,
                              Map<String, List<String>> parameters) {
        String template = loader.load(folder, script, type);
        String name = folder + "/" + type.fileName(script);
        log.debug("Rendering script {}", name);
        RenderedSql rendered = renderer.render(name, template, TemplateDataFactory.fromQueryParameters(parameters));
        rendered.verify();
        return rendered;
    }
}
