package com.enterprise.sqltemplate.template;

import com.enterprise.sqltemplate.ident.InvalidIdentifierException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ParserContext;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;

/**
 * Renders SQL templates written with {@code {{ ... }}} blocks, e.g.
 * <pre>{@code
 * SELECT * FROM {{ ident('table') }}
 * WHERE id = {{ sqlVal('id') }}
 * {{ isSet('status') ? 'AND status IN ' + sqlList('status') : '' }}
 * {{ limitOffset(defaultOrValue('page', '1'), defaultOrValue('size', '10')) }}
 * }</pre>
 *
 * <p>Each block is a SpEL expression evaluated against a fresh
 * {@link TemplateFunctionRegistry}. Only the functions in
 * {@link TemplateFunction} resolve; type references, constructors and bean
 * references are not available. Blocks are evaluated left to right, so
 * placeholder ordinals follow text order. The result records where each
 * bound placeholder sits; nothing is re-derived from the SQL text later.</p>
 *
 * <p>The renderer itself is stateless and may be shared.</p>
 */
public class SqlTemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(SqlTemplateRenderer.class);

    private static final ParserContext DELIMITERS = new TemplateParserContext("{{", "}}");

    private final SpelExpressionParser parser = new SpelExpressionParser();

    public RenderedSql render(String template, Map<String, Object> templateData) {
        return render("inline", template, templateData);
    }

    /**
     * Renders {@code template} against {@code templateData}. The map is handed
     * to the registry as-is and may gain entries through {@code defaultOrValue}.
     *
     * @param templateName used in log and error messages only
     * @throws InvalidIdentifierException if {@code ident} rejects a value
     * @throws TemplateRenderException    on template syntax errors or calls to unknown functions
     */
    public RenderedSql render(String templateName, String template, Map<String, Object> templateData) {
        ArgumentList arguments = ArgumentList.tracked();
        TemplateFunctionRegistry registry = TemplateFunctionRegistry.forRender(templateData, arguments);
        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                .withMethodResolvers(new RegisteredFunctionResolver())
                .withRootObject(registry)
                .build();
        String sql;
        try {
            Expression expression = parser.parseExpression(template, DELIMITERS);
            sql = expression.getValue(context, String.class);
        } catch (ExpressionException e) {
            InvalidIdentifierException invalid = findInvalidIdentifier(e);
            if (invalid != null) {
                throw invalid;
            }
            throw new TemplateRenderException(templateName, e.getMessage(), e);
        }
        RenderedSql rendered = arguments.resolve(sql == null ? "" : sql);
        log.debug("Rendered template '{}' with {} bound argument(s)", templateName, rendered.arguments().size());
        return rendered;
    }

    // SpEL normally rethrows runtime exceptions from invoked methods unchanged; unwrap in case it did not
    private static InvalidIdentifierException findInvalidIdentifier(Throwable t) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (cause instanceof InvalidIdentifierException invalid) {
                return invalid;
            }
        }
        return null;
    }
}
