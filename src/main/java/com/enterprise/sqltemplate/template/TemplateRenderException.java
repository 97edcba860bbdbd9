package com.enterprise.sqltemplate.template;

/**
 * A template could not be parsed or evaluated (syntax error, unknown function).
 */
public class TemplateRenderException extends RuntimeException {

    private final String templateName;

    public TemplateRenderException(String templateName, String message, Throwable cause) {
        super("Failed to render template '" + templateName + "': " + message, cause);
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
