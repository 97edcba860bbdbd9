package com.enterprise.sqltemplate.template;

import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.spel.support.ReflectiveMethodResolver;

import java.util.List;

/**
 * Resolves only the {@link TemplateFunction} names, and only on the
 * registry. Calls to anything else fail with "method not found".
 */
class RegisteredFunctionResolver extends ReflectiveMethodResolver {

    @Override
    public MethodExecutor resolve(EvaluationContext context, Object targetObject, String name,
                                  List<TypeDescriptor> argumentTypes) throws AccessException {
        if (!(targetObject instanceof TemplateFunctionRegistry)
                || TemplateFunction.byName(name).isEmpty()) {
            return null;
        }
        return super.resolve(context, targetObject, name, argumentTypes);
    }
}
