package com.enterprise.sqltemplate.template;

/**
 * How a template function reports bad input.
 */
public enum FailurePolicy {

    /** Throw; the render is aborted and no SQL is produced. */
    PROPAGATE,

    /** Return an empty or zero value and let the render continue. */
    DEGRADE
}
