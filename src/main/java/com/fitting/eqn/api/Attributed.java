package com.fitting.eqn.api;

/**
 * An external object whose state can be addressed by attribute key.
 * Used by ParameterWrapper's attribute form.
 */
public interface Attributed {
    Object getAttribute(String key);

    void setAttribute(String key, Object value);
}
