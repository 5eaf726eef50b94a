package com.fitting.eqn.error;

import java.util.List;

/**
 * An identifier in an equation could not be resolved through the registry or
 * the namespace supplied with the build.
 */
public class NameResolutionException extends EquationException {
    private final List<String> names;

    public NameResolutionException(String expression, List<String> names) {
        super("Unresolved name(s) in '" + expression + "': " + String.join(", ", names));
        this.names = List.copyOf(names);
    }

    /** The unresolved identifiers, in order of first appearance. */
    public List<String> names() {
        return names;
    }
}
