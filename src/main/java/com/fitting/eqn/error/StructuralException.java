package com.fitting.eqn.error;

import java.util.List;

/**
 * Aggregates the messages reported by the Validator for a single graph.
 */
public class StructuralException extends EquationException {
    private final List<String> errors;

    public StructuralException(String subject, List<String> errors) {
        super("Errors found in equation '" + subject + "'\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
