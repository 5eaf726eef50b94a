package com.fitting.eqn.error;

/**
 * Base class for every failure raised by the equation graph.
 *
 * Structural problems (unknown names, conflicting registrations, malformed
 * graphs, bad constraints or restraints) are raised immediately by the call
 * that would break an invariant. Only {@link EvaluationException} can surface
 * at evaluation time.
 */
public class EquationException extends RuntimeException {
    public EquationException(String message) {
        super(message);
    }

    public EquationException(String message, Throwable cause) {
        super(message, cause);
    }
}
