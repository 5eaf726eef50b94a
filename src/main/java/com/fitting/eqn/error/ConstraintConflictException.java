package com.fitting.eqn.error;

/**
 * Constraining a constant, already constrained or self-referencing parameter,
 * or writing directly to a constrained one.
 */
public class ConstraintConflictException extends ConflictException {
    public ConstraintConflictException(String message) {
        super(message);
    }
}
