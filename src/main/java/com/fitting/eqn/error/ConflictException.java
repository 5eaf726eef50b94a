package com.fitting.eqn.error;

/**
 * A name is already bound to a different object, or cannot be bound at all.
 */
public class ConflictException extends EquationException {
    public ConflictException(String message) {
        super(message);
    }
}
