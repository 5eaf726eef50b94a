package com.fitting.eqn.error;

/** A restraint was requested with an unusable sigma. */
public class RestraintDomainException extends EquationException {
    public RestraintDomainException(String message) {
        super(message);
    }
}
