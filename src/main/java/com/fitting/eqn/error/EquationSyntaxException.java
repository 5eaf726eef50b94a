package com.fitting.eqn.error;

/**
 * Malformed equation text.
 */
public class EquationSyntaxException extends EquationException {
    private final int position;

    public EquationSyntaxException(String message, String text, int position) {
        super(message + " at position " + position + " in '" + text + "'");
        this.position = position;
    }

    public int position() {
        return position;
    }
}
