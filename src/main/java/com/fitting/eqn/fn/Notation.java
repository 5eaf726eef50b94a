package com.fitting.eqn.fn;

/** How an operator is rendered back to text. */
public enum Notation {
    /** {@code a + b} */
    INFIX,
    /** {@code -a} */
    PREFIX,
    /** {@code name(a, b, kw=c)} */
    CALL
}
