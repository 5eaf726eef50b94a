package com.fitting.eqn.dsl;

import java.util.List;
import java.util.Map;

/**
 * Parsed form of equation text, before any name is resolved.
 *
 * Keeping this step separate from graph construction lets the factory reject
 * an equation (unknown names, wrong arity) before a single node exists.
 */
public sealed interface Syntax {

    /** Numeric literal. */
    record Constant(double value) implements Syntax {
    }

    /** Identifier referring to an argument. */
    record Name(String id, int position) implements Syntax {
    }

    /** {@code -x}; a leading {@code +} is dropped by the parser. */
    record Negate(Syntax operand) implements Syntax {
    }

    /** {@code left op right} with op one of {@code + - * / ** %}. */
    record Binary(String op, Syntax left, Syntax right) implements Syntax {
    }

    /** {@code function(args..., key=value...)}; keywords keep source order. */
    record Call(String function, int position, List<Syntax> args, Map<String, Syntax> keywords)
            implements Syntax {
    }
}
