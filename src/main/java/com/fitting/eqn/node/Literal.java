package com.fitting.eqn.node;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.engine.Clock;

/**
 * A node in an equation graph.
 *
 * Literals come in three kinds: {@link Argument} leaves holding a value,
 * {@link Operator}s applying a function to child literals, and
 * {@link Generator}s that synthesize another literal on demand.
 *
 * Identity:
 * Literals compare by reference. Two arguments with the same name and value
 * are different nodes. Graphs are DAGs: a literal may be the child of many
 * operators, across many equations, and a change to it is visible to all of
 * them.
 *
 * Change Tracking:
 * Every literal owns a {@link Clock}. Mutations click it, and the stamp is
 * pushed to every operator that depends on the literal.
 */
public abstract sealed class Literal permits Argument, Operator, Generator {
    private final String name;
    protected final Clock clock = new Clock();

    protected Literal(String name) {
        this.name = name;
    }

    /** Display name; may be null or empty for anonymous nodes. */
    public String name() {
        return name;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Returns the current value, recomputing only what changed since the last
     * call.
     *
     * @return A {@code Double} or a {@code double[]}.
     * @throws com.fitting.eqn.error.EvaluationException if evaluation fails.
     */
    public abstract Object getValue();

    /**
     * Identifies this node to a visitor (double dispatch).
     */
    public abstract void identify(Visitor visitor);

    @Override
    public String toString() {
        String simple = getClass().getSimpleName();
        return name == null || name.isEmpty() ? simple + "@" + Integer.toHexString(System.identityHashCode(this))
                : simple + "(" + name + ")";
    }
}
