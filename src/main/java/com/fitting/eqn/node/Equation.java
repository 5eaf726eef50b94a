package com.fitting.eqn.node;

import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.fn.Values;
import com.fitting.eqn.visitor.Visitors;

import java.util.Objects;
import java.util.Set;

/**
 * A handle on the root of an equation graph.
 *
 * The handle exists so that the root can be replaced (see {@link #swap}) while
 * holders of the equation, such as constraints and restraints, keep a stable
 * reference. Its clock observes the current root.
 */
public final class Equation {
    private final String name;
    private final Clock clock = new Clock();
    private Literal root;

    public Equation(String name, Literal root) {
        this.name = name;
        this.root = Objects.requireNonNull(root, "root");
        clock.addSubject(root.clock());
        clock.click();
    }

    /** Wraps an existing literal, named after it. */
    public static Equation of(Literal root) {
        return new Equation(root.name(), root);
    }

    public String name() {
        return name;
    }

    public Literal root() {
        return root;
    }

    public Clock clock() {
        return clock;
    }

    public Object getValue() {
        return root.getValue();
    }

    /**
     * @throws IllegalStateException if the equation does not evaluate to a scalar.
     */
    public double doubleValue() {
        Object v = getValue();
        if (!Values.isScalar(v))
            throw new IllegalStateException("Equation '" + this + "' does not evaluate to a scalar");
        return (Double) v;
    }

    /** Non-constant arguments reachable from the root. */
    public Set<Argument> arguments() {
        return Visitors.getArgs(root, false);
    }

    public Set<Argument> arguments(boolean includeConsts) {
        return Visitors.getArgs(root, includeConsts);
    }

    /**
     * Replaces {@code old} with {@code replacement} throughout the graph, see
     * {@link com.fitting.eqn.visitor.Swapper} for the sharing caveat. If the
     * root itself is {@code old}, the root is replaced.
     */
    public void swap(Literal old, Literal replacement) {
        Literal newRoot = Visitors.swap(root, old, replacement);
        if (newRoot != root) {
            clock.removeSubject(root.clock());
            root = newRoot;
            clock.addSubject(root.clock());
        }
        clock.click();
    }

    @Override
    public String toString() {
        return Visitors.prettyPrint(root);
    }
}
