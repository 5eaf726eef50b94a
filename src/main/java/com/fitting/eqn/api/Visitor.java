package com.fitting.eqn.api;

import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Operator;

/**
 * Traversal over an equation graph, dispatched per node kind.
 *
 * Nodes call back into the visitor from {@code Literal.identify(Visitor)}
 * (double dispatch). The node kinds are a closed set, so a visitor is
 * complete once it handles all three callbacks. Callbacks that a visitor does
 * not override fail loudly.
 *
 * Generators:
 * Before {@link #onGenerator} is called the generator gets a chance to
 * regenerate, with this visitor's clock as the observer. See
 * {@link Generator#generate(Clock)}.
 *
 * Visitors hold their own result state and are not reusable across threads.
 */
public abstract class Visitor {
    private final Clock clock = new Clock();

    /** The clock Generators compare against when this visitor reaches them. */
    public Clock clock() {
        return clock;
    }

    public void onArgument(Argument argument) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not handle arguments");
    }

    public void onOperator(Operator operator) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not handle operators");
    }

    public void onGenerator(Generator generator) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not handle generators");
    }
}
