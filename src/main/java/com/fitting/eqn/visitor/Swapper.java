package com.fitting.eqn.visitor;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Replaces one literal with another throughout a graph, in place.
 *
 * Every visited operator (and generator) that holds {@code old} as a direct
 * child gets that slot pointed at {@code replacement}. Replaced slots are not
 * descended into, so a replacement that itself contains {@code old} is safe.
 *
 * Root:
 * The traversal root cannot be replaced in place. When the root is
 * {@code old} nothing is mutated and the caller must use the replacement as
 * the new root; {@link Visitors#swap} does this.
 *
 * Sharing Hazard:
 * Operators are shared between graphs. Mutating an operator's child slot
 * changes every graph that holds that operator, not only the graph the swap
 * started from. Graphs that reference {@code old} directly through operators
 * this traversal never reaches keep using {@code old}.
 */
public final class Swapper extends Visitor {
    private final Literal old;
    private final Literal replacement;
    private final Set<Literal> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private int swapped;

    public Swapper(Literal old, Literal replacement) {
        this.old = old;
        this.replacement = replacement;
    }

    /** Number of child slots replaced so far. */
    public int swapped() {
        return swapped;
    }

    @Override
    public void onArgument(Argument argument) {
        // Leaves have no children to replace.
    }

    @Override
    public void onOperator(Operator operator) {
        if (!seen.add(operator))
            return;
        List<Literal> children = new ArrayList<>(operator.args());
        children.addAll(operator.kwargs().values());
        swapped += operator.replace(old, replacement);
        for (Literal child : children)
            if (child != null && child != old)
                child.identify(this);
    }

    @Override
    public void onGenerator(Generator generator) {
        if (!seen.add(generator))
            return;
        List<Literal> dependencies = new ArrayList<>(generator.args());
        swapped += generator.replace(old, replacement);
        for (Literal dependency : dependencies)
            if (dependency != old)
                dependency.identify(this);
    }
}
