package com.fitting.eqn.visitor;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.fitbase.Constraint;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Looks for a specific literal in a graph.
 *
 * Unlike the other traversals this one follows constrained parameters into
 * their constraint equations, since the parameter's value depends on them.
 * That makes it suitable for detecting circular constraints.
 */
public final class NodeFinder extends Visitor {
    private final Literal target;
    private final Set<Literal> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean found;

    public NodeFinder(Literal target) {
        this.target = target;
    }

    public boolean found() {
        return found;
    }

    @Override
    public void onArgument(Argument argument) {
        if (argument == target)
            found = true;
        if (found || !seen.add(argument))
            return;
        if (argument instanceof Parameter p) {
            Constraint c = p.constraint();
            if (c != null)
                c.equation().root().identify(this);
        }
    }

    @Override
    public void onOperator(Operator operator) {
        if (operator == target)
            found = true;
        if (found || !seen.add(operator))
            return;
        for (Literal child : operator.args())
            if (child != null && !found)
                child.identify(this);
        for (Literal child : operator.kwargs().values())
            if (child != null && !found)
                child.identify(this);
    }

    @Override
    public void onGenerator(Generator generator) {
        if (generator == target)
            found = true;
        if (found || !seen.add(generator))
            return;
        for (Literal dependency : generator.args())
            if (!found)
                dependency.identify(this);
    }
}
