package com.fitting.eqn.visitor;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the arguments reachable from a literal, depth-first.
 *
 * Shared arguments appear once. Generators contribute their args.
 */
public final class ArgFinder extends Visitor {
    private final boolean getConsts;
    private final Set<Argument> args = new LinkedHashSet<>();
    private final Set<Literal> seen = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * @param getConsts Whether constant arguments are collected too.
     */
    public ArgFinder(boolean getConsts) {
        this.getConsts = getConsts;
    }

    /** Arguments found so far, in depth-first order. */
    public Set<Argument> args() {
        return args;
    }

    @Override
    public void onArgument(Argument argument) {
        if (getConsts || !argument.isConst())
            args.add(argument);
    }

    @Override
    public void onOperator(Operator operator) {
        if (!seen.add(operator))
            return;
        for (Literal child : operator.args())
            if (child != null)
                child.identify(this);
        for (Literal child : operator.kwargs().values())
            if (child != null)
                child.identify(this);
    }

    @Override
    public void onGenerator(Generator generator) {
        if (!seen.add(generator))
            return;
        for (Literal dependency : generator.args())
            dependency.identify(this);
    }
}
