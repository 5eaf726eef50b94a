package com.fitting.eqn.visitor;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of a literal graph.
 *
 * Reports, as human-readable strings:
 * <ul>
 * <li>missing (null) children</li>
 * <li>positional arity mismatches against the operator's function</li>
 * <li>keyword children the function does not accept</li>
 * <li>cycles, when enabled</li>
 * </ul>
 * Shared subgraphs are checked once. An empty error list means the graph is
 * safe to evaluate as far as structure goes; see {@link Visitors#validate}
 * for the throwing variant.
 */
public final class Validator extends Visitor {
    private final boolean checkCycles;
    private final List<String> errors = new ArrayList<>();
    private final Set<Literal> path = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Literal> done = Collections.newSetFromMap(new IdentityHashMap<>());

    public Validator() {
        this(true);
    }

    public Validator(boolean checkCycles) {
        this.checkCycles = checkCycles;
    }

    public List<String> errors() {
        return errors;
    }

    @Override
    public void onArgument(Argument argument) {
        // Values may legitimately be set after the graph is built.
    }

    @Override
    public void onOperator(Operator operator) {
        if (path.contains(operator)) {
            // Never recurse into a cycle, reported or not.
            if (checkCycles)
                errors.add("Cycle detected: '" + label(operator) + "' is reachable from itself");
            return;
        }
        if (!done.add(operator))
            return;
        path.add(operator);

        FunctionDef f = operator.function();
        List<Literal> args = operator.args();
        if (!f.isVariadic() && args.size() != f.arity()) {
            errors.add("'" + label(operator) + "' requires " + f.arity() + " argument(s) but has "
                    + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            Literal child = args.get(i);
            if (child == null)
                errors.add("'" + label(operator) + "' is missing argument " + i);
            else
                child.identify(this);
        }
        for (Map.Entry<String, Literal> e : operator.kwargs().entrySet()) {
            if (!f.acceptsKeyword(e.getKey()))
                errors.add("'" + label(operator) + "' does not accept keyword '" + e.getKey() + "'");
            if (e.getValue() == null)
                errors.add("'" + label(operator) + "' is missing keyword '" + e.getKey() + "'");
            else
                e.getValue().identify(this);
        }

        path.remove(operator);
    }

    @Override
    public void onGenerator(Generator generator) {
        if (!done.add(generator))
            return;
        for (Literal dependency : generator.args())
            dependency.identify(this);
    }

    private static String label(Operator operator) {
        String name = operator.name();
        return name == null || name.isEmpty() ? operator.function().name() : name;
    }
}
