package com.fitting.eqn.util;

import com.fitting.eqn.api.Organizer;
import com.fitting.eqn.api.Refinable;
import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.error.EquationException;
import com.fitting.eqn.fitbase.Constraint;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.fitbase.Restraint;
import com.fitting.eqn.fn.Values;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting equation graphs and organizer trees.
 *
 * <p>
 * Nodes are numbered in depth-first discovery order, so a node shared by
 * several operators appears once and is referred to by its number.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports. Reading a
 * node's value here evaluates it, so do <b>not</b> call this inside an
 * optimizer loop.
 */
public final class GraphExplain {
    private final Equation equation;
    private final Map<Literal, Integer> ids = new IdentityHashMap<>();
    private final List<Literal> order = new ArrayList<>();

    public GraphExplain(Equation equation) {
        this.equation = equation;
        equation.root().identify(new Collector());
    }

    /** Number of distinct nodes in the graph. */
    public int nodeCount() {
        return order.size();
    }

    /**
     * Dumps every node with its kind, current value and children.
     */
    public String explain() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Equation: ").append(equation).append('\n')
                .append("Nodes (").append(order.size()).append("):\n");
        for (Literal node : order) {
            sb.append("  [").append(ids.get(node)).append("] ").append(label(node))
                    .append(" : ").append(kind(node))
                    .append(" = ").append(valueOf(node));
            List<String> children = children(node);
            if (!children.isEmpty())
                sb.append(" <- ").append(String.join(", ", children));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, edges pointing from each operator
     * to its children.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (Literal node : order) {
            sb.append("  n").append(ids.get(node)).append("[\"").append(label(node).replace("\"", "'"))
                    .append("<br/>").append(valueOf(node)).append("\"];\n");
        }
        for (Literal node : order) {
            if (node instanceof Operator op) {
                for (Literal child : op.args())
                    edge(sb, op, child, null);
                for (Map.Entry<String, Literal> kw : op.kwargs().entrySet())
                    edge(sb, op, kw.getValue(), kw.getKey());
            } else if (node instanceof Generator g) {
                for (Literal dependency : g.args())
                    edge(sb, g, dependency, "depends");
            }
        }
        return sb.toString();
    }

    /**
     * Dumps an organizer tree: parameters with their state, owned constraints
     * and restraints, then each sub-organizer indented.
     */
    public static String dumpOrganizer(Organizer organizer) {
        StringBuilder sb = new StringBuilder(512);
        dumpOrganizer(organizer, "", sb);
        return sb.toString();
    }

    private static void dumpOrganizer(Organizer organizer, String indent, StringBuilder sb) {
        sb.append(indent).append("Organizer: ").append(organizer.name()).append('\n');
        Map<Parameter, Constraint> constraints = organizer.getConstraints();
        for (Refinable p : organizer.getParameters().values()) {
            sb.append(indent).append("  ").append(p.name()).append(" = ").append(Values.format(p.getValue()));
            if (p.isConst())
                sb.append(" (const)");
            Constraint c = constraints.get(p.parameter());
            if (c != null)
                sb.append(" := ").append(c.equation());
            if (p.lowerBound() != Double.NEGATIVE_INFINITY || p.upperBound() != Double.POSITIVE_INFINITY)
                sb.append(" in [").append(p.lowerBound()).append(", ").append(p.upperBound()).append(']');
            sb.append('\n');
        }
        for (Restraint r : organizer.getRestraints()) {
            if (ownedBySub(organizer, r))
                continue;
            sb.append(indent).append("  restraint ").append(r.equation())
                    .append(" in [").append(r.lowerBound()).append(", ").append(r.upperBound())
                    .append("] sigma=").append(r.sigma()).append('\n');
        }
        for (Organizer sub : organizer.getOrganizers().values())
            dumpOrganizer(sub, indent + "  ", sb);
    }

    private static boolean ownedBySub(Organizer organizer, Restraint r) {
        for (Organizer sub : organizer.getOrganizers().values())
            if (sub.getRestraints().contains(r))
                return true;
        return false;
    }

    private void edge(StringBuilder sb, Literal from, Literal to, String label) {
        if (to == null)
            return;
        sb.append("  n").append(ids.get(from));
        if (label != null)
            sb.append(" -- \"").append(label).append("\" -->");
        else
            sb.append(" -->");
        sb.append(" n").append(ids.get(to)).append(";\n");
    }

    private List<String> children(Literal node) {
        List<String> out = new ArrayList<>();
        if (node instanceof Operator op) {
            for (Literal child : op.args())
                out.add(child == null ? "?" : "[" + ids.get(child) + "]");
            for (Map.Entry<String, Literal> kw : op.kwargs().entrySet())
                out.add(kw.getKey() + "=" + (kw.getValue() == null ? "?" : "[" + ids.get(kw.getValue()) + "]"));
        } else if (node instanceof Generator g) {
            for (Literal dependency : g.args())
                out.add("[" + ids.get(dependency) + "]");
        }
        return out;
    }

    private static String label(Literal node) {
        String name = node.name();
        if (name != null && !name.isEmpty())
            return name;
        if (node instanceof Operator op)
            return op.function().name();
        if (node instanceof Argument a)
            return Values.format(a.getValue());
        return node.toString();
    }

    private static String kind(Literal node) {
        if (node instanceof Operator op)
            return "Operator(" + op.function().name() + ")";
        if (node instanceof Argument a)
            return a.isConst() ? "Const" : node.getClass().getSimpleName();
        return "Generator";
    }

    // A failing node is reported in the dump rather than aborting it.
    private static String valueOf(Literal node) {
        try {
            return Values.format(node.getValue());
        } catch (EquationException | IllegalArgumentException e) {
            return "<error: " + e.getMessage() + ">";
        }
    }

    private final class Collector extends Visitor {
        private boolean register(Literal node) {
            if (ids.containsKey(node))
                return false;
            ids.put(node, order.size());
            order.add(node);
            return true;
        }

        @Override
        public void onArgument(Argument argument) {
            register(argument);
        }

        @Override
        public void onOperator(Operator operator) {
            if (!register(operator))
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
            if (!register(generator))
                return;
            for (Literal dependency : generator.args())
                dependency.identify(this);
        }
    }
}
