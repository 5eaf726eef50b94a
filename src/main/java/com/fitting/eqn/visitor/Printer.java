package com.fitting.eqn.visitor;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.fn.Values;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Generator;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders a literal graph as equation text.
 *
 * <ul>
 * <li>Infix operators: {@code (a + b)}</li>
 * <li>Prefix operators: {@code (-a)}</li>
 * <li>Everything else: {@code name(a, b, kw=c)}</li>
 * </ul>
 * Infix and prefix renders are parenthesized unless they already form one
 * balanced parenthesized group. A render that merely starts and ends with a
 * parenthesis, such as {@code (a + b) * (c + d)}, is still wrapped.
 * Arguments print their name, or their value when they are anonymous or
 * their name starts with an underscore.
 */
public final class Printer extends Visitor {
    private StringBuilder output = new StringBuilder();
    private final Set<Operator> path = Collections.newSetFromMap(new IdentityHashMap<>());

    /** Renders {@code literal}. */
    public static String print(Literal literal) {
        Printer printer = new Printer();
        literal.identify(printer);
        return printer.output();
    }

    public String output() {
        return output.toString();
    }

    public void reset() {
        output = new StringBuilder();
        path.clear();
    }

    @Override
    public void onArgument(Argument argument) {
        String name = argument.name();
        if (name == null || name.isEmpty() || name.startsWith("_"))
            output.append(Values.format(argument.getValue()));
        else
            output.append(name);
    }

    @Override
    public void onGenerator(Generator generator) {
        String name = generator.name();
        output.append(name == null || name.isEmpty() ? "generator" : name);
    }

    @Override
    public void onOperator(Operator operator) {
        if (!path.add(operator)) {
            output.append("<cycle ").append(label(operator)).append('>');
            return;
        }
        StringBuilder outer = output;
        output = new StringBuilder();

        FunctionDef f = operator.function();
        int n = operator.args().size();
        boolean wrap = true;
        switch (f.notation()) {
            case INFIX -> {
                if (n == 2 && operator.kwargs().isEmpty()) {
                    visit(operator.args().get(0));
                    output.append(' ').append(f.symbol()).append(' ');
                    visit(operator.args().get(1));
                } else {
                    onCall(operator);
                    wrap = false;
                }
            }
            case PREFIX -> {
                if (n == 1 && operator.kwargs().isEmpty()) {
                    output.append(f.symbol());
                    visit(operator.args().get(0));
                } else {
                    onCall(operator);
                    wrap = false;
                }
            }
            default -> {
                onCall(operator);
                wrap = false;
            }
        }

        String rendered = output.toString();
        if (wrap && !isGroup(rendered))
            rendered = "(" + rendered + ")";
        output = outer.append(rendered);
        path.remove(operator);
    }

    private void onCall(Operator operator) {
        output.append(label(operator)).append('(');
        int count = 0;
        for (Literal child : operator.args()) {
            if (count++ > 0)
                output.append(", ");
            visit(child);
        }
        for (Map.Entry<String, Literal> e : operator.kwargs().entrySet()) {
            if (count++ > 0)
                output.append(", ");
            output.append(e.getKey()).append('=');
            visit(e.getValue());
        }
        output.append(')');
    }

    private void visit(Literal child) {
        if (child == null)
            output.append('?');
        else
            child.identify(this);
    }

    private static String label(Operator operator) {
        String name = operator.name();
        return name == null || name.isEmpty() ? operator.function().name() : name;
    }

    // True if s is "( ... )" where the first paren closes at the very end.
    static boolean isGroup(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')')
            return false;
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(')
                depth++;
            else if (c == ')' && --depth == 0)
                return i == s.length() - 1;
        }
        return false;
    }
}
