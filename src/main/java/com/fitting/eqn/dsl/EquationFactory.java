package com.fitting.eqn.dsl;

import com.fitting.eqn.error.ConflictException;
import com.fitting.eqn.error.NameResolutionException;
import com.fitting.eqn.error.StructuralException;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.fn.Functions;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.node.Operator;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link Equation}s from text.
 *
 * <p>
 * The factory keeps a registry of named literals and functions. A build
 * resolves identifiers first against the namespace passed to
 * {@link #build(String, Map)} and then against the registry; the namespace is
 * used for that build only and never retained.
 *
 * <p>
 * A build runs in three passes over the parsed {@link Syntax}: name
 * resolution, call checking, materialization. Nothing is created until the
 * first two passes succeed, so a failed build leaves no nodes behind.
 *
 * <p>
 * The same identifier always resolves to the same object, so {@code x*x}
 * shares one leaf between both operands.
 */
@Log4j2
public class EquationFactory {
    private final Map<String, Literal> arguments = new LinkedHashMap<>();
    private final Map<String, FunctionDef> functions = new LinkedHashMap<>(Functions.builtIns());

    /**
     * Binds {@code name} to {@code literal}. Rebinding a name to the same
     * object is a no-op.
     *
     * @throws ConflictException if the name is bound to a different object.
     */
    public void registerArgument(String name, Literal literal) {
        Literal existing = arguments.get(name);
        if (existing != null && existing != literal)
            throw new ConflictException("Name '" + name + "' is already registered to a different object");
        arguments.put(name, literal);
    }

    public void deregisterArgument(String name) {
        arguments.remove(name);
    }

    /** Makes {@code def} callable as {@code name(...)} in equations built here. */
    public void registerFunction(String name, FunctionDef def) {
        functions.put(name, def);
    }

    public boolean isRegistered(String name) {
        return arguments.containsKey(name);
    }

    public Literal getArgument(String name) {
        return arguments.get(name);
    }

    public Map<String, Literal> registeredArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public Equation build(String text) {
        return build(text, Map.of());
    }

    /**
     * Builds an equation.
     *
     * @param namespace Extra bindings for this build only; they take precedence
     *                  over registered names that they do not conflict with.
     * @throws com.fitting.eqn.error.EquationSyntaxException if the text is malformed.
     * @throws ConflictException        if a namespace name is registered to a
     *                                  different object.
     * @throws NameResolutionException  if identifiers or functions are unknown.
     * @throws StructuralException      if a call has the wrong arity or keywords.
     */
    public Equation build(String text, Map<String, ? extends Literal> namespace) {
        Syntax syntax = EquationParser.parse(text);

        for (Map.Entry<String, ? extends Literal> e : namespace.entrySet()) {
            Literal registered = arguments.get(e.getKey());
            if (registered != null && registered != e.getValue())
                throw new ConflictException("Namespace binds '" + e.getKey()
                        + "' to a different object than the registered one");
        }

        Set<String> unresolved = new LinkedHashSet<>();
        resolve(syntax, namespace, unresolved);
        if (!unresolved.isEmpty())
            throw new NameResolutionException(text, new ArrayList<>(unresolved));

        List<String> errors = new ArrayList<>();
        checkCalls(syntax, errors);
        if (!errors.isEmpty())
            throw new StructuralException(text, errors);

        Literal root = materialize(syntax, namespace);
        log.debug("Built equation '{}'", text);
        return new Equation(text, root);
    }

    private void resolve(Syntax syntax, Map<String, ? extends Literal> namespace, Set<String> unresolved) {
        if (syntax instanceof Syntax.Name n) {
            if (lookup(n.id(), namespace) == null)
                unresolved.add(n.id());
        } else if (syntax instanceof Syntax.Negate n) {
            resolve(n.operand(), namespace, unresolved);
        } else if (syntax instanceof Syntax.Binary b) {
            resolve(b.left(), namespace, unresolved);
            resolve(b.right(), namespace, unresolved);
        } else if (syntax instanceof Syntax.Call c) {
            if (!functions.containsKey(c.function()))
                unresolved.add(c.function());
            for (Syntax arg : c.args())
                resolve(arg, namespace, unresolved);
            for (Syntax kw : c.keywords().values())
                resolve(kw, namespace, unresolved);
        }
    }

    private void checkCalls(Syntax syntax, List<String> errors) {
        if (syntax instanceof Syntax.Negate n) {
            checkCalls(n.operand(), errors);
        } else if (syntax instanceof Syntax.Binary b) {
            checkCalls(b.left(), errors);
            checkCalls(b.right(), errors);
        } else if (syntax instanceof Syntax.Call c) {
            FunctionDef def = functions.get(c.function());
            if (!def.isVariadic() && def.arity() != c.args().size())
                errors.add("'" + c.function() + "' takes " + def.arity() + " argument(s), got " + c.args().size());
            for (String keyword : c.keywords().keySet())
                if (!def.acceptsKeyword(keyword))
                    errors.add("'" + c.function() + "' does not accept keyword '" + keyword + "'");
            for (Syntax arg : c.args())
                checkCalls(arg, errors);
            for (Syntax kw : c.keywords().values())
                checkCalls(kw, errors);
        }
    }

    private Literal materialize(Syntax syntax, Map<String, ? extends Literal> namespace) {
        if (syntax instanceof Syntax.Constant c)
            return Argument.constant(c.value());
        if (syntax instanceof Syntax.Name n)
            return lookup(n.id(), namespace);
        if (syntax instanceof Syntax.Negate n) {
            // -2 is a constant, not an operator over one.
            if (n.operand() instanceof Syntax.Constant c)
                return Argument.constant(-c.value());
            return Operator.of(Functions.NEGATIVE, materialize(n.operand(), namespace));
        }
        if (syntax instanceof Syntax.Binary b)
            return Operator.of(binaryFunction(b.op()), materialize(b.left(), namespace),
                    materialize(b.right(), namespace));
        Syntax.Call c = (Syntax.Call) syntax;
        Operator op = new Operator(functions.get(c.function()));
        for (Syntax arg : c.args())
            op.addLiteral(materialize(arg, namespace));
        for (Map.Entry<String, Syntax> kw : c.keywords().entrySet())
            op.addKeyword(kw.getKey(), materialize(kw.getValue(), namespace));
        return op;
    }

    private static FunctionDef binaryFunction(String op) {
        return switch (op) {
            case "+" -> Functions.ADD;
            case "-" -> Functions.SUBTRACT;
            case "*" -> Functions.MULTIPLY;
            case "/" -> Functions.DIVIDE;
            case "**" -> Functions.POWER;
            case "%" -> Functions.REMAINDER;
            default -> throw new IllegalArgumentException("Unknown operator '" + op + "'");
        };
    }

    private Literal lookup(String name, Map<String, ? extends Literal> namespace) {
        Literal local = namespace.get(name);
        return local != null ? local : arguments.get(name);
    }
}
