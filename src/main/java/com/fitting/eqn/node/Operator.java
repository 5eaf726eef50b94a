package com.fitting.eqn.node;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.error.ConflictException;
import com.fitting.eqn.error.EvaluationException;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.fn.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interior node applying a {@link FunctionDef} to its children.
 *
 * Caching:
 * The operator's clock observes every child's clock. The result is cached
 * together with the stamp at which it was computed; while the clock has not
 * advanced past that stamp the cached value is returned without touching the
 * children. Otherwise every child is evaluated (positional first, then
 * keyword, each in declaration order), the function is applied, and the
 * clock clicks. Array results are returned as copies, so writing into a
 * returned array never reaches the cache.
 *
 * Structure:
 * Children may be added and replaced in place. Every structural change clicks
 * the clock, so the next read recomputes. Because operators are shared
 * between graphs, a replacement is visible to every graph holding this
 * operator.
 */
public final class Operator extends Literal {
    private final FunctionDef function;
    private final List<Literal> args = new ArrayList<>();
    private final Map<String, Literal> kwargs = new LinkedHashMap<>();

    private Object value;
    private long evaluatedAt = -1;
    private long evaluations;

    public Operator(FunctionDef function) {
        this(function.name(), function);
    }

    public Operator(String name, FunctionDef function) {
        super(name);
        this.function = Objects.requireNonNull(function, "function");
    }

    /** Creates an operator with the given positional children. */
    public static Operator of(FunctionDef function, Literal... children) {
        Operator op = new Operator(function);
        for (Literal child : children)
            op.addLiteral(child);
        return op;
    }

    public FunctionDef function() {
        return function;
    }

    /** Positional children (read-only view; may contain null for a missing child). */
    public List<Literal> args() {
        return Collections.unmodifiableList(args);
    }

    /** Keyword children in declaration order (read-only view). */
    public Map<String, Literal> kwargs() {
        return Collections.unmodifiableMap(kwargs);
    }

    /** Appends a positional child. */
    public Operator addLiteral(Literal child) {
        args.add(child);
        subscribe(child);
        clock.click();
        return this;
    }

    /**
     * Adds a keyword child.
     *
     * @throws ConflictException if the keyword is already used.
     */
    public Operator addKeyword(String keyword, Literal child) {
        if (kwargs.containsKey(keyword))
            throw new ConflictException("Keyword '" + keyword + "' is already bound in '" + name() + "'");
        kwargs.put(keyword, child);
        subscribe(child);
        clock.click();
        return this;
    }

    /** Replaces the positional child at {@code index}. */
    public void setArgument(int index, Literal child) {
        Literal old = args.set(index, child);
        resubscribe(old, child);
    }

    /** Replaces an existing keyword child. */
    public void setKeyword(String keyword, Literal child) {
        if (!kwargs.containsKey(keyword))
            throw new IllegalArgumentException("No keyword '" + keyword + "' in '" + name() + "'");
        Literal old = kwargs.put(keyword, child);
        resubscribe(old, child);
    }

    /**
     * Replaces every direct reference to {@code old} among the children.
     *
     * @return The number of slots replaced.
     */
    public int replace(Literal old, Literal replacement) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == old) {
                args.set(i, replacement);
                count++;
            }
        }
        for (Map.Entry<String, Literal> e : kwargs.entrySet()) {
            if (e.getValue() == old) {
                e.setValue(replacement);
                count++;
            }
        }
        if (count > 0)
            resubscribe(old, replacement);
        return count;
    }

    /** True if {@code child} is a direct child of this operator. */
    public boolean references(Literal child) {
        for (Literal a : args)
            if (a == child)
                return true;
        for (Literal k : kwargs.values())
            if (k == child)
                return true;
        return false;
    }

    /** True if the next {@link #getValue()} will recompute. */
    public boolean isStale() {
        return evaluatedAt < clock.state();
    }

    /** Number of times the function has actually run. */
    public long evaluationCount() {
        return evaluations;
    }

    @Override
    public Object getValue() {
        if (!isStale())
            return copyOf(value);

        Object[] argv = new Object[args.size()];
        for (int i = 0; i < argv.length; i++)
            argv[i] = evaluate(args.get(i), "argument " + i);

        Map<String, Object> kv;
        if (kwargs.isEmpty()) {
            kv = Map.of();
        } else {
            kv = new LinkedHashMap<>();
            for (Map.Entry<String, Literal> e : kwargs.entrySet())
                kv.put(e.getKey(), evaluate(e.getValue(), "keyword '" + e.getKey() + "'"));
        }

        Object result;
        try {
            result = Values.normalize(function.fn().apply(argv, kv));
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(displayName(), e);
        }
        if (result == null)
            throw new EvaluationException(displayName(), "function '" + function.name() + "' returned no value");

        value = result;
        evaluations++;
        clock.click();
        evaluatedAt = clock.state();
        return copyOf(value);
    }

    private static Object copyOf(Object v) {
        return v instanceof double[] arr ? arr.clone() : v;
    }

    @Override
    public void identify(Visitor visitor) {
        visitor.onOperator(this);
    }

    private Object evaluate(Literal child, String slot) {
        if (child == null)
            throw new EvaluationException(displayName(), "missing " + slot);
        return child.getValue();
    }

    private String displayName() {
        return name() == null || name().isEmpty() ? function.name() : name();
    }

    private void subscribe(Literal child) {
        // Self-references are left for the Validator to report as a cycle.
        if (child != null && child != this)
            clock.addSubject(child.clock());
    }

    private void resubscribe(Literal old, Literal replacement) {
        if (old != null && old != this && !references(old))
            clock.removeSubject(old.clock());
        subscribe(replacement);
        clock.click();
    }
}
