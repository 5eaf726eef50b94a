package com.fitting.eqn.fn;

import java.util.Objects;
import java.util.Set;

/**
 * Describes a function that an Operator can apply.
 *
 * @param name     Name used in equation text and as the default operator name.
 * @param symbol   Infix or prefix symbol, or null for call notation.
 * @param notation How the operator renders.
 * @param arity    Exact number of positional arguments, or {@link #VARIADIC}.
 * @param keywords Keyword arguments the function accepts.
 * @param fn       The evaluation function.
 */
public record FunctionDef(String name, String symbol, Notation notation, int arity, Set<String> keywords,
        EvalFn fn) {

    public static final int VARIADIC = -1;

    public FunctionDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(notation, "notation");
        Objects.requireNonNull(fn, "fn");
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        if (notation != Notation.CALL && symbol == null)
            throw new IllegalArgumentException(notation + " function '" + name + "' needs a symbol");
        if (arity < VARIADIC)
            throw new IllegalArgumentException("Invalid arity " + arity + " for function '" + name + "'");
    }

    /** A binary operator rendered as {@code a symbol b}. */
    public static FunctionDef infix(String name, String symbol, Fn2 kernel) {
        return new FunctionDef(name, symbol, Notation.INFIX, 2, Set.of(),
                (args, kw) -> Values.zip(args[0], args[1], kernel));
    }

    /** A unary operator rendered as {@code symbol a}. */
    public static FunctionDef prefix(String name, String symbol, Fn1 kernel) {
        return new FunctionDef(name, symbol, Notation.PREFIX, 1, Set.of(),
                (args, kw) -> Values.map(args[0], kernel));
    }

    /** An elementwise function of one argument. */
    public static FunctionDef unary(String name, Fn1 kernel) {
        return new FunctionDef(name, null, Notation.CALL, 1, Set.of(),
                (args, kw) -> Values.map(args[0], kernel));
    }

    /** An elementwise function of two arguments. */
    public static FunctionDef binary(String name, Fn2 kernel) {
        return new FunctionDef(name, null, Notation.CALL, 2, Set.of(),
                (args, kw) -> Values.zip(args[0], args[1], kernel));
    }

    /** A general function in call notation. */
    public static FunctionDef of(String name, int arity, EvalFn fn, String... keywords) {
        return new FunctionDef(name, null, Notation.CALL, arity, Set.of(keywords), fn);
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    public boolean acceptsKeyword(String keyword) {
        return keywords.contains(keyword);
    }
}
