package com.fitting.eqn.fn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in functions available to every equation.
 *
 * <p>
 * The arithmetic operators back the infix/prefix syntax of the equation
 * language; the rest are reachable with call syntax, e.g. {@code sin(x)}.
 */
public final class Functions {
    public static final FunctionDef ADD = FunctionDef.infix("add", "+", (a, b) -> a + b);
    public static final FunctionDef SUBTRACT = FunctionDef.infix("subtract", "-", (a, b) -> a - b);
    public static final FunctionDef MULTIPLY = FunctionDef.infix("multiply", "*", (a, b) -> a * b);
    public static final FunctionDef DIVIDE = FunctionDef.infix("divide", "/", (a, b) -> a / b);
    public static final FunctionDef POWER = FunctionDef.infix("power", "**", Math::pow);
    // Floored remainder: the result takes the sign of the divisor.
    public static final FunctionDef REMAINDER = FunctionDef.infix("remainder", "%",
            (a, b) -> a - b * Math.floor(a / b));
    public static final FunctionDef NEGATIVE = FunctionDef.prefix("negative", "-", x -> -x);

    public static final FunctionDef SIN = FunctionDef.unary("sin", Math::sin);
    public static final FunctionDef COS = FunctionDef.unary("cos", Math::cos);
    public static final FunctionDef TAN = FunctionDef.unary("tan", Math::tan);
    public static final FunctionDef EXP = FunctionDef.unary("exp", Math::exp);
    public static final FunctionDef LOG = FunctionDef.unary("log", Math::log);
    public static final FunctionDef SQRT = FunctionDef.unary("sqrt", Math::sqrt);
    public static final FunctionDef ABS = FunctionDef.unary("abs", Math::abs);
    public static final FunctionDef MAXIMUM = FunctionDef.binary("maximum", Math::max);
    public static final FunctionDef MINIMUM = FunctionDef.binary("minimum", Math::min);
    public static final FunctionDef SUM = FunctionDef.of("sum", 1, (args, kw) -> Values.sum(args[0]));

    private static final Map<String, FunctionDef> BUILT_INS;

    static {
        Map<String, FunctionDef> m = new LinkedHashMap<>();
        for (FunctionDef f : new FunctionDef[] { SIN, COS, TAN, EXP, LOG, SQRT, ABS, MAXIMUM, MINIMUM, SUM })
            m.put(f.name(), f);
        BUILT_INS = Collections.unmodifiableMap(m);
    }

    private Functions() {
    }

    /** Functions registered in every new EquationFactory, keyed by name. */
    public static Map<String, FunctionDef> builtIns() {
        return BUILT_INS;
    }
}
