package com.fitting.eqn.fn;

import java.util.Map;

/**
 * The evaluation function of an Operator.
 *
 * Receives the already evaluated values of the operator's children: positional
 * values in declaration order, keyword values in a map that preserves
 * declaration order. Values are {@code Double} or {@code double[]}.
 *
 * Implementations must be pure with respect to the inputs. The arrays they
 * receive may be shared with leaves and must NOT be modified in place.
 * Shape checking is the function's own responsibility; throwing any
 * RuntimeException is enough, the Operator tags it with its name.
 */
@FunctionalInterface
public interface EvalFn {
    Object apply(Object[] args, Map<String, Object> kwargs);
}
