package com.fitting.eqn.fn;

/**
 * Elementwise kernel with 2 inputs.
 *
 * <p>
 * Lifted over scalar/array combinations by
 * {@link Values#zip(Object, Object, Fn2)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (a, b) -> a + b}</li>
 * <li>{@code Math::pow}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2 {
    /**
     * Applies the function.
     *
     * @param a First input.
     * @param b Second input.
     * @return The result.
     */
    double apply(double a, double b);
}
