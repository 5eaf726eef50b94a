package com.fitting.eqn.fn;

/**
 * Elementwise kernel with 1 input.
 *
 * <p>
 * Lifted over arrays by {@link Values#map(Object, Fn1)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code Math::sin}</li>
 * <li>{@code x -> -x}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    double apply(double input);
}
