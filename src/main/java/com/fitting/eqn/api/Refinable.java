package com.fitting.eqn.api;

import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.fitbase.Parameter;

/**
 * The small capability set shared by parameters and their stand-ins
 * (proxies, wrappers): what an organizer registers and what an optimizer
 * reads and writes.
 */
public interface Refinable {

    /** Name under which this parameter is registered. */
    String name();

    /**
     * Current value: a {@code Double} or a {@code double[]}. For a constrained
     * parameter this is refreshed from the constraint equation first.
     */
    Object getValue();

    /**
     * Sets a new value.
     *
     * @throws IllegalStateException if the parameter is constant.
     * @throws com.fitting.eqn.error.ConstraintConflictException if the
     *                                                           parameter is
     *                                                           constrained.
     */
    void setValue(Object value);

    double lowerBound();

    double upperBound();

    void setBounds(double lowerBound, double upperBound);

    boolean isConst();

    boolean isConstrained();

    /** The parameter that actually holds the state. */
    Parameter parameter();

    Clock clock();

    /** Scalar shortcut for {@link #getValue()}. */
    default double doubleValue() {
        Object v = getValue();
        if (v instanceof Double d)
            return d;
        throw new IllegalStateException("Parameter '" + name() + "' does not hold a scalar");
    }
}
