package com.fitting.eqn.fitbase;

import com.fitting.eqn.error.EvaluationException;
import com.fitting.eqn.error.RestraintDomainException;
import com.fitting.eqn.node.Equation;
import lombok.extern.log4j.Log4j2;

import java.util.Objects;

/**
 * Soft bounds on the value of an equation.
 *
 * The penalty is zero inside {@code [lowerBound, upperBound]} and grows
 * linearly outside, scaled by {@code 1/sigma}. The equation must be scalar
 * valued; this is checked on construction when the equation can already be
 * evaluated, and again on every {@link #penalty()}.
 */
@Log4j2
public final class Restraint {
    private final Equation equation;
    private final double lowerBound;
    private final double upperBound;
    private final double sigma;

    /**
     * @throws RestraintDomainException if sigma is zero or NaN.
     * @throws EvaluationException      if the equation currently evaluates to
     *                                  an array.
     */
    public Restraint(Equation equation, double lowerBound, double upperBound, double sigma) {
        if (sigma == 0 || Double.isNaN(sigma))
            throw new RestraintDomainException("Invalid sigma " + sigma + " for restraint on '" + equation + "'");
        this.equation = Objects.requireNonNull(equation, "equation");
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.sigma = sigma;
        checkShape();
    }

    /** Restrains the equation to exactly {@code value}. */
    public Restraint(Equation equation, double value) {
        this(equation, value, value, 1);
    }

    public Restraint(Equation equation, double lowerBound, double upperBound) {
        this(equation, lowerBound, upperBound, 1);
    }

    /**
     * {@code max(0, lb - v, v - ub) / sigma}.
     *
     * @throws EvaluationException if the equation is not scalar valued.
     */
    public double penalty() {
        Object value = equation.getValue();
        if (!(value instanceof Double v))
            throw new EvaluationException(String.valueOf(equation.name()), "restrained equation must be scalar");
        return Math.max(0, Math.max(lowerBound - v, v - upperBound)) / sigma;
    }

    private void checkShape() {
        Object value;
        try {
            value = equation.getValue();
        } catch (EvaluationException e) {
            log.debug("Shape of '{}' unknown until it can be evaluated: {}", equation, e.getMessage());
            return;
        }
        if (value instanceof double[])
            throw new EvaluationException(String.valueOf(equation.name()), "restrained equation must be scalar");
    }

    public Equation equation() {
        return equation;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    public double sigma() {
        return sigma;
    }

    @Override
    public String toString() {
        return "Restraint(" + equation + " in [" + lowerBound + ", " + upperBound + "], sigma=" + sigma + ")";
    }
}
