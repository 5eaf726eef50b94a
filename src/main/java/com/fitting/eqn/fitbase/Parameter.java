package com.fitting.eqn.fitbase;

import com.fitting.eqn.api.Refinable;
import com.fitting.eqn.error.ConstraintConflictException;
import com.fitting.eqn.fn.Values;
import com.fitting.eqn.node.Argument;

import java.util.regex.Pattern;

/**
 * An argument an optimizer may refine.
 *
 * Adds bounds (unbounded by default) and an optional {@link Constraint}. A
 * constrained parameter takes its value from the constraint equation, is
 * refreshed on every read and rejects direct writes.
 */
public class Parameter extends Argument implements Refinable {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private double lowerBound = Double.NEGATIVE_INFINITY;
    private double upperBound = Double.POSITIVE_INFINITY;
    private Constraint constraint;

    /**
     * @throws IllegalArgumentException if the name is neither empty nor a valid
     *                                  identifier.
     */
    public Parameter(String name, Object value, boolean constant) {
        super(checkName(name), value, constant);
    }

    public Parameter(String name, Object value) {
        this(name, value, false);
    }

    public Parameter(String name, double value) {
        this(name, value, false);
    }

    /** A parameter without a value yet. */
    public Parameter(String name) {
        this(name, null, false);
    }

    static String checkName(String name) {
        if (name == null)
            return "";
        if (!name.isEmpty() && !IDENTIFIER.matcher(name).matches())
            throw new IllegalArgumentException("Invalid parameter name '" + name + "'");
        return name;
    }

    @Override
    public Object getValue() {
        if (constraint != null)
            constraint.update();
        return super.getValue();
    }

    /**
     * @throws ConstraintConflictException if the parameter is constrained.
     * @throws IllegalStateException       if the parameter is constant.
     */
    @Override
    public void setValue(Object value) {
        if (constraint != null)
            throw new ConstraintConflictException("Parameter '" + name() + "' is constrained");
        super.setValue(value);
    }

    /**
     * @throws ConstraintConflictException if a value is given for a
     *                                     constrained parameter.
     */
    @Override
    public void setConst(boolean constant, Object value) {
        if (value != null && constraint != null)
            throw new ConstraintConflictException("Parameter '" + name() + "' is constrained");
        super.setConst(constant, value);
    }

    @Override
    public double lowerBound() {
        return lowerBound;
    }

    @Override
    public double upperBound() {
        return upperBound;
    }

    @Override
    public void setBounds(double lowerBound, double upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /** Fluent form of {@link #setBounds}. */
    public Parameter boundRange(double lowerBound, double upperBound) {
        setBounds(lowerBound, upperBound);
        return this;
    }

    public Constraint constraint() {
        return constraint;
    }

    @Override
    public boolean isConstrained() {
        return constraint != null;
    }

    @Override
    public Parameter parameter() {
        return this;
    }

    void bind(Constraint constraint) {
        this.constraint = constraint;
    }

    // Writes bypassing the const and constraint checks; used by Constraint.
    void assign(Object value) {
        storeValue(Values.normalize(value));
    }
}
