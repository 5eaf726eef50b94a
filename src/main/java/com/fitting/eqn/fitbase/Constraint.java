package com.fitting.eqn.fitbase;

import com.fitting.eqn.error.ConstraintConflictException;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.visitor.Visitors;
import lombok.extern.log4j.Log4j2;

/**
 * Ties the value of a {@link Parameter} to an {@link Equation}.
 *
 * A constraint is owned by exactly one organizer. While bound, the parameter's
 * clock observes the equation's clock, so anything reading the parameter sees
 * the equation change; the parameter itself pulls the new value on its next
 * read.
 */
@Log4j2
public final class Constraint {
    private Parameter parameter;
    private Equation equation;
    private long seen = -1;

    /**
     * Binds {@code parameter} to {@code equation} and evaluates it once.
     *
     * @throws ConstraintConflictException if the parameter is constant, already
     *                                     constrained, or used by the equation.
     */
    public void constrain(Parameter parameter, Equation equation) {
        if (this.parameter != null)
            throw new IllegalStateException("Constraint is already bound to '" + this.parameter.name() + "'");
        if (parameter.isConst())
            throw new ConstraintConflictException("The parameter '" + parameter.name() + "' is constant");
        if (parameter.isConstrained())
            throw new ConstraintConflictException("The parameter '" + parameter.name() + "' is already constrained");
        if (Visitors.contains(equation.root(), parameter))
            throw new ConstraintConflictException("The parameter '" + parameter.name()
                    + "' is used by its own constraint '" + equation + "'");

        this.parameter = parameter;
        this.equation = equation;
        this.seen = -1;
        parameter.bind(this);
        parameter.clock().addSubject(equation.clock());
        update();
        log.debug("Constrained '{}' to '{}'", parameter.name(), equation);
    }

    /**
     * Pushes the equation value into the parameter if the equation changed
     * since the last update.
     */
    public void update() {
        Object value = equation.getValue();
        long state = equation.clock().state();
        if (state == seen)
            return;
        parameter.assign(value);
        seen = state;
    }

    /** Releases the parameter. It keeps the last value the equation produced. */
    public void unconstrain() {
        if (parameter == null)
            return;
        Parameter released = parameter;
        update();
        released.clock().removeSubject(equation.clock());
        released.bind(null);
        released.clock().click();
        log.debug("Unconstrained '{}'", released.name());
        parameter = null;
        equation = null;
    }

    public Parameter parameter() {
        return parameter;
    }

    public Equation equation() {
        return equation;
    }

    @Override
    public String toString() {
        return parameter == null ? "Constraint(unbound)" : parameter.name() + " = " + equation;
    }
}
