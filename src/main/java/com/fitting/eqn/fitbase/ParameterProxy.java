package com.fitting.eqn.fitbase;

import com.fitting.eqn.api.Refinable;
import com.fitting.eqn.engine.Clock;

import java.util.Objects;

/**
 * Exposes a parameter under another name. Everything but the name is
 * delegated, so the proxy and its parameter always agree.
 */
public final class ParameterProxy implements Refinable {
    private final String name;
    private final Parameter parameter;

    public ParameterProxy(String name, Parameter parameter) {
        this.name = Parameter.checkName(name);
        this.parameter = Objects.requireNonNull(parameter, "parameter");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object getValue() {
        return parameter.getValue();
    }

    @Override
    public void setValue(Object value) {
        parameter.setValue(value);
    }

    @Override
    public double lowerBound() {
        return parameter.lowerBound();
    }

    @Override
    public double upperBound() {
        return parameter.upperBound();
    }

    @Override
    public void setBounds(double lowerBound, double upperBound) {
        parameter.setBounds(lowerBound, upperBound);
    }

    @Override
    public boolean isConst() {
        return parameter.isConst();
    }

    @Override
    public boolean isConstrained() {
        return parameter.isConstrained();
    }

    @Override
    public Parameter parameter() {
        return parameter;
    }

    @Override
    public Clock clock() {
        return parameter.clock();
    }

    @Override
    public String toString() {
        return "ParameterProxy(" + name + " -> " + parameter.name() + ")";
    }
}
