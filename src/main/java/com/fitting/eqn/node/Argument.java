package com.fitting.eqn.node;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.fn.Values;

/**
 * Leaf node holding a named value.
 *
 * The value is either a scalar or a numeric array (see {@link Values}).
 * Setting a value that differs from the current one clicks the clock. Arrays
 * are stored by reference and every array write counts as a change, since
 * the caller may have modified the array in place.
 *
 * Constant arguments reject {@link #setValue(Object)}. Their value can only be
 * replaced through {@link #setConst(boolean, Object)}.
 */
public non-sealed class Argument extends Literal {
    private Object value;
    private boolean constant;

    public Argument(String name, Object value, boolean constant) {
        super(name);
        this.value = Values.normalize(value);
        this.constant = constant;
    }

    public Argument(String name, double value) {
        this(name, value, false);
    }

    /** An anonymous constant, as produced for numeric literals in equation text. */
    public static Argument constant(double value) {
        return new Argument(null, value, true);
    }

    @Override
    public Object getValue() {
        return loadValue();
    }

    /**
     * @throws IllegalStateException    if this argument is constant.
     * @throws IllegalArgumentException if the value is not numeric.
     */
    public void setValue(Object value) {
        if (constant)
            throw new IllegalStateException("Cannot change the value of constant '" + name() + "'");
        storeValue(Values.normalize(value));
    }

    public boolean isConst() {
        return constant;
    }

    public void setConst(boolean constant) {
        this.constant = constant;
    }

    /**
     * Toggles the constant flag, optionally replacing the value first.
     *
     * @param value New value, or null to keep the current one.
     */
    public void setConst(boolean constant, Object value) {
        if (value != null)
            storeValue(Values.normalize(value));
        this.constant = constant;
    }

    /** Reads the stored value. Subclasses with external storage override this. */
    protected Object loadValue() {
        return value;
    }

    /** Writes a normalized value and clicks on change. No access checks. */
    protected void storeValue(Object newValue) {
        if (Values.same(value, newValue))
            return;
        value = newValue;
        clock.click();
    }

    @Override
    public void identify(Visitor visitor) {
        visitor.onArgument(this);
    }
}
