package com.fitting.eqn.fitbase;

import com.fitting.eqn.api.Attributed;
import com.fitting.eqn.fn.Values;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A parameter whose value lives in an external object.
 *
 * Reads and writes go straight to the wrapped object, either through a
 * getter/setter pair or through an attribute key. Writes made through the
 * wrapper click its clock; writes made to the object behind its back are
 * not seen by the graph until the wrapper is written again.
 *
 * @param <T> Type of the wrapped object.
 */
public final class ParameterWrapper<T> extends Parameter {
    private final T target;
    private final Function<? super T, Object> getter;
    private final BiConsumer<? super T, Object> setter;

    private ParameterWrapper(String name, T target, Function<? super T, Object> getter,
            BiConsumer<? super T, Object> setter) {
        super(name);
        this.target = Objects.requireNonNull(target, "target");
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * Wraps a value reached through accessor functions.
     *
     * @throws IllegalArgumentException unless both getter and setter are given.
     */
    public static <T> ParameterWrapper<T> of(String name, T target, Function<? super T, Object> getter,
            BiConsumer<? super T, Object> setter) {
        if (getter == null || setter == null)
            throw new IllegalArgumentException("Parameter '" + name + "' needs both a getter and a setter");
        return new ParameterWrapper<>(name, target, getter, setter);
    }

    /**
     * Wraps the value stored under {@code key} in an {@link Attributed} object or
     * a {@code Map<String, Object>}.
     *
     * @throws IllegalArgumentException if the object supports neither.
     */
    @SuppressWarnings("unchecked")
    public static <T> ParameterWrapper<T> ofAttribute(String name, T target, String key) {
        Objects.requireNonNull(key, "key");
        if (target instanceof Attributed) {
            return new ParameterWrapper<>(name, target, o -> ((Attributed) o).getAttribute(key),
                    (o, v) -> ((Attributed) o).setAttribute(key, v));
        }
        if (target instanceof Map) {
            return new ParameterWrapper<>(name, target, o -> ((Map<String, Object>) o).get(key),
                    (o, v) -> ((Map<String, Object>) o).put(key, v));
        }
        throw new IllegalArgumentException("Cannot address attribute '" + key + "' of "
                + (target == null ? "null" : target.getClass().getName()));
    }

    public T target() {
        return target;
    }

    @Override
    protected Object loadValue() {
        return Values.normalize(getter.apply(target));
    }

    @Override
    protected void storeValue(Object newValue) {
        if (Values.same(loadValue(), newValue))
            return;
        setter.accept(target, newValue);
        clock.click();
    }
}
