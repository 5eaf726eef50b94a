package com.fitting.eqn.fn;

import java.util.Arrays;
import java.util.List;

/**
 * Helpers for the two value shapes the graph carries: a scalar
 * ({@code Double}) or a homogeneous numeric array ({@code double[]}).
 *
 * Broadcasting:
 * scalar op scalar gives a scalar, scalar op array applies the scalar to every
 * element, array op array requires equal lengths. Results are always fresh
 * arrays; inputs are never written to.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /**
     * Converts an incoming value to the canonical shape.
     * Accepts any Number, double[], int[], long[] and lists of Numbers. Null
     * passes through (an unset leaf).
     *
     * @throws IllegalArgumentException for anything else.
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof Double || value instanceof double[])
            return value;
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof int[] ints)
            return Arrays.stream(ints).asDoubleStream().toArray();
        if (value instanceof long[] longs)
            return Arrays.stream(longs).asDoubleStream().toArray();
        if (value instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                if (!(list.get(i) instanceof Number n))
                    throw new IllegalArgumentException("Non-numeric element at index " + i + ": " + list.get(i));
                out[i] = n.doubleValue();
            }
            return out;
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    public static boolean isScalar(Object value) {
        return value instanceof Double;
    }

    public static boolean isArray(Object value) {
        return value instanceof double[];
    }

    /**
     * Reads a scalar.
     *
     * @throws IllegalArgumentException if the value is not a scalar.
     */
    public static double toDouble(Object value) {
        if (value instanceof Double d)
            return d;
        if (value == null)
            throw new IllegalArgumentException("Value is not set");
        throw new IllegalArgumentException("Expected a scalar but got an array of length " + ((double[]) value).length);
    }

    public static Object map(Object value, Fn1 kernel) {
        if (value instanceof Double d)
            return kernel.apply(d);
        double[] in = array(value);
        double[] out = new double[in.length];
        for (int i = 0; i < in.length; i++)
            out[i] = kernel.apply(in[i]);
        return out;
    }

    public static Object zip(Object a, Object b, Fn2 kernel) {
        if (a instanceof Double x && b instanceof Double y)
            return kernel.apply(x, y);
        if (a instanceof Double x) {
            double[] ys = array(b);
            double[] out = new double[ys.length];
            for (int i = 0; i < ys.length; i++)
                out[i] = kernel.apply(x, ys[i]);
            return out;
        }
        double[] xs = array(a);
        if (b instanceof Double y) {
            double[] out = new double[xs.length];
            for (int i = 0; i < xs.length; i++)
                out[i] = kernel.apply(xs[i], y);
            return out;
        }
        double[] ys = array(b);
        if (xs.length != ys.length)
            throw new IllegalArgumentException("Shape mismatch: " + xs.length + " vs " + ys.length);
        double[] out = new double[xs.length];
        for (int i = 0; i < xs.length; i++)
            out[i] = kernel.apply(xs[i], ys[i]);
        return out;
    }

    /** Sum of all elements; a scalar sums to itself. */
    public static double sum(Object value) {
        if (value instanceof Double d)
            return d;
        double total = 0;
        for (double v : array(value))
            total += v;
        return total;
    }

    /** Value equality used to decide whether a write is a change. */
    public static boolean same(Object a, Object b) {
        if (a instanceof Double x && b instanceof Double y)
            return Double.compare(x, y) == 0;
        return a == null && b == null;
    }

    public static String format(Object value) {
        if (value == null)
            return "None";
        if (value instanceof double[] arr) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < arr.length; i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(formatScalar(arr[i]));
            }
            return sb.append(']').toString();
        }
        return formatScalar((Double) value);
    }

    private static String formatScalar(double d) {
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15)
            return Long.toString((long) d);
        return Double.toString(d);
    }

    private static double[] array(Object value) {
        if (value instanceof double[] arr)
            return arr;
        if (value == null)
            throw new IllegalArgumentException("Value is not set");
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
}
