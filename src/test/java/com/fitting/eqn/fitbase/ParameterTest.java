package com.fitting.eqn.fitbase;

import com.fitting.eqn.api.Attributed;
import com.fitting.eqn.fn.Functions;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.node.Operator;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ParameterTest {

    /** External object holding a value. */
    private static final class Holder {
        double x;
    }

    @Test
    public void testNames() {
        assertEquals("a_1", new Parameter("a_1", 1.0).name());
        assertEquals("", new Parameter("", 1.0).name());
        for (String bad : new String[] { "1a", "a b", "a-b", "a.b" }) {
            try {
                new Parameter(bad, 1.0);
                fail("Should reject name '" + bad + "'");
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test
    public void testBounds() {
        Parameter p = new Parameter("p", 1.0);
        assertEquals(Double.NEGATIVE_INFINITY, p.lowerBound(), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, p.upperBound(), 0.0);

        assertSame(p, p.boundRange(0, 5));
        assertEquals(0.0, p.lowerBound(), 0.0);
        assertEquals(5.0, p.upperBound(), 0.0);
    }

    @Test
    public void testConstAndValues() {
        Parameter p = new Parameter("p", 1.0, true);
        assertTrue(p.isConst());
        assertSame(p, p.parameter());
        try {
            p.setValue(2.0);
            fail("Should throw IllegalStateException for a constant parameter");
        } catch (IllegalStateException e) {
            // expected
        }
        p.setConst(false, 2.0);
        p.setValue(3);
        assertEquals(3.0, p.doubleValue(), 0.0);

        Parameter unset = new Parameter("u");
        assertNull(unset.getValue());
    }

    @Test
    public void testProxyDelegatesEverythingButName() {
        Parameter p = new Parameter("p", 1.0);
        ParameterProxy proxy = new ParameterProxy("alias", p);

        assertEquals("alias", proxy.name());
        assertSame(p, proxy.parameter());
        assertSame(p.clock(), proxy.clock());

        proxy.setValue(3.0);
        assertEquals(3.0, p.doubleValue(), 0.0);
        p.setValue(4.0);
        assertEquals(4.0, proxy.doubleValue(), 0.0);

        proxy.setBounds(-1, 1);
        assertEquals(-1.0, p.lowerBound(), 0.0);
        assertEquals(1.0, proxy.upperBound(), 0.0);

        p.setConst(true);
        assertTrue(proxy.isConst());
    }

    @Test
    public void testWrapperWithAccessors() {
        Holder holder = new Holder();
        holder.x = 2.0;
        ParameterWrapper<Holder> w = ParameterWrapper.of("x", holder, h -> h.x, (h, v) -> h.x = (Double) v);

        assertEquals(2.0, w.doubleValue(), 0.0);
        holder.x = 7.0;
        assertEquals(7.0, w.doubleValue(), 0.0);

        long before = w.clock().state();
        w.setValue(4);
        assertEquals(4.0, holder.x, 0.0);
        assertTrue(w.clock().state() > before);

        // Unchanged writes do not click
        before = w.clock().state();
        w.setValue(4.0);
        assertEquals(before, w.clock().state());
    }

    @Test
    public void testWrapperNeedsBothAccessors() {
        try {
            ParameterWrapper.of("x", new Holder(), h -> h.x, null);
            fail("Should throw IllegalArgumentException without a setter");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("getter and a setter"));
        }
    }

    @Test
    public void testWrapperOnMapAndAttributed() {
        Map<String, Object> map = new HashMap<>();
        map.put("scale", 2.0);
        ParameterWrapper<Map<String, Object>> fromMap = ParameterWrapper.ofAttribute("scale", map, "scale");
        assertEquals(2.0, fromMap.doubleValue(), 0.0);
        fromMap.setValue(5);
        assertEquals(5.0, map.get("scale"));

        Map<String, Object> backing = new HashMap<>();
        Attributed attributed = new Attributed() {
            @Override
            public Object getAttribute(String key) {
                return backing.get(key);
            }

            @Override
            public void setAttribute(String key, Object value) {
                backing.put(key, value);
            }
        };
        ParameterWrapper<Attributed> fromAttr = ParameterWrapper.ofAttribute("delta", attributed, "delta");
        assertNull(fromAttr.getValue());
        fromAttr.setValue(1.5);
        assertEquals(1.5, backing.get("delta"));

        try {
            ParameterWrapper.ofAttribute("len", "text", "len");
            fail("Should throw IllegalArgumentException for an unaddressable object");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testWrapperInsideEquation() {
        Holder holder = new Holder();
        holder.x = 1.0;
        ParameterWrapper<Holder> w = ParameterWrapper.of("x", holder, h -> h.x, (h, v) -> h.x = (Double) v);
        Operator op = Operator.of(Functions.ADD, w, Argument.constant(1));
        assertEquals(2.0, (Double) op.getValue(), 0.0);

        w.setValue(5.0);
        assertTrue(op.isStale());
        assertEquals(6.0, (Double) op.getValue(), 0.0);
    }

    @Test
    public void testConstrainedWrapperPushesIntoObject() {
        Holder holder = new Holder();
        ParameterWrapper<Holder> w = ParameterWrapper.of("x", holder, h -> h.x, (h, v) -> h.x = (Double) v);
        Parameter source = new Parameter("source", 3.0);
        new Constraint().constrain(w, Equation.of(source));
        assertEquals(3.0, holder.x, 0.0);

        source.setValue(9.0);
        assertEquals(9.0, w.doubleValue(), 0.0);
        assertEquals(9.0, holder.x, 0.0);
    }
}
