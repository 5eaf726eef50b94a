package com.fitting.eqn.fitbase;

import com.fitting.eqn.dsl.EquationFactory;
import com.fitting.eqn.error.ConflictException;
import com.fitting.eqn.error.ConstraintConflictException;
import com.fitting.eqn.fn.Functions;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.node.Operator;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ConstraintTest {

    private EquationFactory factory;
    private Parameter p1;
    private Parameter p2;

    @Before
    public void setUp() {
        p1 = new Parameter("p1", 1.0);
        p2 = new Parameter("p2", 2.0);
        factory = new EquationFactory();
        factory.registerArgument("p1", p1);
        factory.registerArgument("p2", p2);
    }

    @Test
    public void testConstrainUnconstrainSequence() {
        Constraint c = new Constraint();
        c.constrain(p1, factory.build("2*p2"));
        assertTrue(p1.isConstrained());
        assertSame(c, p1.constraint());
        assertSame(p1, c.parameter());
        assertEquals(4.0, p1.doubleValue(), 0.0);

        p2.setValue(10.0);
        assertEquals(20.0, p1.doubleValue(), 0.0);

        try {
            p1.setValue(5.0);
            fail("Should throw ConstraintConflictException");
        } catch (ConstraintConflictException e) {
            assertTrue(e instanceof ConflictException);
        }

        c.unconstrain();
        assertFalse(p1.isConstrained());
        assertNull(c.parameter());
        // Keeps the last constrained value
        assertEquals(20.0, p1.doubleValue(), 0.0);

        p1.setValue(1.0);
        p2.setValue(3.0);
        assertEquals(1.0, p1.doubleValue(), 0.0);
    }

    @Test
    public void testDependentsSeeConstraintChanges() {
        new Constraint().constrain(p1, factory.build("p2 + 1"));
        Operator usesP1 = Operator.of(Functions.MULTIPLY, p1, Argument.constant(2));
        assertEquals(6.0, (Double) usesP1.getValue(), 0.0);

        p2.setValue(4.0);
        assertTrue(usesP1.isStale());
        assertEquals(10.0, (Double) usesP1.getValue(), 0.0);
        assertEquals(10.0, (Double) usesP1.getValue(), 0.0);
        assertEquals(2, usesP1.evaluationCount());
    }

    @Test
    public void testConstantParameterRejected() {
        Parameter fixed = new Parameter("fixed", 1.0, true);
        try {
            new Constraint().constrain(fixed, factory.build("p2"));
            fail("Should throw ConstraintConflictException");
        } catch (ConstraintConflictException e) {
            assertTrue(e.getMessage().contains("constant"));
        }
    }

    @Test
    public void testDoubleConstraintRejected() {
        new Constraint().constrain(p1, factory.build("2*p2"));
        try {
            new Constraint().constrain(p1, factory.build("3*p2"));
            fail("Should throw ConstraintConflictException");
        } catch (ConstraintConflictException e) {
            assertTrue(e.getMessage().contains("already constrained"));
        }
        assertEquals(4.0, p1.doubleValue(), 0.0);
    }

    @Test
    public void testCircularConstraintRejected() {
        try {
            new Constraint().constrain(p1, factory.build("p1 + 1"));
            fail("Should throw ConstraintConflictException for a direct cycle");
        } catch (ConstraintConflictException e) {
            assertFalse(p1.isConstrained());
        }

        new Constraint().constrain(p1, factory.build("2*p2"));
        try {
            new Constraint().constrain(p2, factory.build("3*p1"));
            fail("Should throw ConstraintConflictException for an indirect cycle");
        } catch (ConstraintConflictException e) {
            assertFalse(p2.isConstrained());
        }
    }

    @Test
    public void testArrayConstraintDoesNotInvalidateOnRead() {
        Parameter v = new Parameter("v", new double[] { 1, 2 });
        Parameter w = new Parameter("w");
        new Constraint().constrain(w, new Equation("v*2", Operator.of(Functions.MULTIPLY, v, Argument.constant(2))));
        Operator usesW = Operator.of(Functions.SUM, w);
        assertEquals(6.0, (Double) usesW.getValue(), 0.0);
        w.getValue();
        assertFalse(usesW.isStale());
    }
}
