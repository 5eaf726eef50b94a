package com.fitting.eqn.node;

import com.fitting.eqn.error.ConflictException;
import com.fitting.eqn.error.EvaluationException;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.fn.Functions;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class OperatorTest {

    private Argument a;
    private Argument b;
    private Operator sum;

    @Before
    public void setUp() {
        a = new Argument("a", 1.0);
        b = new Argument("b", 2.0);
        sum = Operator.of(Functions.ADD, a, b);
    }

    @Test
    public void testCachedValueIsReused() {
        assertEquals(3.0, (Double) sum.getValue(), 0.0);
        assertEquals(1, sum.evaluationCount());
        assertFalse(sum.isStale());

        assertEquals(3.0, (Double) sum.getValue(), 0.0);
        assertEquals(1, sum.evaluationCount());
    }

    @Test
    public void testChangedLeafInvalidates() {
        sum.getValue();
        a.setValue(5.0);
        assertTrue(sum.isStale());
        assertEquals(7.0, (Double) sum.getValue(), 0.0);
        assertEquals(2, sum.evaluationCount());
    }

    @Test
    public void testSameValueDoesNotInvalidate() {
        sum.getValue();
        a.setValue(1);
        assertFalse(sum.isStale());
        assertEquals(1, sum.evaluationCount());
    }

    @Test
    public void testInvalidationReachesAncestors() {
        Operator twice = Operator.of(Functions.MULTIPLY, sum, Argument.constant(2));
        assertEquals(6.0, (Double) twice.getValue(), 0.0);

        b.setValue(3.0);
        assertTrue(twice.isStale());
        assertTrue(sum.isStale());
        assertEquals(8.0, (Double) twice.getValue(), 0.0);

        // A sibling that does not depend on b stays cached
        Operator other = Operator.of(Functions.NEGATIVE, a);
        other.getValue();
        b.setValue(4.0);
        assertFalse(other.isStale());
    }

    @Test
    public void testConstantRejectsMutation() {
        Argument c = Argument.constant(3);
        try {
            c.setValue(4.0);
            fail("Should throw IllegalStateException for a constant");
        } catch (IllegalStateException e) {
            // expected
        }
        c.setConst(false, 4.0);
        assertEquals(4.0, (Double) c.getValue(), 0.0);
        assertFalse(c.isConst());
    }

    @Test
    public void testChildrenEvaluatedPositionalThenKeyword() {
        List<String> order = new ArrayList<>();
        FunctionDef collect = FunctionDef.of("collect", FunctionDef.VARIADIC, (args, kw) -> {
            order.addAll(kw.keySet());
            return (double) args.length;
        }, "z", "y");
        Operator op = new Operator(collect);
        op.addLiteral(new Recording("first", order));
        op.addKeyword("z", new Recording("kw-z", order));
        op.addLiteral(new Recording("second", order));
        op.addKeyword("y", new Recording("kw-y", order));

        assertEquals(2.0, (Double) op.getValue(), 0.0);
        assertEquals(List.of("first", "second", "kw-z", "kw-y", "z", "y"), order);
    }

    @Test
    public void testDuplicateKeywordRejected() {
        Operator op = new Operator(FunctionDef.of("f", 0, (args, kw) -> 0.0, "k"));
        op.addKeyword("k", a);
        try {
            op.addKeyword("k", b);
            fail("Should throw ConflictException for a duplicate keyword");
        } catch (ConflictException e) {
            assertTrue(e.getMessage().contains("'k'"));
        }
    }

    @Test
    public void testFailureCarriesOperatorName() {
        FunctionDef boom = FunctionDef.of("boom", 1, (args, kw) -> {
            throw new ArithmeticException("bad input");
        });
        Operator op = new Operator("blowup", boom).addLiteral(a);
        try {
            op.getValue();
            fail("Should throw EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("blowup", e.nodeName());
            assertTrue(e.getCause() instanceof ArithmeticException);
        }
    }

    @Test
    public void testFailureInChildPropagatesUnchanged() {
        Operator broken = new Operator(Functions.ADD).addLiteral(a);
        Operator parent = Operator.of(Functions.MULTIPLY, broken, b);
        try {
            parent.getValue();
            fail("Should throw EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("add", e.nodeName());
        }
    }

    @Test
    public void testArrayValuesBroadcast() {
        Argument v = new Argument("v", new double[] { 1, 2, 3 }, false);
        Operator scaled = Operator.of(Functions.MULTIPLY, v, Argument.constant(2));
        assertArrayEquals(new double[] { 2, 4, 6 }, (double[]) scaled.getValue(), 0.0);

        v.setValue(List.of(1, 1));
        assertTrue(scaled.isStale());
        assertArrayEquals(new double[] { 2, 2 }, (double[]) scaled.getValue(), 0.0);

        Operator mismatch = Operator.of(Functions.ADD, v, new Argument("w", new double[] { 1, 2, 3 }, false));
        try {
            mismatch.getValue();
            fail("Should throw EvaluationException for a shape mismatch");
        } catch (EvaluationException e) {
            assertTrue(e.getMessage().contains("Shape mismatch"));
        }
    }

    @Test
    public void testFlooredRemainder() {
        Operator op = Operator.of(Functions.REMAINDER, Argument.constant(-7), Argument.constant(3));
        assertEquals(2.0, (Double) op.getValue(), 0.0);
    }

    @Test
    public void testSetArgumentRewiresDependency() {
        sum.getValue();
        Argument c = new Argument("c", 10.0);
        sum.setArgument(1, c);
        assertTrue(sum.isStale());
        assertEquals(11.0, (Double) sum.getValue(), 0.0);

        b.setValue(100.0);
        assertFalse(sum.isStale());
        assertFalse(sum.clock().hasSubject(b.clock()));

        // a is still referenced, so replacing one of two slots keeps the subscription
        Operator square = Operator.of(Functions.MULTIPLY, a, a);
        assertEquals(0, square.replace(b, c));
        square.setArgument(0, c);
        assertTrue(square.clock().hasSubject(a.clock()));
    }

    /** Leaf that records when it is read. */
    private static final class Recording extends Generator {
        private final List<String> log;

        Recording(String name, List<String> log) {
            super(name, RegenerationPolicy.IF_STALE);
            this.log = log;
        }

        @Override
        protected Literal regenerate(Literal previous) {
            return Argument.constant(0);
        }

        @Override
        public Object getValue() {
            log.add(name());
            return super.getValue();
        }
    }

    @Test
    public void testWritingIntoArrayResultLeavesCacheIntact() {
        Argument v = new Argument("v", new double[] { 1, 2, 3 }, false);
        Operator neg = Operator.of(Functions.NEGATIVE, v);

        double[] first = (double[]) neg.getValue();
        first[0] = 99;

        double[] second = (double[]) neg.getValue();
        assertEquals(-1.0, second[0], 0.0);
        assertNotSame(first, second);
        assertEquals(1, neg.evaluationCount());
    }
}
