package com.fitting.eqn.visitor;

import com.fitting.eqn.dsl.EquationFactory;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.fn.Functions;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Operator;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class PrinterTest {

    private EquationFactory factory;

    @Before
    public void setUp() {
        factory = new EquationFactory();
        factory.registerArgument("a", new Argument("a", 1.0));
        factory.registerArgument("b", new Argument("b", 2.0));
        factory.registerArgument("c", new Argument("c", 3.0));
    }

    private String print(String text) {
        return Visitors.prettyPrint(factory.build(text).root());
    }

    @Test
    public void testInfixIsParenthesized() {
        assertEquals("(a + b)", print("a+b"));
        assertEquals("(a + (b * c))", print("a + b*c"));
        assertEquals("((a + b) * c)", print("(a + b) * c"));
        assertEquals("(a ** 2)", print("a**2"));
        assertEquals("(a % b)", print("a % b"));
    }

    @Test
    public void testPrefixAndConstants() {
        assertEquals("(-(a + b))", print("-(a+b)"));
        assertEquals("(-a)", print("-a"));
        assertEquals("(a * -2)", print("a * -2"));
        assertEquals("(a / 0.5)", print("a / 0.5"));
    }

    @Test
    public void testCallNotation() {
        factory.registerFunction("scale", FunctionDef.of("scale", 1, (args, kw) -> args[0], "factor"));
        assertEquals("sin(a)", print("sin(a)"));
        assertEquals("maximum(a, (b + 1))", print("maximum(a, b + 1)"));
        assertEquals("scale(a, factor=2)", print("scale(a, factor=2)"));
    }

    @Test
    public void testHiddenNamesPrintValues() {
        Argument hidden = new Argument("_hidden", 3.0);
        Argument anonymous = new Argument(null, 2.5, false);
        Operator op = Operator.of(Functions.ADD, hidden, anonymous);
        assertEquals("(3 + 2.5)", Printer.print(op));
    }

    @Test
    public void testMissingChildAndCycle() {
        Operator op = new Operator(Functions.ADD);
        op.addLiteral(new Argument("a", 1.0));
        op.addLiteral(null);
        assertEquals("(a + ?)", Printer.print(op));

        Operator loop = new Operator("loop", Functions.ADD);
        loop.addLiteral(new Argument("a", 1.0));
        loop.addLiteral(loop);
        assertEquals("(a + <cycle loop>)", Printer.print(loop));
    }

    @Test
    public void testGroupDetection() {
        assertTrue(Printer.isGroup("(a + b)"));
        assertTrue(Printer.isGroup("((a))"));
        assertFalse(Printer.isGroup("(a) + (b)"));
        assertFalse(Printer.isGroup("(a + b) * (c + d)"));
        assertFalse(Printer.isGroup("a"));
        assertFalse(Printer.isGroup("-(a)"));
    }
}
