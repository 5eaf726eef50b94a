package com.fitting.eqn.util;

import com.fitting.eqn.dsl.EquationFactory;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.fitbase.RecipeOrganizer;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Equation;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private EquationFactory factory;

    @Before
    public void setUp() {
        factory = new EquationFactory();
        factory.registerArgument("a", new Argument("a", 1.0));
        factory.registerArgument("b", new Argument("b", 2.0));
    }

    @Test
    public void testExplainListsEveryNodeOnce() {
        GraphExplain explain = new GraphExplain(factory.build("a + b*2"));
        assertEquals(5, explain.nodeCount());

        String text = explain.explain();
        assertTrue(text.startsWith("Equation: (a + (b * 2))"));
        assertTrue(text.contains("[0] add : Operator(add) = 5 <- [1], [2]"));
        assertTrue(text.contains("[4] 2 : Const = 2"));

        assertEquals(2, new GraphExplain(factory.build("a*a")).nodeCount());
    }

    @Test
    public void testExplainReportsFailures() {
        String text = new GraphExplain(factory.build("log(a - 1) + sum(b)")).explain();
        assertTrue(text.contains("Operator(log) = " + Double.NEGATIVE_INFINITY));

        Equation broken = factory.build("a + b");
        ((Argument) factory.getArgument("a")).setValue(new double[] { 1, 2 });
        ((Argument) factory.getArgument("b")).setValue(new double[] { 1, 2, 3 });
        assertTrue(new GraphExplain(broken).explain().contains("<error:"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(factory.build("maximum(a, b) - a")).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("n0[\"subtract<br/>1\"];"));
        assertTrue(mermaid.contains("n0 --> n1;"));
        assertTrue(mermaid.contains("n1 --> n2;"));
        assertTrue(mermaid.contains("n0 --> n2;"));
    }

    @Test
    public void testDumpOrganizer() {
        RecipeOrganizer fit = new RecipeOrganizer("fit");
        fit.newParameter("x", 1.0);
        fit.addParameter(new Parameter("c", 2.0, true));
        Parameter y = fit.newParameter("y", 0.0).boundRange(0, 5);
        fit.constrain(y, "x * 3");
        fit.restrain("x", 0, 0.5);

        RecipeOrganizer phase = fit.addOrganizer(new RecipeOrganizer("phase"));
        phase.newParameter("z", 4.0);
        phase.restrain("z", 1, 2);

        String dump = GraphExplain.dumpOrganizer(fit);
        assertTrue(dump.startsWith("Organizer: fit\n"));
        assertTrue(dump.contains("  x = 1\n"));
        assertTrue(dump.contains("  c = 2 (const)\n"));
        assertTrue(dump.contains("  y = 3 := (x * 3) in [0.0, 5.0]\n"));
        assertTrue(dump.contains("  restraint x in [0.0, 0.5] sigma=1.0\n"));
        assertTrue(dump.contains("  Organizer: phase\n    z = 4\n    restraint z in [1.0, 2.0] sigma=1.0\n"));
        assertEquals(1, dump.split("restraint z", -1).length - 1);
    }
}
