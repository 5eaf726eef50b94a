package com.fitting.eqn.io;

import com.fitting.eqn.api.Refinable;
import com.fitting.eqn.error.NameResolutionException;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.fitbase.RecipeOrganizer;
import com.fitting.eqn.fitbase.Restraint;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;

public class RecipeLoaderTest {

    private static Path resource(String name) throws Exception {
        return Paths.get(RecipeLoaderTest.class.getResource(name).toURI());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        RecipeOrganizer fit = RecipeLoader.load(resource("/recipes/two-phase.json"));
        assertEquals("fit", fit.name());
        assertEquals(4, fit.getParameters().size());

        Refinable scale = fit.get("scale");
        assertEquals(1.0, scale.doubleValue(), 0.0);
        assertEquals(0.0, scale.lowerBound(), 0.0);
        assertEquals(10.0, scale.upperBound(), 0.0);
        assertTrue(fit.get("wavelength").isConst());
        assertEquals(Double.NEGATIVE_INFINITY, fit.get("offset").lowerBound(), 0.0);

        RecipeOrganizer phase = (RecipeOrganizer) fit.getOrganizer("phase");
        assertNotNull(phase);
        assertArrayEquals(new double[] { 1, 0.5, 0.25 }, (double[]) phase.get("occupancy").getValue(), 0.0);

        // Constraints from both levels
        assertEquals(2, fit.getConstraints().size());
        assertEquals(0.25, fit.get("ratio").doubleValue(), 0.0);
        assertEquals(3.9, phase.get("b").doubleValue(), 0.0);

        // scale + offset = 1.5 is 0.5 above its bound; a = 3.9 is 0.1 above with sigma 0.1
        assertEquals(2, fit.getRestraints().size());
        assertEquals(1.5, fit.totalPenalty(), 1e-9);

        List<Parameter> free = fit.getFreeParameters();
        assertEquals(4, free.size());
        assertEquals(List.of("scale", "offset", "a", "occupancy"), free.stream().map(Parameter::name).toList());
    }

    @Test
    public void testParseDefaults() {
        RecipeDefinition def = RecipeLoader.parse("""
                {"recipe": {"name": "r",
                            "parameters": [{"name": "x", "value": 2}],
                            "restraints": [{"equation": "x", "lowerBound": 1}],
                            "unknown": 42}}
                """);
        assertEquals("r", def.getRecipe().getName());
        assertNull(def.getRecipe().getOrganizers());

        RecipeOrganizer r = RecipeLoader.compile(def);
        Restraint restraint = r.getRestraints().iterator().next();
        assertEquals(1.0, restraint.upperBound(), 0.0);
        assertEquals(1.0, restraint.sigma(), 0.0);
        assertEquals(1.0, restraint.penalty(), 0.0);
    }

    @Test
    public void testMissingRecipeKey() {
        try {
            RecipeLoader.parse("{\"graph\": {}}");
            fail("Should throw IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("recipe"));
        }
    }

    @Test
    public void testMalformedJson() {
        try {
            RecipeLoader.parse("{\"recipe\": ");
            fail("Should throw IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertNotNull(e.getCause());
        }
    }

    @Test
    public void testUnresolvedEquation() {
        RecipeDefinition def = RecipeLoader.parse("""
                {"recipe": {"name": "r",
                            "parameters": [{"name": "x", "value": 2}],
                            "constraints": [{"parameter": "x", "equation": "y + 1"}]}}
                """);
        try {
            RecipeLoader.compile(def);
            fail("Should throw NameResolutionException");
        } catch (NameResolutionException e) {
            assertEquals(List.of("y"), e.names());
        }
    }
}
