package com.fitting.eqn.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.fitbase.RecipeOrganizer;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads JSON recipe definitions and compiles them into organizer trees.
 *
 * <p>
 * Compilation order within an organizer: parameters, sub-organizers,
 * constraints, restraints. Equations are resolved against the parameters of
 * the organizer they are declared in.
 */
@Log4j2
public final class RecipeLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecipeLoader() {
        // Utility class
    }

    /**
     * Parses a JSON string into a RecipeDefinition.
     *
     * @throws IllegalArgumentException if the JSON is malformed or has no
     *                                  {@code recipe} key.
     */
    public static RecipeDefinition parse(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || !root.hasNonNull("recipe"))
                throw new IllegalArgumentException("Missing 'recipe' key");
            return MAPPER.treeToValue(root, RecipeDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid recipe JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file into a RecipeDefinition. */
    public static RecipeDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Reads and compiles a recipe file. */
    public static RecipeOrganizer load(Path path) throws IOException {
        RecipeOrganizer organizer = compile(parseFile(path));
        log.info("Loaded recipe '{}' from {}", organizer.name(), path);
        return organizer;
    }

    /** Builds the organizer tree a definition describes. */
    public static RecipeOrganizer compile(RecipeDefinition definition) {
        if (definition.getRecipe() == null)
            throw new IllegalArgumentException("Missing 'recipe' key");
        return compile(definition.getRecipe());
    }

    private static RecipeOrganizer compile(RecipeDefinition.OrganizerDef def) {
        if (def.getName() == null)
            throw new IllegalArgumentException("Organizer without a name");
        RecipeOrganizer organizer = new RecipeOrganizer(def.getName());

        for (RecipeDefinition.ParameterDef pd : orEmpty(def.getParameters())) {
            Parameter p = new Parameter(pd.getName(), pd.getValue(), pd.isConstant());
            p.setBounds(pd.getLowerBound() == null ? Double.NEGATIVE_INFINITY : pd.getLowerBound(),
                    pd.getUpperBound() == null ? Double.POSITIVE_INFINITY : pd.getUpperBound());
            organizer.addParameter(p);
        }

        for (RecipeDefinition.OrganizerDef sub : orEmpty(def.getOrganizers()))
            organizer.addOrganizer(compile(sub));

        for (RecipeDefinition.ConstraintDef cd : orEmpty(def.getConstraints()))
            organizer.constrain(cd.getParameter(), cd.getEquation());

        for (RecipeDefinition.RestraintDef rd : orEmpty(def.getRestraints())) {
            if (rd.getLowerBound() == null)
                throw new IllegalArgumentException("Restraint on '" + rd.getEquation() + "' has no lowerBound");
            double lb = rd.getLowerBound();
            double ub = rd.getUpperBound() == null ? lb : rd.getUpperBound();
            double sigma = rd.getSigma() == null ? 1 : rd.getSigma();
            organizer.restrain(rd.getEquation(), lb, ub, sigma);
        }

        log.debug("Compiled organizer '{}' ({} parameters, {} sub-organizers)", organizer.name(),
                organizer.getParameters().size(), organizer.getOrganizers().size());
        return organizer;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
