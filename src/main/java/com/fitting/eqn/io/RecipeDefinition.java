package com.fitting.eqn.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a fitting recipe: a tree of organizers with their
 * parameters, constraints and restraints.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RecipeDefinition {
    private OrganizerDef recipe;

    /** One organizer; sub-organizers nest recursively. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class OrganizerDef {
        private String name;
        private List<ParameterDef> parameters;
        private List<OrganizerDef> organizers;
        private List<ConstraintDef> constraints;
        private List<RestraintDef> restraints;
    }

    /** A parameter; {@code value} is a number or an array of numbers. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ParameterDef {
        private String name;
        private Object value;
        @JsonProperty("const")
        private boolean constant;
        private Double lowerBound, upperBound;
    }

    /** {@code parameter = equation}, both resolved in the enclosing organizer. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConstraintDef {
        private String parameter, equation;
    }

    /** Missing upper bound defaults to the lower bound, missing sigma to 1. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class RestraintDef {
        private String equation;
        private Double lowerBound, upperBound, sigma;
    }
}
