package com.fitting.eqn.api;

import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.fitbase.Constraint;
import com.fitting.eqn.fitbase.Parameter;
import com.fitting.eqn.fitbase.Restraint;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A hierarchical owner of parameters, sub-organizers, constraints and
 * restraints.
 *
 * An organizer's clock observes every parameter and sub-organizer it holds,
 * so {@code organizer.clock().isAtLeast(p.clock())} holds for every reachable
 * parameter and an optimizer can tell whether anything changed since it last
 * looked with a single comparison.
 */
public interface Organizer {

    String name();

    Clock clock();

    /** Parameters registered directly with this organizer, by name. */
    Map<String, Refinable> getParameters();

    /** Sub-organizers registered directly with this organizer, by name. */
    Map<String, Organizer> getOrganizers();

    /** Constraints owned by this organizer and all descendants, by target. */
    Map<Parameter, Constraint> getConstraints();

    /** Restraints owned by this organizer and all descendants. */
    Set<Restraint> getRestraints();

    /** Non-constant, unconstrained parameters of this organizer and all descendants. */
    List<Parameter> getFreeParameters();
}
