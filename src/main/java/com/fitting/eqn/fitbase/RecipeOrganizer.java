package com.fitting.eqn.fitbase;

import com.fitting.eqn.api.Organizer;
import com.fitting.eqn.api.Refinable;
import com.fitting.eqn.dsl.EquationFactory;
import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.error.ConflictException;
import com.fitting.eqn.fn.FunctionDef;
import com.fitting.eqn.node.Equation;
import com.fitting.eqn.node.Literal;
import com.fitting.eqn.visitor.Visitors;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Organizer that owns parameters, sub-organizers, constraints and restraints
 * and builds their equations with its own {@link EquationFactory}.
 *
 * <p>
 * <b>Namespace:</b> Parameters and sub-organizers share one namespace. Every
 * parameter added here is registered in the factory, so equation text passed
 * to {@link #constrain(Refinable, String)} and {@link #restrain(String, double)}
 * can refer to it by name.
 *
 * <p>
 * <b>Ownership:</b> Constraints and restraints belong to the organizer that
 * created them. {@link #getConstraints()} and {@link #getRestraints()} report
 * the union over the whole tree, but only the owner can remove them.
 *
 * <p>
 * <b>Change tracking:</b> The organizer's clock observes every parameter and
 * sub-organizer it holds, and clicks on every structural change.
 */
@Log4j2
public class RecipeOrganizer implements Organizer {
    private final String name;
    private final Clock clock = new Clock();
    private final EquationFactory factory = new EquationFactory();

    private final Map<String, Refinable> parameters = new LinkedHashMap<>();
    private final Map<String, Organizer> organizers = new LinkedHashMap<>();
    private final Map<Parameter, Constraint> constraints = new LinkedHashMap<>();
    private final Set<Restraint> restraints = new LinkedHashSet<>();

    public RecipeOrganizer(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    /** The factory that builds this organizer's equations. */
    public EquationFactory factory() {
        return factory;
    }

    /**
     * Adds a parameter. Adding the same object twice is a no-op.
     *
     * @throws ConflictException if the parameter has no name, or the name is
     *                           taken by another parameter or organizer.
     */
    public <P extends Refinable> P addParameter(P parameter) {
        Objects.requireNonNull(parameter, "parameter");
        String key = parameter.name();
        if (key == null || key.isEmpty())
            throw new ConflictException("Cannot add an unnamed parameter to '" + name + "'");
        if (parameters.get(key) == parameter)
            return parameter;
        checkFree(key);
        parameters.put(key, parameter);
        factory.registerArgument(key, parameter.parameter());
        clock.addSubject(parameter.clock());
        clock.click();
        return parameter;
    }

    /** Creates and adds a parameter. */
    public Parameter newParameter(String parameterName, Object value) {
        return addParameter(new Parameter(parameterName, value));
    }

    /**
     * Removes a parameter added to this organizer.
     *
     * @return false if it was not registered here.
     */
    public boolean removeParameter(Refinable parameter) {
        String key = parameter.name();
        if (parameters.get(key) != parameter)
            return false;
        parameters.remove(key);
        factory.deregisterArgument(key);
        // A proxy shares its parameter's clock.
        boolean shared = parameters.values().stream().anyMatch(p -> p.clock() == parameter.clock());
        if (!shared)
            clock.removeSubject(parameter.clock());
        clock.click();
        return true;
    }

    /** Parameter registered here under {@code parameterName}, or null. */
    public Refinable get(String parameterName) {
        return parameters.get(parameterName);
    }

    /** Sub-organizer registered here under {@code organizerName}, or null. */
    public Organizer getOrganizer(String organizerName) {
        return organizers.get(organizerName);
    }

    /**
     * Adds a sub-organizer. Adding the same object twice is a no-op.
     *
     * @throws IllegalArgumentException if {@code organizer} is null, is this
     *                                  organizer, or already contains it.
     * @throws ConflictException        if it has no name, or its name is
     *                                  already taken.
     */
    public <O extends Organizer> O addOrganizer(O organizer) {
        if (organizer == null)
            throw new IllegalArgumentException("Cannot add a null organizer to '" + name + "'");
        if (organizer == this)
            throw new IllegalArgumentException("Organizer '" + name + "' cannot contain itself");
        String key = organizer.name();
        if (key == null || key.isEmpty())
            throw new ConflictException("Cannot add an unnamed organizer to '" + name + "'");
        if (organizers.get(key) == organizer)
            return organizer;
        if (reaches(organizer, Collections.newSetFromMap(new IdentityHashMap<>())))
            throw new IllegalArgumentException(
                    "Organizer '" + key + "' already contains '" + name + "'");
        checkFree(key);
        organizers.put(key, organizer);
        clock.addSubject(organizer.clock());
        clock.click();
        return organizer;
    }

    private boolean reaches(Organizer from, Set<Organizer> seen) {
        if (!seen.add(from))
            return false;
        for (Organizer child : from.getOrganizers().values()) {
            if (child == this || reaches(child, seen))
                return true;
        }
        return false;
    }

    private void checkFree(String key) {
        if (parameters.containsKey(key) || organizers.containsKey(key))
            throw new ConflictException("The name '" + key + "' is already used in '" + name + "'");
    }

    /** Makes a function callable from this organizer's equations. */
    public void registerFunction(String functionName, FunctionDef def) {
        factory.registerFunction(functionName, def);
    }

    public Constraint constrain(Refinable parameter, String expression) {
        return constrain(parameter, expression, Map.of());
    }

    /**
     * Constrains a parameter to the value of an equation.
     *
     * @param namespace Extra names for this equation only.
     * @throws com.fitting.eqn.error.ConstraintConflictException if the
     *         parameter is constant, already constrained, or used by the
     *         equation.
     */
    public Constraint constrain(Refinable parameter, String expression, Map<String, ? extends Literal> namespace) {
        return bindConstraint(parameter, factory.build(expression, namespace));
    }

    /** Constrains the parameter registered here as {@code parameterName}. */
    public Constraint constrain(String parameterName, String expression) {
        return constrain(lookup(parameterName), expression, Map.of());
    }

    public Constraint constrain(String parameterName, String expression, Map<String, ? extends Literal> namespace) {
        return constrain(lookup(parameterName), expression, namespace);
    }

    /** Constrains a parameter to a prebuilt equation, which is validated first. */
    public Constraint constrain(Refinable parameter, Equation equation) {
        Visitors.validate(equation.root());
        return bindConstraint(parameter, equation);
    }

    /** Makes {@code parameter} follow {@code source}. */
    public Constraint constrain(Refinable parameter, Refinable source) {
        return bindConstraint(parameter, Equation.of(source.parameter()));
    }

    private Constraint bindConstraint(Refinable parameter, Equation equation) {
        Constraint constraint = new Constraint();
        constraint.constrain(parameter.parameter(), equation);
        constraints.put(parameter.parameter(), constraint);
        clock.click();
        log.debug("'{}' constrained '{}' to '{}'", name, parameter.name(), equation);
        return constraint;
    }

    /**
     * Removes constraints created by this organizer. Parameters constrained
     * elsewhere are left alone.
     */
    public void unconstrain(Refinable... pars) {
        for (Refinable p : pars) {
            Constraint constraint = constraints.remove(p.parameter());
            if (constraint == null) {
                log.warn("'{}' does not own a constraint on '{}', ignoring", name, p.name());
                continue;
            }
            constraint.unconstrain();
        }
        clock.click();
    }

    /**
     * Removes every constraint this organizer owns, and those of
     * sub-organizers when {@code recurse} is set.
     */
    public void clearConstraints(boolean recurse) {
        for (Constraint constraint : constraints.values())
            constraint.unconstrain();
        constraints.clear();
        if (recurse) {
            for (Organizer organizer : organizers.values())
                if (organizer instanceof RecipeOrganizer sub)
                    sub.clearConstraints(true);
        }
        clock.click();
    }

    /** Restrains an expression to exactly {@code value}. */
    public Restraint restrain(String expression, double value) {
        return restrain(expression, value, value, 1, Map.of());
    }

    public Restraint restrain(String expression, double lowerBound, double upperBound) {
        return restrain(expression, lowerBound, upperBound, 1, Map.of());
    }

    public Restraint restrain(String expression, double lowerBound, double upperBound, double sigma) {
        return restrain(expression, lowerBound, upperBound, sigma, Map.of());
    }

    /**
     * Restrains the value of an expression between bounds.
     *
     * @throws com.fitting.eqn.error.RestraintDomainException if sigma is zero or NaN.
     */
    public Restraint restrain(String expression, double lowerBound, double upperBound, double sigma,
            Map<String, ? extends Literal> namespace) {
        return addRestraint(new Restraint(factory.build(expression, namespace), lowerBound, upperBound, sigma));
    }

    /** Restrains a prebuilt equation, which is validated first. */
    public Restraint restrain(Equation equation, double lowerBound, double upperBound, double sigma) {
        Visitors.validate(equation.root());
        return addRestraint(new Restraint(equation, lowerBound, upperBound, sigma));
    }

    public Restraint restrain(Refinable parameter, double lowerBound, double upperBound, double sigma) {
        return addRestraint(new Restraint(Equation.of(parameter.parameter()), lowerBound, upperBound, sigma));
    }

    private Restraint addRestraint(Restraint restraint) {
        restraints.add(restraint);
        clock.click();
        log.debug("'{}' added {}", name, restraint);
        return restraint;
    }

    public void unrestrain(Restraint... toRemove) {
        for (Restraint restraint : toRemove) {
            if (!restraints.remove(restraint))
                log.warn("'{}' does not own {}, ignoring", name, restraint);
        }
        clock.click();
    }

    public void clearRestraints(boolean recurse) {
        restraints.clear();
        if (recurse) {
            for (Organizer organizer : organizers.values())
                if (organizer instanceof RecipeOrganizer sub)
                    sub.clearRestraints(true);
        }
        clock.click();
    }

    @Override
    public Map<String, Refinable> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    @Override
    public Map<String, Organizer> getOrganizers() {
        return Collections.unmodifiableMap(organizers);
    }

    @Override
    public Map<Parameter, Constraint> getConstraints() {
        Map<Parameter, Constraint> all = new LinkedHashMap<>(constraints);
        for (Organizer organizer : organizers.values())
            organizer.getConstraints().forEach(all::putIfAbsent);
        return all;
    }

    @Override
    public Set<Restraint> getRestraints() {
        Set<Restraint> all = new LinkedHashSet<>(restraints);
        for (Organizer organizer : organizers.values())
            all.addAll(organizer.getRestraints());
        return all;
    }

    @Override
    public List<Parameter> getFreeParameters() {
        List<Parameter> free = new ArrayList<>();
        collectFree(this, free, Collections.newSetFromMap(new IdentityHashMap<>()));
        return free;
    }

    private static void collectFree(Organizer organizer, List<Parameter> free, Set<Parameter> seen) {
        for (Refinable r : organizer.getParameters().values()) {
            Parameter p = r.parameter();
            if (!p.isConst() && !p.isConstrained() && seen.add(p))
                free.add(p);
        }
        for (Organizer sub : organizer.getOrganizers().values())
            collectFree(sub, free, seen);
    }

    /** Sum of the penalties of every restraint in the tree. */
    public double totalPenalty() {
        double total = 0;
        for (Restraint restraint : getRestraints())
            total += restraint.penalty();
        return total;
    }

    private Refinable lookup(String parameterName) {
        Refinable p = parameters.get(parameterName);
        if (p == null)
            throw new IllegalArgumentException("No parameter '" + parameterName + "' in '" + name + "'");
        return p;
    }

    @Override
    public String toString() {
        return "RecipeOrganizer(" + name + ")";
    }
}
