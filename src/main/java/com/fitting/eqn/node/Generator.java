package com.fitting.eqn.node;

import com.fitting.eqn.api.Visitor;
import com.fitting.eqn.engine.Clock;
import com.fitting.eqn.error.EvaluationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Leaf that creates or refreshes another literal on demand.
 *
 * Some quantities are awkward to express with arguments and operators (a
 * profile computed by an external calculator, say). A generator wraps such a
 * computation: {@link #regenerate(Literal)} produces the literal, and the
 * generator forwards reads to it.
 *
 * The generator's args are literals it depends on purely for change
 * propagation; they are not evaluated by the generator itself but are reported
 * by the ArgFinder. When to regenerate is decided by the
 * {@link RegenerationPolicy} given at construction; there is no default.
 */
public abstract non-sealed class Generator extends Literal {
    private final RegenerationPolicy policy;
    private final List<Literal> args = new ArrayList<>();
    private final Clock lookout = new Clock();
    private Literal literal;

    protected Generator(String name, RegenerationPolicy policy) {
        super(name);
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Produces the literal this generator stands for.
     *
     * @param previous The literal produced last time, or null. Returning the
     *                 same instance after updating it in place is allowed.
     */
    protected abstract Literal regenerate(Literal previous);

    /** Registers a dependency for change propagation. */
    public Generator addLiteral(Literal dependency) {
        args.add(Objects.requireNonNull(dependency, "dependency"));
        clock.addSubject(dependency.clock());
        clock.click();
        return this;
    }

    public List<Literal> args() {
        return Collections.unmodifiableList(args);
    }

    /** The most recently generated literal, or null. */
    public Literal literal() {
        return literal;
    }

    public RegenerationPolicy policy() {
        return policy;
    }

    /**
     * Replaces every reference to {@code old} among the args.
     *
     * @return The number of references replaced.
     */
    public int replace(Literal old, Literal replacement) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == old) {
                args.set(i, replacement);
                count++;
            }
        }
        if (count > 0) {
            clock.removeSubject(old.clock());
            clock.addSubject(replacement.clock());
            clock.click();
        }
        return count;
    }

    /**
     * Regenerates the literal if the policy allows it for this observer.
     *
     * @return true if regeneration happened.
     */
    public final boolean generate(Clock observer) {
        if (!policy.shouldRegenerate(this, observer))
            return false;
        Literal previous = literal;
        Literal next = regenerate(previous);
        if (next != previous) {
            if (previous != null)
                clock.removeSubject(previous.clock());
            if (next != null)
                clock.addSubject(next.clock());
            literal = next;
        }
        clock.click();
        return true;
    }

    @Override
    public Object getValue() {
        generate(lookout);
        lookout.observe(clock);
        Literal current = literal;
        if (current == null)
            throw new EvaluationException(name() == null ? "generator" : name(), "no literal has been generated");
        return current.getValue();
    }

    @Override
    public void identify(Visitor visitor) {
        generate(visitor.clock());
        visitor.onGenerator(this);
    }
}
