package com.fitting.eqn.node;

import com.fitting.eqn.engine.Clock;

/**
 * Decides whether a {@link Generator} may regenerate its literal.
 *
 * The observer clock is supplied by whoever asks: a visitor passes its own
 * clock, a direct read passes the generator's private read clock.
 */
@FunctionalInterface
public interface RegenerationPolicy {

    boolean shouldRegenerate(Generator generator, Clock observer);

    /** Regenerate on every request. */
    RegenerationPolicy ALWAYS = (generator, observer) -> true;

    /** Never regenerate; the literal is managed by hand. */
    RegenerationPolicy NEVER = (generator, observer) -> false;

    /**
     * Regenerate when nothing has been generated yet, or when the generator
     * (including its args) changed since the observer last looked.
     */
    RegenerationPolicy IF_STALE = (generator, observer) -> generator.literal() == null
            || !observer.isAtLeast(generator.clock());
}
