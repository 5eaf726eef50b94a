package com.fitting.eqn.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logical clock used for change tracking in the equation graph.
 *
 * Every node owns exactly one clock. A clock holds a version stamp drawn from a
 * single process-wide counter, so stamps from different clocks are directly
 * comparable: {@code a.isAtLeast(b)} answers "has a observed everything b has
 * produced so far".
 *
 * Propagation Model:
 * A clock may observe other clocks (its subjects). When a subject clicks, the
 * new stamp is pushed to every observer, transitively. Asking whether a node
 * is stale is therefore a single comparison and never walks the graph.
 *
 * Registration Contract:
 * addSubject() only records the dependency. It does not synchronize the
 * stamps. The owner is expected to click() when its structure changes so that
 * whatever depends on it sees the change.
 *
 * Memory:
 * Observers are held weakly. A leaf shared by many short-lived equations does
 * not keep those equations alive.
 *
 * Session Counter:
 * The counter is global for the JVM. resetSession() rewinds it to zero and
 * must only be used when no clock from a previous session will be compared
 * again (e.g. between independent fits in a test suite).
 */
public final class Clock implements Comparable<Clock> {
    private static final AtomicLong COUNTER = new AtomicLong();

    private long state;

    // Clocks that get our stamp pushed to them when we advance.
    private final Set<Clock> observers = Collections.newSetFromMap(new WeakHashMap<>());

    // Clocks whose stamps are pushed to us.
    private final Set<Clock> subjects = new LinkedHashSet<>();

    /** Latest stamp issued in the current session. */
    public static long now() {
        return COUNTER.get();
    }

    /**
     * Rewinds the process-wide counter. Only safe between fitting sessions.
     */
    public static void resetSession() {
        COUNTER.set(0);
    }

    /** Current stamp of this clock. */
    public long state() {
        return state;
    }

    /**
     * Advances this clock past every previously issued stamp and pushes the
     * new stamp to all observers.
     */
    public void click() {
        long next = COUNTER.incrementAndGet();
        state = next;
        notifyObservers(next);
    }

    /**
     * Catches up with another clock without issuing a new stamp.
     */
    public void observe(Clock other) {
        advanceTo(other.state);
    }

    /**
     * Registers {@code other} as a subject: its future clicks are pushed to
     * this clock.
     */
    public void addSubject(Clock other) {
        if (other == this)
            throw new IllegalArgumentException("A clock cannot observe itself");
        subjects.add(other);
        other.observers.add(this);
    }

    public void removeSubject(Clock other) {
        subjects.remove(other);
        other.observers.remove(this);
    }

    public boolean hasSubject(Clock other) {
        return subjects.contains(other);
    }

    public boolean hasObserver(Clock other) {
        return observers.contains(other);
    }

    /** {@code this >= other} */
    public boolean isAtLeast(Clock other) {
        return state >= other.state;
    }

    /** {@code this > other} */
    public boolean isAfter(Clock other) {
        return state > other.state;
    }

    @Override
    public int compareTo(Clock other) {
        return Long.compare(state, other.state);
    }

    private void advanceTo(long stamp) {
        if (state >= stamp)
            return;
        state = stamp;
        notifyObservers(stamp);
    }

    private void notifyObservers(long stamp) {
        if (observers.isEmpty())
            return;
        // Copy: the weak set may drop entries while we iterate.
        for (Clock observer : observers.toArray(new Clock[0])) {
            observer.advanceTo(stamp);
        }
    }

    @Override
    public String toString() {
        return "Clock(" + state + ")";
    }
}
