package com.fitting.eqn.visitor;

import com.fitting.eqn.error.StructuralException;
import com.fitting.eqn.node.Argument;
import com.fitting.eqn.node.Literal;

import java.util.List;
import java.util.Set;

/**
 * Entry points for the standard traversals.
 */
public final class Visitors {
    private Visitors() {
        // Utility class
    }

    /**
     * Arguments reachable from {@code literal}, depth-first.
     *
     * @param getConsts Whether constant arguments are included.
     */
    public static Set<Argument> getArgs(Literal literal, boolean getConsts) {
        ArgFinder finder = new ArgFinder(getConsts);
        literal.identify(finder);
        return finder.args();
    }

    /** Equation text for {@code literal}. */
    public static String prettyPrint(Literal literal) {
        return Printer.print(literal);
    }

    /**
     * Validates a graph, cycles included.
     *
     * @throws StructuralException listing every problem found.
     */
    public static void validate(Literal literal) {
        Validator validator = new Validator(true);
        literal.identify(validator);
        List<String> errors = validator.errors();
        if (!errors.isEmpty())
            throw new StructuralException(describe(literal), errors);
    }

    /**
     * Swaps {@code old} for {@code replacement} in the graph rooted at
     * {@code root}. Changes happen in place, see {@link Swapper} for the
     * sharing hazard.
     *
     * @return The root to use from now on: {@code replacement} if {@code root}
     *         was {@code old}, otherwise {@code root}.
     */
    public static Literal swap(Literal root, Literal old, Literal replacement) {
        if (root == old)
            return replacement;
        root.identify(new Swapper(old, replacement));
        return root;
    }

    /** True if {@code target} is reachable from {@code root}, through constraints too. */
    public static boolean contains(Literal root, Literal target) {
        NodeFinder finder = new NodeFinder(target);
        root.identify(finder);
        return finder.found();
    }

    // The printer would recurse into the same cycle the validator is reporting.
    private static String describe(Literal literal) {
        return literal.name() != null && !literal.name().isEmpty() ? literal.name() : literal.toString();
    }
}
