package com.fitting.eqn.error;

/**
 * Evaluation of a node failed. Carries the name of the failing node; it is
 * never retried or swallowed by the graph.
 */
public class EvaluationException extends EquationException {
    private final String nodeName;

    public EvaluationException(String nodeName, String message) {
        super("Error evaluating '" + nodeName + "': " + message);
        this.nodeName = nodeName;
    }

    public EvaluationException(String nodeName, Throwable cause) {
        super("Error evaluating '" + nodeName + "': " + cause.getMessage(), cause);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
