package com.driftql.exception;

/**
 * Exception thrown when an optimizer rule fails while rewriting a plan.
 *
 * <p>A rule that throws this exception leaves the plan structurally valid but
 * possibly partially rewritten; the optimizer stops the current pass and
 * propagates the failure to its caller. No rollback is attempted.
 *
 * @see com.driftql.optimizer.Optimizer
 */
public class OptimizerException extends RuntimeException {

    private final String ruleName;

    /**
     * Creates an optimizer exception.
     *
     * @param message the error message
     * @param ruleName the name of the failing rule
     */
    public OptimizerException(String message, String ruleName) {
        super(message + " (rule: " + ruleName + ")");
        this.ruleName = ruleName;
    }

    /**
     * Creates an optimizer exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param ruleName the name of the failing rule
     */
    public OptimizerException(String message, Throwable cause, String ruleName) {
        super(message + " (rule: " + ruleName + ")", cause);
        this.ruleName = ruleName;
    }

    /**
     * Returns the name of the rule that failed.
     *
     * @return the rule name
     */
    public String getRuleName() {
        return ruleName;
    }
}
