package com.driftql.optimizer;

/**
 * Outcome of a successful {@link OptimizerRule} application.
 *
 * @param keepOriginal whether the input plan remains a candidate
 */
public record RuleResult(boolean keepOriginal) {

    private static final RuleResult KEEP = new RuleResult(true);
    private static final RuleResult DROP = new RuleResult(false);

    /** The input plan stays a candidate. */
    public static RuleResult keep() {
        return KEEP;
    }

    /** The input plan is superseded by the rule's output plans. */
    public static RuleResult drop() {
        return DROP;
    }
}
