package org.mozilla.automation.etp.sync;

/**
 * What a run did with a bug.
 */
public enum Outcome {
    SKIPPED_NOT_ACTIONABLE("skipped-not-actionable"),
    SKIPPED_INCOMPLETE("skipped-incomplete"),
    SKIPPED_MALFORMED("skipped-malformed"),
    SKIPPED_CONFLICT("skipped-conflict"),
    APPLIED("applied"),
    APPLIED_AND_CLOSED("applied-and-closed"),
    FAILED("failed");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static Outcome fromParseStatus(ParseResult.Status status) {
        return switch (status) {
            case NOT_ACTIONABLE -> SKIPPED_NOT_ACTIONABLE;
            case INCOMPLETE -> SKIPPED_INCOMPLETE;
            case MALFORMED -> SKIPPED_MALFORMED;
            case ACTIONABLE -> throw new IllegalArgumentException("Actionable bugs have no skip outcome");
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
