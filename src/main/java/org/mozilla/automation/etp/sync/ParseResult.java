package org.mozilla.automation.etp.sync;

/**
 * Result of reading exception metadata from a bug.
 *
 * @param status classification
 * @param fields structured fields, only present when {@link Status#ACTIONABLE}
 * @param reason explanation when the bug is not actionable
 */
public record ParseResult(Status status, StructuredFields fields, String reason) {

    public enum Status {
        ACTIONABLE,
        /** no diagnosis tag */
        NOT_ACTIONABLE,
        /** diagnosed, but required fields are missing */
        INCOMPLETE,
        /** fields are present but ambiguous or unparseable */
        MALFORMED
    }

    static ParseResult actionable(StructuredFields fields) {
        return new ParseResult(Status.ACTIONABLE, fields, null);
    }

    static ParseResult notActionable(String reason) {
        return new ParseResult(Status.NOT_ACTIONABLE, null, reason);
    }

    static ParseResult incomplete(String reason) {
        return new ParseResult(Status.INCOMPLETE, null, reason);
    }

    static ParseResult malformed(String reason) {
        return new ParseResult(Status.MALFORMED, null, reason);
    }

    public boolean isActionable() {
        return status == Status.ACTIONABLE;
    }
}
