package org.mozilla.automation.etp.sync;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.mozilla.automation.etp.config.RunOptions;

/**
 * Outcome of a reconciliation run.
 *
 * @param options run options
 * @param outcomes one per processed bug, ordered by bug id (newest first)
 * @param reviewStatus collection status after the review request, or null if none was needed
 * @param reviewFailure error requesting review, or null
 */
public record RunSummary(RunOptions options, List<BugOutcome> outcomes, String reviewStatus, String reviewFailure) {

    public RunSummary {
        outcomes = List.copyOf(outcomes);
    }

    public Map<Outcome, Integer> counts() {
        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        outcomes.forEach(o -> counts.merge(o.outcome(), 1, Integer::sum));
        return counts;
    }

    public int changes() {
        return outcomes.stream().mapToInt(BugOutcome::changes).sum();
    }

    /**
     * @return 1 if any bug failed, any conflict was left unresolved
     *         (conflicts are only skipped without force), or the review request failed; 0 otherwise
     */
    public int exitCode() {
        boolean failed = reviewFailure != null || outcomes.stream()
                .anyMatch(o -> o.outcome() == Outcome.FAILED || o.outcome() == Outcome.SKIPPED_CONFLICT);
        return failed ? 1 : 0;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(options.dryRun() ? "DRY RUN " : "")
                .append("Summary for ").append(options.environment())
                .append(": ").append(outcomes.size()).append(" bug(s), ")
                .append(changes()).append(" change(s)\n");
        outcomes.forEach(o -> sb.append("  ").append(o).append('\n'));
        counts().forEach((outcome, count) -> sb.append("  ").append(outcome).append(": ").append(count).append('\n'));
        if (reviewFailure != null) {
            sb.append("Review request failed: ").append(reviewFailure).append('\n');
        } else if (reviewStatus != null) {
            sb.append("Collection status: ").append(reviewStatus).append('\n');
        }
        return sb.toString();
    }
}
