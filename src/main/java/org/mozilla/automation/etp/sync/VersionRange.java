package org.mozilla.automation.etp.sync;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Half-open range of client versions, <code>[minVersion, maxVersion)</code>.
 * A null bound is unbounded.
 * <p>
 * Stored in Remote Settings records as a <code>filter_expression</code>.
 */
public record VersionRange(String minVersion, String maxVersion) implements Comparable<VersionRange> {

    public static final VersionRange ALL = new VersionRange(null, null);

    static final String COMPARE = "env.version|versionCompare(\"%s\")";
    static final Pattern FROM = Pattern.compile(
            "^env\\.version\\|versionCompare\\(\"([^\"]+)\"\\)\\s*>=\\s*0$");
    static final Pattern BEFORE = Pattern.compile(
            "^env\\.version\\|versionCompare\\(\"([^\"]+)\"\\)\\s*<\\s*0$");
    static final Pattern BETWEEN = Pattern.compile(
            "^env\\.version\\|versionCompare\\(\"([^\"]+)\"\\)\\s*>=\\s*0\\s*&&\\s*"
                    + "env\\.version\\|versionCompare\\(\"([^\"]+)\"\\)\\s*<\\s*0$");

    static final Comparator<String> LOWER_BOUND = Comparator.nullsFirst(ToolkitVersion.COMPARATOR);
    static final Comparator<String> UPPER_BOUND = Comparator.nullsLast(ToolkitVersion.COMPARATOR);

    public static VersionRange before(String version) {
        return new VersionRange(null, version);
    }

    public static VersionRange from(String version) {
        return new VersionRange(version, null);
    }

    public boolean isAll() {
        return minVersion == null && maxVersion == null;
    }

    public boolean contains(String version) {
        return (minVersion == null || ToolkitVersion.compare(version, minVersion) >= 0)
                && (maxVersion == null || ToolkitVersion.compare(version, maxVersion) < 0);
    }

    /**
     * @return true if this range ends exactly where the other one starts
     */
    public boolean isFollowedBy(VersionRange other) {
        return maxVersion != null && other.minVersion != null
                && ToolkitVersion.compare(maxVersion, other.minVersion) == 0;
    }

    /**
     * @return filter expression for this range, or null when it covers all versions
     */
    public String toFilterExpression() {
        if (isAll()) {
            return null;
        }
        if (minVersion == null) {
            return COMPARE.formatted(maxVersion) + " < 0";
        }
        if (maxVersion == null) {
            return COMPARE.formatted(minVersion) + " >= 0";
        }
        return COMPARE.formatted(minVersion) + " >= 0 && " + COMPARE.formatted(maxVersion) + " < 0";
    }

    /**
     * Read a range back from a record filter expression.
     *
     * @param expression filter expression; null or blank covers all versions
     * @return the range, or empty if the expression is not a version range
     */
    public static Optional<VersionRange> fromFilterExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of(ALL);
        }
        String expr = expression.trim();
        Matcher m = FROM.matcher(expr);
        if (m.matches()) {
            return Optional.of(from(m.group(1)));
        }
        m = BEFORE.matcher(expr);
        if (m.matches()) {
            return Optional.of(before(m.group(1)));
        }
        m = BETWEEN.matcher(expr);
        if (m.matches()) {
            return Optional.of(new VersionRange(m.group(1), m.group(2)));
        }
        return Optional.empty();
    }

    @Override
    public int compareTo(VersionRange o) {
        int result = LOWER_BOUND.compare(minVersion, o.minVersion);
        return result != 0 ? result : UPPER_BOUND.compare(maxVersion, o.maxVersion);
    }

    @Override
    public String toString() {
        return "[%s, %s)".formatted(minVersion == null ? "*" : minVersion, maxVersion == null ? "*" : maxVersion);
    }
}
