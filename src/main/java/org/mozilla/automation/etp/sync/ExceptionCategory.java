package org.mozilla.automation.etp.sync;

import java.util.Locale;
import java.util.Optional;

/**
 * Exception category, selected on the bug with a whiteboard tag.
 */
public enum ExceptionCategory {
    BASELINE("exception-baseline"),
    CONVENIENCE("exception-convenience");

    private final String whiteboardTag;

    ExceptionCategory(String whiteboardTag) {
        this.whiteboardTag = whiteboardTag;
    }

    /**
     * @return the whiteboard tag (without brackets) selecting this category
     */
    public String whiteboardTag() {
        return whiteboardTag;
    }

    /**
     * @return value used in Remote Settings records
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ExceptionCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ExceptionCategory c : values()) {
            if (c.value().equals(value)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value();
    }
}
