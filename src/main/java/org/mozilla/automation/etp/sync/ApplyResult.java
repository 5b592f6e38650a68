package org.mozilla.automation.etp.sync;

/**
 * What happened when a plan was applied.
 *
 * @param created records created
 * @param removed records removed
 * @param failure first error, or null if every change was applied
 */
public record ApplyResult(int created, int removed, String failure) {

    static final ApplyResult NOTHING = new ApplyResult(0, 0, null);

    public boolean failed() {
        return failure != null;
    }

    public int changes() {
        return created + removed;
    }
}
