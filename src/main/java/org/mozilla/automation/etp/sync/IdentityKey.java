package org.mozilla.automation.etp.sync;

import java.util.Comparator;

/**
 * Identity of a logical exception: two records with the same key are the same
 * exception, whoever created them and whenever.
 *
 * @param category exception category
 * @param domain tracker domain (host name)
 * @param feature classifier feature
 * @param range client versions the exception applies to
 */
public record IdentityKey(
        ExceptionCategory category,
        String domain,
        String feature,
        VersionRange range) implements Comparable<IdentityKey> {

    static final Comparator<IdentityKey> ORDER = Comparator.comparing(IdentityKey::category)
            .thenComparing(IdentityKey::domain)
            .thenComparing(IdentityKey::feature)
            .thenComparing(IdentityKey::range);

    /**
     * @return the Remote Settings url pattern for the tracker domain
     */
    public String urlPattern() {
        return toUrlPattern(domain);
    }

    public static String toUrlPattern(String host) {
        return "*://" + host + "/*";
    }

    @Override
    public int compareTo(IdentityKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "%s|%s|%s|%s".formatted(category, domain, feature, range);
    }
}
