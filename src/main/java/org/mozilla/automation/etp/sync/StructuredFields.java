package org.mozilla.automation.etp.sync;

import java.util.List;

/**
 * Exception requirements read from a bug.
 *
 * @param category requested exception category
 * @param domains tracker domains to exempt, in user story order
 * @param features classifier features to exempt, in user story order
 * @param topLevelUrlPattern site the exceptions are limited to (from the bug URL)
 */
public record StructuredFields(
        ExceptionCategory category,
        List<String> domains,
        List<String> features,
        String topLevelUrlPattern) {

    public StructuredFields {
        domains = List.copyOf(domains);
        features = List.copyOf(features);
    }
}
