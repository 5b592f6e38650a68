package org.mozilla.automation.etp.sync;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.mozilla.automation.etp.bugzilla.Bug;

/**
 * Reads exception requirements from a bug's whiteboard and user story.
 * <p>
 * The whiteboard must carry <code>[privacy-team:diagnosed]</code> and exactly one
 * category tag (<code>[exception-baseline]</code> or <code>[exception-convenience]</code>).
 * The user story must contain one line of each:
 *
 * <pre>
 * trackers-blocked: tracker.example, cdn.tracker.example
 * classifier-features: tracking-protection, emailtracking-protection
 * </pre>
 *
 * Text is written by people: anything that does not follow this grammar is
 * rejected as incomplete or malformed, never guessed at.
 */
public class MetadataParser {
    public static final String DIAGNOSED_TAG = "privacy-team:diagnosed";
    static final String TRACKERS_LABEL = "trackers-blocked:";
    static final String FEATURES_LABEL = "classifier-features:";

    static final Pattern DOMAIN = Pattern.compile(
            "^(\\*\\.)?[a-z0-9]([a-z0-9-]*[a-z0-9])?(\\.[a-z0-9]([a-z0-9-]*[a-z0-9])?)+$");
    static final Pattern FEATURE = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    public ParseResult parse(Bug bug) {
        Set<String> tags = bug.whiteboardTags();
        if (!tags.contains(DIAGNOSED_TAG)) {
            return ParseResult.notActionable("not diagnosed by the privacy team");
        }

        boolean baseline = tags.contains(ExceptionCategory.BASELINE.whiteboardTag());
        boolean convenience = tags.contains(ExceptionCategory.CONVENIENCE.whiteboardTag());
        if (baseline && convenience) {
            return ParseResult.malformed("both [%s] and [%s] are set".formatted(
                    ExceptionCategory.BASELINE.whiteboardTag(), ExceptionCategory.CONVENIENCE.whiteboardTag()));
        }
        if (!baseline && !convenience) {
            return ParseResult.incomplete("no exception category tag");
        }
        ExceptionCategory category = baseline ? ExceptionCategory.BASELINE : ExceptionCategory.CONVENIENCE;

        String story = bug.userStory() == null ? "" : bug.userStory();
        List<String> trackerValues = labelledValues(story, TRACKERS_LABEL);
        List<String> featureValues = labelledValues(story, FEATURES_LABEL);
        if (trackerValues.size() > 1) {
            return ParseResult.malformed("'%s' appears %d times".formatted(TRACKERS_LABEL, trackerValues.size()));
        }
        if (featureValues.size() > 1) {
            return ParseResult.malformed("'%s' appears %d times".formatted(FEATURES_LABEL, featureValues.size()));
        }
        if (trackerValues.isEmpty() || trackerValues.get(0).isBlank()) {
            return ParseResult.incomplete("missing '%s'".formatted(TRACKERS_LABEL));
        }
        if (featureValues.isEmpty() || featureValues.get(0).isBlank()) {
            return ParseResult.incomplete("missing '%s'".formatted(FEATURES_LABEL));
        }

        List<String> domains = new ArrayList<>();
        for (String token : tokens(trackerValues.get(0))) {
            String domain = token.toLowerCase(Locale.ROOT);
            if (domain.isEmpty()) {
                return ParseResult.malformed("empty entry in '%s'".formatted(TRACKERS_LABEL));
            }
            if (!DOMAIN.matcher(domain).matches()) {
                return ParseResult.malformed("'%s' is not a domain".formatted(token));
            }
            domains.add(domain);
        }

        List<String> features = new ArrayList<>();
        for (String feature : tokens(featureValues.get(0))) {
            if (feature.isEmpty()) {
                return ParseResult.malformed("empty entry in '%s'".formatted(FEATURES_LABEL));
            }
            if (!FEATURE.matcher(feature).matches()) {
                return ParseResult.malformed("'%s' is not a classifier feature".formatted(feature));
            }
            features.add(feature);
        }

        if (bug.url() == null || bug.url().isBlank()) {
            return ParseResult.incomplete("no site URL");
        }
        String host = siteHost(bug.url());
        if (host == null) {
            return ParseResult.malformed("bad site URL '%s'".formatted(bug.url()));
        }

        return ParseResult.actionable(new StructuredFields(category, domains, features,
                IdentityKey.toUrlPattern(host)));
    }

    /**
     * @return values of every line starting with the label (leading whitespace allowed)
     */
    static List<String> labelledValues(String story, String label) {
        List<String> values = new ArrayList<>();
        for (String line : story.split("\\R")) {
            String text = line.stripLeading();
            if (text.startsWith(label)) {
                values.add(text.substring(label.length()).trim());
            }
        }
        return values;
    }

    static List<String> tokens(String value) {
        List<String> tokens = new ArrayList<>();
        for (String token : value.split(",", -1)) {
            tokens.add(token.trim());
        }
        return tokens;
    }

    static String siteHost(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            String host = uri.getHost();
            return host == null || host.isBlank() ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
