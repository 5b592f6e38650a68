package org.mozilla.automation.etp.cli;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.bugzilla.BugList;
import org.mozilla.automation.etp.bugzilla.BugQuery;
import org.mozilla.automation.etp.bugzilla.BugzillaService;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "bz-info", mixinStandardHelpOptions = true, description = "Print open bugs of a Bugzilla component as JSON")
public class BugInfoCommand extends ExceptionsManagerSubcommand {

    @Option(names = "--product", description = "Bugzilla product; defaults to the configured product")
    String product;

    @Option(names = "--component", description = "Bugzilla component; defaults to the configured component")
    String component;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    BugzillaService bugzilla;

    @Inject
    RetryingCaller retry;

    @Inject
    ObjectMapper objectMapper;

    @Override
    int execute() {
        BugQuery query = new BugQuery(
                product == null ? config.bugzilla().product() : product,
                component == null ? config.bugzilla().component() : component,
                null);
        BugList bugs = new BugList(retry.call("search bugs", () -> bugzilla.searchBugs(query)));
        try {
            out().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(bugs));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write bugs as JSON", e);
        }
        out().flush();
        return EXIT_OK;
    }
}
