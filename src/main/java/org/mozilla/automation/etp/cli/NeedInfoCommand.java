package org.mozilla.automation.etp.cli;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.FatalConfigurationException;
import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.bugzilla.BugzillaService;

import io.quarkus.logging.Log;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "bz-ni", mixinStandardHelpOptions = true, description = "Request information on bugs")
public class NeedInfoCommand extends ExceptionsManagerSubcommand {

    @ArgGroup(exclusive = true, multiplicity = "1")
    BugIdOptions bugIds;

    @Option(names = "--message", required = true, description = "Comment to post with the request")
    String message;

    @Option(names = "--requestee", required = true, description = "E-mail of the person asked for information")
    String requestee;

    @Inject
    BugzillaService bugzilla;

    @Inject
    RetryingCaller retry;

    @Override
    int execute() {
        if (!bugzilla.canUpdate()) {
            throw new FatalConfigurationException("Bugzilla API key is required (set BZ_API_KEY)");
        }
        int failed = 0;
        for (long id : bugIds.bugIds()) {
            try {
                retry.run("needinfo on bug " + id, () -> bugzilla.requestInfo(id, requestee, message));
                out().printf("NeedInfo %s for bug %d%n", requestee, id);
            } catch (RuntimeException e) {
                Log.errorf(e, "[%s] needinfo %s on bug %d failed", spec.name(), requestee, id);
                err().printf("Error: needinfo %s on bug %d: %s%n", requestee, id, e.getMessage());
                failed++;
            }
        }
        out().flush();
        return failed == 0 ? EXIT_OK : EXIT_FAILED;
    }
}
