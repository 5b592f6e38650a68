package org.mozilla.automation.etp.cli;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.FatalConfigurationException;
import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.bugzilla.BugzillaService;

import io.quarkus.logging.Log;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "bz-close", mixinStandardHelpOptions = true, description = "Resolve bugs with a comment")
public class CloseBugCommand extends ExceptionsManagerSubcommand {

    @ArgGroup(exclusive = true, multiplicity = "1")
    BugIdOptions bugIds;

    @Option(names = "--resolution", defaultValue = "FIXED", description = "Resolution (default: ${DEFAULT-VALUE})")
    String resolution;

    @Option(names = "--message", required = true, description = "Comment to post when closing")
    String message;

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
                retry.run("close bug " + id, () -> bugzilla.closeBug(id, resolution, message));
                out().printf("Bug %d closed as %s%n", id, resolution);
            } catch (RuntimeException e) {
                Log.errorf(e, "[%s] closing bug %d failed", spec.name(), id);
                err().printf("Error: closing bug %d: %s%n", id, e.getMessage());
                failed++;
            }
        }
        out().flush();
        return failed == 0 ? EXIT_OK : EXIT_FAILED;
    }
}
