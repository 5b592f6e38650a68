package org.mozilla.automation.etp.cli;

import java.util.ArrayList;
import java.util.List;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

@Command(name = "remove", mixinStandardHelpOptions = true, description = "Remove records by id, or every record")
public class RemoveCommand extends ExceptionsManagerSubcommand {

    @Mixin
    ServerOptions serverOptions;

    @Parameters(arity = "0..*", paramLabel = "<id>", description = "Ids of the records to remove")
    List<String> ids = new ArrayList<>();

    @Option(names = "--all", description = "Remove every record in the collection")
    boolean all;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    RemoteSettingsService remoteSettings;

    @Inject
    RetryingCaller retry;

    @Override
    int execute() {
        if (all == !ids.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Specify record ids or --all (not both)");
        }
        RemoteSettingsTarget target = serverOptions.target(config);
        if (all) {
            retry.run("delete all records on " + target, () -> remoteSettings.deleteAllRecords(target));
            out().println("Removed all records");
        } else {
            for (String id : ids) {
                retry.run("delete record " + id, () -> remoteSettings.deleteRecord(target, id));
                out().println("Removed " + id);
            }
        }
        String status = retry.call("request review on " + target, () -> remoteSettings.requestReview(target));
        out().println("Collection status: " + status);
        out().flush();
        return EXIT_OK;
    }
}
