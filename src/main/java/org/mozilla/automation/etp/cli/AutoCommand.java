package org.mozilla.automation.etp.cli;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.RunOptions;
import org.mozilla.automation.etp.sync.RunSummary;
import org.mozilla.automation.etp.sync.SyncEngine;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "auto", mixinStandardHelpOptions = true, description = "Sync exceptions from diagnosed bugs to Remote Settings, and close bugs whose exceptions are live")
public class AutoCommand extends ExceptionsManagerSubcommand {

    @Mixin
    ServerOptions serverOptions;

    @Option(names = "--dry-run", description = "Report what would change without changing anything")
    boolean dryRun;

    @Option(names = "--force", description = "Take over records held by other bugs, and re-create unpublished records")
    boolean force;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    SyncEngine syncEngine;

    @Override
    int execute() {
        RunOptions options = serverOptions.runOptions(config, dryRun, force);
        RunSummary summary = syncEngine.run(options);
        out().print(summary.format());
        out().flush();
        return summary.exitCode();
    }
}
