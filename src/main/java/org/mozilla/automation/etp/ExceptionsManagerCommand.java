package org.mozilla.automation.etp;

import org.mozilla.automation.etp.cli.AddCommand;
import org.mozilla.automation.etp.cli.AutoCommand;
import org.mozilla.automation.etp.cli.BugInfoCommand;
import org.mozilla.automation.etp.cli.CloseBugCommand;
import org.mozilla.automation.etp.cli.ListCommand;
import org.mozilla.automation.etp.cli.NeedInfoCommand;
import org.mozilla.automation.etp.cli.RemoveCommand;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@TopCommand
@Command(name = "url-classifier-exceptions-manager", mixinStandardHelpOptions = true, description = "Manage URL classifier exceptions in Remote Settings", subcommands = {
        AutoCommand.class,
        ListCommand.class,
        AddCommand.class,
        RemoveCommand.class,
        BugInfoCommand.class,
        NeedInfoCommand.class,
        CloseBugCommand.class
})
public class ExceptionsManagerCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
