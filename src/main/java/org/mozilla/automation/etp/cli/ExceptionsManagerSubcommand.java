package org.mozilla.automation.etp.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.mozilla.automation.etp.FatalConfigurationException;

import io.quarkus.logging.Log;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Common handling for subcommands: output streams and the exit code used
 * when required configuration is missing.
 */
abstract class ExceptionsManagerSubcommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (FatalConfigurationException e) {
            Log.errorf("[%s] %s", spec.name(), e.getMessage());
            err().println("Error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        }
    }

    abstract int execute();

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
