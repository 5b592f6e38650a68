package org.mozilla.automation.etp.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig.RetryConfig;
import org.mozilla.automation.etp.config.ServerEnvironment;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import picocli.CommandLine;

public class RemoveCommandTest {
    static final String LOCATION = "https://rs.example/v1";

    final RemoteSettingsService remoteSettings = mock(RemoteSettingsService.class);
    final StringWriter output = new StringWriter();
    RemoveCommand command;
    CommandLine commandLine;

    @BeforeEach
    void setup() {
        RetryConfig retryConfig = mock(RetryConfig.class);
        when(retryConfig.maxAttempts()).thenReturn(1);
        when(retryConfig.initialBackoff()).thenReturn(Duration.ofMillis(1));
        when(retryConfig.maxBackoff()).thenReturn(Duration.ofMillis(1));
        ExceptionsManagerConfig config = mock(ExceptionsManagerConfig.class);
        when(config.retry()).thenReturn(retryConfig);

        command = new RemoveCommand();
        command.config = config;
        command.remoteSettings = remoteSettings;
        command.retry = new RetryingCaller(config);

        commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(output));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    @Test
    void testRemoveByIdRequestsReview() {
        when(remoteSettings.requestReview(any())).thenReturn("to-review");

        int exitCode = commandLine.execute("--server", "stage", "--server-location", LOCATION,
                "--auth", "token", "r1", "r2");

        RemoteSettingsTarget target = new RemoteSettingsTarget(ServerEnvironment.STAGE, LOCATION, "token");
        assertThat(exitCode).isZero();
        verify(remoteSettings).deleteRecord(eq(target), eq("r1"));
        verify(remoteSettings).deleteRecord(eq(target), eq("r2"));
        verify(remoteSettings).requestReview(eq(target));
        assertThat(output.toString())
                .contains("Removed r1")
                .contains("Removed r2")
                .contains("Collection status: to-review");
    }

    @Test
    void testRemoveAll() {
        when(remoteSettings.requestReview(any())).thenReturn("to-review");

        int exitCode = commandLine.execute("--server", "dev", "--server-location", LOCATION,
                "--auth", "token", "--all");

        assertThat(exitCode).isZero();
        verify(remoteSettings).deleteAllRecords(any());
        assertThat(output.toString()).contains("Removed all records");
    }

    @Test
    void testIdsOrAllRequired() {
        assertThat(commandLine.execute("--server", "dev", "--server-location", LOCATION, "--auth", "token"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(commandLine.execute("--server", "dev", "--server-location", LOCATION, "--auth", "token",
                "--all", "r1"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        verifyNoInteractions(remoteSettings);
    }

    @Test
    void testBlankAuthIsConfigurationError() {
        assertThat(commandLine.execute("--server", "dev", "--server-location", LOCATION, "--auth", " ", "r1"))
                .isEqualTo(ExceptionsManagerSubcommand.EXIT_CONFIGURATION);
        verifyNoInteractions(remoteSettings);
    }

    @Test
    void testUnknownServer() {
        assertThat(commandLine.execute("--server", "qa", "--auth", "token", "r1"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        verifyNoInteractions(remoteSettings);
    }
}
