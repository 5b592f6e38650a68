package org.mozilla.automation.etp.cli;

import java.util.Comparator;
import java.util.List;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.remotesettings.RecordData;
import org.mozilla.automation.etp.remotesettings.RemoteRecord;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List the records in the collection")
public class ListCommand extends ExceptionsManagerSubcommand {

    @Mixin
    ServerOptions serverOptions;

    @Option(names = "--json", description = "Print records as a JSON array")
    boolean json;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    RemoteSettingsService remoteSettings;

    @Inject
    RetryingCaller retry;

    @Inject
    ObjectMapper objectMapper;

    @Override
    int execute() {
        RemoteSettingsTarget target = serverOptions.target(config);
        List<RemoteRecord> records = retry.call("list records on " + target,
                () -> remoteSettings.listAllRecords(target)).stream()
                .sorted(Comparator.comparing(RemoteRecord::id))
                .toList();
        try {
            if (json) {
                List<RecordData> data = records.stream().map(RemoteRecord::toRecordData).toList();
                out().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data));
            } else {
                out().printf("%d record(s) on %s%n", records.size(), target);
                for (RemoteRecord record : records) {
                    out().printf("%s [%s]%n%s%n", record.id(), record.status(),
                            objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record.toRecordData()));
                }
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write records as JSON", e);
        }
        out().flush();
        return EXIT_OK;
    }
}
