package org.mozilla.automation.etp.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.remotesettings.RecordData;
import org.mozilla.automation.etp.remotesettings.RecordImporter;
import org.mozilla.automation.etp.remotesettings.RecordImporter.ImportPlan;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "add", mixinStandardHelpOptions = true, description = "Add or update records from a JSON file (one record or an array)")
public class AddCommand extends ExceptionsManagerSubcommand {

    @Mixin
    ServerOptions serverOptions;

    @Parameters(index = "0", paramLabel = "<json-file>", description = "Records to add")
    Path jsonFile;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    RemoteSettingsService remoteSettings;

    @Inject
    RetryingCaller retry;

    @Inject
    ObjectMapper objectMapper;

    final RecordImporter importer = new RecordImporter();

    @Override
    int execute() {
        RemoteSettingsTarget target = serverOptions.target(config);
        List<RecordData> incoming = read(jsonFile);

        ImportPlan plan = importer.plan(incoming,
                retry.call("list records on " + target, () -> remoteSettings.listAllRecords(target)));
        if (plan.isEmpty()) {
            out().println("No records to add");
            return EXIT_OK;
        }
        for (RecordData data : plan.toUpdate()) {
            retry.call("update record " + data.id, () -> remoteSettings.updateRecord(target, data));
            out().println("Updated " + data.id);
        }
        for (RecordData data : plan.toCreate()) {
            retry.call("create record " + data.id, () -> remoteSettings.updateRecord(target, data));
            out().println("Created " + data.id);
        }
        String status = retry.call("request review on " + target, () -> remoteSettings.requestReview(target));
        out().printf("%d created, %d updated; collection status: %s%n",
                plan.toCreate().size(), plan.toUpdate().size(), status);
        out().flush();
        return EXIT_OK;
    }

    List<RecordData> read(Path file) {
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            if (node.isArray()) {
                return objectMapper.convertValue(node, new TypeReference<List<RecordData>>() {
                });
            }
            return List.of(objectMapper.treeToValue(node, RecordData.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read records from " + file + ": " + e.getMessage(), e);
        }
    }
}
