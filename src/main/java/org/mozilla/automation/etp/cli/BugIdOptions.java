package org.mozilla.automation.etp.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import picocli.CommandLine.Option;

/**
 * A single bug, or a file listing one bug id per line.
 */
public class BugIdOptions {

    @Option(names = "--bug-id", description = "Bug number")
    Long bugId;

    @Option(names = "--bug-ids-file", description = "File with one bug number per line")
    Path bugIdsFile;

    List<Long> bugIds() {
        if (bugId != null) {
            return List.of(bugId);
        }
        List<Long> ids = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(bugIdsFile)) {
                String value = line.trim();
                if (value.isEmpty() || value.startsWith("#")) {
                    continue;
                }
                try {
                    ids.add(Long.parseLong(value));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("'%s' in %s is not a bug number".formatted(value, bugIdsFile), e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + bugIdsFile, e);
        }
        return ids;
    }
}
