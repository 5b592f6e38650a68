package org.mozilla.automation.etp.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class BugIdOptionsTest {

    @TempDir
    Path tempDir;

    @Test
    void testSingleBug() {
        BugIdOptions options = new BugIdOptions();
        options.bugId = 1914242L;

        assertThat(options.bugIds()).containsExactly(1914242L);
    }

    @Test
    void testBugIdsFile() throws Exception {
        Path file = tempDir.resolve("bugs.txt");
        Files.writeString(file, """
                # diagnosed last week
                1914242

                  1914300
                """);
        BugIdOptions options = new BugIdOptions();
        options.bugIdsFile = file;

        assertThat(options.bugIds()).containsExactly(1914242L, 1914300L);
    }

    @Test
    void testInvalidLine() throws Exception {
        Path file = tempDir.resolve("bugs.txt");
        Files.writeString(file, "1914242\nbug 12\n");
        BugIdOptions options = new BugIdOptions();
        options.bugIdsFile = file;

        assertThatThrownBy(options::bugIds)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'bug 12'");
    }
}
