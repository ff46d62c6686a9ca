package com.vtb.leastprivilege.cli;

import com.vtb.leastprivilege.models.ApplicationPrincipal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @Test
    void readsApplicationsIgnoringUnknownFields() throws IOException, URISyntaxException {
        Path file = Paths.get(MainCommandTest.class.getClassLoader().getResource("applications-sample.json").toURI());

        List<ApplicationPrincipal> applications = MainCommand.readApplications(file);

        assertEquals(2, applications.size());
        assertEquals("00000000-0000-0000-0000-00000000000a", applications.get(0).getId());
        assertEquals("HR Sync", applications.get(0).getDisplayName());
        assertEquals(List.of("User.Read.All", "Mail.Read"), applications.get(0).getCurrentPermissions());
        assertEquals("Reporting", applications.get(1).getDisplayName());
    }

    @Test
    void missingApplicationsFileIsRejected(@TempDir Path tempDir) {
        assertThrows(IllegalArgumentException.class,
            () -> MainCommand.readApplications(tempDir.resolve("apps.json")));
    }

    @Test
    void requiredOptionsAreEnforced() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("--workspace-id", "ws-1");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
    }

    @Test
    void missingMapFileFailsRun(@TempDir Path tempDir) throws URISyntaxException {
        Path applications = Paths.get(MainCommandTest.class.getClassLoader().getResource("applications-sample.json").toURI());
        CommandLine commandLine = new CommandLine(new MainCommand());

        int exitCode = commandLine.execute(
            "--workspace-id", "ws-1",
            "--token", "test-token",
            "--applications", applications.toString(),
            "--map-v1", tempDir.resolve("permissions-v1.0.json").toString(),
            "--map-beta", tempDir.resolve("permissions-beta.json").toString(),
            "--output", tempDir.resolve("reports").toString());

        assertEquals(1, exitCode);
    }
}
