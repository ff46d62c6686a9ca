package com.vtb.leastprivilege.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.leastprivilege.core.UriCanonicalizer;
import com.vtb.leastprivilege.knowledge.PermissionMapSummary;
import com.vtb.leastprivilege.models.AnalysisReport;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.ApplicationReport;
import com.vtb.leastprivilege.models.CollectionStatus;
import com.vtb.leastprivilege.models.ScopeType;
import com.vtb.leastprivilege.models.SelectedPermission;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    @Test
    void writesReportAsJson(@TempDir Path tempDir) throws IOException {
        ApplicationReport application = ApplicationReport.builder()
            .application(ApplicationPrincipal.builder().id("sp-1").displayName("HR Sync").build())
            .collectionStatus(CollectionStatus.SUCCESS)
            .activity(List.of(UriCanonicalizer.toActivity("GET", "https://graph.microsoft.com/v1.0/users/1")))
            .optimalPermissions(List.of(SelectedPermission.builder()
                .permission("User.Read.All")
                .scopeType(ScopeType.APPLICATION)
                .leastPrivileged(true)
                .activitiesCovered(1)
                .build()))
            .matchedAllActivity(true)
            .totalActivities(1)
            .matchedActivities(1)
            .excessPermissions(List.of("Directory.ReadWrite.All"))
            .build();
        application.setUnmatchedActivities(null);

        AnalysisReport report = AnalysisReport.builder()
            .generatedAt(Instant.parse("2024-06-01T00:00:00Z"))
            .lookbackDays(30)
            .applications(new ArrayList<>(List.of(application)))
            .permissionMaps(List.of(PermissionMapSummary.of("v1.0", List.of())))
            .submittedApplications(1)
            .completedApplications(1)
            .build();

        Path output = tempDir.resolve("nested/permission-report.json");
        JsonReportGenerator generator = new JsonReportGenerator();
        generator.generate(report, output);

        assertTrue(Files.exists(output));
        assertEquals("json", generator.getFileExtension());

        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("2024-06-01T00:00:00Z", root.get("generatedAt").asText());
        JsonNode app = root.get("applications").get(0);
        assertEquals("HR Sync", app.get("application").get("displayName").asText());
        assertEquals("User.Read.All", app.get("optimalPermissions").get(0).get("permission").asText());
        assertEquals("Application", app.get("optimalPermissions").get(0).get("scopeType").asText(),
            "Область действия пишется в форме Microsoft Graph");
        assertEquals("/users/{id}", app.get("activity").get(0).get("path").asText());
        assertTrue(app.get("unmatchedActivities").isArray());
        assertFalse(app.get("activity").get(0).has("key"), "Служебные поля не сериализуются");
    }

    @Test
    void rejectsNullReport(@TempDir Path tempDir) {
        assertThrows(IllegalArgumentException.class,
            () -> new JsonReportGenerator().generate(null, tempDir.resolve("report.json")));
    }
}
