package com.vtb.leastprivilege.models;

import com.vtb.leastprivilege.knowledge.PermissionMapSummary;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Сводный отчет по всем приложениям одного запуска
 */
@Data
@Builder
public class AnalysisReport {
    private Instant generatedAt;
    private int lookbackDays;

    @Builder.Default
    private List<ApplicationReport> applications = new ArrayList<>();

    @Builder.Default
    private List<PermissionMapSummary> permissionMaps = new ArrayList<>();

    private int submittedApplications;
    private int completedApplications;
    private int failedApplications;

    @Builder.Default
    private boolean stalled = false;
}
