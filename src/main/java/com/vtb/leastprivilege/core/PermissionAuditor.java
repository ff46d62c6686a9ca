package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.collector.CollectionBatch;
import com.vtb.leastprivilege.collector.CollectionResult;
import com.vtb.leastprivilege.collector.CollectionScheduler;
import com.vtb.leastprivilege.knowledge.PermissionMapSummary;
import com.vtb.leastprivilege.models.ActivityWindow;
import com.vtb.leastprivilege.models.AnalysisReport;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.ApplicationReport;
import com.vtb.leastprivilege.models.CollectionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Главный движок анализа минимальных привилегий.
 * Собирает активность по всем приложениям и строит сводный отчет.
 */
@Slf4j
public class PermissionAuditor {

    private final CollectionScheduler scheduler;
    private final PermissionAnalyzer analyzer;
    private final List<PermissionMapSummary> mapSummaries;
    private final Clock clock;

    public PermissionAuditor(CollectionScheduler scheduler, PermissionAnalyzer analyzer,
                             List<PermissionMapSummary> mapSummaries) {
        this(scheduler, analyzer, mapSummaries, Clock.systemUTC());
    }

    public PermissionAuditor(CollectionScheduler scheduler, PermissionAnalyzer analyzer,
                             List<PermissionMapSummary> mapSummaries, Clock clock) {
        if (scheduler == null || analyzer == null) {
            throw new IllegalArgumentException("Scheduler и analyzer обязательны");
        }
        this.scheduler = scheduler;
        this.analyzer = analyzer;
        this.mapSummaries = mapSummaries != null ? mapSummaries : List.of();
        this.clock = clock;
    }

    /**
     * Проанализировать приложения за последние lookbackDays дней
     */
    public AnalysisReport audit(List<ApplicationPrincipal> applications, int lookbackDays, int maxEntries) {
        if (lookbackDays <= 0) {
            throw new IllegalArgumentException("Глубина анализа должна быть положительной: " + lookbackDays);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Лимит строк должен быть положительным: " + maxEntries);
        }

        Instant now = clock.instant();
        log.info("=== Анализ минимальных привилегий: {} приложений, {} дней ===",
            applications != null ? applications.size() : 0, lookbackDays);

        ActivityWindow window = ActivityWindow.lookback(now, lookbackDays, maxEntries);
        CollectionBatch batch = scheduler.collectAll(applications, window);

        List<ApplicationReport> reports = new ArrayList<>();
        for (CollectionResult result : batch.getResults()) {
            reports.add(analyzeSafely(result));
        }
        for (CollectionResult pending : batch.getPending()) {
            reports.add(analyzer.analyze(pending));
        }

        long failed = reports.stream()
            .filter(report -> report.getCollectionStatus() == CollectionStatus.FAILED)
            .count();
        if (batch.isStalled()) {
            log.warn("Пакет остановлен по таймауту: {} приложений без результата", batch.getPending().size());
        }
        log.info("Анализ завершен: {} из {} приложений, ошибок {}", batch.getCompleted(), batch.getSubmitted(), failed);

        return AnalysisReport.builder()
            .generatedAt(now)
            .lookbackDays(lookbackDays)
            .applications(reports)
            .permissionMaps(new ArrayList<>(mapSummaries))
            .submittedApplications(batch.getSubmitted())
            .completedApplications(batch.getCompleted())
            .failedApplications((int) failed)
            .stalled(batch.isStalled())
            .build();
    }

    private ApplicationReport analyzeSafely(CollectionResult result) {
        try {
            return analyzer.analyze(result);
        } catch (RuntimeException e) {
            log.error("Ошибка анализа {}: {}", result.getApplication().getId(), e.getMessage(), e);
            return ApplicationReport.builder()
                .application(result.getApplication())
                .collectionStatus(CollectionStatus.FAILED)
                .failureReason("Ошибка анализа: " + e.getMessage())
                .build();
        }
    }
}
