package com.vtb.leastprivilege.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.leastprivilege.collector.CollectionScheduler;
import com.vtb.leastprivilege.collector.ResilientActivityCollector;
import com.vtb.leastprivilege.config.AnalyzerConfig;
import com.vtb.leastprivilege.core.PermissionAnalyzer;
import com.vtb.leastprivilege.core.PermissionAuditor;
import com.vtb.leastprivilege.core.PermissionMapIndex;
import com.vtb.leastprivilege.integration.LogAnalyticsClient;
import com.vtb.leastprivilege.knowledge.PermissionMapLoader;
import com.vtb.leastprivilege.knowledge.PermissionMapSummary;
import com.vtb.leastprivilege.models.AnalysisReport;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.ApplicationReport;
import com.vtb.leastprivilege.models.EndpointEntry;
import com.vtb.leastprivilege.models.SelectedPermission;
import com.vtb.leastprivilege.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI команда анализатора минимальных привилегий Microsoft Graph
 */
@Slf4j
@Command(
    name = "graph-permission-analyzer",
    mixinStandardHelpOptions = true,
    version = "VTB Graph Least-Privilege Analyzer 1.0.0",
    description = """

        VTB Graph Least-Privilege Analyzer

        Сравнивает выданные приложениям разрешения Microsoft Graph
        с фактическими вызовами API из журнала активности и предлагает
        минимальный набор разрешений.

        """
)
public class MainCommand implements Callable<Integer> {

    @Option(
        names = {"-w", "--workspace-id"},
        required = true,
        description = "Идентификатор рабочей области Log Analytics с таблицей MicrosoftGraphActivityLogs"
    )
    private String workspaceId;

    @Option(
        names = {"-t", "--token"},
        description = "Bearer токен для Log Analytics (по умолчанию из переменной LOG_ANALYTICS_TOKEN)"
    )
    private String token;

    @Option(
        names = {"-a", "--applications"},
        required = true,
        description = "JSON файл со списком приложений (id, appId, displayName, currentPermissions)"
    )
    private Path applicationsFile;

    @Option(
        names = {"--map-v1"},
        required = true,
        description = "Карта разрешений v1.0 (permissions-v1.0.json)"
    )
    private Path mapV1;

    @Option(
        names = {"--map-beta"},
        required = true,
        description = "Карта разрешений beta (permissions-beta.json)"
    )
    private Path mapBeta;

    @Option(
        names = {"-d", "--days"},
        description = "Глубина анализа в днях (по умолчанию из analyzer-config.yaml)"
    )
    private Integer lookbackDays;

    @Option(
        names = {"--max-entries"},
        description = "Лимит строк на один запрос к журналу"
    )
    private Integer maxEntries;

    @Option(
        names = {"--workers"},
        description = "Количество параллельных потоков сбора"
    )
    private Integer workers;

    @Option(
        names = {"--stall-timeout"},
        description = "Сколько минут ждать очередного результата до остановки пакета"
    )
    private Integer stallTimeoutMinutes;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            AnalyzerConfig config = AnalyzerConfig.load();
            applyOverrides(config);

            String accessToken = token != null ? token : System.getenv("LOG_ANALYTICS_TOKEN");
            if (accessToken == null || accessToken.isBlank()) {
                log.error("Не указан токен доступа: используйте --token или LOG_ANALYTICS_TOKEN");
                return 1;
            }

            // 1. Карта разрешений
            PermissionMapLoader loader = new PermissionMapLoader();
            List<EndpointEntry> v1Entries = loader.loadFromFile(mapV1, PermissionMapIndex.VERSION_V1);
            List<EndpointEntry> betaEntries = loader.loadFromFile(mapBeta, PermissionMapIndex.VERSION_BETA);
            PermissionMapIndex index = PermissionMapIndex.of(v1Entries, betaEntries);
            List<PermissionMapSummary> summaries = List.of(
                PermissionMapSummary.of(PermissionMapIndex.VERSION_V1, v1Entries),
                PermissionMapSummary.of(PermissionMapIndex.VERSION_BETA, betaEntries));

            // 2. Приложения
            List<ApplicationPrincipal> applications = readApplications(applicationsFile);
            log.info("Загружено приложений: {}", applications.size());

            // 3. Сбор и анализ
            LogAnalyticsClient client = new LogAnalyticsClient(config.getLogAnalytics(), workspaceId, () -> accessToken);
            ResilientActivityCollector collector =
                new ResilientActivityCollector(client, config.getCollector().minWindow());
            CollectionScheduler scheduler = new CollectionScheduler(collector,
                config.getScheduler().getWorkers(), config.getScheduler().stallTimeout());
            PermissionAuditor auditor = new PermissionAuditor(scheduler, new PermissionAnalyzer(index), summaries);

            AnalysisReport report = auditor.audit(applications,
                config.getCollector().getLookbackDays(), config.getCollector().getMaxEntries());

            // 4. Отчет
            Path outputPath = Paths.get(outputDir);
            Files.createDirectories(outputPath);
            new JsonReportGenerator().generate(report, outputPath.resolve("permission-report.json"));

            printSummary(report);
            return 0;
        } catch (Exception e) {
            log.error("Ошибка анализа: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void applyOverrides(AnalyzerConfig config) {
        if (lookbackDays != null && lookbackDays > 0) {
            config.getCollector().setLookbackDays(lookbackDays);
        }
        if (maxEntries != null && maxEntries > 0) {
            config.getCollector().setMaxEntries(maxEntries);
        }
        if (workers != null && workers > 0) {
            config.getScheduler().setWorkers(workers);
        }
        if (stallTimeoutMinutes != null && stallTimeoutMinutes > 0) {
            config.getScheduler().setStallTimeoutMinutes(stallTimeoutMinutes);
        }
    }

    static List<ApplicationPrincipal> readApplications(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Файл приложений не найден: " + file);
        }
        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper.readValue(file.toFile(), new TypeReference<List<ApplicationPrincipal>>() {
        });
    }

    private void printSummary(AnalysisReport report) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("GRAPH LEAST-PRIVILEGE REPORT");
        System.out.println("=".repeat(80));
        System.out.println("Приложений: " + report.getSubmittedApplications()
            + ", обработано: " + report.getCompletedApplications()
            + ", ошибок: " + report.getFailedApplications());
        if (report.isStalled()) {
            System.out.println("ВНИМАНИЕ: сбор остановлен по таймауту, отчет неполный");
        }
        System.out.println();

        for (ApplicationReport application : report.getApplications()) {
            String name = application.getApplication().getDisplayName() != null
                ? application.getApplication().getDisplayName()
                : application.getApplication().getId();
            System.out.printf("%s [%s]%n", name, application.getCollectionStatus());
            if (application.getFailureReason() != null) {
                System.out.println("   → " + application.getFailureReason());
                continue;
            }
            System.out.printf("   вызовов: %d, объяснено: %d%s%n",
                application.getTotalActivities(),
                application.getMatchedActivities(),
                application.isMatchedAllActivity() ? "" : " (есть необъясненные вызовы)");
            for (SelectedPermission permission : application.getOptimalPermissions()) {
                System.out.printf("   + %s (%d)%n", permission.getPermission(), permission.getActivitiesCovered());
            }
            if (!application.getExcessPermissions().isEmpty()) {
                System.out.println("   лишние: " + String.join(", ", application.getExcessPermissions()));
            }
        }

        System.out.println();
        System.out.println("Отчеты сохранены в: " + outputDir);
        System.out.println("=".repeat(80));
        System.out.println();
    }
}
