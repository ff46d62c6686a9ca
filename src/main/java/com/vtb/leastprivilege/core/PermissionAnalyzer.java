package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.collector.CollectionResult;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.ApplicationReport;
import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.CollectionStatus;
import com.vtb.leastprivilege.models.MatchResult;
import com.vtb.leastprivilege.models.SelectedPermission;
import com.vtb.leastprivilege.models.SelectionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Анализ одного приложения: сопоставление вызовов, подбор набора разрешений
 * и сравнение с тем, что приложению выдано сейчас
 */
@Slf4j
public class PermissionAnalyzer {

    private final LeastPrivilegeMatcher matcher;
    private final OptimalPermissionSelector selector;

    public PermissionAnalyzer(PermissionMapIndex index) {
        this(new LeastPrivilegeMatcher(index), new OptimalPermissionSelector());
    }

    public PermissionAnalyzer(LeastPrivilegeMatcher matcher, OptimalPermissionSelector selector) {
        this.matcher = matcher;
        this.selector = selector;
    }

    /**
     * Построить отчет по результату сбора активности
     */
    public ApplicationReport analyze(CollectionResult collection) {
        if (collection == null || collection.getApplication() == null) {
            throw new IllegalArgumentException("Результат сбора не содержит приложения");
        }

        ApplicationPrincipal application = collection.getApplication();
        if (collection.getStatus() == CollectionStatus.FAILED || collection.getStatus() == CollectionStatus.NOT_COLLECTED) {
            return ApplicationReport.builder()
                .application(application)
                .collectionStatus(collection.getStatus())
                .failureReason(collection.getFailureReason())
                .build();
        }

        ApplicationReport report = analyze(application, collection.getActivities());
        report.setCollectionStatus(collection.getStatus());
        return report;
    }

    /**
     * Проанализировать уже собранный список вызовов
     */
    public ApplicationReport analyze(ApplicationPrincipal application, List<CanonicalActivity> activities) {
        List<CanonicalActivity> safeActivities = activities != null ? activities : List.of();
        List<MatchResult> matches = matcher.matchAll(safeActivities);
        SelectionResult selection = selector.select(matches);

        List<String> granted = application != null && application.getCurrentPermissions() != null
            ? application.getCurrentPermissions()
            : List.of();
        List<String> selectedNames = selection.getSelected().stream()
            .map(SelectedPermission::getPermission)
            .collect(Collectors.toList());

        ApplicationReport report = ApplicationReport.builder()
            .application(application)
            .collectionStatus(safeActivities.isEmpty() ? CollectionStatus.EMPTY : CollectionStatus.SUCCESS)
            .activity(new ArrayList<>(safeActivities))
            .activityPermissions(matches)
            .optimalPermissions(selection.getSelected())
            .unmatchedActivities(selection.getUnmatchedActivities())
            .matchedAllActivity(selection.coversAllActivities())
            .totalActivities(selection.getTotalActivities())
            .matchedActivities(selection.getMatchedActivities())
            .excessPermissions(difference(granted, selectedNames))
            .requiredPermissions(difference(selectedNames, granted))
            .build();

        log.info("{}: вызовов {}, покрыто {}, выбрано разрешений {}, лишних {}",
            displayName(application), report.getTotalActivities(), report.getMatchedActivities(),
            report.getOptimalPermissions().size(), report.getExcessPermissions().size());
        return report;
    }

    // Элементы left, отсутствующие в right (имена разрешений без учета регистра)
    static List<String> difference(List<String> left, List<String> right) {
        Set<String> rightNormalized = right.stream()
            .filter(name -> name != null)
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String name : left) {
            if (name == null) {
                continue;
            }
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            if (!rightNormalized.contains(normalized) && seen.add(normalized)) {
                result.add(name.trim());
            }
        }
        return result;
    }

    private String displayName(ApplicationPrincipal application) {
        if (application == null) {
            return "<unknown>";
        }
        return application.getDisplayName() != null ? application.getDisplayName() : application.getId();
    }
}
