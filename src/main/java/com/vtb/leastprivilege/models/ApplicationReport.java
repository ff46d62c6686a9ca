package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат анализа одного приложения для отчетов
 */
@Data
@Builder
public class ApplicationReport {
    private ApplicationPrincipal application;
    private CollectionStatus collectionStatus;
    private String failureReason;

    @Builder.Default
    private List<CanonicalActivity> activity = new ArrayList<>();

    @Builder.Default
    private List<MatchResult> activityPermissions = new ArrayList<>();

    @Builder.Default
    private List<SelectedPermission> optimalPermissions = new ArrayList<>();

    @Builder.Default
    private List<CanonicalActivity> unmatchedActivities = new ArrayList<>();

    private boolean matchedAllActivity;
    private int totalActivities;
    private int matchedActivities;

    // Выданные, но не нужные по активности
    @Builder.Default
    private List<String> excessPermissions = new ArrayList<>();

    // Нужные по активности, но не выданные
    @Builder.Default
    private List<String> requiredPermissions = new ArrayList<>();
}
