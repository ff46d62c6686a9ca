package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог подбора набора разрешений для одного приложения
 */
@Data
@Builder
public class SelectionResult {

    @Builder.Default
    private List<SelectedPermission> selected = new ArrayList<>();

    @Builder.Default
    private List<CanonicalActivity> unmatchedActivities = new ArrayList<>();

    private int totalActivities;
    private int matchedActivities;

    public static SelectionResult empty() {
        return SelectionResult.builder().build();
    }

    public boolean coversAllActivities() {
        return unmatchedActivities == null || unmatchedActivities.isEmpty();
    }
}
