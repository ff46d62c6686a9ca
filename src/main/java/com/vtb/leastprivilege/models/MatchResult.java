package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат сопоставления одного вызова с картой разрешений
 */
@Data
@Builder
public class MatchResult {
    private CanonicalActivity activity;
    private String matchedPath;

    @Builder.Default
    private List<PermissionDescriptor> candidatePermissions = new ArrayList<>();

    private boolean matched;

    public boolean hasCandidates() {
        return matched && candidatePermissions != null && !candidatePermissions.isEmpty();
    }
}
