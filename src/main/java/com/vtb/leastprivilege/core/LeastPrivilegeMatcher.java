package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.EndpointEntry;
import com.vtb.leastprivilege.models.MatchResult;
import com.vtb.leastprivilege.models.PermissionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Сопоставление вызова API с минимально достаточными разрешениями.
 *
 * Порядок выбора кандидатов:
 * 1. Application-разрешения с флагом least privileged;
 * 2. если таких нет - все Application-разрешения эндпоинта.
 * Delegated-разрешения не возвращаются никогда.
 */
@Slf4j
public class LeastPrivilegeMatcher {

    private final PermissionMapIndex index;

    public LeastPrivilegeMatcher(PermissionMapIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("PermissionMapIndex не может быть null");
        }
        this.index = index;
    }

    /**
     * Сопоставить один вызов
     *
     * @return пусто, если вызов не относится к Graph (нет версии v1.0/beta)
     */
    public Optional<MatchResult> match(CanonicalActivity activity) {
        if (activity == null || !activity.isVersioned()) {
            return Optional.empty();
        }

        Optional<EndpointEntry> entry = index.find(activity.getVersion(), activity.getMethod(), activity.getPath());
        if (entry.isEmpty()) {
            return Optional.of(MatchResult.builder()
                .activity(activity)
                .matched(false)
                .build());
        }

        List<PermissionDescriptor> descriptors = entry.get().permissionsFor(activity.getMethod());
        return Optional.of(MatchResult.builder()
            .activity(activity)
            .matchedPath(entry.get().getCanonicalPath())
            .candidatePermissions(resolveCandidates(descriptors))
            .matched(true)
            .build());
    }

    /**
     * Сопоставить все вызовы приложения; вызовы без версии Graph отбрасываются
     */
    public List<MatchResult> matchAll(Collection<CanonicalActivity> activities) {
        List<MatchResult> results = new ArrayList<>();
        if (activities == null) {
            return results;
        }
        int dropped = 0;
        for (CanonicalActivity activity : activities) {
            Optional<MatchResult> result = match(activity);
            if (result.isPresent()) {
                results.add(result.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Пропущено {} вызовов вне Microsoft Graph v1.0/beta", dropped);
        }
        return results;
    }

    private List<PermissionDescriptor> resolveCandidates(List<PermissionDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return new ArrayList<>();
        }

        List<PermissionDescriptor> application = descriptors.stream()
            .filter(PermissionDescriptor::isApplicationScope)
            .collect(Collectors.toList());

        List<PermissionDescriptor> leastPrivileged = application.stream()
            .filter(PermissionDescriptor::isLeastPrivileged)
            .collect(Collectors.toList());

        return leastPrivileged.isEmpty() ? application : leastPrivileged;
    }
}
