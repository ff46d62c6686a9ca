package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.models.ActivityKey;
import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.MatchResult;
import com.vtb.leastprivilege.models.PermissionDescriptor;
import com.vtb.leastprivilege.models.ScopeType;
import com.vtb.leastprivilege.models.SelectedPermission;
import com.vtb.leastprivilege.models.SelectionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Подбор минимального набора разрешений, покрывающего все сопоставленные вызовы.
 *
 * Задача минимального покрытия множества NP-трудна, здесь используется жадное
 * приближение: на каждом шаге берется разрешение, покрывающее больше всего
 * еще не покрытых вызовов. Разрешения заранее отсортированы по полному покрытию
 * (по убыванию, сортировка стабильная), при равенстве выигрывает первое в этом порядке.
 * Результат не обязан быть оптимальным - это свойство алгоритма, а не ошибка.
 */
@Slf4j
public class OptimalPermissionSelector {

    public SelectionResult select(List<MatchResult> results) {
        if (results == null || results.isEmpty()) {
            return SelectionResult.empty();
        }

        Set<ActivityKey> allKeys = new LinkedHashSet<>();
        Set<ActivityKey> coverable = new LinkedHashSet<>();
        Map<ActivityKey, CanonicalActivity> unmatched = new LinkedHashMap<>();
        Map<PermissionKey, Coverage> coverageByPermission = new LinkedHashMap<>();

        for (MatchResult result : results) {
            if (result == null || result.getActivity() == null) {
                continue;
            }
            CanonicalActivity activity = result.getActivity();
            ActivityKey key = activity.getKey();
            allKeys.add(key);

            if (!result.hasCandidates()) {
                unmatched.putIfAbsent(key, activity);
                continue;
            }

            coverable.add(key);
            for (PermissionDescriptor descriptor : result.getCandidatePermissions()) {
                if (descriptor == null || descriptor.getName() == null) {
                    continue;
                }
                Coverage coverage = coverageByPermission.computeIfAbsent(
                    new PermissionKey(descriptor.getName(), descriptor.getScopeType()), Coverage::new);
                coverage.activities.add(key);
                coverage.leastPrivileged |= descriptor.isLeastPrivileged();
            }
        }

        // Ключ, покрытый хотя бы одним результатом, не считается непокрытым
        unmatched.keySet().removeAll(coverable);

        List<SelectedPermission> selected = greedyCover(coverable, coverageByPermission);

        return SelectionResult.builder()
            .selected(selected)
            .unmatchedActivities(new ArrayList<>(unmatched.values()))
            .totalActivities(allKeys.size())
            .matchedActivities(coverable.size())
            .build();
    }

    private List<SelectedPermission> greedyCover(Set<ActivityKey> coverable,
                                                 Map<PermissionKey, Coverage> coverageByPermission) {
        List<Coverage> ordered = new ArrayList<>(coverageByPermission.values());
        ordered.sort(Comparator.comparingInt((Coverage c) -> c.activities.size()).reversed());

        Set<ActivityKey> uncovered = new LinkedHashSet<>(coverable);
        List<SelectedPermission> selected = new ArrayList<>();

        while (!uncovered.isEmpty()) {
            Coverage best = null;
            int bestGain = 0;
            for (Coverage candidate : ordered) {
                int gain = countUncovered(candidate, uncovered);
                if (gain > bestGain) {
                    best = candidate;
                    bestGain = gain;
                }
            }

            if (best == null) {
                log.warn("Жадный подбор остановлен: {} вызовов не покрываются ни одним разрешением", uncovered.size());
                break;
            }

            uncovered.removeAll(best.activities);
            ordered.remove(best);
            selected.add(SelectedPermission.builder()
                .permission(best.key.name())
                .scopeType(best.key.scopeType())
                .leastPrivileged(best.leastPrivileged)
                .activitiesCovered(bestGain)
                .build());
            log.debug("Выбрано разрешение {} (+{} вызовов, осталось {})", best.key.name(), bestGain, uncovered.size());
        }
        return selected;
    }

    private int countUncovered(Coverage coverage, Set<ActivityKey> uncovered) {
        int count = 0;
        for (ActivityKey key : coverage.activities) {
            if (uncovered.contains(key)) {
                count++;
            }
        }
        return count;
    }

    private record PermissionKey(String name, ScopeType scopeType) {
    }

    private static final class Coverage {
        private final PermissionKey key;
        private final Set<ActivityKey> activities = new LinkedHashSet<>();
        private boolean leastPrivileged;

        private Coverage(PermissionKey key) {
            this.key = key;
        }
    }
}
