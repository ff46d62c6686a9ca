package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.models.EndpointEntry;
import com.vtb.leastprivilege.models.PermissionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Индекс карты разрешений: версия → путь → метод → разрешения.
 *
 * Строится один раз на запуск и дальше только читается, поэтому
 * безопасно разделяется между потоками сбора.
 * Сопоставление - точное равенство путей после {@link UriCanonicalizer#normalizeTemplate(String)},
 * без префиксного или нечеткого поиска.
 */
@Slf4j
public final class PermissionMapIndex {

    public static final String VERSION_V1 = "v1.0";
    public static final String VERSION_BETA = "beta";

    private final Map<String, Map<String, EndpointEntry>> entriesByVersion;

    private PermissionMapIndex(Map<String, Map<String, EndpointEntry>> entriesByVersion) {
        this.entriesByVersion = entriesByVersion;
    }

    /**
     * Построить индекс из карт v1.0 и beta
     */
    public static PermissionMapIndex of(Collection<EndpointEntry> v1Entries, Collection<EndpointEntry> betaEntries) {
        Map<String, Map<String, EndpointEntry>> byVersion = new LinkedHashMap<>();
        byVersion.put(VERSION_V1, indexVersion(VERSION_V1, v1Entries));
        byVersion.put(VERSION_BETA, indexVersion(VERSION_BETA, betaEntries));
        return new PermissionMapIndex(Collections.unmodifiableMap(byVersion));
    }

    public static PermissionMapIndex empty() {
        return of(List.of(), List.of());
    }

    /**
     * Найти эндпоинт с разрешениями для указанного метода
     *
     * @return пусто, если путь неизвестен или для метода нет списка разрешений
     */
    public Optional<EndpointEntry> find(String version, String method, String canonicalPath) {
        return findEndpoint(version, canonicalPath)
            .filter(entry -> entry.permissionsFor(method) != null);
    }

    /**
     * Найти эндпоинт по пути без учета метода
     */
    public Optional<EndpointEntry> findEndpoint(String version, String canonicalPath) {
        if (version == null || canonicalPath == null) {
            return Optional.empty();
        }
        Map<String, EndpointEntry> entries = entriesByVersion.get(version.toLowerCase(Locale.ROOT));
        if (entries == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(UriCanonicalizer.normalizeTemplate(canonicalPath)));
    }

    public int size(String version) {
        Map<String, EndpointEntry> entries = entriesByVersion.get(version);
        return entries != null ? entries.size() : 0;
    }

    private static Map<String, EndpointEntry> indexVersion(String version, Collection<EndpointEntry> entries) {
        Map<String, EndpointEntry> index = new LinkedHashMap<>();
        if (entries == null) {
            return Collections.unmodifiableMap(index);
        }

        int merged = 0;
        for (EndpointEntry entry : entries) {
            if (entry == null || entry.getCanonicalPath() == null) {
                continue;
            }
            String key = UriCanonicalizer.normalizeTemplate(entry.getCanonicalPath());
            EndpointEntry existing = index.get(key);
            if (existing != null) {
                merged++;
            }
            index.put(key, freeze(key, version, existing, entry));
        }

        if (merged > 0) {
            log.debug("Карта {}: объединено {} эндпоинтов с одинаковым шаблоном пути", version, merged);
        }
        return Collections.unmodifiableMap(index);
    }

    // Копия записи с нормализованным путем; при совпадении шаблонов списки методов объединяются
    private static EndpointEntry freeze(String key, String version, EndpointEntry existing, EndpointEntry entry) {
        Map<String, Set<PermissionDescriptor>> methods = new LinkedHashMap<>();
        if (existing != null) {
            collectMethods(methods, existing.getPerMethodPermissions());
        }
        collectMethods(methods, entry.getPerMethodPermissions());

        Map<String, List<PermissionDescriptor>> frozen = new LinkedHashMap<>();
        methods.forEach((method, descriptors) ->
            frozen.put(method, Collections.unmodifiableList(dedupeByNameAndScope(descriptors))));

        return EndpointEntry.builder()
            .canonicalPath(key)
            .version(version)
            .perMethodPermissions(Collections.unmodifiableMap(frozen))
            .build();
    }

    private static void collectMethods(Map<String, Set<PermissionDescriptor>> target,
                                       Map<String, List<PermissionDescriptor>> source) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, List<PermissionDescriptor>> methodEntry : source.entrySet()) {
            if (methodEntry.getKey() == null) {
                continue;
            }
            Set<PermissionDescriptor> descriptors = target.computeIfAbsent(
                methodEntry.getKey().trim().toUpperCase(Locale.ROOT), k -> new LinkedHashSet<>());
            if (methodEntry.getValue() != null) {
                methodEntry.getValue().stream()
                    .filter(descriptor -> descriptor != null && descriptor.getName() != null)
                    .forEach(descriptors::add);
            }
        }
    }

    private static List<PermissionDescriptor> dedupeByNameAndScope(Set<PermissionDescriptor> descriptors) {
        Map<String, PermissionDescriptor> unique = new LinkedHashMap<>();
        for (PermissionDescriptor descriptor : descriptors) {
            unique.putIfAbsent(descriptor.getName() + "|" + descriptor.getScopeType(), descriptor);
        }
        return new ArrayList<>(unique.values());
    }
}
