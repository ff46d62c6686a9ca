package com.vtb.leastprivilege.knowledge;

import com.vtb.leastprivilege.models.EndpointEntry;
import com.vtb.leastprivilege.models.PermissionDescriptor;
import lombok.Builder;
import lombok.Data;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Статистика карты разрешений одной версии API
 */
@Data
@Builder
public class PermissionMapSummary {
    private String version;
    private int totalEndpoints;
    private int totalMethods;
    private int totalPermissions;
    private int endpointsWithPermissions;
    private double coveragePercent;

    public static PermissionMapSummary of(String version, Collection<EndpointEntry> entries) {
        int endpoints = 0;
        int methods = 0;
        int permissions = 0;
        int withPermissions = 0;

        if (entries != null) {
            for (EndpointEntry entry : entries) {
                if (entry == null) {
                    continue;
                }
                endpoints++;
                boolean hasAny = false;
                Map<String, List<PermissionDescriptor>> perMethod = entry.getPerMethodPermissions();
                if (perMethod != null) {
                    methods += perMethod.size();
                    for (List<PermissionDescriptor> descriptors : perMethod.values()) {
                        if (descriptors != null && !descriptors.isEmpty()) {
                            permissions += descriptors.size();
                            hasAny = true;
                        }
                    }
                }
                if (hasAny) {
                    withPermissions++;
                }
            }
        }

        double coverage = endpoints > 0
            ? Math.round(withPermissions * 10000.0 / endpoints) / 100.0
            : 0.0;

        return PermissionMapSummary.builder()
            .version(version)
            .totalEndpoints(endpoints)
            .totalMethods(methods)
            .totalPermissions(permissions)
            .endpointsWithPermissions(withPermissions)
            .coveragePercent(coverage)
            .build();
    }
}
