package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Эндпоинт из карты разрешений: путь и разрешения по HTTP-методам
 */
@Value
@Builder
public class EndpointEntry {
    String canonicalPath;
    String version;
    Map<String, List<PermissionDescriptor>> perMethodPermissions;

    public List<PermissionDescriptor> permissionsFor(String method) {
        if (method == null || perMethodPermissions == null) {
            return null;
        }
        return perMethodPermissions.get(method.toUpperCase(Locale.ROOT));
    }
}
