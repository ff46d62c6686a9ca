package com.vtb.leastprivilege.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Одно разрешение, допускающее вызов эндпоинта
 */
@Value
@Builder
public class PermissionDescriptor {
    String name;
    ScopeType scopeType;
    boolean leastPrivileged;

    @JsonIgnore
    public boolean isApplicationScope() {
        return scopeType == ScopeType.APPLICATION;
    }
}
