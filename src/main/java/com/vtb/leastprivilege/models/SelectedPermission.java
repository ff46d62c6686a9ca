package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Data;

/**
 * Разрешение, выбранное жадным покрытием.
 * activitiesCovered - сколько новых вызовов оно покрыло в момент выбора.
 */
@Data
@Builder
public class SelectedPermission {
    private String permission;
    private ScopeType scopeType;
    private boolean leastPrivileged;
    private int activitiesCovered;
}
