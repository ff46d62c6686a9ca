package com.vtb.leastprivilege.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Приложение (service principal), для которого анализируется активность.
 * currentPermissions приходят из каталога удостоверений и здесь не вычисляются.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationPrincipal {
    private String id;
    private String appId;
    private String displayName;

    @Builder.Default
    private List<String> currentPermissions = new ArrayList<>();
}
