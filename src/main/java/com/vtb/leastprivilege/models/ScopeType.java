package com.vtb.leastprivilege.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Контекст, в котором действует разрешение Microsoft Graph
 */
public enum ScopeType {
    APPLICATION("Application"),
    DELEGATED("Delegated");

    private final String graphName;

    ScopeType(String graphName) {
        this.graphName = graphName;
    }

    @JsonValue
    public String getGraphName() {
        return graphName;
    }

    /**
     * Разобрать значение scopeType из карты разрешений (без учета регистра).
     * DelegatedWork и DelegatedPersonal считаются Delegated, неизвестные значения возвращают null.
     */
    @JsonCreator
    public static ScopeType fromGraphName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("application")) {
            return APPLICATION;
        }
        if (normalized.startsWith("delegated")) {
            return DELEGATED;
        }
        return null;
    }
}
