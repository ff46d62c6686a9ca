package com.vtb.leastprivilege.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Вызов API после канонизации URI.
 * version == null означает, что это не вызов Graph (нет сегмента v1.0/beta).
 */
@Value
@Builder
public class CanonicalActivity {
    String method;
    String uri;
    String version;
    String path;

    @JsonIgnore
    public boolean isVersioned() {
        return version != null;
    }

    @JsonIgnore
    public ActivityKey getKey() {
        return new ActivityKey(method, version, path);
    }
}
