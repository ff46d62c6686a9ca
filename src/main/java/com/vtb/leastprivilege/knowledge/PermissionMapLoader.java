package com.vtb.leastprivilege.knowledge;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.leastprivilege.models.EndpointEntry;
import com.vtb.leastprivilege.models.PermissionDescriptor;
import com.vtb.leastprivilege.models.ScopeType;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Загрузка карты "эндпоинт → разрешения" (permissions-v1.0.json / permissions-beta.json).
 *
 * Формат файла:
 * <pre>
 * [ { "Endpoint": "/users/{user-id}", "Version": "v1.0",
 *     "Method": { "GET": [ { "value": "User.Read.All", "scopeType": "Application", "isLeastPrivilege": true } ] } } ]
 * </pre>
 */
@Slf4j
public class PermissionMapLoader {

    private static final TypeReference<List<EndpointDocument>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<EndpointEntry> loadFromFile(Path path, String version) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл карты разрешений не найден: " + path);
        }
        log.info("Загрузка карты разрешений {}: {}", version, path);
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, version);
        }
    }

    public List<EndpointEntry> loadFromClasspath(String resource, String version) throws IOException {
        try (InputStream is = PermissionMapLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException(resource + " не найден в classpath");
            }
            return load(is, version);
        }
    }

    public List<EndpointEntry> load(InputStream is, String version) throws IOException {
        List<EndpointDocument> documents = objectMapper.readValue(is, DOCUMENT_TYPE);
        List<EndpointEntry> entries = new ArrayList<>();
        int skipped = 0;
        int unknownScopes = 0;

        for (EndpointDocument document : documents) {
            if (document == null || document.getEndpoint() == null || document.getMethod() == null
                || document.getMethod().isEmpty()) {
                skipped++;
                continue;
            }

            Map<String, List<PermissionDescriptor>> perMethod = new LinkedHashMap<>();
            for (Map.Entry<String, List<PermissionDocument>> method : document.getMethod().entrySet()) {
                List<PermissionDescriptor> descriptors = new ArrayList<>();
                if (method.getValue() != null) {
                    for (PermissionDocument permission : method.getValue()) {
                        if (permission == null || permission.getValue() == null) {
                            continue;
                        }
                        ScopeType scopeType = ScopeType.fromGraphName(permission.getScopeType());
                        if (scopeType == null) {
                            unknownScopes++;
                            continue;
                        }
                        descriptors.add(PermissionDescriptor.builder()
                            .name(permission.getValue().trim())
                            .scopeType(scopeType)
                            .leastPrivileged(Boolean.TRUE.equals(permission.getLeastPrivilege()))
                            .build());
                    }
                }
                perMethod.put(method.getKey().toUpperCase(Locale.ROOT), descriptors);
            }

            entries.add(EndpointEntry.builder()
                .canonicalPath(document.getEndpoint())
                .version(document.getVersion() != null ? document.getVersion() : version)
                .perMethodPermissions(perMethod)
                .build());
        }

        if (skipped > 0 || unknownScopes > 0) {
            log.debug("Карта {}: пропущено {} эндпоинтов без методов и {} разрешений с неизвестным scopeType",
                version, skipped, unknownScopes);
        }
        PermissionMapSummary summary = PermissionMapSummary.of(version, entries);
        log.info("Карта {}: эндпоинтов {}, методов {}, разрешений {}, с разрешениями {} ({}%)",
            version, summary.getTotalEndpoints(), summary.getTotalMethods(), summary.getTotalPermissions(),
            summary.getEndpointsWithPermissions(), summary.getCoveragePercent());
        return entries;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EndpointDocument {
        @JsonProperty("Endpoint")
        @JsonAlias("endpoint")
        private String endpoint;

        @JsonProperty("Version")
        @JsonAlias("version")
        private String version;

        @JsonProperty("Method")
        @JsonAlias("method")
        private Map<String, List<PermissionDocument>> method;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PermissionDocument {
        @JsonAlias("name")
        private String value;

        private String scopeType;

        @JsonProperty("isLeastPrivilege")
        @JsonAlias({"isLeastPrivileged", "leastPrivileged"})
        private Boolean leastPrivilege;
    }
}
