package com.vtb.leastprivilege.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.leastprivilege.collector.ActivityLogClient;
import com.vtb.leastprivilege.collector.ActivityQueryResult;
import com.vtb.leastprivilege.config.AnalyzerConfig;
import com.vtb.leastprivilege.models.ActivityWindow;
import com.vtb.leastprivilege.models.RawActivity;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Клиент Azure Monitor Logs для таблицы MicrosoftGraphActivityLogs.
 *
 * Запрос выполняет дедупликацию (метод, URI без query string и двойных слешей)
 * на стороне хранилища и ограничивает число строк лимитом окна.
 * Коды ошибок из {@code sizeExceededCodes} в любом месте цепочки error/innererror
 * дают SIZE_EXCEEDED, остальные ошибки - OTHER.
 */
@Slf4j
public class LogAnalyticsClient implements ActivityLogClient {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern PRINCIPAL_ID = Pattern.compile("^[A-Za-z0-9-]{1,64}$");
    private static final String METHOD_COLUMN = "RequestMethod";
    private static final String URI_COLUMN = "CleanUri";

    private final String workspaceId;
    private final String endpoint;
    private final String activityTable;
    private final Supplier<String> tokenSupplier;
    private final Set<String> sizeExceededCodes;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LogAnalyticsClient(AnalyzerConfig.LogAnalytics settings, String workspaceId, Supplier<String> tokenSupplier) {
        if (settings == null) {
            throw new IllegalArgumentException("Настройки Log Analytics не заданы");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("Не указан идентификатор рабочей области Log Analytics");
        }
        if (tokenSupplier == null) {
            throw new IllegalArgumentException("Не указан источник токена доступа");
        }
        this.workspaceId = workspaceId.trim();
        this.endpoint = settings.getEndpoint();
        this.activityTable = settings.getActivityTable();
        this.tokenSupplier = tokenSupplier;
        this.sizeExceededCodes = settings.getSizeExceededCodes().stream()
            .map(code -> code.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(settings.getTimeoutSec(), TimeUnit.SECONDS)
            .callTimeout(settings.getTimeoutSec(), TimeUnit.SECONDS)
            .retryOnConnectionFailure(false)
            .build();
    }

    @Override
    public ActivityQueryResult query(String principalId, ActivityWindow window) {
        if (principalId == null || !PRINCIPAL_ID.matcher(principalId).matches()) {
            return ActivityQueryResult.failure("Недопустимый идентификатор приложения: " + principalId);
        }

        HttpUrl url = resolveQueryUrl();
        if (url == null) {
            return ActivityQueryResult.failure("Недопустимый адрес Log Analytics: " + endpoint);
        }

        String requestJson;
        try {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("query", buildQuery(principalId, window));
            body.put("timespan", window.getStart() + "/" + window.getEnd());
            requestJson = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            return ActivityQueryResult.failure("Не удалось сформировать запрос: " + e.getMessage());
        }

        Request request = new Request.Builder()
            .url(url)
            .addHeader("Authorization", "Bearer " + tokenSupplier.get())
            .addHeader("User-Agent", "VTB-Least-Privilege-Analyzer/1.0")
            .post(RequestBody.create(requestJson, JSON))
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            JsonNode root = parse(text);

            if (root != null && root.hasNonNull("error")) {
                return classifyError(root.get("error"), response.code());
            }
            if (!response.isSuccessful()) {
                return ActivityQueryResult.failure("HTTP " + response.code() + " от Log Analytics");
            }
            if (root == null) {
                return ActivityQueryResult.failure("Некорректный JSON в ответе Log Analytics");
            }
            return ActivityQueryResult.success(readRows(root));
        } catch (SocketTimeoutException timeout) {
            return ActivityQueryResult.failure("Таймаут запроса к Log Analytics");
        } catch (IOException e) {
            return ActivityQueryResult.failure("Сетевая ошибка Log Analytics: " + e.getMessage());
        }
    }

    /**
     * Сформировать KQL-запрос уникальных успешных вызовов приложения
     */
    String buildQuery(String principalId, ActivityWindow window) {
        return String.join("\n",
            activityTable,
            "| where TimeGenerated >= datetime(" + window.getStart() + ") and TimeGenerated < datetime(" + window.getEnd() + ")",
            "| where ServicePrincipalId == '" + principalId + "'",
            "| where ResponseStatusCode >= 200 and ResponseStatusCode < 300",
            "| extend " + URI_COLUMN + " = replace_regex(tostring(split(RequestUri, '?')[0]), @'([^:])/{2,}', @'\\1/')",
            "| distinct " + METHOD_COLUMN + ", " + URI_COLUMN,
            "| take " + window.getMaxEntries());
    }

    private HttpUrl resolveQueryUrl() {
        HttpUrl base = HttpUrl.parse(endpoint);
        if (base == null) {
            return null;
        }
        return base.newBuilder()
            .addPathSegment("v1")
            .addPathSegment("workspaces")
            .addPathSegment(workspaceId)
            .addPathSegment("query")
            .build();
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            log.debug("Ответ Log Analytics не является JSON: {}", e.getMessage());
            return null;
        }
    }

    private ActivityQueryResult classifyError(JsonNode error, int statusCode) {
        List<String> codes = new ArrayList<>();
        collectCodes(error, codes);
        String message = error.path("message").asText("Ошибка Log Analytics");

        boolean sizeExceeded = codes.stream()
            .anyMatch(code -> sizeExceededCodes.contains(code.toLowerCase(Locale.ROOT)));
        if (sizeExceeded) {
            log.debug("Log Analytics: превышен размер ответа ({})", codes);
            return ActivityQueryResult.sizeExceeded(message);
        }
        return ActivityQueryResult.failure("HTTP " + statusCode + " " + String.join("/", codes) + ": " + message);
    }

    private void collectCodes(JsonNode node, List<String> codes) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return;
        }
        if (node.hasNonNull("code")) {
            codes.add(node.get("code").asText());
        }
        collectCodes(node.get("innererror"), codes);
        JsonNode details = node.get("details");
        if (details != null && details.isArray()) {
            for (JsonNode detail : details) {
                collectCodes(detail, codes);
            }
        }
    }

    private List<RawActivity> readRows(JsonNode root) {
        List<RawActivity> activities = new ArrayList<>();
        JsonNode tables = root.path("tables");
        if (!tables.isArray() || tables.isEmpty()) {
            return activities;
        }

        JsonNode table = tables.get(0);
        int methodIndex = -1;
        int uriIndex = -1;
        JsonNode columns = table.path("columns");
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).path("name").asText();
            if (METHOD_COLUMN.equals(name)) {
                methodIndex = i;
            } else if (URI_COLUMN.equals(name)) {
                uriIndex = i;
            }
        }
        if (methodIndex < 0 || uriIndex < 0) {
            log.warn("В ответе Log Analytics нет колонок {} и {}", METHOD_COLUMN, URI_COLUMN);
            return activities;
        }

        for (JsonNode row : table.path("rows")) {
            String method = row.path(methodIndex).asText(null);
            String uri = row.path(uriIndex).asText(null);
            if (method != null && uri != null) {
                activities.add(RawActivity.builder().method(method).uri(uri).build());
            }
        }
        return activities;
    }
}
