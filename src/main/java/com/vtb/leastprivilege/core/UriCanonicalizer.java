package com.vtb.leastprivilege.core;

import com.vtb.leastprivilege.models.CanonicalActivity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Канонизация URI вызовов Microsoft Graph.
 *
 * Превращает конкретный запрос в шаблон без идентификаторов:
 * <pre>
 *   https://graph.microsoft.com/v1.0/users/1111-...-1111?$select=id
 *   → https://graph.microsoft.com/v1.0/users/{id}
 * </pre>
 * Преобразование детерминировано, идемпотентно и не бросает исключений.
 */
public final class UriCanonicalizer {

    public static final String ID_PLACEHOLDER = "{id}";

    private static final Set<String> VERSION_SEGMENTS = Set.of("v1.0", "beta");

    private static final Pattern SCHEME_AUTHORITY =
        Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*://[^/]*)(.*)$");

    private static final Pattern EMAIL_SEGMENT =
        Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private static final Pattern PLACEHOLDER_SEGMENT =
        Pattern.compile("^\\{[^{}]*}$");

    private static final Pattern DIGIT = Pattern.compile("\\d");

    private UriCanonicalizer() {
    }

    /**
     * Канонизировать URI запроса
     *
     * @param uri абсолютный или относительный URI, возможно с query string
     * @return канонический URI; null для null, пустая строка для пустого ввода
     */
    public static String canonicalize(String uri) {
        if (uri == null) {
            return null;
        }
        String trimmed = uri.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }

        int queryStart = trimmed.indexOf('?');
        String withoutQuery = queryStart >= 0 ? trimmed.substring(0, queryStart).trim() : trimmed;

        String prefix = "";
        String path = withoutQuery;
        Matcher matcher = SCHEME_AUTHORITY.matcher(withoutQuery);
        if (matcher.matches()) {
            prefix = matcher.group(1);
            path = matcher.group(2);
        }
        return prefix + canonicalizePath(path);
    }

    /**
     * Канонизировать URI и разложить его на версию и путь
     */
    public static CanonicalActivity toActivity(String method, String uri) {
        String canonical = canonicalize(uri);
        String normalizedMethod = method != null ? method.trim().toUpperCase(Locale.ROOT) : null;

        if (canonical == null) {
            return CanonicalActivity.builder()
                .method(normalizedMethod)
                .build();
        }

        String path = canonical;
        Matcher matcher = SCHEME_AUTHORITY.matcher(canonical);
        if (matcher.matches()) {
            path = matcher.group(2);
        }

        // Версия API - только первый сегмент после хоста
        List<String> segments = splitSegments(path);
        String version = null;
        String versionlessPath;
        if (!segments.isEmpty() && isVersionSegment(segments.get(0))) {
            version = segments.get(0).toLowerCase(Locale.ROOT);
            versionlessPath = "/" + String.join("/", segments.subList(1, segments.size()));
        } else {
            versionlessPath = "/" + String.join("/", segments);
        }

        return CanonicalActivity.builder()
            .method(normalizedMethod)
            .uri(canonical)
            .version(version)
            .path(versionlessPath)
            .build();
    }

    /**
     * Привести путь из карты разрешений к той же форме, что и канонический путь вызова.
     * Плейсхолдеры вида {user-id} превращаются в {id}.
     */
    public static String normalizeTemplate(String path) {
        String canonical = canonicalize(path);
        if (canonical == null || canonical.isEmpty()) {
            return canonical;
        }

        boolean leadingSlash = canonical.startsWith("/");
        List<String> segments = splitSegments(canonical);
        List<String> normalized = new ArrayList<>(segments.size() + 1);

        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean last = i == segments.size() - 1;

            if (PLACEHOLDER_SEGMENT.matcher(segment).matches()) {
                normalized.add(ID_PLACEHOLDER);
            } else if (segment.indexOf('{') >= 0) {
                addFunctionOrId(normalized, segment, last);
            } else {
                normalized.add(segment);
            }
        }
        return join(normalized, leadingSlash);
    }

    private static String canonicalizePath(String path) {
        boolean leadingSlash = path.startsWith("/");
        List<String> segments = splitSegments(path);
        List<String> result = new ArrayList<>(segments.size() + 1);

        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean last = i == segments.size() - 1;

            if (segment.equalsIgnoreCase("me")) {
                result.add("users");
                result.add(ID_PLACEHOLDER);
            } else if (isVersionSegment(segment)) {
                result.add(segment);
            } else if (EMAIL_SEGMENT.matcher(segment).matches()) {
                result.add(ID_PLACEHOLDER);
            } else if (containsDigit(segment)) {
                addFunctionOrId(result, segment, last);
            } else {
                result.add(segment);
            }
        }
        return join(result, leadingSlash);
    }

    // OData-функция в конце пути: getEmailActivity(period='D7') → getEmailActivity/{id}
    private static void addFunctionOrId(List<String> target, String segment, boolean last) {
        int paren = segment.indexOf('(');
        if (last && paren > 0) {
            String functionName = segment.substring(0, paren);
            if (!containsDigit(functionName)) {
                target.add(functionName);
                target.add(ID_PLACEHOLDER);
                return;
            }
        }
        target.add(ID_PLACEHOLDER);
    }

    private static List<String> splitSegments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/+")) {
            String trimmed = segment.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    private static String join(List<String> segments, boolean leadingSlash) {
        String joined = String.join("/", segments);
        return leadingSlash && !joined.isEmpty() ? "/" + joined : joined;
    }

    private static boolean isVersionSegment(String segment) {
        return VERSION_SEGMENTS.contains(segment.toLowerCase(Locale.ROOT));
    }

    private static boolean containsDigit(String value) {
        return DIGIT.matcher(value).find();
    }
}
