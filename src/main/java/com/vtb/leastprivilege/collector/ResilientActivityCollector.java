package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.core.UriCanonicalizer;
import com.vtb.leastprivilege.models.ActivityWindow;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.CollectionStatus;
import com.vtb.leastprivilege.models.RawActivity;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Сбор уникальных вызовов приложения из журнала активности.
 *
 * Если хранилище отвечает SIZE_EXCEEDED, окно делится пополам по времени
 * (лимит строк тоже делится пополам) и каждая половина собирается отдельно.
 * Окно не уже {@code minWindow}, которое все равно не укладывается в лимит,
 * пропускается с предупреждением. Любая другая ошибка не повторяется и
 * помечает приложение как FAILED.
 *
 * Экземпляр не хранит состояния между вызовами и может использоваться из нескольких потоков,
 * если это допускает клиент.
 */
@Slf4j
public class ResilientActivityCollector {

    public static final Duration DEFAULT_MIN_WINDOW = Duration.ofDays(1);

    private final ActivityLogClient client;
    private final Duration minWindow;

    public ResilientActivityCollector(ActivityLogClient client) {
        this(client, DEFAULT_MIN_WINDOW);
    }

    public ResilientActivityCollector(ActivityLogClient client, Duration minWindow) {
        if (client == null) {
            throw new IllegalArgumentException("ActivityLogClient не может быть null");
        }
        if (minWindow == null || minWindow.isNegative() || minWindow.isZero()) {
            throw new IllegalArgumentException("Минимальное окно должно быть положительным: " + minWindow);
        }
        this.client = client;
        this.minWindow = minWindow;
    }

    /**
     * Собрать активность приложения за окно
     */
    public CollectionResult collect(ApplicationPrincipal application, ActivityWindow window) {
        if (application == null || application.getId() == null || application.getId().isBlank()) {
            throw new IllegalArgumentException("Не указан идентификатор приложения");
        }
        validateWindow(window);

        log.debug("Сбор активности {} за [{}, {}), лимит {}",
            application.getId(), window.getStart(), window.getEnd(), window.getMaxEntries());

        SliceOutcome outcome = collectWindow(application.getId(), window);

        if (outcome.failure() != null) {
            log.warn("Сбор активности {} не выполнен: {}", application.getId(), outcome.failure());
            CollectionResult failed = CollectionResult.failed(application, outcome.failure());
            failed.setQueriesIssued(outcome.queries());
            return failed;
        }

        List<CanonicalActivity> activities = canonicalize(outcome.activities());
        if (outcome.truncated() > 0) {
            log.warn("{}: {} окон минимальной ширины пропущено из-за лимита размера ответа",
                application.getId(), outcome.truncated());
        }

        return CollectionResult.builder()
            .application(application)
            .status(activities.isEmpty() ? CollectionStatus.EMPTY : CollectionStatus.SUCCESS)
            .activities(activities)
            .truncatedSlices(outcome.truncated())
            .queriesIssued(outcome.queries())
            .build();
    }

    private SliceOutcome collectWindow(String principalId, ActivityWindow window) {
        ActivityQueryResult result;
        try {
            result = client.query(principalId, window);
        } catch (RuntimeException e) {
            log.error("Ошибка клиента журнала активности для {}: {}", principalId, e.getMessage(), e);
            return SliceOutcome.failed(describe(e), 1);
        }

        if (result == null) {
            return SliceOutcome.failed("Клиент журнала активности вернул null", 1);
        }

        QueryErrorKind kind = result.getErrorKind() != null ? result.getErrorKind() : QueryErrorKind.OTHER;
        return switch (kind) {
            case NONE -> SliceOutcome.of(dedupe(result.getActivities()), 0, 1);
            case SIZE_EXCEEDED -> bisect(principalId, window);
            case OTHER -> SliceOutcome.failed(
                result.getMessage() != null ? result.getMessage() : "Ошибка запроса к журналу активности", 1);
        };
    }

    private SliceOutcome bisect(String principalId, ActivityWindow window) {
        if (window.getDuration().compareTo(minWindow) <= 0) {
            log.warn("Окно [{}, {}) для {} превышает лимит размера даже при минимальной ширине - пропускаем",
                window.getStart(), window.getEnd(), principalId);
            return SliceOutcome.of(List.of(), 1, 1);
        }

        ActivityWindow[] halves = window.bisect();
        log.debug("Превышен размер ответа для {}: делим окно [{}, {}) пополам, лимит {}",
            principalId, window.getStart(), window.getEnd(), halves[0].getMaxEntries());

        SliceOutcome left = collectWindow(principalId, halves[0]);
        if (left.failure() != null) {
            return SliceOutcome.failed(left.failure(), left.queries() + 1);
        }
        SliceOutcome right = collectWindow(principalId, halves[1]);
        if (right.failure() != null) {
            return SliceOutcome.failed(right.failure(), left.queries() + right.queries() + 1);
        }

        List<RawActivity> union = new ArrayList<>(left.activities().size() + right.activities().size());
        union.addAll(left.activities());
        union.addAll(right.activities());
        return SliceOutcome.of(dedupe(union),
            left.truncated() + right.truncated(),
            left.queries() + right.queries() + 1);
    }

    static List<RawActivity> dedupe(List<RawActivity> activities) {
        if (activities == null || activities.isEmpty()) {
            return List.of();
        }
        Map<String, RawActivity> unique = new LinkedHashMap<>();
        for (RawActivity activity : activities) {
            if (activity == null || activity.getUri() == null) {
                continue;
            }
            unique.putIfAbsent(methodKey(activity.getMethod()) + " " + activity.getUri(), activity);
        }
        return Collections.unmodifiableList(new ArrayList<>(unique.values()));
    }

    // Хранилище убирает только query string и двойные слеши, идентификаторы заменяем локально
    private List<CanonicalActivity> canonicalize(List<RawActivity> activities) {
        Map<String, CanonicalActivity> unique = new LinkedHashMap<>();
        for (RawActivity raw : activities) {
            CanonicalActivity activity = UriCanonicalizer.toActivity(raw.getMethod(), raw.getUri());
            unique.putIfAbsent(methodKey(activity.getMethod()) + " " + activity.getUri(), activity);
        }
        return new ArrayList<>(unique.values());
    }

    private static String methodKey(String method) {
        return method != null ? method.trim().toUpperCase(Locale.ROOT) : "";
    }

    private void validateWindow(ActivityWindow window) {
        if (window == null || window.getStart() == null || window.getEnd() == null) {
            throw new IllegalArgumentException("Окно запроса не задано");
        }
        if (!window.getEnd().isAfter(window.getStart())) {
            throw new IllegalArgumentException("Конец окна должен быть позже начала: " + window);
        }
        if (window.getMaxEntries() < 1) {
            throw new IllegalArgumentException("Лимит строк должен быть положительным: " + window.getMaxEntries());
        }
    }

    private String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record SliceOutcome(List<RawActivity> activities, int truncated, int queries, String failure) {

        static SliceOutcome of(List<RawActivity> activities, int truncated, int queries) {
            return new SliceOutcome(activities, truncated, queries, null);
        }

        static SliceOutcome failed(String failure, int queries) {
            return new SliceOutcome(List.of(), 0, queries, failure);
        }
    }
}
