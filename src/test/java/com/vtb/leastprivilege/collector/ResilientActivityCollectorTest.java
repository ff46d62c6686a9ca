package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.models.ActivityWindow;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.CollectionStatus;
import com.vtb.leastprivilege.models.RawActivity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ResilientActivityCollectorTest {

    private static final Instant T = Instant.parse("2024-05-01T00:00:00Z");
    private static final String GRAPH = "https://graph.microsoft.com/v1.0";
    private static final ApplicationPrincipal APP = ApplicationPrincipal.builder()
        .id("sp-1")
        .displayName("HR Sync")
        .build();

    /**
     * Клиент, который записывает окна запросов и отвечает по функции от окна
     */
    private static final class RecordingClient implements ActivityLogClient {
        private final List<ActivityWindow> windows = Collections.synchronizedList(new ArrayList<>());
        private final Function<ActivityWindow, ActivityQueryResult> responder;

        private RecordingClient(Function<ActivityWindow, ActivityQueryResult> responder) {
            this.responder = responder;
        }

        @Override
        public ActivityQueryResult query(String principalId, ActivityWindow window) {
            windows.add(window);
            return responder.apply(window);
        }
    }

    private static RawActivity raw(String method, String uri) {
        return RawActivity.builder().method(method).uri(GRAPH + uri).build();
    }

    private static ActivityWindow window(Duration duration, int maxEntries) {
        return ActivityWindow.builder().start(T).end(T.plus(duration)).maxEntries(maxEntries).build();
    }

    private static Set<String> uris(CollectionResult result) {
        return result.getActivities().stream().map(CanonicalActivity::getUri).collect(Collectors.toSet());
    }

    @Test
    void bisectsWindowWhenResponseIsTooLarge() {
        ActivityWindow full = window(Duration.ofDays(30), 100_000);
        RecordingClient client = new RecordingClient(w -> {
            if (w.getDuration().equals(Duration.ofDays(30))) {
                return ActivityQueryResult.sizeExceeded("ResponseSizeError");
            }
            if (w.getStart().equals(T)) {
                return ActivityQueryResult.success(List.of(raw("GET", "/users"), raw("GET", "/groups")));
            }
            return ActivityQueryResult.success(List.of(raw("GET", "/groups"), raw("GET", "/devices")));
        });

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, full);

        assertEquals(CollectionStatus.SUCCESS, result.getStatus());
        assertEquals(3, result.getQueriesIssued());
        assertEquals(0, result.getTruncatedSlices());
        assertEquals(3, result.getActivities().size(), "Объединение половин без дубликатов");

        ActivityWindow left = client.windows.get(1);
        ActivityWindow right = client.windows.get(2);
        assertEquals(T, left.getStart());
        assertEquals(T.plus(Duration.ofDays(15)), left.getEnd());
        assertEquals(T.plus(Duration.ofDays(15)), right.getStart());
        assertEquals(T.plus(Duration.ofDays(30)), right.getEnd());
        assertEquals(50_000, left.getMaxEntries());
        assertEquals(50_000, right.getMaxEntries());
    }

    @Test
    void skipsMinimalWindowThatStillExceedsLimit() {
        RecordingClient client = new RecordingClient(w -> {
            if (w.getStart().equals(T)) {
                return ActivityQueryResult.sizeExceeded("E_QUERY_RESULT_SET_TOO_LARGE");
            }
            return ActivityQueryResult.success(List.of(raw("GET", "/users")));
        });

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(2), 10));

        assertEquals(CollectionStatus.SUCCESS, result.getStatus());
        assertEquals(1, result.getTruncatedSlices());
        assertEquals(3, result.getQueriesIssued());
        assertEquals(Set.of(GRAPH + "/users"), uris(result));
    }

    @Test
    void keepsBisectingUntilMinimalWindow() {
        Instant hotDayEnd = T.plus(Duration.ofDays(1));
        RecordingClient client = new RecordingClient(w -> {
            if (w.getStart().isBefore(hotDayEnd)) {
                return ActivityQueryResult.sizeExceeded("ResponseSizeError");
            }
            return ActivityQueryResult.success(List.of(raw("GET", "/users/" + w.getStart().getEpochSecond())));
        });

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(4), 8));

        // [0,4) → [0,2) + [2,4); [0,2) → [0,1) (пропущено) + [1,2)
        assertEquals(5, result.getQueriesIssued());
        assertEquals(1, result.getTruncatedSlices());
        assertEquals(1, result.getActivities().size(), "Идентификаторы схлопываются в {id}");
        assertEquals(2, client.windows.stream().filter(w -> w.getMaxEntries() == 2).count());
    }

    @Test
    void otherErrorFailsApplicationWithoutRetry() {
        RecordingClient client = new RecordingClient(w -> ActivityQueryResult.failure("HTTP 403 Forbidden"));

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(30), 100));

        assertEquals(CollectionStatus.FAILED, result.getStatus());
        assertEquals("HTTP 403 Forbidden", result.getFailureReason());
        assertEquals(1, client.windows.size());
        assertTrue(result.getActivities().isEmpty());
    }

    @Test
    void failureInsideSubWindowFailsWholeCollection() {
        RecordingClient client = new RecordingClient(w -> {
            if (w.getDuration().equals(Duration.ofDays(30))) {
                return ActivityQueryResult.sizeExceeded("ResponseSizeError");
            }
            if (w.getStart().equals(T)) {
                return ActivityQueryResult.success(List.of(raw("GET", "/users")));
            }
            return ActivityQueryResult.failure("HTTP 500");
        });

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(30), 100));

        assertEquals(CollectionStatus.FAILED, result.getStatus());
        assertEquals("HTTP 500", result.getFailureReason());
        assertEquals(3, result.getQueriesIssued());
        assertTrue(result.getActivities().isEmpty(), "Частичные данные не возвращаются");
    }

    @Test
    void clientExceptionBecomesFailure() {
        ActivityLogClient client = (principalId, w) -> {
            throw new IllegalStateException("connection reset");
        };

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(1), 10));

        assertTrue(result.isFailed());
        assertEquals("connection reset", result.getFailureReason());
    }

    @Test
    void noActivityIsEmptyStatus() {
        RecordingClient client = new RecordingClient(w -> ActivityQueryResult.success(List.of()));

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(30), 100));

        assertEquals(CollectionStatus.EMPTY, result.getStatus());
        assertEquals(1, result.getQueriesIssued());
    }

    @Test
    void deduplicatesByCanonicalForm() {
        RecordingClient client = new RecordingClient(w -> ActivityQueryResult.success(List.of(
            raw("GET", "/users/11111111-1111-1111-1111-111111111111"),
            raw("get", "/users/22222222-2222-2222-2222-222222222222"),
            raw("PATCH", "/users/11111111-1111-1111-1111-111111111111"),
            raw("GET", "/users?$top=5"),
            raw("GET", "/users"))));

        CollectionResult result = new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(30), 100));

        assertEquals(3, result.getActivities().size());
        assertEquals("GET", result.getActivities().get(0).getMethod());
        assertEquals("/users/{id}", result.getActivities().get(0).getPath());
    }

    @Test
    void entryLimitNeverDropsBelowOne() {
        RecordingClient client = new RecordingClient(w -> w.getDuration().compareTo(Duration.ofDays(1)) > 0
            ? ActivityQueryResult.sizeExceeded("ResponseSizeError")
            : ActivityQueryResult.success(List.of()));

        new ResilientActivityCollector(client).collect(APP, window(Duration.ofDays(8), 1));

        assertTrue(client.windows.stream().allMatch(w -> w.getMaxEntries() >= 1));
        assertEquals(15, client.windows.size());
    }

    @Test
    void rejectsInvalidInput() {
        ResilientActivityCollector collector =
            new ResilientActivityCollector(new RecordingClient(w -> ActivityQueryResult.success(List.of())));
        ActivityWindow inverted = ActivityWindow.builder().start(T).end(T).maxEntries(10).build();
        ApplicationPrincipal withoutId = ApplicationPrincipal.builder().displayName("no id").build();

        assertThrows(IllegalArgumentException.class, () -> collector.collect(APP, inverted));
        assertThrows(IllegalArgumentException.class, () -> collector.collect(APP, window(Duration.ofDays(1), 0)));
        assertThrows(IllegalArgumentException.class, () -> collector.collect(withoutId, window(Duration.ofDays(1), 1)));
        assertThrows(IllegalArgumentException.class, () -> new ResilientActivityCollector(null));
    }

    @Test
    void dedupeKeepsFirstOccurrence() {
        List<RawActivity> unique = ResilientActivityCollector.dedupe(List.of(
            raw("get", "/users"), raw("GET", "/users"), raw("POST", "/users")));

        assertEquals(2, unique.size());
        assertEquals("get", unique.get(0).getMethod());
    }
}
