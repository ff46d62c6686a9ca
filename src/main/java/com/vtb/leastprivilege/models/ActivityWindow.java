package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Окно запроса к журналу активности: [start, end) и лимит строк
 */
@Value
@Builder(toBuilder = true)
public class ActivityWindow {
    Instant start;
    Instant end;
    int maxEntries;

    public static ActivityWindow lookback(Instant now, int days, int maxEntries) {
        return ActivityWindow.builder()
            .start(now.minus(Duration.ofDays(days)))
            .end(now)
            .maxEntries(maxEntries)
            .build();
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    /**
     * Разделить окно пополам по времени; лимит строк каждой половины делится на два (минимум 1)
     */
    public ActivityWindow[] bisect() {
        Instant middle = start.plus(getDuration().dividedBy(2));
        int halfEntries = Math.max(1, maxEntries / 2);
        return new ActivityWindow[] {
            new ActivityWindow(start, middle, halfEntries),
            new ActivityWindow(middle, end, halfEntries)
        };
    }
}
