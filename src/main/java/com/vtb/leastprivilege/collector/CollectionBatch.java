package com.vtb.leastprivilege.collector;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результаты пакетного сбора по всем приложениям
 */
@Data
@Builder
public class CollectionBatch {

    @Builder.Default
    private List<CollectionResult> results = new ArrayList<>();

    // Приложения, по которым результат не пришел до остановки по таймауту
    @Builder.Default
    private List<CollectionResult> pending = new ArrayList<>();

    private int submitted;

    @Builder.Default
    private boolean stalled = false;

    public int getCompleted() {
        return results.size();
    }

    public long getFailedCount() {
        return results.stream().filter(CollectionResult::isFailed).count();
    }

    public static CollectionBatch empty() {
        return CollectionBatch.builder().build();
    }
}
