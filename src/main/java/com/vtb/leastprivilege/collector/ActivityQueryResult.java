package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.models.RawActivity;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Ответ хранилища логов на один запрос активности
 */
@Data
@Builder
public class ActivityQueryResult {

    @Builder.Default
    private List<RawActivity> activities = new ArrayList<>();

    @Builder.Default
    private QueryErrorKind errorKind = QueryErrorKind.NONE;

    private String message;

    public boolean isSuccess() {
        return errorKind == QueryErrorKind.NONE;
    }

    public static ActivityQueryResult success(List<RawActivity> activities) {
        return ActivityQueryResult.builder()
            .activities(activities != null ? activities : new ArrayList<>())
            .build();
    }

    public static ActivityQueryResult sizeExceeded(String message) {
        return ActivityQueryResult.builder()
            .errorKind(QueryErrorKind.SIZE_EXCEEDED)
            .message(message)
            .build();
    }

    public static ActivityQueryResult failure(String message) {
        return ActivityQueryResult.builder()
            .errorKind(QueryErrorKind.OTHER)
            .message(message)
            .build();
    }
}
