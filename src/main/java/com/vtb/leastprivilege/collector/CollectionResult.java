package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.models.ApplicationPrincipal;
import com.vtb.leastprivilege.models.CanonicalActivity;
import com.vtb.leastprivilege.models.CollectionStatus;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог сбора активности по одному приложению
 */
@Data
@Builder
public class CollectionResult {
    private ApplicationPrincipal application;
    private CollectionStatus status;

    @Builder.Default
    private List<CanonicalActivity> activities = new ArrayList<>();

    private String failureReason;

    // Окна минимальной ширины, которые так и не уложились в лимит размера
    @Builder.Default
    private int truncatedSlices = 0;

    @Builder.Default
    private int queriesIssued = 0;

    public boolean isFailed() {
        return status == CollectionStatus.FAILED;
    }

    public static CollectionResult failed(ApplicationPrincipal application, String reason) {
        return CollectionResult.builder()
            .application(application)
            .status(CollectionStatus.FAILED)
            .failureReason(reason)
            .build();
    }

    public static CollectionResult notCollected(ApplicationPrincipal application) {
        return CollectionResult.builder()
            .application(application)
            .status(CollectionStatus.NOT_COLLECTED)
            .failureReason("Сбор не завершился до остановки пакета")
            .build();
    }
}
