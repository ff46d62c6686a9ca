package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.models.ActivityWindow;
import com.vtb.leastprivilege.models.ApplicationPrincipal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Параллельный сбор активности по многим приложениям.
 *
 * Приложения кладутся в очередь заданий, фиксированный пул рабочих потоков
 * берет их по одному и отдает результаты в очередь результатов. Координатор
 * вычитывает результаты; если за {@code stallTimeout} не пришло ни одного нового,
 * ожидание прекращается и возвращается то, что успело завершиться.
 * Ошибка по одному приложению не влияет на остальные.
 */
@Slf4j
public class CollectionScheduler {

    public static final int DEFAULT_WORKERS = 10;
    public static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofMinutes(5);

    private final ResilientActivityCollector collector;
    private final int workers;
    private final Duration stallTimeout;

    public CollectionScheduler(ResilientActivityCollector collector) {
        this(collector, DEFAULT_WORKERS, DEFAULT_STALL_TIMEOUT);
    }

    public CollectionScheduler(ResilientActivityCollector collector, int workers, Duration stallTimeout) {
        if (collector == null) {
            throw new IllegalArgumentException("Collector не может быть null");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Количество потоков должно быть положительным: " + workers);
        }
        if (stallTimeout == null || stallTimeout.isNegative() || stallTimeout.isZero()) {
            throw new IllegalArgumentException("Таймаут ожидания должен быть положительным: " + stallTimeout);
        }
        this.collector = collector;
        this.workers = workers;
        this.stallTimeout = stallTimeout;
    }

    /**
     * Собрать активность по всем приложениям
     *
     * @param applications приложения для анализа
     * @param window окно запроса; каждое приложение получает свою копию
     */
    public CollectionBatch collectAll(List<ApplicationPrincipal> applications, ActivityWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("Окно запроса не задано");
        }
        if (applications == null || applications.isEmpty()) {
            return CollectionBatch.empty();
        }

        BlockingQueue<ApplicationPrincipal> workQueue = new LinkedBlockingQueue<>();
        applications.stream().filter(Objects::nonNull).forEach(workQueue::add);
        BlockingQueue<CollectionResult> resultQueue = new LinkedBlockingQueue<>();

        int total = workQueue.size();
        if (total == 0) {
            return CollectionBatch.empty();
        }
        int poolSize = Math.min(workers, total);
        log.info("Сбор активности: {} приложений, {} потоков, таймаут ожидания {}", total, poolSize, stallTimeout);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new CollectorThreadFactory());
        for (int i = 0; i < poolSize; i++) {
            executor.submit(() -> drain(workQueue, resultQueue, window));
        }
        executor.shutdown();

        List<CollectionResult> completed = new ArrayList<>(total);
        boolean stalled = false;
        try {
            while (completed.size() < total) {
                CollectionResult result = resultQueue.poll(stallTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (result == null) {
                    stalled = true;
                    log.warn("Нет новых результатов за {} - прекращаем ожидание ({} из {} готово)",
                        stallTimeout, completed.size(), total);
                    break;
                }
                completed.add(result);
                log.info("Готово {}/{}: {} [{}]", completed.size(), total,
                    result.getApplication().getDisplayName(), result.getStatus());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stalled = true;
            log.warn("Ожидание результатов прервано ({} из {} готово)", completed.size(), total);
        } finally {
            if (stalled) {
                executor.shutdownNow();
            }
        }

        return CollectionBatch.builder()
            .results(completed)
            .pending(pendingResults(applications, completed))
            .submitted(total)
            .stalled(stalled)
            .build();
    }

    private void drain(BlockingQueue<ApplicationPrincipal> workQueue,
                       BlockingQueue<CollectionResult> resultQueue,
                       ActivityWindow window) {
        ApplicationPrincipal application;
        while (!Thread.currentThread().isInterrupted() && (application = workQueue.poll()) != null) {
            CollectionResult result;
            try {
                result = collector.collect(application, window.toBuilder().build());
            } catch (Exception e) {
                log.error("Ошибка сбора активности для {}: {}", application.getId(), e.getMessage(), e);
                result = CollectionResult.failed(application,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } catch (Error e) {
                // Каждое взятое из очереди приложение дает ровно один результат
                log.error("Критическая ошибка сбора активности для {}: {}", application.getId(), e, e);
                result = CollectionResult.failed(application, "Критическая ошибка: " + e);
            }
            resultQueue.add(result);
        }
    }

    private List<CollectionResult> pendingResults(List<ApplicationPrincipal> applications,
                                                  List<CollectionResult> completed) {
        Set<ApplicationPrincipal> done = Collections.newSetFromMap(new IdentityHashMap<>());
        completed.forEach(result -> done.add(result.getApplication()));

        List<CollectionResult> pending = new ArrayList<>();
        for (ApplicationPrincipal application : applications) {
            if (application != null && !done.contains(application)) {
                pending.add(CollectionResult.notCollected(application));
            }
        }
        return pending;
    }

    private static final class CollectorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "activity-collector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
