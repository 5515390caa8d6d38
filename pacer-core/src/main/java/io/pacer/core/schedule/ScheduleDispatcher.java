package io.pacer.core.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.inject.Inject;
import io.pacer.commons.guava.ThrowablesUtil;
import io.pacer.spi.EnqueueException;
import io.pacer.spi.JobQueue;
import io.pacer.spi.JobRequest;
import io.pacer.spi.metrics.PacerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;


/**
 * Hands due entries to the {@link JobQueue}.
 *
 * A failed hand-off leaves the entry as it was, so it is still due at the next
 * iteration of the loop. Bookkeeping of successful hand-offs is queued to the
 * {@link RunRecorder} and never written here.
 */
public class ScheduleDispatcher
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleDispatcher.class);

    static final String CORRELATION_ID_KEY = "correlation_id";

    private final JobQueue queue;
    private final RunRecorder recorder;
    private final ScheduleConfig config;
    private final PacerMetrics metrics;

    private final AtomicLong dispatchCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();

    private ExecutorService executor;

    @Inject
    public ScheduleDispatcher(JobQueue queue, RunRecorder recorder, ScheduleConfig config, PacerMetrics metrics)
    {
        this.queue = queue;
        this.recorder = recorder;
        this.config = config;
        this.metrics = metrics;
    }

    public DispatchResult dispatch(ScheduleEntry entry, Instant now)
    {
        UUID correlationId = UUID.randomUUID();
        MDC.put(CORRELATION_ID_KEY, correlationId.toString());
        try {
            ScheduleEntry updated;
            try {
                // computed before the hand-off so that an accepted job always advances the entry
                updated = entry.dispatchedAt(now);
                JobRequest request = JobRequest.builder()
                    .taskIdentifier(entry.getTask())
                    .args(entry.getArgs())
                    .kwargs(entry.getKwargs().deepCopy())
                    .correlationId(correlationId)
                    .scheduleName(entry.getName())
                    .scheduledAt(entry.getNextDueAt())
                    .build();
                queue.enqueue(request);
            }
            catch (EnqueueException | RuntimeException ex) {
                failureCount.incrementAndGet();
                metrics.increment("scheduler_dispatch_failures");
                logger.warn("Failed to dispatch schedule '{}' (task {}). It stays due and will be retried: {}",
                        entry.getName(), entry.getTask(), ex.toString());
                return DispatchResult.failure(entry, correlationId, ex.toString());
            }

            recorder.record(entry.getName(), now);
            dispatchCount.incrementAndGet();
            metrics.increment("scheduler_dispatches");
            logger.info("Dispatched schedule '{}' (task {}, correlation id {}, due at {}). Next due at {}",
                    entry.getName(), entry.getTask(), correlationId, entry.getNextDueAt(), updated.getNextDueAt());
            return DispatchResult.success(updated, correlationId);
        }
        finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }

    /**
     * Dispatches all entries and waits for every hand-off. Results are in the order of
     * the given entries.
     */
    public List<DispatchResult> dispatchAll(List<ScheduleEntry> entries, Instant now)
    {
        if (entries.size() <= 1 || config.getDispatchThreads() <= 1) {
            ImmutableList.Builder<DispatchResult> results = ImmutableList.builder();
            for (ScheduleEntry entry : entries) {
                results.add(dispatch(entry, now));
            }
            return results.build();
        }

        ExecutorService pool = getExecutor();
        List<Future<DispatchResult>> futures = new ArrayList<>();
        for (ScheduleEntry entry : entries) {
            futures.add(pool.submit(() -> dispatch(entry, now)));
        }
        ImmutableList.Builder<DispatchResult> results = ImmutableList.builder();
        for (Future<DispatchResult> future : futures) {
            try {
                results.add(Uninterruptibles.getUninterruptibly(future));
            }
            catch (ExecutionException ex) {
                throw ThrowablesUtil.propagate(ex.getCause());
            }
        }
        return results.build();
    }

    private synchronized ExecutorService getExecutor()
    {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(config.getDispatchThreads(),
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("dispatcher-%d")
                    .build()
                    );
        }
        return executor;
    }

    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    logger.warn("Dispatcher threads didn't finish within 30 seconds");
                }
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
    }

    public long getDispatchCount()
    {
        return dispatchCount.get();
    }

    public long getFailureCount()
    {
        return failureCount.get();
    }
}
