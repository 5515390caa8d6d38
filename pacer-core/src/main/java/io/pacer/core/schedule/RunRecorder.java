package io.pacer.core.schedule;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.pacer.core.database.TransactionManager;
import io.pacer.core.repository.ResourceNotFoundException;
import io.pacer.spi.metrics.PacerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Writes run bookkeeping to the {@link ScheduleStore} in the background.
 *
 * Records are written in the order they were queued, each in its own transaction.
 * When a write fails, the record stays at the head of the queue and the flush stops
 * until the next tick.
 */
public class RunRecorder
{
    private static final Logger logger = LoggerFactory.getLogger(RunRecorder.class);

    private final ScheduleStore store;
    private final TransactionManager tm;
    private final ScheduleConfig config;
    private final PacerMetrics metrics;

    private final Deque<RunRecord> records = new ArrayDeque<>();
    private final Object flushLock = new Object();

    private ScheduledExecutorService executor;

    @Inject
    public RunRecorder(ScheduleStore store, TransactionManager tm, ScheduleConfig config, PacerMetrics metrics)
    {
        this.store = store;
        this.tm = tm;
        this.config = config;
        this.metrics = metrics;
    }

    public synchronized void start()
    {
        if (executor == null) {
            executor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("bookkeeping-%d")
                    .build()
                    );
            long interval = config.getBookkeepingFlushIntervalSeconds();
            executor.scheduleWithFixedDelay(this::flushQuietly, interval, interval, TimeUnit.SECONDS);
        }
    }

    /**
     * Queues a run of the schedule. Never blocks on the database.
     */
    public void record(String scheduleName, Instant runAt)
    {
        synchronized (records) {
            records.addLast(new RunRecord(scheduleName, runAt));
        }
    }

    public int getPendingCount()
    {
        synchronized (records) {
            return records.size();
        }
    }

    /**
     * Writes queued records until the queue is empty or a write fails.
     *
     * @return number of records written
     */
    @VisibleForTesting
    int flush()
    {
        int written = 0;
        synchronized (flushLock) {
            while (true) {
                RunRecord record;
                synchronized (records) {
                    record = records.peekFirst();
                }
                if (record == null) {
                    break;
                }

                try {
                    tm.begin(() -> {
                        store.recordRun(record.scheduleName, record.runAt);
                        return null;
                    }, ResourceNotFoundException.class);
                    written++;
                }
                catch (ResourceNotFoundException ex) {
                    logger.warn("Schedule '{}' was deleted before its run at {} was recorded. Dropping the record.",
                            record.scheduleName, record.runAt);
                }
                catch (RuntimeException ex) {
                    logger.warn("Failed to record run of schedule '{}' at {}. Retrying at the next flush.",
                            record.scheduleName, record.runAt, ex);
                    metrics.increment("scheduler_bookkeeping_failures");
                    break;
                }

                synchronized (records) {
                    records.removeFirst();
                }
            }
        }
        return written;
    }

    private void flushQuietly()
    {
        try {
            flush();
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Recording runs will be retried.", t);
            metrics.increment("scheduler_uncaught_errors");
        }
    }

    /**
     * Stops the background writer and flushes the queue one last time.
     */
    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            try {
                executor.awaitTermination(30, TimeUnit.SECONDS);
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        flush();
        int remaining = getPendingCount();
        if (remaining > 0) {
            logger.warn("{} run records could not be written before shutdown", remaining);
        }
    }

    private static class RunRecord
    {
        private final String scheduleName;
        private final Instant runAt;

        RunRecord(String scheduleName, Instant runAt)
        {
            this.scheduleName = scheduleName;
            this.runAt = runAt;
        }
    }
}
