package io.pacer.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.inject.Inject;
import io.pacer.core.ErrorReporter;
import io.pacer.spi.metrics.PacerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The scheduler loop. One thread syncs the {@link ScheduleCache}, dispatches the due
 * entries and sleeps until the earliest of the next due time, the next sync and
 * max_interval.
 */
public class ScheduleExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleExecutor.class);

    private final ScheduleCache cache;
    private final ScheduleDispatcher dispatcher;
    private final RunRecorder recorder;
    private final ScheduleConfig config;
    private final Clock clock;
    private final PacerMetrics metrics;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    private final Object wakeLock = new Object();
    private volatile boolean stop = false;
    private Thread thread;

    private volatile Optional<Instant> lastSyncAttemptAt = Optional.absent();
    private volatile Optional<Instant> lastSuccessfulSyncAt = Optional.absent();
    private volatile Optional<String> lastSyncError = Optional.absent();

    @Inject
    public ScheduleExecutor(
            ScheduleCache cache,
            ScheduleDispatcher dispatcher,
            RunRecorder recorder,
            ScheduleConfig config,
            Clock clock,
            PacerMetrics metrics)
    {
        this.cache = cache;
        this.dispatcher = dispatcher;
        this.recorder = recorder;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    @VisibleForTesting
    synchronized boolean isStarted()
    {
        return thread != null;
    }

    /**
     * Runs the first sync in the calling thread and starts the loop. If the first sync
     * fails, the exception propagates and the loop doesn't start.
     */
    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.info("Scheduler is disabled.");
            return;
        }
        if (thread != null) {
            return;
        }

        Instant now = now();
        lastSyncAttemptAt = Optional.of(now);
        ScheduleSnapshot snapshot = cache.sync(now);
        lastSuccessfulSyncAt = Optional.of(now);
        logger.info("Loaded {} schedules ({} malformed). Starting scheduler loop.",
                snapshot.size(), snapshot.getMalformed().size());

        recorder.start();
        stop = false;
        thread = new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("scheduler-%d")
            .build()
            .newThread(this::runLoop);
        thread.start();
    }

    private void runLoop()
    {
        while (!stop) {
            Duration sleep;
            try {
                sleep = runOnce(now());
            }
            catch (Throwable t) {
                logger.error("An uncaught exception is ignored. Scheduling will be retried.", t);
                errorReporter.reportUncaughtError(t);
                metrics.increment("scheduler_uncaught_errors");
                sleep = min(config.getMaxInterval(), untilNextSync(now()));
            }
            sleepFor(sleep);
        }
        logger.debug("Scheduler loop stopped.");
    }

    /**
     * One iteration: sync if due, dispatch due entries, and return how long to sleep.
     */
    @VisibleForTesting
    Duration runOnce(Instant now)
    {
        if (isSyncDue(now)) {
            syncQuietly(now);
        }

        List<ScheduleEntry> due = cache.getSnapshot().getDueEntries(now);
        List<DispatchResult> results = dispatcher.dispatchAll(due, now);
        ScheduleSnapshot snapshot = cache.replaceEntries(
                results.stream()
                .filter(DispatchResult::isSuccess)
                .map(DispatchResult::getEntry)
                .collect(Collectors.toList()));

        Instant after = now();
        if (after.isBefore(now)) {
            after = now;
        }
        return computeSleep(snapshot, results, after);
    }

    @VisibleForTesting
    Duration computeSleep(ScheduleSnapshot snapshot, List<DispatchResult> results, Instant after)
    {
        Set<String> failed = new HashSet<>();
        for (DispatchResult result : results) {
            if (!result.isSuccess()) {
                failed.add(result.getEntry().getName());
            }
        }

        Duration sleep = min(config.getMaxInterval(), untilNextSync(after));
        for (ScheduleEntry entry : snapshot.getEntries()) {
            Instant wake = failed.contains(entry.getName())
                ? after.plus(config.getDispatchRetryDelay())
                : entry.getNextDueAt();
            sleep = min(sleep, Duration.between(after, wake));
        }
        return sleep.isNegative() ? Duration.ZERO : sleep;
    }

    private boolean isSyncDue(Instant now)
    {
        if (!lastSyncAttemptAt.isPresent()) {
            return true;
        }
        return !now.isBefore(lastSyncAttemptAt.get().plus(config.getSyncEvery()));
    }

    private Duration untilNextSync(Instant now)
    {
        if (!lastSyncAttemptAt.isPresent()) {
            return Duration.ZERO;
        }
        Duration d = Duration.between(now, lastSyncAttemptAt.get().plus(config.getSyncEvery()));
        return d.isNegative() ? Duration.ZERO : d;
    }

    private void syncQuietly(Instant now)
    {
        lastSyncAttemptAt = Optional.of(now);
        try {
            cache.sync(now);
            lastSuccessfulSyncAt = Optional.of(now);
            lastSyncError = Optional.absent();
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to sync schedules. Keeping {} schedules of the previous sync.",
                    cache.getSnapshot().size(), ex);
            metrics.increment("scheduler_sync_failures");
            lastSyncError = Optional.of(ex.toString());
        }
    }

    private void sleepFor(Duration duration)
    {
        long millis = duration.toMillis();
        if (millis <= 0) {
            return;
        }
        synchronized (wakeLock) {
            if (stop) {
                return;
            }
            try {
                wakeLock.wait(millis);
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                stop = true;
            }
        }
    }

    /**
     * Stops the loop after the current iteration, then stops the dispatcher threads and
     * writes the remaining bookkeeping.
     */
    public void shutdown()
    {
        Thread running;
        synchronized (this) {
            running = thread;
            thread = null;
        }
        if (running == null) {
            return;
        }
        synchronized (wakeLock) {
            stop = true;
            wakeLock.notifyAll();
        }
        Uninterruptibles.joinUninterruptibly(running);
        dispatcher.shutdown();
        recorder.shutdown();
        logger.info("Scheduler stopped.");
    }

    public SchedulerStatus getStatus()
    {
        ScheduleSnapshot snapshot = cache.getSnapshot();
        return ImmutableSchedulerStatus.builder()
            .isEnabled(config.getEnabled())
            .isRunning(isStarted())
            .lastSyncAttemptAt(lastSyncAttemptAt)
            .lastSuccessfulSyncAt(lastSuccessfulSyncAt)
            .lastSyncError(lastSyncError)
            .scheduleCount(snapshot.size())
            .malformedCount(snapshot.getMalformed().size())
            .earliestDueAt(snapshot.getEarliestDueTime())
            .totalDispatches(dispatcher.getDispatchCount())
            .totalDispatchFailures(dispatcher.getFailureCount())
            .pendingBookkeeping(recorder.getPendingCount())
            .build();
    }

    private Instant now()
    {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static Duration min(Duration a, Duration b)
    {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
