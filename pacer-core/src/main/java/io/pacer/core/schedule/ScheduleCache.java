package io.pacer.core.schedule;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigException;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.database.TransactionManager;
import io.pacer.spi.DueTimeCalculator;
import io.pacer.spi.metrics.PacerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * In-memory view of the enabled schedules.
 *
 * The current snapshot is replaced as a whole, so readers never see a partially built
 * set of entries.
 */
public class ScheduleCache
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleCache.class);

    private final ScheduleStore store;
    private final TransactionManager tm;
    private final DueTimeCalculatorManager calculators;
    private final ObjectMapper mapper;
    private final ConfigFactory cf;
    private final PacerMetrics metrics;

    private final AtomicReference<ScheduleSnapshot> snapshot = new AtomicReference<>(ScheduleSnapshot.empty());

    @Inject
    public ScheduleCache(ScheduleStore store, TransactionManager tm,
            DueTimeCalculatorManager calculators, ObjectMapper mapper,
            ConfigFactory cf, PacerMetrics metrics)
    {
        this.store = store;
        this.tm = tm;
        this.calculators = calculators;
        this.mapper = mapper;
        this.cf = cf;
        this.metrics = metrics;
    }

    public ScheduleSnapshot getSnapshot()
    {
        return snapshot.get();
    }

    /**
     * Reads the store and publishes a new snapshot. If the read fails, the exception
     * propagates and the current snapshot stays.
     */
    public synchronized ScheduleSnapshot sync(Instant referenceTime)
    {
        List<StoredSchedule> rows = tm.begin(() -> store.listEnabledSchedules());

        ScheduleSnapshot previous = snapshot.get();
        Map<String, ScheduleEntry> entries = new LinkedHashMap<>();
        Map<String, String> malformed = new LinkedHashMap<>();
        for (StoredSchedule row : rows) {
            if (!row.getEnabled()) {
                continue;
            }
            try {
                entries.put(row.getName(), buildEntry(row, previous.getEntry(row.getName()), referenceTime));
            }
            catch (ConfigException ex) {
                logger.warn("Skipping malformed schedule '{}': {}", row.getName(), ex.getMessage());
                skipMalformed(malformed, row, ex);
            }
            catch (RuntimeException ex) {
                // values that pass validation can still fail in date-time arithmetic
                logger.warn("Skipping schedule '{}' that can't be evaluated", row.getName(), ex);
                skipMalformed(malformed, row, ex);
            }
        }

        ScheduleSnapshot next = new ScheduleSnapshot(Optional.of(referenceTime), entries, malformed);
        snapshot.set(next);
        logger.debug("Synced {} schedules ({} malformed)", entries.size(), malformed.size());
        return next;
    }

    private void skipMalformed(Map<String, String> malformed, StoredSchedule row, RuntimeException ex)
    {
        metrics.increment("scheduler_malformed_schedules");
        malformed.put(row.getName(), String.valueOf(ex.getMessage()));
    }

    /**
     * Publishes entries updated after dispatching. Names that a concurrent sync removed
     * are dropped.
     */
    public synchronized ScheduleSnapshot replaceEntries(List<ScheduleEntry> updated)
    {
        ScheduleSnapshot next = snapshot.get().withEntries(updated);
        snapshot.set(next);
        return next;
    }

    private ScheduleEntry buildEntry(StoredSchedule row, Optional<ScheduleEntry> cached, Instant referenceTime)
    {
        DueTimeCalculator calculator = calculators.getCalculator(row);
        Optional<Instant> lastRunAt = mergeLastRunAt(row.getLastRunAt(), cached);
        long totalRunCount = row.getTotalRunCount();
        if (cached.isPresent() && cached.get().getTotalRunCount() > totalRunCount) {
            totalRunCount = cached.get().getTotalRunCount();
        }

        ScheduleKind kind = ScheduleKind.fromType(row.getKind());
        String rule = calculators.describeRule(row);

        return ScheduleEntry.builder()
            .name(row.getName())
            .kind(kind)
            .rule(rule)
            .task(row.getTask())
            .args(parseArgs(row))
            .kwargs(parseKwargs(row))
            .calculator(calculator)
            .lastRunAt(lastRunAt)
            .totalRunCount(totalRunCount)
            .nextDueAt(pendingDueTime(cached, kind, rule, lastRunAt, referenceTime)
                    .or(() -> calculator.nextDueTime(lastRunAt, referenceTime)))
            .build();
    }

    /**
     * A due time that passed before this sync and was not dispatched yet stays due.
     * Recomputing it from the sync time would skip the occurrence because due times
     * are searched strictly after the reference time.
     */
    static Optional<Instant> pendingDueTime(Optional<ScheduleEntry> cached,
            ScheduleKind kind, String rule, Optional<Instant> lastRunAt, Instant referenceTime)
    {
        if (!cached.isPresent()) {
            return Optional.absent();
        }
        ScheduleEntry entry = cached.get();
        if (entry.getKind() != kind || !entry.getRule().equals(rule) || !entry.getLastRunAt().equals(lastRunAt)) {
            // definition changed or another process ran it
            return Optional.absent();
        }
        if (entry.getNextDueAt().isAfter(referenceTime)) {
            return Optional.absent();
        }
        return Optional.of(entry.getNextDueAt());
    }

    // a dispatch whose bookkeeping write is still queued is newer than the stored value
    static Optional<Instant> mergeLastRunAt(Optional<Instant> stored, Optional<ScheduleEntry> cached)
    {
        if (!cached.isPresent() || !cached.get().getLastRunAt().isPresent()) {
            return stored;
        }
        Instant inMemory = cached.get().getLastRunAt().get();
        if (!stored.isPresent() || inMemory.isAfter(stored.get())) {
            return Optional.of(inMemory);
        }
        return stored;
    }

    private List<JsonNode> parseArgs(StoredSchedule row)
    {
        if (!row.getArgs().isPresent()) {
            return ImmutableList.of();
        }
        JsonNode node;
        try {
            node = mapper.readTree(row.getArgs().get());
        }
        catch (JsonProcessingException ex) {
            throw new ConfigException("args is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || node.isNull()) {
            return ImmutableList.of();
        }
        if (!node.isArray()) {
            throw new ConfigException("args must be a JSON array but got " + node.getNodeType());
        }
        return ImmutableList.copyOf(node);
    }

    private Config parseKwargs(StoredSchedule row)
    {
        if (!row.getKwargs().isPresent()) {
            return cf.create();
        }
        return cf.fromJsonString(row.getKwargs().get());
    }
}
