package io.pacer.core.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Immutable set of schedule entries keyed and ordered by name, as of one sync.
 * Schedules that failed validation at that sync are kept as name to error message
 * for diagnostics.
 */
public class ScheduleSnapshot
{
    private static final ScheduleSnapshot EMPTY = new ScheduleSnapshot(
            Optional.absent(), ImmutableSortedMap.of(), ImmutableSortedMap.of());

    private final Optional<Instant> syncedAt;
    private final ImmutableSortedMap<String, ScheduleEntry> entries;
    private final ImmutableSortedMap<String, String> malformed;

    public ScheduleSnapshot(Optional<Instant> syncedAt,
            Map<String, ScheduleEntry> entries, Map<String, String> malformed)
    {
        this.syncedAt = syncedAt;
        this.entries = ImmutableSortedMap.copyOf(entries);
        this.malformed = ImmutableSortedMap.copyOf(malformed);
    }

    public static ScheduleSnapshot empty()
    {
        return EMPTY;
    }

    public Optional<Instant> getSyncedAt()
    {
        return syncedAt;
    }

    public List<ScheduleEntry> getEntries()
    {
        return entries.values().asList();
    }

    public Optional<ScheduleEntry> getEntry(String name)
    {
        return Optional.fromNullable(entries.get(name));
    }

    public int size()
    {
        return entries.size();
    }

    public Map<String, String> getMalformed()
    {
        return malformed;
    }

    /**
     * Entries with next_due_at at or before {@code now}, ordered by name.
     */
    public List<ScheduleEntry> getDueEntries(Instant now)
    {
        return entries.values().stream()
            .filter(entry -> entry.isDueAt(now))
            .collect(ImmutableList.toImmutableList());
    }

    public Optional<Instant> getEarliestDueTime()
    {
        Instant earliest = null;
        for (ScheduleEntry entry : entries.values()) {
            if (earliest == null || entry.getNextDueAt().isBefore(earliest)) {
                earliest = entry.getNextDueAt();
            }
        }
        return Optional.fromNullable(earliest);
    }

    /**
     * Returns a snapshot with the given entries replacing those of the same name.
     * Entries whose name is not in this snapshot are ignored: the schedule was removed
     * by a sync that ran in the meantime.
     */
    public ScheduleSnapshot withEntries(List<ScheduleEntry> updated)
    {
        ImmutableSortedMap.Builder<String, ScheduleEntry> builder = ImmutableSortedMap.naturalOrder();
        Map<String, ScheduleEntry> replacements = updated.stream()
            .filter(entry -> entries.containsKey(entry.getName()))
            .collect(Collectors.toMap(ScheduleEntry::getName, entry -> entry, (a, b) -> b));
        for (Map.Entry<String, ScheduleEntry> pair : entries.entrySet()) {
            builder.put(pair.getKey(), replacements.getOrDefault(pair.getKey(), pair.getValue()));
        }
        return new ScheduleSnapshot(syncedAt, builder.build(), malformed);
    }

    @Override
    public String toString()
    {
        return "ScheduleSnapshot{syncedAt=" + syncedAt.orNull() +
            ", entries=" + entries.keySet() +
            ", malformed=" + malformed.keySet() + "}";
    }
}
