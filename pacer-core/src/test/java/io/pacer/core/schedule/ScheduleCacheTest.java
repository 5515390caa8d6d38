package io.pacer.core.schedule;

import java.time.Instant;
import java.util.stream.Collectors;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.database.DatabaseFactory;
import io.pacer.core.database.DatabaseTestingUtils.ScheduleRow;
import io.pacer.core.metrics.StdPacerMetrics;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.pacer.commons.ObjectMappers.objectMapper;
import static io.pacer.core.database.DatabaseTestingUtils.createConfigFactory;
import static io.pacer.core.database.DatabaseTestingUtils.setupDatabase;
import static io.pacer.core.schedule.ScheduleTestingUtils.calculatorManager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ScheduleCacheTest
{
    private static final Instant NOW = Instant.parse("2024-01-05T08:30:00Z");

    private DatabaseFactory factory;
    private StdPacerMetrics metrics;
    private ScheduleCache cache;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        metrics = StdPacerMetrics.empty();
        ConfigFactory cf = createConfigFactory();
        cache = new ScheduleCache(factory.getScheduleStore(), factory.get(),
                calculatorManager(), objectMapper(), cf, metrics);
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void emptyBeforeFirstSync()
    {
        assertThat(cache.getSnapshot().size(), is(0));
        assertThat(cache.getSnapshot().getSyncedAt(), is(Optional.absent()));
    }

    @Test
    public void syncBuildsEntriesOrderedByName()
    {
        factory.insertSchedule(ScheduleRow.interval("heartbeat", 30));
        factory.insertSchedule(ScheduleRow.crontab("daily-report", "0 9 * * *"));
        factory.insertSchedule(ScheduleRow.interval("cleanup", 3600).lastRunAt(NOW.minusSeconds(600)));

        ScheduleSnapshot snapshot = cache.sync(NOW);

        assertThat(snapshot.getEntries().stream().map(ScheduleEntry::getName).collect(Collectors.toList()),
                contains("cleanup", "daily-report", "heartbeat"));
        assertThat(snapshot.getSyncedAt(), is(Optional.of(NOW)));
        assertThat(snapshot.getEntry("heartbeat").get().getNextDueAt(), is(NOW));
        assertThat(snapshot.getEntry("daily-report").get().getNextDueAt(), is(Instant.parse("2024-01-05T09:00:00Z")));
        assertThat(snapshot.getEntry("daily-report").get().getRule(), is("0 9 * * *"));
        assertThat(snapshot.getEntry("cleanup").get().getNextDueAt(), is(NOW.plusSeconds(3000)));
        assertThat(snapshot.getEntry("cleanup").get().getRule(), is("every 3600s"));
        assertThat(cache.getSnapshot(), is(snapshot));
    }

    @Test
    public void argsAndKwargsAreParsed()
    {
        factory.insertSchedule(ScheduleRow.interval("report", 60)
                .args("[1, \"x\"]")
                .kwargs("{\"to\": \"ops\"}"));

        ScheduleEntry entry = cache.sync(NOW).getEntry("report").get();
        assertThat(entry.getArgs(), is(ImmutableList.of(IntNode.valueOf(1), TextNode.valueOf("x"))));
        assertThat(entry.getKwargs().get("to", String.class), is("ops"));
    }

    @Test
    public void malformedRowsAreSkipped()
    {
        factory.insertSchedule(ScheduleRow.interval("good", 60));
        factory.insertSchedule(ScheduleRow.crontab("bad-minute", "61 * * * *"));
        factory.insertSchedule(ScheduleRow.crontab("never", "0 0 31 2 *"));
        factory.insertSchedule(ScheduleRow.interval("zero", 0));
        factory.insertSchedule(ScheduleRow.interval("weekly", 60).kind("weekly"));
        factory.insertSchedule(ScheduleRow.interval("broken-args", 60).args("[1,"));
        factory.insertSchedule(ScheduleRow.interval("object-args", 60).args("{\"a\": 1}"));
        factory.insertSchedule(ScheduleRow.interval("array-kwargs", 60).kwargs("[1]"));
        factory.insertSchedule(ScheduleRow.crontab("mixed", "0 9 * * *").intervalSeconds(60L));

        ScheduleSnapshot snapshot = cache.sync(NOW);

        assertThat(snapshot.getEntries().stream().map(ScheduleEntry::getName).collect(Collectors.toList()),
                contains("good"));
        assertThat(snapshot.getMalformed().keySet(), containsInAnyOrder(
                    "bad-minute", "never", "zero", "weekly", "broken-args", "object-args", "array-kwargs", "mixed"));
        assertThat(snapshot.getMalformed().get("never"), containsString("never matches"));
        assertThat(snapshot.getMalformed().get("weekly"), containsString("Unknown schedule kind"));
        assertThat(metrics.getCount("scheduler_malformed_schedules"), is(8.0));
    }

    @Test
    public void rowsOutOfDateTimeRangeDoNotStopSync()
    {
        factory.insertSchedule(ScheduleRow.interval("a-ok", 60));
        factory.insertSchedule(ScheduleRow.interval("huge", Long.MAX_VALUE / 2));
        factory.insertSchedule(ScheduleRow.interval("far-future", 60).lastRunAt(Instant.MAX.minusSeconds(10)));

        ScheduleSnapshot snapshot = cache.sync(NOW);

        assertThat(snapshot.getEntries().stream().map(ScheduleEntry::getName).collect(Collectors.toList()),
                contains("a-ok"));
        assertThat(snapshot.getMalformed().keySet(), containsInAnyOrder("huge", "far-future"));
        assertThat(metrics.getCount("scheduler_malformed_schedules"), is(2.0));
    }

    @Test
    public void pendingCrontabOccurrenceSurvivesSync()
    {
        factory.insertSchedule(ScheduleRow.crontab("daily-report", "0 9 * * *"));
        Instant nine = Instant.parse("2024-01-05T09:00:00Z");

        assertThat(cache.sync(Instant.parse("2024-01-05T08:59:00Z")).getEntry("daily-report").get().getNextDueAt(), is(nine));
        // synced in the same second as the due time, before the due entries are collected
        assertThat(cache.sync(nine).getEntry("daily-report").get().getNextDueAt(), is(nine));
        // synced while the dispatch of 09:00 waits for a retry
        assertThat(cache.sync(nine.plusSeconds(30)).getEntry("daily-report").get().getNextDueAt(), is(nine));
    }

    @Test
    public void changedRuleIsRecomputedAtSync()
    {
        factory.insertSchedule(ScheduleRow.crontab("daily-report", "0 9 * * *"));
        cache.sync(Instant.parse("2024-01-05T08:59:00Z"));

        factory.getJdbi().useHandle(handle -> handle.execute("update schedules set cron_minute = '30' where name = 'daily-report'"));

        ScheduleEntry entry = cache.sync(Instant.parse("2024-01-05T09:00:10Z")).getEntry("daily-report").get();
        assertThat(entry.getRule(), is("30 9 * * *"));
        assertThat(entry.getNextDueAt(), is(Instant.parse("2024-01-05T09:30:00Z")));
    }

    @Test
    public void runByAnotherProcessReplacesPendingDueTime()
    {
        factory.insertSchedule(ScheduleRow.crontab("daily-report", "0 9 * * *"));
        cache.sync(Instant.parse("2024-01-05T08:59:00Z"));

        factory.setLastRunAt("daily-report", Instant.parse("2024-01-05T09:00:00Z"));

        ScheduleEntry entry = cache.sync(Instant.parse("2024-01-05T09:00:10Z")).getEntry("daily-report").get();
        assertThat(entry.getNextDueAt(), is(Instant.parse("2024-01-06T09:00:00Z")));
    }

    @Test
    public void disabledOrDeletedSchedulesDisappearAtNextSync()
    {
        factory.insertSchedule(ScheduleRow.interval("a", 60));
        factory.insertSchedule(ScheduleRow.interval("b", 60));
        factory.insertSchedule(ScheduleRow.interval("c", 60));
        assertThat(cache.sync(NOW).size(), is(3));

        factory.setEnabled("a", false);
        factory.deleteSchedule("b");
        ScheduleSnapshot snapshot = cache.sync(NOW.plusSeconds(60));

        assertThat(snapshot.getEntries().stream().map(ScheduleEntry::getName).collect(Collectors.toList()),
                contains("c"));
    }

    @Test
    public void newScheduleAppearsAtNextSync()
    {
        assertThat(cache.sync(NOW).size(), is(0));
        factory.insertSchedule(ScheduleRow.interval("late", 60));
        assertThat(cache.sync(NOW.plusSeconds(60)).getEntry("late").isPresent(), is(true));
    }

    @Test
    public void readFailureKeepsCurrentSnapshot()
    {
        factory.insertSchedule(ScheduleRow.interval("heartbeat", 30));
        ScheduleSnapshot first = cache.sync(NOW);

        factory.getJdbi().useHandle(handle -> handle.execute("drop table schedules"));
        try {
            cache.sync(NOW.plusSeconds(60));
            fail();
        }
        catch (RuntimeException ex) {
            // expected
        }
        assertThat(cache.getSnapshot(), is(first));
        assertThat(cache.getSnapshot().getEntry("heartbeat").isPresent(), is(true));
    }

    @Test
    public void newerInMemoryRunWinsOverStoredValue()
    {
        factory.insertSchedule(ScheduleRow.interval("heartbeat", 30));
        ScheduleEntry entry = cache.sync(NOW).getEntry("heartbeat").get();

        // dispatched, but the bookkeeping write didn't reach the store yet
        cache.replaceEntries(ImmutableList.of(entry.dispatchedAt(NOW)));

        ScheduleEntry merged = cache.sync(NOW.plusSeconds(10)).getEntry("heartbeat").get();
        assertThat(merged.getLastRunAt(), is(Optional.of(NOW)));
        assertThat(merged.getTotalRunCount(), is(1L));
        assertThat(merged.getNextDueAt(), is(NOW.plusSeconds(30)));
    }

    @Test
    public void newerStoredRunWinsOverInMemoryValue()
    {
        factory.insertSchedule(ScheduleRow.interval("heartbeat", 30));
        ScheduleEntry entry = cache.sync(NOW).getEntry("heartbeat").get();
        cache.replaceEntries(ImmutableList.of(entry.dispatchedAt(NOW)));

        // another process ran it later
        factory.setLastRunAt("heartbeat", NOW.plusSeconds(20));

        ScheduleEntry merged = cache.sync(NOW.plusSeconds(25)).getEntry("heartbeat").get();
        assertThat(merged.getLastRunAt(), is(Optional.of(NOW.plusSeconds(20))));
        assertThat(merged.getNextDueAt(), is(NOW.plusSeconds(50)));
    }

    @Test
    public void replaceEntriesIgnoresRemovedSchedules()
    {
        factory.insertSchedule(ScheduleRow.interval("kept", 30));
        factory.insertSchedule(ScheduleRow.interval("removed", 30));
        ScheduleSnapshot snapshot = cache.sync(NOW);
        ScheduleEntry removed = snapshot.getEntry("removed").get();

        factory.deleteSchedule("removed");
        cache.sync(NOW.plusSeconds(1));

        ScheduleSnapshot replaced = cache.replaceEntries(ImmutableList.of(removed.dispatchedAt(NOW.plusSeconds(1))));
        assertThat(replaced.getEntry("removed").isPresent(), is(false));
        assertThat(replaced.getEntry("kept").isPresent(), is(true));
    }
}
