package io.pacer.core.database;

import java.io.IOException;
import io.pacer.core.database.DatabaseTestingUtils.ScheduleRow;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.pacer.core.database.DatabaseTestingUtils.createConfigMapper;
import static io.pacer.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ThreadLocalTransactionManagerTest
{
    private DatabaseFactory factory;
    private TransactionManager tm;
    private ConfigMapper cfm;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        tm = factory.get();
        cfm = createConfigMapper();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private int insertTask(String name)
    {
        return tm.getHandle(cfm)
            .createUpdate("insert into schedules (name, kind, interval_seconds, task, enabled, total_run_count, created_at, updated_at)" +
                    " values (:name, 'interval', 60, 'tasks.noop', true, 0, current_timestamp, current_timestamp)")
            .bind("name", name)
            .execute();
    }

    private long countSchedules()
    {
        return factory.getJdbi().withHandle(handle ->
                handle.createQuery("select count(*) from schedules").mapTo(Long.class).one());
    }

    @Test
    public void committedTransactionsCanBeRepeated()
    {
        // every transaction must close cleanly after commit, or the next one on this thread fails
        for (int i = 0; i < 3; i++) {
            String name = "s" + i;
            assertThat(tm.begin(() -> insertTask(name)), is(1));
        }
        assertThat(countSchedules(), is(3L));
    }

    @Test
    public void storeReadsThroughBegin()
    {
        factory.insertSchedule(ScheduleRow.interval("heartbeat", 60));
        DatabaseScheduleStore store = factory.getScheduleStore();

        assertThat(tm.begin(() -> store.listEnabledSchedules()), hasSize(1));
        assertThat(tm.begin(() -> store.listEnabledSchedules()), hasSize(1));
    }

    @Test
    public void runtimeExceptionRollsBack()
    {
        try {
            tm.begin(() -> {
                insertTask("rolled-back");
                throw new IllegalArgumentException("broken");
            });
            fail();
        }
        catch (IllegalArgumentException ex) {
            assertThat(ex.getMessage(), is("broken"));
        }
        assertThat(countSchedules(), is(0L));
    }

    @Test
    public void declaredExceptionRollsBackAndPropagates()
    {
        try {
            tm.begin(() -> {
                insertTask("rolled-back");
                throw new IOException("disk");
            }, IOException.class);
            fail();
        }
        catch (IOException ex) {
            assertThat(ex.getMessage(), is("disk"));
        }
        assertThat(countSchedules(), is(0L));
    }

    @Test
    public void transactionWithoutStatementsCommits()
    {
        assertThat(tm.begin(() -> "nothing"), is("nothing"));
        assertThat(tm.begin(() -> insertTask("after")), is(1));
    }

    @Test
    public void nestedTransactionIsRejected()
    {
        try {
            tm.begin(() -> tm.begin(() -> insertTask("nested")));
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), containsString("Nested transaction"));
        }
        assertThat(countSchedules(), is(0L));
    }

    @Test(expected = IllegalStateException.class)
    public void handleOutsideTransaction()
    {
        tm.getHandle(cfm);
    }
}
