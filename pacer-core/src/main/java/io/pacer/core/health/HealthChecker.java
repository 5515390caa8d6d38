package io.pacer.core.health;

import com.google.inject.Binding;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Key;
import io.pacer.core.database.ConfigMapper;
import io.pacer.core.database.TransactionManager;
import io.pacer.core.schedule.ScheduleConfig;
import io.pacer.core.schedule.ScheduleExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness and readiness of the process. The scheduler is reported as disabled when
 * it is turned off by configuration or this process doesn't host the loop.
 */
public class HealthChecker
{
    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private final TransactionManager tm;
    private final ConfigMapper configMapper;
    private final ScheduleConfig scheduleConfig;
    private final Injector injector;

    @Inject
    public HealthChecker(TransactionManager tm, ConfigMapper configMapper,
            ScheduleConfig scheduleConfig, Injector injector)
    {
        this.tm = tm;
        this.configMapper = configMapper;
        this.scheduleConfig = scheduleConfig;
        this.injector = injector;
    }

    public boolean isLive()
    {
        return true;
    }

    public HealthStatus check()
    {
        return HealthStatus.of(checkDatabase(), checkScheduler());
    }

    private boolean checkDatabase()
    {
        try {
            Integer one = tm.begin(() ->
                    tm.getHandle(configMapper)
                        .createQuery("select 1")
                        .mapTo(Integer.class)
                        .one());
            return one != null && one == 1;
        }
        catch (RuntimeException ex) {
            logger.warn("Database health check failed", ex);
            return false;
        }
    }

    private String checkScheduler()
    {
        if (!scheduleConfig.getEnabled()) {
            return HealthStatus.SCHEDULER_DISABLED;
        }
        Binding<ScheduleExecutor> binding = injector.getExistingBinding(Key.get(ScheduleExecutor.class));
        if (binding == null) {
            return HealthStatus.SCHEDULER_DISABLED;
        }
        boolean running = binding.getProvider().get().getStatus().isRunning();
        return running ? HealthStatus.SCHEDULER_RUNNING : HealthStatus.SCHEDULER_STOPPED;
    }
}
