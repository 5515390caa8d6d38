package io.pacer.cli;

import java.util.concurrent.CountDownLatch;
import io.pacer.core.PacerEmbed;
import io.pacer.core.schedule.ScheduleExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.pacer.cli.SystemExitException.systemExit;

public class Sched
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Sched.class);

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }

        PacerEmbed pacer = bootstrap().initialize();
        CountDownLatch stopped = new CountDownLatch(1);
        try {
            pacer.getScheduleExecutor().start();
        }
        catch (RuntimeException ex) {
            pacer.close();
            throw ex;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down scheduler");
            try {
                pacer.close();
            }
            finally {
                stopped.countDown();
            }
        }, "shutdown"));

        // the loop runs on daemon threads. block until the shutdown hook closes it.
        stopped.await();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " scheduler [options...]");
        err.println("  Runs the scheduler loop until the process receives SIGTERM or SIGINT.");
        err.println("  Scheduler options are read from the configuration (scheduler.enabled,");
        err.println("  scheduler.sync_every_seconds, scheduler.max_interval_seconds,");
        err.println("  scheduler.dispatch_threads, scheduler.time_zone, scheduler.dispatch_retry_seconds).");
        err.println("");
        err.println("  Options:");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
