package io.pacer.cli;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import io.pacer.core.PacerEmbed;
import io.pacer.core.schedule.ScheduleEntry;
import io.pacer.core.schedule.ScheduleSnapshot;

import static io.pacer.cli.SystemExitException.systemExit;

public class ShowSchedules
    extends Command
{
    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }

        try (PacerEmbed pacer = bootstrap()
                .withScheduleExecutor(false)
                .initialize()) {
            Instant now = pacer.getInjector().getInstance(Clock.class).instant().truncatedTo(ChronoUnit.SECONDS);
            ScheduleSnapshot snapshot = pacer.getScheduleCache().sync(now);
            printSnapshot(snapshot);
        }
    }

    private void printSnapshot(ScheduleSnapshot snapshot)
    {
        TablePrinter table = new TablePrinter(out);
        table.row("NAME", "KIND", "RULE", "TASK", "LAST RUN", "NEXT DUE");
        for (ScheduleEntry entry : snapshot.getEntries()) {
            table.row(
                    entry.getName(),
                    entry.getKind().getType(),
                    entry.getRule(),
                    entry.getTask(),
                    entry.getLastRunAt().transform(Instant::toString).or("-"),
                    entry.getNextDueAt().toString());
        }
        table.print();

        if (!snapshot.getMalformed().isEmpty()) {
            out.println();
            out.println("Skipped " + snapshot.getMalformed().size() + " malformed schedules:");
            for (Map.Entry<String, String> pair : snapshot.getMalformed().entrySet()) {
                out.println("  " + pair.getKey() + ": " + pair.getValue());
            }
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " schedules [options...]");
        err.println("  Shows enabled schedules with their last run and next due time.");
        err.println("  Options:");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
