package io.pacer.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pacer.core.PacerEmbed;
import io.pacer.core.health.HealthStatus;

import static io.pacer.cli.SystemExitException.systemExit;

public class Health
    extends Command
{
    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }

        HealthStatus status;
        try (PacerEmbed pacer = bootstrap()
                .withScheduleExecutor(false)
                .initialize()) {
            status = pacer.getHealthChecker().check();
            ObjectMapper mapper = pacer.getInjector().getInstance(ObjectMapper.class);
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(status));
        }
        if (!status.isReady()) {
            throw SystemExitException.quietFailure();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " health [options...]");
        err.println("  Prints database health. Exits with 1 if the database is not reachable.");
        err.println("  Options:");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
