package io.pacer.cli;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Map;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import static io.pacer.cli.ConfigUtil.defaultConfigPath;
import static io.pacer.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "pacer";

    private final String version;
    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(String version, Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.version = version;
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.pacer.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(buildVersion(), System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static String buildVersion()
    {
        String v = Main.class.getPackage().getImplementationVersion();
        return v != null ? v : "unknown";
    }

    protected void addCommands(JCommander jc, Injector injector)
    {
        jc.addCommand("scheduler", injector.getInstance(Sched.class), "sched");
        jc.addCommand("migrate", injector.getInstance(Migrate.class));
        jc.addCommand("schedules", injector.getInstance(ShowSchedules.class), "schedule");
        jc.addCommand("health", injector.getInstance(Health.class));
    }

    public int cli(String... args)
    {
        for (String arg : args) {
            if ("--version".equals(arg)) {
                out.println(version);
                return 0;
            }
        }
        err.println(new SimpleDateFormat("yyyy-MM-dd HH:mm:ss Z").format(new Date()) + ": Pacer v" + version);
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        addCommands(jc, injector);

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(mainOpts, command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private static final List<String> LOG_LEVELS = ImmutableList.of("error", "warn", "info", "debug", "trace");

    // returns true when stack traces should be printed on failure
    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }
        if (!LOG_LEVELS.contains(command.logLevel)) {
            throw usage("Unknown log level '" + command.logLevel + "'");
        }
        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        Level level = Level.toLevel(command.logLevel.toUpperCase(ENGLISH));
        configureLogging(level, command.logPath, command.logbackConfigPath);
        return !level.isGreaterOrEqual(Level.INFO);
    }

    private static void configureLogging(Level level, String logPath, String logbackConfigPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        // the bundled logback xml files read ${pacer.log.level} and ${pacer.log.path}
        System.setProperty("pacer.log.level", level.toString());
        try {
            if (logbackConfigPath != null) {
                configurator.doConfigure(Paths.get(logbackConfigPath).toFile());
            }
            else if ("-".equals(logPath)) {
                String variant = System.console() != null ? "color" : "console";
                configurator.doConfigure(Main.class.getResource("/io/pacer/cli/logback-" + variant + ".xml"));
            }
            else {
                System.setProperty("pacer.log.path", logPath);
                configurator.doConfigure(Main.class.getResource("/io/pacer/cli/logback-file.xml"));
            }
        }
        catch (JoranException ex) {
            throw new IllegalStateException("Failed to configure logging", ex);
        }
    }

    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        for (Throwable t : Throwables.getCausalChain(ex)) {
            String message = t.getMessage();
            if (message == null || message.isEmpty() || sb.indexOf(message) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(message);
        }
        if (sb.length() == 0) {
            return ex.toString();
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    sched[uler]                        run the scheduler loop");
        err.println("    migrate (run|check)                migrate database");
        err.println("    schedules                          show enabled schedules and their next due times");
        err.println("    health                             check the database and print health status");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    --logback-config PATH.xml        use this logback configuration instead of the bundled one");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    -o, --database DIR               use an H2 database stored in this directory");
        err.println("    --version                        show version");
        err.println("");
    }
}
