package io.pacer.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.pacer.core.PacerEmbed;
import io.pacer.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options shared by every command and the system config they resolve to.
 */
public abstract class Command
{
    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-o", "--database"})
    protected String database = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @Parameter(names = {"--logback-config"})
    protected String logbackConfigPath = null;

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    /**
     * Prints usage of the command and returns the exception that ends it.
     */
    public abstract SystemExitException usage(String error);

    /**
     * Merges the config sources. A later source overrides an earlier one:
     * the default config file (skipped if --config is given), PACER_CONFIG,
     * JVM system properties, the --config file, -X options, and --database.
     */
    protected Properties loadSystemProperties()
        throws IOException
    {
        Properties props = new Properties();

        if (configPath == null) {
            props.putAll(loadOptionalFile(ConfigUtil.defaultConfigPath(env)));
        }
        String inline = env.get("PACER_CONFIG");
        if (inline != null) {
            props.putAll(PropertyUtils.loadString(inline));
        }
        props.putAll(System.getProperties());
        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }
        props.putAll(systemProperties);
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        return props;
    }

    private static Properties loadOptionalFile(Path path)
        throws IOException
    {
        try {
            return PropertyUtils.loadFile(path);
        }
        catch (NoSuchFileException ex) {
            logger.debug("No config file at {}", path);
            return new Properties();
        }
    }

    protected PacerEmbed.Bootstrap bootstrap()
        throws IOException
    {
        return new PacerEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(loadSystemProperties()));
    }
}
