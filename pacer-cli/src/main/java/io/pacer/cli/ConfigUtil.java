package io.pacer.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import com.google.common.base.Optional;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    // $PACER_CONFIG_HOME/config, else $XDG_CONFIG_HOME/pacer/config, else ~/.config/pacer/config
    public static Path defaultConfigPath(Map<String, String> env)
    {
        return pacerConfigHome(env).resolve("config");
    }

    public static Path pacerConfigHome(Map<String, String> env)
    {
        return envPath(env, "PACER_CONFIG_HOME").or(() ->
                envPath(env, "XDG_CONFIG_HOME")
                .or(() -> Paths.get(System.getProperty("user.home"), ".config"))
                .resolve("pacer"));
    }

    private static Optional<Path> envPath(Map<String, String> env, String name)
    {
        return Optional.fromNullable(env.get(name)).transform(Paths::get);
    }
}
