package io.tickwork.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return tickworkConfigHome(env).resolve("config");
    }

    public static Path tickworkConfigHome(Map<String, String> env)
    {
        String home = env.get("TICKWORK_CONFIG_HOME");
        if (home != null) {
            return Paths.get(home);
        }
        return configHome(env).resolve("tickwork");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
