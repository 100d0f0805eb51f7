package de.bsommerfeld.cockpit.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Where the cockpit keeps its files. Nothing here creates directories; callers
 * do that before writing.
 *
 * <ul>
 * <li>macOS: {@code ~/Library/Application Support/em-cockpit}</li>
 * <li>Windows: {@code %APPDATA%\em-cockpit}</li>
 * <li>Linux and others: {@code $XDG_DATA_HOME/em-cockpit}, else
 * {@code ~/.local/share/em-cockpit}</li>
 * </ul>
 */
public final class CockpitPaths {

    public static final String APP_NAME = "em-cockpit";

    private CockpitPaths() {
    }

    public static Path dataDir() {
        return dataDir(System.getProperty("os.name", ""), System.getProperty("user.home"),
                System.getenv("APPDATA"), System.getenv("XDG_DATA_HOME"));
    }

    static Path dataDir(String osName, String userHome, String appData, String xdgDataHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin"))
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        if (os.contains("win")) {
            Path roaming = appData != null ? Paths.get(appData) : Paths.get(userHome, "AppData", "Roaming");
            return roaming.resolve(APP_NAME);
        }
        Path share = xdgDataHome != null && !xdgDataHome.isEmpty()
                ? Paths.get(xdgDataHome)
                : Paths.get(userHome, ".local", "share");
        return share.resolve(APP_NAME);
    }

    public static Path configFile() {
        return dataDir().resolve("config.toml");
    }

    public static Path logsDir() {
        return dataDir().resolve("logs");
    }
}
