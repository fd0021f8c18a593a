package com.gearcheck;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Run configuration parsed from the command line, plus platform-specific log location.
 */
public class AppConfig {

    private static final String APP_NAME = "Orphan-Gear-Checker";

    private final Path scriptsPath;
    private final Path inventoryPath;
    private final Path containersPath;
    private final Path outputPath;
    private final Path logPath;
    private final boolean equippableOnly;
    private final boolean devMode;

    private AppConfig(Path scriptsPath, Path inventoryPath, Path containersPath, Path outputPath,
                      Path logPath, boolean equippableOnly, boolean devMode) {
        this.scriptsPath = scriptsPath;
        this.inventoryPath = inventoryPath;
        this.containersPath = containersPath;
        this.outputPath = outputPath;
        this.logPath = logPath;
        this.equippableOnly = equippableOnly;
        this.devMode = devMode;
    }

    public Path getScriptsPath() {
        return scriptsPath;
    }

    public Path getInventoryPath() {
        return inventoryPath;
    }

    /** JSON container map replacing the default wardrobes, or null. */
    public Path getContainersPath() {
        return containersPath;
    }

    /** Where to write the JSON report, or null for console output only. */
    public Path getOutputPath() {
        return outputPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isEquippableOnly() {
        return equippableOnly;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Orphan-Gear-Checker\logs
     * macOS: ~/Library/Logs/Orphan-Gear-Checker
     * Linux: ~/.local/share/Orphan-Gear-Checker/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return logDir.resolve("orphan-gear-checker.log");
    }

    public static class Builder {
        private final List<String> positional = new ArrayList<>();
        private Path containersPath = null;
        private Path outputPath = null;
        private Path logPath = null;
        private boolean equippableOnly = true;
        private boolean devMode = false;

        public Builder logPath(Path path) {
            this.logPath = path;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // --containers=value or --containers value
                if (arg.startsWith("--containers=")) {
                    containersPath = toPath(arg.substring("--containers=".length()));
                } else if ("--containers".equals(arg) && i + 1 < args.length) {
                    containersPath = toPath(args[++i]);
                }

                // --out=value or --out value
                else if (arg.startsWith("--out=")) {
                    outputPath = toPath(arg.substring("--out=".length()));
                } else if ("--out".equals(arg) && i + 1 < args.length) {
                    outputPath = toPath(args[++i]);
                }

                else if ("--all-containers".equals(arg)) {
                    equippableOnly = false;
                } else if ("--dev".equals(arg)) {
                    devMode = true;
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else {
                    positional.add(arg);
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            if (positional.size() != 2) {
                throw new IllegalArgumentException("Expected <scripts folder or file> <inventory csv>");
            }
            Path scripts = toPath(positional.get(0));
            Path inventory = toPath(positional.get(1));
            Path log = logPath != null ? logPath : ensureLogDirectory();
            return new AppConfig(scripts, inventory, containersPath, outputPath, log, equippableOnly, devMode);
        }

        private static Path toPath(String value) {
            if (value == null || value.isEmpty()) {
                return null;
            }
            return Paths.get(value).toAbsolutePath().normalize();
        }
    }
}
