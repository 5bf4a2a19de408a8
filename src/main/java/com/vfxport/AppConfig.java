package com.vfxport;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: workspace and log locations, HTTP port, and
 * the editor settings (compiler path, undo depth, background save delay).
 */
public class AppConfig {

    private static final String APP_NAME = "VfxPort";
    public static final int DEFAULT_HISTORY = 10;
    public static final int MAX_HISTORY = 20;
    public static final long DEFAULT_SAVE_DELAY_MS = 500L;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final Path ritobinPath;
    private final int historyLimit;
    private final long saveDelayMs;
    private final boolean backgroundSave;

    private AppConfig(Builder builder, Path workspacePath, Path logPath, int port) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = builder.devMode;
        this.ritobinPath = builder.ritobinPath;
        this.historyLimit = builder.historyLimit;
        this.saveDelayMs = builder.saveDelayMs;
        this.backgroundSave = builder.backgroundSave;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /** Null when neither {@code --ritobin} nor {@code RITOBIN_PATH} is set. */
    public Path getRitobinPath() {
        return ritobinPath;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public long getSaveDelayMs() {
        return saveDelayMs;
    }

    public boolean isBackgroundSave() {
        return backgroundSave;
    }

    /**
     * Default workspace:
     * Windows: %USERPROFILE%\Documents\VfxPort\workspace
     * macOS: ~/Documents/VfxPort/workspace
     * Linux: ~/VfxPort/workspace
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "workspace");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "workspace");
        }
        return Paths.get(userHome, APP_NAME, "workspace");
    }

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
        }
        return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
    }

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return logDir.resolve("vfx-port.log");
    }

    /**
     * Preferred port if free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path workspacePath = null;
        private int preferredPort = 7340;
        private boolean devMode = false;
        private Path ritobinPath = null;
        private int historyLimit = DEFAULT_HISTORY;
        private long saveDelayMs = DEFAULT_SAVE_DELAY_MS;
        private boolean backgroundSave = false;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder ritobinPath(String path) {
            if (path != null && !path.isBlank()) {
                this.ritobinPath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        /** Clamped to 1..{@value #MAX_HISTORY}. */
        public Builder historyLimit(int limit) {
            this.historyLimit = Math.max(1, Math.min(MAX_HISTORY, limit));
            return this;
        }

        public Builder saveDelayMs(long delayMs) {
            if (delayMs >= 0) {
                this.saveDelayMs = delayMs;
            }
            return this;
        }

        public Builder backgroundSave(boolean enabled) {
            this.backgroundSave = enabled;
            return this;
        }

        public Builder environment(java.util.Map<String, String> env) {
            if (ritobinPath == null) {
                ritobinPath(env.get("RITOBIN_PATH"));
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                } else if (takesValue(arg) && i + 1 < args.length) {
                    value = args[++i];
                }

                switch (name) {
                    case "--workspace":
                        workspacePath(value);
                        break;
                    case "--port":
                        parseInt(value).ifPresent(this::port);
                        break;
                    case "--ritobin":
                        ritobinPath(value);
                        break;
                    case "--history":
                        parseInt(value).ifPresent(this::historyLimit);
                        break;
                    case "--save-delay-ms":
                        parseInt(value).ifPresent(this::saveDelayMs);
                        break;
                    case "--background-save":
                        this.backgroundSave = true;
                        break;
                    case "--dev":
                        this.devMode = true;
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        private static boolean takesValue(String arg) {
            return "--workspace".equals(arg) || "--port".equals(arg) || "--ritobin".equals(arg)
                || "--history".equals(arg) || "--save-delay-ms".equals(arg);
        }

        private static java.util.OptionalInt parseInt(String value) {
            if (value == null) {
                return java.util.OptionalInt.empty();
            }
            try {
                return java.util.OptionalInt.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                return java.util.OptionalInt.empty();
            }
        }

        /** Builds without touching the network or the log directory. */
        public AppConfig buildForTests(Path workspace, Path logPath) {
            return new AppConfig(this, workspace, logPath, preferredPort);
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            Files.createDirectories(workspace);
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(this, workspace, logPath, port);
        }
    }
}
