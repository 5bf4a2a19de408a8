package com.vfxport;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private static AppConfig build(AppConfig.Builder builder) {
        return builder.buildForTests(Path.of("ws"), Path.of("log.txt"));
    }

    @Test
    void defaults() {
        AppConfig config = build(new AppConfig.Builder());

        assertEquals(AppConfig.DEFAULT_HISTORY, config.getHistoryLimit());
        assertEquals(AppConfig.DEFAULT_SAVE_DELAY_MS, config.getSaveDelayMs());
        assertFalse(config.isBackgroundSave());
        assertNull(config.getRitobinPath());
        assertEquals(7340, config.getPort());
    }

    @Test
    void parsesEditorFlags() {
        AppConfig config = build(new AppConfig.Builder().parseArgs(new String[] {
            "--history", "15", "--save-delay-ms=750", "--background-save", "--port", "9000",
            "--ritobin", "tools/ritobin_cli", "--dev", "--unknown"
        }));

        assertEquals(15, config.getHistoryLimit());
        assertEquals(750, config.getSaveDelayMs());
        assertTrue(config.isBackgroundSave());
        assertTrue(config.isDevMode());
        assertEquals(9000, config.getPort());
        assertEquals(Path.of("tools/ritobin_cli").toAbsolutePath().normalize(), config.getRitobinPath());
    }

    @Test
    void historyIsClamped() {
        assertEquals(AppConfig.MAX_HISTORY, build(new AppConfig.Builder().historyLimit(99)).getHistoryLimit());
        assertEquals(1, build(new AppConfig.Builder().historyLimit(0)).getHistoryLimit());
        assertEquals(AppConfig.DEFAULT_HISTORY,
            build(new AppConfig.Builder().parseArgs(new String[] { "--history", "lots" })).getHistoryLimit());
    }

    @Test
    void negativeSaveDelayIsIgnored() {
        assertEquals(AppConfig.DEFAULT_SAVE_DELAY_MS, build(new AppConfig.Builder().saveDelayMs(-5)).getSaveDelayMs());
    }

    @Test
    void commandLineRitobinBeatsEnvironment() {
        AppConfig fromEnv = build(new AppConfig.Builder().environment(Map.of("RITOBIN_PATH", "env/ritobin")));
        AppConfig fromArgs = build(new AppConfig.Builder()
            .parseArgs(new String[] { "--ritobin=cli/ritobin" })
            .environment(Map.of("RITOBIN_PATH", "env/ritobin")));

        assertEquals(Path.of("env/ritobin").toAbsolutePath().normalize(), fromEnv.getRitobinPath());
        assertEquals(Path.of("cli/ritobin").toAbsolutePath().normalize(), fromArgs.getRitobinPath());
    }
}
