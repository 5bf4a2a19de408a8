package com.vfxport.external;

import com.vfxport.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the {@code ritobin} executable out of process:
 * {@code ritobin <input> <output>}, format chosen by the file extensions.
 * At most one invocation per output file runs at a time.
 */
public class RitobinCompiler implements BinCompiler {

    private static final long DEFAULT_TIMEOUT_SECONDS = 120;

    private final Path executable;
    private final long timeoutSeconds;
    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RitobinCompiler(Path executable) {
        this(executable, DEFAULT_TIMEOUT_SECONDS);
    }

    public RitobinCompiler(Path executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    }

    @Override
    public boolean isConfigured() {
        return executable != null && Files.isRegularFile(executable);
    }

    @Override
    public CompilerResult toText(Path binFile, Path textFile) throws IOException {
        return run(binFile, textFile);
    }

    @Override
    public CompilerResult toBinary(Path textFile, Path binFile) throws IOException {
        return run(textFile, binFile);
    }

    private CompilerResult run(Path input, Path output) throws IOException {
        if (!isConfigured()) {
            return CompilerResult.notRun("ritobin executable not configured (use --ritobin or RITOBIN_PATH)");
        }
        Path key = output.toAbsolutePath().normalize();
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        Path outputLog = null;
        try {
            log("Running ritobin: " + input.getFileName() + " -> " + output.getFileName());
            outputLog = Files.createTempFile("ritobin-", ".log");
            ProcessBuilder builder = new ProcessBuilder(List.of(
                executable.toString(), input.toAbsolutePath().toString(), key.toString()));
            builder.redirectErrorStream(true);
            // Output goes to a file so a process that never closes stdout cannot outlive the timeout.
            builder.redirectOutput(outputLog.toFile());
            Process process = builder.start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                logWarning("ritobin timed out after " + timeoutSeconds + "s");
                return CompilerResult.notRun("ritobin timed out after " + timeoutSeconds + "s");
            }
            String out = new String(Files.readAllBytes(outputLog), StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (exit != 0) {
                logWarning("ritobin exited with " + exit);
            }
            return CompilerResult.of(exit, out);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompilerResult.notRun("Interrupted while waiting for ritobin");
        } finally {
            lock.unlock();
            if (outputLog != null) {
                Files.deleteIfExists(outputLog);
            }
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[RitobinCompiler] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[RitobinCompiler] " + message);
        }
    }
}
