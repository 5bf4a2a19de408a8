package com.vfxport.session;

import com.vfxport.AppLogger;
import com.vfxport.WorkspaceService;
import com.vfxport.external.BinCompiler;
import com.vfxport.external.CompilerResult;
import com.vfxport.mutations.EditErrorKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes session text to its {@code .py} and compiles it back to {@code .bin}.
 * Saves of the same file never overlap.
 */
public class SaveService {

    private final WorkspaceService workspace;
    private final BinCompiler compiler;
    private final ConcurrentHashMap<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public SaveService(WorkspaceService workspace, BinCompiler compiler) {
        this.workspace = workspace;
        this.compiler = compiler;
    }

    public SaveOutcome save(EditSession session) {
        String text;
        long version;
        synchronized (session) {
            text = session.getFileText();
            version = session.getVersion();
        }
        return write(session, text, version);
    }

    /**
     * Saves only if the session is still at {@code capturedVersion}; used by
     * the background saver so a stale capture never overwrites newer text.
     */
    public SaveOutcome saveIfCurrent(EditSession session, long capturedVersion) {
        String text;
        synchronized (session) {
            if (session.getVersion() != capturedVersion) {
                return SaveOutcome.superseded();
            }
            text = session.getFileText();
        }
        return write(session, text, capturedVersion);
    }

    private SaveOutcome write(EditSession session, String text, long version) {
        if (session.getRole() != EditSession.Role.TARGET) {
            return SaveOutcome.failure(EditErrorKind.INVALID_INPUT, "Only the target file is saved");
        }
        Object lock = fileLocks.computeIfAbsent(session.getTextPath().toAbsolutePath().normalize(), k -> new Object());
        synchronized (lock) {
            try {
                workspace.writeText(session.getTextPath(), text);
            } catch (IOException e) {
                logWarning("Failed to write " + session.getTextPath().getFileName() + ": " + e.getMessage());
                return SaveOutcome.failure(EditErrorKind.IO, "Failed to write file: " + e.getMessage());
            }
            CompilerResult result;
            try {
                result = compiler.toBinary(session.getTextPath(), session.getBinPath());
            } catch (IOException e) {
                logWarning("ritobin could not be started: " + e.getMessage());
                return SaveOutcome.failure(EditErrorKind.EXTERNAL_TOOL, "ritobin could not be started: " + e.getMessage());
            }
            if (!result.isSuccess()) {
                logWarning("ritobin rejected " + session.getTextPath().getFileName() + " (exit " + result.getExitCode() + ")");
                return SaveOutcome.compilerFailure(result.getOutput());
            }
            session.markSaved(version, text);
            log("Saved " + session.getBinPath().getFileName());
            return SaveOutcome.success("Saved " + session.getBinPath().getFileName());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SaveService] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SaveService] " + message);
        }
    }
}
