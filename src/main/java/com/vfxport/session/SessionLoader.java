package com.vfxport.session;

import com.vfxport.AppLogger;
import com.vfxport.WorkspaceService;
import com.vfxport.external.BinCompiler;
import com.vfxport.external.CompilerResult;
import com.vfxport.mutations.EditErrorKind;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens a {@code .py} or {@code .bin} file into a fresh {@link EditSession}.
 * A {@code .bin} is read through its sibling {@code .py} when one exists;
 * otherwise the compiler converts it first.
 */
public class SessionLoader {

    private final WorkspaceService workspace;
    private final BinCompiler compiler;
    private final int historyLimit;

    public SessionLoader(WorkspaceService workspace, BinCompiler compiler, int historyLimit) {
        this.workspace = workspace;
        this.compiler = compiler;
        this.historyLimit = historyLimit;
    }

    public LoadOutcome load(Path file, EditSession.Role role) {
        Path source = workspace.confine(file);
        String fileName = source.getFileName().toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".py") && !lower.endsWith(".bin")) {
            return LoadOutcome.failure(EditErrorKind.INVALID_INPUT, "Expected a .bin or .py file: " + fileName);
        }
        String stem = fileName.substring(0, fileName.lastIndexOf('.'));
        Path textPath = lower.endsWith(".py") ? source : source.resolveSibling(stem + ".py");
        Path binPath = lower.endsWith(".bin") ? source : source.resolveSibling(stem + ".bin");

        try {
            if (!workspace.exists(textPath)) {
                if (!workspace.exists(binPath)) {
                    return LoadOutcome.failure(EditErrorKind.NOT_FOUND, "File not found: " + fileName);
                }
                CompilerResult result = compiler.toText(binPath, textPath);
                if (!result.isSuccess()) {
                    logWarning("Conversion failed for " + fileName + " (exit " + result.getExitCode() + ")");
                    return LoadOutcome.failure(EditErrorKind.EXTERNAL_TOOL, result.getOutput());
                }
                if (!workspace.exists(textPath)) {
                    return LoadOutcome.failure(EditErrorKind.EXTERNAL_TOOL, "ritobin produced no text output for " + fileName);
                }
            }
            String text = workspace.readText(textPath);
            EditSession session = new EditSession(role, source, textPath, binPath, text, historyLimit);
            HashedContentDetector.Result hashed = HashedContentDetector.analyze(text);
            session.setHashedContent(hashed.isHashed());
            if (hashed.isHashed()) {
                session.addWarning("File appears to contain hashed field names (" + hashed.getHashedFields()
                    + " hashed fields); names may be shown as hashes. Refresh the hash tables and convert again.");
            }
            log("Loaded " + role + " " + workspace.toRelativePath(source) + ": "
                + session.getTree().getSystems().size() + " systems, "
                + session.getTree().getMaterials().size() + " materials");
            return LoadOutcome.success(session, "Loaded " + fileName);
        } catch (FileNotFoundException e) {
            return LoadOutcome.failure(EditErrorKind.NOT_FOUND, e.getMessage());
        } catch (IOException e) {
            logWarning("Failed to load " + fileName + ": " + e.getMessage());
            return LoadOutcome.failure(EditErrorKind.IO, "Failed to load " + fileName + ": " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SessionLoader] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SessionLoader] " + message);
        }
    }
}
