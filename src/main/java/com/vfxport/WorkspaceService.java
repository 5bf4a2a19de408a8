package com.vfxport;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File-system collaborator for the editor. Every path it touches must lie
 * inside the workspace root; anything else is rejected with a
 * {@link SecurityException}.
 */
public class WorkspaceService {

    private final Path workspaceRoot;

    public WorkspaceService(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        log("WorkspaceService initialized with root: " + this.workspaceRoot);
    }

    // -------------------------------------------------------------------------
    // Path Resolution
    // -------------------------------------------------------------------------

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a workspace-relative path to an absolute path.
     *
     * @throws SecurityException if the path escapes the workspace root
     */
    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return workspaceRoot;
        }
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return workspaceRoot;
        }
        return confine(workspaceRoot.resolve(normalized));
    }

    public String toRelativePath(Path absolutePath) {
        return workspaceRoot.relativize(absolutePath.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    /**
     * @throws SecurityException if {@code path} is outside the workspace root
     */
    public Path confine(Path path) {
        Path resolved = path.toAbsolutePath().normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new SecurityException("Path escapes workspace root: " + path);
        }
        return resolved;
    }

    // -------------------------------------------------------------------------
    // Text and bytes
    // -------------------------------------------------------------------------

    public String readText(Path file) throws IOException {
        Path path = confine(file);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + toRelativePath(path));
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Cannot read directory as file: " + toRelativePath(path));
        }
        log("Reading file: " + toRelativePath(path));
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    public void writeText(Path file, String content) throws IOException {
        writeBytes(file, content.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] readBytes(Path file) throws IOException {
        Path path = confine(file);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + toRelativePath(path));
        }
        return Files.readAllBytes(path);
    }

    public void writeBytes(Path file, byte[] content) throws IOException {
        Path path = confine(file);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content);
        log("Wrote file: " + toRelativePath(path));
    }

    /**
     * Copies {@code source} to {@code target}, creating parent directories.
     * An existing target is left alone.
     *
     * @return true when a file was written
     */
    public boolean copyIfAbsent(Path source, Path target) throws IOException {
        Path from = confine(source);
        Path to = confine(target);
        if (!Files.isRegularFile(from)) {
            throw new FileNotFoundException("File not found: " + toRelativePath(from));
        }
        if (Files.exists(to)) {
            return false;
        }
        if (to.getParent() != null) {
            Files.createDirectories(to.getParent());
        }
        Files.copy(from, to, StandardCopyOption.COPY_ATTRIBUTES);
        return true;
    }

    public boolean exists(Path file) {
        try {
            return Files.exists(confine(file));
        } catch (SecurityException e) {
            return false;
        }
    }

    public boolean isDirectory(Path dir) {
        try {
            return Files.isDirectory(confine(dir));
        } catch (SecurityException e) {
            return false;
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[WorkspaceService] " + message);
        }
    }
}
