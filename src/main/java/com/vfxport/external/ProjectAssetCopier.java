package com.vfxport.external;

import com.vfxport.AppLogger;
import com.vfxport.WorkspaceService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Resolves asset paths against the project root of each file (the nearest
 * ancestor directory holding an {@code assets} or {@code data} folder) and
 * copies missing files into the target project. Files already present in the
 * target are skipped, never overwritten.
 */
public class ProjectAssetCopier implements AssetCopier {

    private final WorkspaceService workspace;

    public ProjectAssetCopier(WorkspaceService workspace) {
        this.workspace = workspace;
    }

    @Override
    public AssetCopyReport copy(Path donorFile, Path targetFile, Collection<String> assetPaths) {
        AssetCopyReport report = new AssetCopyReport();
        if (assetPaths == null || assetPaths.isEmpty()) {
            return report;
        }
        Path donorRoot = findProjectRoot(donorFile);
        Path targetRoot = findProjectRoot(targetFile);
        if (donorRoot == null || targetRoot == null) {
            report.getFailed().addAll(assetPaths);
            logWarning("No project root (assets/ or data/) found for "
                + (donorRoot == null ? donorFile : targetFile));
            return report;
        }
        if (donorRoot.equals(targetRoot)) {
            report.getSkipped().addAll(assetPaths);
            return report;
        }
        for (String asset : assetPaths) {
            Path source = locate(donorRoot, asset);
            if (source == null) {
                report.getFailed().add(asset);
                continue;
            }
            Path destination = targetRoot.resolve(donorRoot.relativize(source));
            try {
                if (workspace.copyIfAbsent(source, destination)) {
                    report.getCopied().add(asset);
                } else {
                    report.getSkipped().add(asset);
                }
            } catch (IOException | SecurityException e) {
                report.getFailed().add(asset);
                logWarning("Failed to copy " + asset + ": " + e.getMessage());
            }
        }
        log("Asset copy: " + report.summary());
        return report;
    }

    static Path findProjectRoot(Path file) {
        if (file == null) {
            return null;
        }
        Path dir = file.toAbsolutePath().normalize().getParent();
        while (dir != null) {
            if (hasChildDirectory(dir, "assets") || hasChildDirectory(dir, "data")) {
                return dir;
            }
            dir = dir.getParent();
        }
        return null;
    }

    /** Asset paths are matched case-insensitively, as the game treats them. */
    static Path locate(Path root, String asset) {
        Path direct = root.resolve(asset).normalize();
        if (!direct.startsWith(root)) {
            return null;
        }
        if (Files.isRegularFile(direct)) {
            return direct;
        }
        Path current = root;
        for (String segment : asset.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            Path next = findChildIgnoreCase(current, segment);
            if (next == null) {
                return null;
            }
            current = next;
        }
        return Files.isRegularFile(current) ? current : null;
    }

    private static boolean hasChildDirectory(Path dir, String name) {
        Path child = findChildIgnoreCase(dir, name);
        return child != null && Files.isDirectory(child);
    }

    private static Path findChildIgnoreCase(Path dir, String name) {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        try (Stream<Path> children = Files.list(dir)) {
            return children
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst()
                .orElse(null);
        } catch (IOException e) {
            return null;
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProjectAssetCopier] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ProjectAssetCopier] " + message);
        }
    }
}
