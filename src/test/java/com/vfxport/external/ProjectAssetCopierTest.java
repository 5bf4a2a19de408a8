package com.vfxport.external;

import com.vfxport.WorkspaceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectAssetCopierTest {

    @TempDir
    Path root;

    private ProjectAssetCopier copier;
    private Path donorFile;
    private Path targetFile;

    @BeforeEach
    void setUp() throws IOException {
        copier = new ProjectAssetCopier(new WorkspaceService(root));
        donorFile = root.resolve("donor/data/skin0.py");
        targetFile = root.resolve("target/data/skin0.py");
        Files.createDirectories(donorFile.getParent());
        Files.createDirectories(targetFile.getParent());
        Files.createDirectories(root.resolve("donor/assets/characters/demo"));
        Files.createDirectories(root.resolve("target/assets"));
        Files.write(root.resolve("donor/assets/characters/demo/glow.dds"), "dds".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void copiesMissingAssetsMatchingCaseInsensitively() {
        AssetCopyReport report = copier.copy(donorFile, targetFile,
            List.of("ASSETS/Characters/Demo/glow.dds", "assets/characters/demo/missing.dds"));

        assertEquals(List.of("ASSETS/Characters/Demo/glow.dds"), report.getCopied());
        assertEquals(List.of("assets/characters/demo/missing.dds"), report.getFailed());
        assertTrue(Files.isRegularFile(root.resolve("target/assets/characters/demo/glow.dds")));
        assertEquals("1 copied, 0 skipped, 1 failed", report.summary());
    }

    @Test
    void existingTargetFilesAreSkipped() throws IOException {
        Files.createDirectories(root.resolve("target/assets/characters/demo"));
        Files.write(root.resolve("target/assets/characters/demo/glow.dds"), "mine".getBytes(StandardCharsets.UTF_8));

        AssetCopyReport report = copier.copy(donorFile, targetFile, List.of("assets/characters/demo/glow.dds"));

        assertEquals(List.of("assets/characters/demo/glow.dds"), report.getSkipped());
        assertEquals("mine", new String(Files.readAllBytes(root.resolve("target/assets/characters/demo/glow.dds")),
            StandardCharsets.UTF_8));
    }

    @Test
    void sameProjectNeedsNoCopy() {
        AssetCopyReport report = copier.copy(donorFile, root.resolve("donor/data/other.py"),
            List.of("assets/characters/demo/glow.dds"));

        assertEquals(List.of("assets/characters/demo/glow.dds"), report.getSkipped());
        assertTrue(report.getCopied().isEmpty());
    }

    @Test
    void nothingToCopyGivesEmptyReport() {
        assertTrue(copier.copy(donorFile, targetFile, List.of()).isEmpty());
    }

    @Test
    void projectRootIsNearestAncestorWithAssetFolder() {
        assertEquals(root.resolve("donor").toAbsolutePath().normalize(), ProjectAssetCopier.findProjectRoot(donorFile));
    }
}
