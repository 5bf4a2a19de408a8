package com.vfxport.session;

import com.vfxport.Fixtures;
import com.vfxport.WorkspaceService;
import com.vfxport.mutations.EditErrorKind;
import com.vfxport.mutations.VfxMutationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SaveServiceTest {

    @TempDir
    Path root;

    private RecordingCompiler compiler;
    private SaveService saveService;
    private EditSession session;

    @BeforeEach
    void setUp() {
        compiler = new RecordingCompiler();
        saveService = new SaveService(new WorkspaceService(root), compiler);
        session = session(EditSession.Role.TARGET);
        new VfxMutationService().createSystem(session, "Fx_New");
    }

    private EditSession session(EditSession.Role role) {
        return new EditSession(role, root.resolve("skin0.py"), root.resolve("skin0.py"), root.resolve("skin0.bin"),
            Fixtures.sampleSkin(), 10);
    }

    private String onDisk() throws IOException {
        return new String(Files.readAllBytes(root.resolve("skin0.py")), StandardCharsets.UTF_8);
    }

    @Test
    void saveWritesTextCompilesAndMarksClean() throws IOException {
        assertTrue(session.isDirty());

        SaveOutcome outcome = saveService.save(session);

        assertTrue(outcome.isSuccess(), outcome.getMessage());
        assertEquals("Saved skin0.bin", outcome.getMessage());
        assertEquals(session.getFileText(), onDisk());
        assertEquals(1, compiler.toBinaryCalls.size());
        assertFalse(session.isDirty());
    }

    @Test
    void compilerRejectionOffersRestore() throws IOException {
        compiler.exitCode = 3;
        compiler.output = "Parse error at line 12";

        SaveOutcome outcome = saveService.save(session);

        assertFalse(outcome.isSuccess());
        assertEquals(EditErrorKind.EXTERNAL_TOOL, outcome.getErrorKind());
        assertEquals("Parse error at line 12", outcome.getMessage());
        assertTrue(outcome.isRestoreOffered());
        assertTrue(session.isDirty());
        assertEquals(session.getFileText(), onDisk());
    }

    @Test
    void staleCaptureIsSuperseded() {
        long captured = session.getVersion();
        new VfxMutationService().createSystem(session, "Fx_Other");

        SaveOutcome outcome = saveService.saveIfCurrent(session, captured);

        assertTrue(outcome.isSuperseded());
        assertFalse(outcome.isSuccess());
        assertFalse(Files.exists(root.resolve("skin0.py")));
        assertTrue(compiler.toBinaryCalls.isEmpty());
    }

    @Test
    void donorIsNeverSaved() {
        SaveOutcome outcome = saveService.save(session(EditSession.Role.DONOR));

        assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        assertFalse(Files.exists(root.resolve("skin0.py")));
    }
}
