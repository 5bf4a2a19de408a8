package com.vfxport.session;

import com.vfxport.Fixtures;
import com.vfxport.WorkspaceService;
import com.vfxport.mutations.VfxMutationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackgroundSaveSchedulerTest {

    @TempDir
    Path root;

    private RecordingCompiler compiler;
    private BackgroundSaveScheduler scheduler;
    private EditSession session;

    @BeforeEach
    void setUp() {
        compiler = new RecordingCompiler();
        scheduler = new BackgroundSaveScheduler(new SaveService(new WorkspaceService(root), compiler), 250);
        session = new EditSession(EditSession.Role.TARGET, root.resolve("skin0.py"), root.resolve("skin0.py"),
            root.resolve("skin0.bin"), Fixtures.sampleSkin(), 10);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void staleRunIsSkipped() {
        long captured = session.getVersion();
        new VfxMutationService().createSystem(session, "Fx_New");

        scheduler.runOnce(session, captured);

        BackgroundSaveScheduler.BackgroundSaveStatus status = scheduler.getStatus();
        assertTrue(status.lastOutcome.isSuperseded());
        assertTrue(compiler.toBinaryCalls.isEmpty());
        assertTrue(session.isDirty());
    }

    @Test
    void currentRunSaves() {
        new VfxMutationService().createSystem(session, "Fx_New");

        scheduler.runOnce(session, session.getVersion());

        BackgroundSaveScheduler.BackgroundSaveStatus status = scheduler.getStatus();
        assertTrue(status.lastOutcome.isSuccess());
        assertTrue(status.lastRunAt > 0);
        assertEquals(250, status.delayMs);
        assertFalse(session.isDirty());
    }

    @Test
    void cancelledRequestNeverRuns() {
        scheduler.schedule(session);
        scheduler.cancelPending();

        assertNull(scheduler.getStatus().lastOutcome);
    }

    @Test
    void negativeDelayFallsBackToDefault() {
        BackgroundSaveScheduler fallback = new BackgroundSaveScheduler(
            new SaveService(new WorkspaceService(root), compiler), -1);
        try {
            assertEquals(500, fallback.getStatus().delayMs);
        } finally {
            fallback.stop();
        }
    }
}
