package com.vfxport.session;

import com.vfxport.Fixtures;
import com.vfxport.models.DeletedEmitterRecord;
import com.vfxport.mutations.VfxMutationService;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EditSessionTest {

    private final VfxMutationService mutations = new VfxMutationService();

    @Test
    void applyAndUndoBothBumpVersion() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertFalse(session.isDirty());

        long afterApply = session.apply(new SessionChange(Fixtures.file(), "Clear everything"));
        assertEquals(1, afterApply);
        assertTrue(session.getTree().getSystems().isEmpty());
        assertTrue(session.isDirty());

        assertEquals("Clear everything", session.undo().orElseThrow().getDescription());
        assertEquals(2, session.getVersion());
        assertEquals(Fixtures.sampleSkin(), session.getFileText());
        assertEquals(2, session.getTree().getSystems().size());
    }

    @Test
    void historyIsBoundedByLimit() {
        EditSession session = new EditSession(EditSession.Role.TARGET, Path.of("a.py"), Path.of("a.py"),
            Path.of("a.bin"), Fixtures.file(), 2);
        mutations.createSystem(session, "One");
        mutations.createSystem(session, "Two");
        mutations.createSystem(session, "Three");

        assertEquals(2, session.getHistory().size());
        session.undo();
        session.undo();
        assertTrue(session.undo().isEmpty());
        assertNotNull(session.getTree().getSystem("One"));
        assertNull(session.getTree().getSystem("Two"));
    }

    @Test
    void selectionIsClearedWhenSystemDisappears() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertTrue(session.select(Fixtures.IDLE_KEY));
        assertFalse(session.select("Missing"));
        assertEquals(Fixtures.IDLE_KEY, session.getSelectedSystemKey());

        session.apply(new SessionChange(Fixtures.file(), "Clear everything"));

        assertNull(session.getSelectedSystemKey());
        session.undo();
        assertEquals(Fixtures.IDLE_KEY, session.getSelectedSystemKey());
    }

    @Test
    void deletionRecordsFollowSystemRename() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        mutations.deleteEmitter(session, Fixtures.CAST_KEY, "Flash");

        mutations.renameSystem(session, Fixtures.CAST_KEY, "Demo_E");

        assertEquals(Set.of(new DeletedEmitterRecord("Demo_E", "Flash")), session.getDeletedEmitters());
    }

    @Test
    void markSavedClearsDeletionRecordsOnlyWhenCurrent() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        mutations.deleteEmitter(session, Fixtures.IDLE_KEY, "Glow");
        long staleVersion = session.getVersion();
        String staleText = session.getFileText();
        mutations.deleteEmitter(session, Fixtures.IDLE_KEY, "Sparks");

        session.markSaved(staleVersion, staleText);
        assertEquals(2, session.getDeletedEmitters().size());
        assertTrue(session.isDirty());

        session.markSaved(session.getVersion(), session.getFileText());
        assertTrue(session.getDeletedEmitters().isEmpty());
        assertFalse(session.isDirty());
        assertEquals(session.getFileText(), session.getSavedText());
    }

    @Test
    void recentlyCreatedTracksLastCreation() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        mutations.createSystem(session, "Fx_One");
        mutations.createSystem(session, "Fx_Two");

        assertEquals(Set.of("Fx_Two"), session.getRecentlyCreated());
        session.undo();
        assertTrue(session.getRecentlyCreated().isEmpty());
    }
}
