package com.vfxport.mutations;

import com.vfxport.Fixtures;
import com.vfxport.models.VfxSystem;
import com.vfxport.session.EditSession;
import com.vfxport.tree.SystemTransforms;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VfxMutationServiceTest {

    private final VfxMutationService service = new VfxMutationService();

    @Test
    void renameSystemUpdatesHeaderParticleFieldsAndResourceMap() {
        String text = "#PROP_text\n"
            + "entries: map[hash,embed] = {\n"
            + "    \"Fx_A\" = VfxSystemDefinitionData {\n"
            + "        complexEmitterDefinitionData: list[pointer] = {}\n"
            + "        particleName: string = \"Fx_A\"\n"
            + "        particlePath: string = \"Fx_A\"\n"
            + "    }\n"
            + "    \"Res\" = ResourceResolver {\n"
            + "        resourceMap: map[hash,link] = {\n"
            + "            \"Fx_A\" = \"Fx_A\"\n"
            + "        }\n"
            + "    }\n"
            + "}\n";
        EditSession session = Fixtures.target(text);

        MutationOutcome outcome = service.renameSystem(session, "Fx_A", "Fx_B");

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(text.replace("Fx_A", "Fx_B"), session.getFileText());
        assertNotNull(session.getTree().getSystem("Fx_B"));
        assertNull(session.getTree().getSystem("Fx_A"));
        assertEquals("Fx_B", outcome.getDetails().get("systemKey"));
    }

    @Test
    void renameSystemCollisionLeavesSessionUntouched() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        String before = session.getFileText();

        MutationOutcome outcome = service.renameSystem(session, Fixtures.IDLE_KEY, Fixtures.CAST_KEY);

        assertFalse(outcome.isSuccess());
        assertEquals(EditErrorKind.COLLISION, outcome.getErrorKind());
        assertEquals(before, session.getFileText());
        assertEquals(0, session.getVersion());
        assertTrue(session.getHistory().isEmpty());
    }

    @Test
    void renameSystemRejectsBlankAndUnknown() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertEquals(EditErrorKind.INVALID_INPUT, service.renameSystem(session, Fixtures.IDLE_KEY, "  ").getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND, service.renameSystem(session, "Missing", "Other").getErrorKind());
        assertEquals(EditErrorKind.INVALID_INPUT,
            service.renameSystem(session, Fixtures.IDLE_KEY, Fixtures.IDLE_KEY).getErrorKind());
    }

    @Test
    void renamedSelectionFollowsTheSystem() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertTrue(service.selectSystem(session, Fixtures.CAST_KEY).isSuccess());

        service.renameSystem(session, Fixtures.CAST_KEY, "Demo_W_Cast");

        assertEquals("Demo_W_Cast", session.getSelectedSystemKey());
    }

    @Test
    void createSystemPicksUniqueNameAndMapsResolver() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());

        MutationOutcome first = service.createSystem(session, "Fx_New");
        MutationOutcome second = service.createSystem(session, "Fx_New");

        assertTrue(first.isSuccess());
        assertEquals("Created VFX system \"Fx_New\" and updated ResourceResolver", first.getMessage());
        assertEquals("Fx_New_1", second.getDetails().get("systemKey"));
        assertEquals("Fx_New_1", session.getSelectedSystemKey());
        assertTrue(session.getRecentlyCreated().contains("Fx_New_1"));
        assertTrue(session.getFileText().contains("\"Fx_New_1\" = \"Fx_New_1\""));
        assertTrue(session.getTree().getSystem("Fx_New").getEmitters().isEmpty());
    }

    @Test
    void createSystemWithoutResolverOnlyAddsBlock() {
        EditSession session = Fixtures.target(Fixtures.file(Fixtures.system("Existing")));
        MutationOutcome outcome = service.createSystem(session, "Fx");
        assertEquals("Created VFX system \"Fx\"", outcome.getMessage());
        assertEquals(List.of("Existing", "Fx"), List.copyOf(session.getTree().getSystems().keySet()));
    }

    @Test
    void createSystemRequiresName() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        MutationOutcome outcome = service.createSystem(session, "   ");
        assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        assertEquals("Enter a system name", outcome.getMessage());
    }

    @Test
    void deletingOnlyEmitterLeavesEmptyList() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());

        MutationOutcome outcome = service.deleteEmitter(session, Fixtures.CAST_KEY, "Flash");

        assertTrue(outcome.isSuccess());
        VfxSystem cast = session.getTree().getSystem(Fixtures.CAST_KEY);
        assertTrue(cast.getEmitters().isEmpty());
        assertTrue(cast.getRawContent().contains("        complexEmitterDefinitionData: list[pointer] = {}\n"));
        assertTrue(session.isDeleted(Fixtures.CAST_KEY, "Flash"));
    }

    @Test
    void deleteAllRecordsEveryEmitter() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());

        MutationOutcome outcome = service.deleteAllEmitters(session, Fixtures.IDLE_KEY);

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("Glow", "Sparks"), outcome.getDetails().get("deleted"));
        assertTrue(session.getTree().getSystem(Fixtures.IDLE_KEY).getEmitters().isEmpty());
        assertTrue(session.isDeleted(Fixtures.IDLE_KEY, "Glow"));
        assertTrue(session.isDeleted(Fixtures.IDLE_KEY, "Sparks"));
        assertEquals(EditErrorKind.NOT_FOUND, service.deleteAllEmitters(session, Fixtures.IDLE_KEY).getErrorKind());
    }

    @Test
    void deleteUnknownEmitterIsNotFound() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertEquals(EditErrorKind.NOT_FOUND, service.deleteEmitter(session, Fixtures.IDLE_KEY, "Missing").getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND, service.deleteEmitter(session, "Missing", "Glow").getErrorKind());
    }

    @Test
    void renameEmitterClearsDeletionRecordOfTheNewName() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        service.deleteEmitter(session, Fixtures.IDLE_KEY, "Glow");
        assertTrue(session.isDeleted(Fixtures.IDLE_KEY, "Glow"));

        MutationOutcome outcome = service.renameEmitter(session, Fixtures.IDLE_KEY, "Sparks", "Glow");

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertFalse(session.isDeleted(Fixtures.IDLE_KEY, "Glow"));
        assertEquals(List.of("Glow"), session.getTree().getSystem(Fixtures.IDLE_KEY).emitterNames());
    }

    @Test
    void renameEmitterRejectsCollision() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        MutationOutcome outcome = service.renameEmitter(session, Fixtures.IDLE_KEY, "Sparks", "Glow");
        assertEquals(EditErrorKind.COLLISION, outcome.getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND,
            service.renameEmitter(session, Fixtures.IDLE_KEY, "Missing", "Other").getErrorKind());
    }

    @Test
    void moveEmitterIsOneStep() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        String before = session.getFileText();

        MutationOutcome outcome = service.moveEmitter(session, Fixtures.IDLE_KEY, "Glow", Fixtures.CAST_KEY);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of("Sparks"), session.getTree().getSystem(Fixtures.IDLE_KEY).emitterNames());
        assertEquals(List.of("Flash", "Glow"), session.getTree().getSystem(Fixtures.CAST_KEY).emitterNames());
        assertEquals(1, session.getHistory().size());
        assertTrue(session.getFileText().contains(
            "            VfxEmitterDefinitionData {\n"
            + "                rate: embed = ValueFloat {\n"
            + "                    constantValue: f32 = 2\n"
            + "                }\n"
            + "                emitterName: string = \"Glow\"\n"));

        session.undo();
        assertEquals(before, session.getFileText());
    }

    @Test
    void moveRenamesOnCollision() {
        EditSession session = Fixtures.target(Fixtures.file(Fixtures.system("A", "Shared"), Fixtures.system("B", "Shared")));

        MutationOutcome outcome = service.moveEmitter(session, "A", "Shared", "B");

        assertEquals("Shared_1", outcome.getDetails().get("emitterName"));
        assertEquals(List.of("Shared", "Shared_1"), session.getTree().getSystem("B").emitterNames());
        assertTrue(session.getTree().getSystem("A").getEmitters().isEmpty());
    }

    @Test
    void moveWithinSameSystemIsRejected() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        MutationOutcome outcome = service.moveEmitter(session, Fixtures.IDLE_KEY, "Glow", Fixtures.IDLE_KEY);
        assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        assertEquals(0, session.getVersion());
    }

    @Test
    void undoRestoresExactTextAfterSeveralEdits() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        String original = session.getFileText();

        service.createSystem(session, "Fx_New");
        service.deleteEmitter(session, Fixtures.IDLE_KEY, "Sparks");
        service.renameSystem(session, Fixtures.CAST_KEY, "Demo_E");
        assertEquals(3, session.getHistory().size());

        session.undo();
        session.undo();
        session.undo();

        assertEquals(original, session.getFileText());
        assertEquals(List.of(Fixtures.IDLE_KEY, Fixtures.CAST_KEY), List.copyOf(session.getTree().getSystems().keySet()));
        assertTrue(session.getDeletedEmitters().isEmpty());
        assertTrue(session.undo().isEmpty());
    }

    @Test
    void selectingIsNotAnUndoStep() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        assertTrue(service.selectSystem(session, Fixtures.IDLE_KEY).isSuccess());
        assertEquals(EditErrorKind.NOT_FOUND, service.selectSystem(session, "Missing").getErrorKind());
        assertTrue(session.getHistory().isEmpty());
        assertEquals(Fixtures.IDLE_KEY, session.getSelectedSystemKey());
    }

    @Test
    void namesThatWouldBreakQuotedLiteralsAreRejected() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        String before = session.getFileText();

        List<MutationOutcome> outcomes = List.of(
            service.renameSystem(session, Fixtures.CAST_KEY, "Fx\"B"),
            service.renameSystem(session, Fixtures.CAST_KEY, "Fx\nB"),
            service.createSystem(session, "New\"One"),
            service.createSystem(session, "New\\One"),
            service.renameEmitter(session, Fixtures.IDLE_KEY, "Glow", "Gl\"ow"),
            service.renameEmitter(session, Fixtures.IDLE_KEY, "Glow", "Gl\rw"));

        for (MutationOutcome outcome : outcomes) {
            assertFalse(outcome.isSuccess());
            assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        }
        assertEquals(before, session.getFileText());
        assertEquals(0, session.getVersion());
        assertEquals(2, session.getTree().getSystems().size());
        assertEquals(List.of("Glow", "Sparks"), session.getTree().getSystem(Fixtures.IDLE_KEY).emitterNames());
    }

    @Test
    void renamingPathKeyedSystemKeepsShortResolverKey() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());

        MutationOutcome outcome = service.renameSystem(session, Fixtures.CAST_KEY, "Fx_B");

        assertTrue(outcome.isSuccess(), outcome.toString());
        String text = session.getFileText();
        assertTrue(text.contains("            \"Demo_Q_Cast\" = \"Fx_B\"\n"));
        assertTrue(text.contains("            \"Demo_Idle\" = \"" + Fixtures.IDLE_KEY + "\"\n"));
        assertEquals(" (1 resource entries updated)",
            outcome.getMessage().substring("Renamed system to \"Fx_B\"".length()));
    }

    @Test
    void setSystemTransformAddsThenReplacesMatrix() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        String original = session.getFileText();
        double[] scaled = {2, 0, 0, 0, 0, 2, 0, 0, 0, 0, 2, 0, 0, 0, 0, 1};

        assertArrayEquals(SystemTransforms.identity(), service.systemTransform(session, Fixtures.CAST_KEY).orElseThrow());
        MutationOutcome added = service.setSystemTransform(session, Fixtures.CAST_KEY, scaled);

        assertTrue(added.isSuccess(), added.toString());
        assertEquals("Update matrix for \"Demo_Q_Cast\"", added.getDescription());
        assertTrue(session.getFileText().contains(
            "        particlePath: string = \"" + Fixtures.CAST_KEY + "\"\n"
                + "        transform: mtx44 = {\n"
                + "            2, 0, 0, 0\n"
                + "            0, 2, 0, 0\n"
                + "            0, 0, 2, 0\n"
                + "            0, 0, 0, 1\n"
                + "        }\n"
                + "    }\n"));
        assertArrayEquals(scaled, service.systemTransform(session, Fixtures.CAST_KEY).orElseThrow());
        assertEquals(List.of("Flash"), session.getTree().getSystem(Fixtures.CAST_KEY).emitterNames());

        double[] moved = SystemTransforms.identity();
        moved[12] = 0.5;
        assertTrue(service.setSystemTransform(session, Fixtures.CAST_KEY, moved).isSuccess());
        assertTrue(session.getFileText().contains("            0.5, 0, 0, 1\n"));
        assertEquals(1, session.getFileText().split("transform: mtx44", -1).length - 1);

        assertEquals(EditErrorKind.INVALID_INPUT,
            service.setSystemTransform(session, Fixtures.CAST_KEY, moved).getErrorKind());
        assertEquals(2, session.getHistory().size());
        assertTrue(session.undo().isPresent());
        assertTrue(session.undo().isPresent());
        assertEquals(original, session.getFileText());
    }

    @Test
    void setSystemTransformValidatesInput() {
        EditSession session = Fixtures.target(Fixtures.sampleSkin());
        double[] infinite = SystemTransforms.identity();
        infinite[0] = Double.POSITIVE_INFINITY;

        assertEquals(EditErrorKind.INVALID_INPUT, service.setSystemTransform(session, Fixtures.CAST_KEY, new double[4]).getErrorKind());
        assertEquals(EditErrorKind.INVALID_INPUT, service.setSystemTransform(session, Fixtures.CAST_KEY, null).getErrorKind());
        assertEquals(EditErrorKind.INVALID_INPUT, service.setSystemTransform(session, Fixtures.CAST_KEY, infinite).getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND,
            service.setSystemTransform(session, "Missing", SystemTransforms.identity()).getErrorKind());
        assertTrue(service.systemTransform(session, "Missing").isEmpty());
        assertEquals(0, session.getVersion());
    }
}
