package com.vfxport.mutations;

import com.vfxport.Fixtures;
import com.vfxport.external.AssetCopier;
import com.vfxport.external.AssetCopyReport;
import com.vfxport.session.EditSession;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PortServiceTest {

    private final RecordingCopier copier = new RecordingCopier();
    private final PortService service = new PortService(copier);
    private final VfxMutationService mutations = new VfxMutationService();

    @Test
    void portEmitterAppendsAndCopiesReferencedAssets() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx")));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());

        MutationOutcome outcome = service.portEmitter(target, donor, Fixtures.IDLE_KEY, "Glow", "Fx");

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of("Glow"), target.getTree().getSystem("Fx").emitterNames());
        assertTrue(target.getFileText().contains("blendMode: u8 = 4"));
        assertEquals(1, copier.calls.size());
        assertEquals(Set.of(Fixtures.GLOW_TEXTURE), Set.copyOf(copier.calls.get(0)));
        assertNotNull(outcome.getDetails().get("assetReport"));
        assertFalse(outcome.getDetails().containsKey("assets"));
    }

    @Test
    void portEmitterUsesSelectionWhenNoTargetGiven() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx")));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());

        MutationOutcome missing = service.portEmitter(target, donor, Fixtures.CAST_KEY, "Flash", null);
        assertEquals(EditErrorKind.INVALID_INPUT, missing.getErrorKind());
        assertEquals("Please select a target system first", missing.getMessage());

        target.select("Fx");
        MutationOutcome outcome = service.portEmitter(target, donor, Fixtures.CAST_KEY, "Flash", null);
        assertTrue(outcome.isSuccess());
        assertEquals(List.of("Flash"), target.getTree().getSystem("Fx").emitterNames());
        assertTrue(copier.calls.isEmpty());
    }

    @Test
    void portEmitterRenamesOnCollision() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx", "Glow")));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());

        MutationOutcome outcome = service.portEmitter(target, donor, Fixtures.IDLE_KEY, "Glow", "Fx");

        assertEquals("Glow_1", outcome.getDetails().get("emitterName"));
        assertEquals(List.of("Glow", "Glow_1"), target.getTree().getSystem("Fx").emitterNames());
        assertTrue(donor.getTree().getSystem(Fixtures.IDLE_KEY).emitterNames().contains("Glow"));
    }

    @Test
    void portEmitterReportsUnknownNames() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx")));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());
        assertEquals(EditErrorKind.NOT_FOUND,
            service.portEmitter(target, donor, Fixtures.IDLE_KEY, "Missing", "Fx").getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND,
            service.portEmitter(target, donor, "Missing", "Glow", "Fx").getErrorKind());
        assertEquals(EditErrorKind.NOT_FOUND,
            service.portEmitter(target, donor, Fixtures.IDLE_KEY, "Glow", "Missing").getErrorKind());
        assertEquals(0, target.getVersion());
    }

    @Test
    void portAfterDeletingEveryEmitterThenPortAll() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx", "Old")));
        EditSession donor = Fixtures.donor(Fixtures.file(
            Fixtures.system("Solo", "Beam"),
            Fixtures.system("Trio", "Beam", "Core", "Trail")));

        assertTrue(mutations.deleteEmitter(target, "Fx", "Old").isSuccess());
        assertTrue(target.getFileText().contains("complexEmitterDefinitionData: list[pointer] = {}"));

        assertTrue(service.portEmitter(target, donor, "Solo", "Beam", "Fx").isSuccess());
        assertEquals(List.of("Beam"), target.getTree().getSystem("Fx").emitterNames());

        MutationOutcome outcome = service.portAllEmitters(target, donor, "Trio", "Fx", null);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of("Beam_1", "Core", "Trail"), outcome.getDetails().get("ported"));
        assertEquals(List.of("Beam", "Beam_1", "Core", "Trail"), target.getTree().getSystem("Fx").emitterNames());
        assertEquals(3, target.getHistory().size());
    }

    @Test
    void portAllSkipsEmittersDeletedThisSession() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx", "Beam", "Core")));
        EditSession donor = Fixtures.donor(Fixtures.file(Fixtures.system("Src", "Beam", "Core")));
        mutations.deleteEmitter(target, "Fx", "Core");

        BulkPortMonitor monitor = new BulkPortMonitor();
        MutationOutcome outcome = service.portAllEmitters(target, donor, "Src", "Fx", monitor);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of("Beam_1"), outcome.getDetails().get("ported"));
        assertEquals(List.of("Core"), outcome.getDetails().get("skipped"));
        assertEquals(List.of("Beam", "Beam_1"), target.getTree().getSystem("Fx").emitterNames());
        assertEquals(2, monitor.getDone());
        assertEquals(2, monitor.getTotal());
        assertFalse(monitor.isRunning());
    }

    @Test
    void portAllWithCancelledMonitorCopiesNothing() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx")));
        EditSession donor = Fixtures.donor(Fixtures.file(Fixtures.system("Src", "Beam", "Core")));
        BulkPortMonitor monitor = new BulkPortMonitor();
        monitor.cancel();

        MutationOutcome outcome = service.portAllEmitters(target, donor, "Src", "Fx", monitor);

        assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        assertEquals(0, target.getVersion());
    }

    @Test
    void portAllEmittersKeepsItemsFinishedBeforeCancel() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx")));
        EditSession donor = Fixtures.donor(Fixtures.file(Fixtures.system("Src", "Beam", "Core", "Trail")));
        CancelAfter monitor = new CancelAfter(2);

        MutationOutcome outcome = service.portAllEmitters(target, donor, "Src", "Fx", monitor);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of("Beam", "Core"), outcome.getDetails().get("ported"));
        assertEquals(Boolean.TRUE, outcome.getDetails().get("cancelled"));
        assertTrue(outcome.getMessage().endsWith(" before cancel"));
        assertEquals(List.of("Beam", "Core"), target.getTree().getSystem("Fx").emitterNames());
        assertEquals(1, target.getHistory().size());
        assertEquals(2, monitor.getDone());
        assertEquals(3, monitor.getTotal());
    }

    @Test
    void portSystemRenamesOnCollisionAndMapsResolver() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.system("Fx", "A"), Fixtures.resolver("Fx", "Fx")));
        EditSession donor = Fixtures.donor(Fixtures.file(Fixtures.system("Fx", "B"), Fixtures.resolver("Fx", "Fx")));

        MutationOutcome outcome = service.portSystem(target, donor, "Fx");

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals("Fx_1", outcome.getDetails().get("systemKey"));
        assertEquals(List.of("A"), target.getTree().getSystem("Fx").emitterNames());
        assertEquals(List.of("B"), target.getTree().getSystem("Fx_1").emitterNames());
        assertEquals("Fx_1", target.getTree().getSystem("Fx_1").getParticleName());
        assertTrue(target.getFileText().contains("            \"Fx_1\" = \"Fx_1\"\n"));
        assertTrue(target.getRecentlyCreated().contains("Fx_1"));
    }

    @Test
    void portAllSystemsCarriesResolverEntries() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.resolver()));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());
        BulkPortMonitor monitor = new BulkPortMonitor();

        MutationOutcome outcome = service.portAllSystems(target, donor, monitor);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of(Fixtures.IDLE_KEY, Fixtures.CAST_KEY), outcome.getDetails().get("ported"));
        assertEquals(Boolean.FALSE, outcome.getDetails().get("cancelled"));
        String text = target.getFileText();
        assertTrue(text.contains("\"Demo_Idle\" = \"" + Fixtures.IDLE_KEY + "\""));
        assertTrue(text.contains("\"Demo_Q_Cast\" = \"" + Fixtures.CAST_KEY + "\""));
        assertEquals(1, target.getHistory().size());
        assertEquals(2, monitor.getDone());
        assertEquals(List.of(Fixtures.GLOW_TEXTURE), new ArrayList<>(copier.calls.get(0)));
    }

    @Test
    void portAllSystemsCancelledBeforeStart() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.resolver()));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());
        BulkPortMonitor monitor = new BulkPortMonitor();
        monitor.cancel();

        MutationOutcome outcome = service.portAllSystems(target, donor, monitor);

        assertEquals(EditErrorKind.INVALID_INPUT, outcome.getErrorKind());
        assertEquals("Port cancelled before any system was copied", outcome.getMessage());
        assertTrue(target.getTree().getSystems().isEmpty());
    }

    @Test
    void portAllSystemsKeepsSystemsFinishedBeforeCancel() {
        EditSession target = Fixtures.target(Fixtures.file(Fixtures.resolver()));
        EditSession donor = Fixtures.donor(Fixtures.sampleSkin());
        CancelAfter monitor = new CancelAfter(1);

        MutationOutcome outcome = service.portAllSystems(target, donor, monitor);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(List.of(Fixtures.IDLE_KEY), outcome.getDetails().get("ported"));
        assertEquals(Boolean.TRUE, outcome.getDetails().get("cancelled"));
        assertEquals(Set.of(Fixtures.IDLE_KEY), target.getTree().getSystems().keySet());
        assertFalse(target.getFileText().contains(Fixtures.CAST_KEY));
        assertEquals(1, target.getHistory().size());
        assertEquals(1, monitor.getDone());
    }

    /** Requests a cancel once {@code limit} items have started. */
    private static final class CancelAfter extends BulkPortMonitor {
        private final int limit;
        private int started;

        CancelAfter(int limit) {
            this.limit = limit;
        }

        @Override
        void advance(String item) {
            super.advance(item);
            if (++started >= limit) {
                cancel();
            }
        }
    }

    private static final class RecordingCopier implements AssetCopier {
        final List<Collection<String>> calls = new ArrayList<>();

        @Override
        public AssetCopyReport copy(Path donorFile, Path targetFile, Collection<String> assetPaths) {
            calls.add(new ArrayList<>(assetPaths));
            AssetCopyReport report = new AssetCopyReport();
            report.getCopied().addAll(assetPaths);
            return report;
        }
    }
}
