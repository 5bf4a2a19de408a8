package com.vfxport.mutations;

import com.vfxport.AppLogger;
import com.vfxport.external.AssetCopier;
import com.vfxport.external.AssetCopyReport;
import com.vfxport.external.AssetReferences;
import com.vfxport.models.ResourceMapEntry;
import com.vfxport.models.VfxEmitter;
import com.vfxport.models.VfxSystem;
import com.vfxport.models.VfxTree;
import com.vfxport.naming.UniqueNameResolver;
import com.vfxport.resources.MatchKind;
import com.vfxport.resources.ResourceMapSynchronizer;
import com.vfxport.session.EditSession;
import com.vfxport.session.SessionChange;
import com.vfxport.tree.BlockKind;
import com.vfxport.tree.BlockReplacer;
import com.vfxport.tree.EmitterBlocks;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.PropertyTreeParser;
import com.vfxport.tree.SystemBlocks;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Copies emitters and whole systems from a donor session into the target
 * session. Referenced assets are copied afterwards; asset problems are
 * reported in the outcome and never undo the structural copy.
 */
public class PortService {

    private final AssetCopier assetCopier;
    private final AppLogger logger = AppLogger.get();

    public PortService(AssetCopier assetCopier) {
        this.assetCopier = assetCopier;
    }

    /**
     * Ports one emitter. A null {@code targetSystemKey} means the target's
     * current selection.
     */
    public MutationOutcome portEmitter(EditSession target, EditSession donor, String donorSystemKey,
                                       String emitterName, String targetSystemKey) {
        VfxTree donorTree;
        synchronized (donor) {
            donorTree = donor.getTree();
        }
        MutationOutcome outcome = VfxMutationService.guarded(target, "port emitter", () -> {
            String targetKey = targetSystemKey != null ? targetSystemKey : target.getSelectedSystemKey();
            if (targetKey == null) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Please select a target system first");
            }
            VfxSystem targetSystem = target.getTree().getSystem(targetKey);
            if (targetSystem == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Target system not found: " + targetKey);
            }
            VfxSystem donorSystem = donorTree.getSystem(donorSystemKey);
            if (donorSystem == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Donor system not found: " + donorSystemKey);
            }
            Optional<VfxEmitter> emitter = PropertyTreeParser.loadEmitter(donorSystem, emitterName);
            if (emitter.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Emitter not found: " + emitterName);
            }
            String finalName = UniqueNameResolver.resolve(emitterName, targetSystem.emitterNames());
            String emitterText = finalName.equals(emitterName)
                ? emitter.get().getContent()
                : EmitterBlocks.rename(emitter.get().getContent(), finalName);
            String newBlock = EmitterBlocks.append(targetSystem.getRawContent(), emitterText);
            Optional<String> updated = BlockReplacer.replace(target.getFileText(), BlockKind.SYSTEM, targetKey, newBlock);
            if (updated.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + targetKey);
            }
            String description = "Port emitter \"" + finalName + "\" to \"" + targetSystem.getName() + "\"";
            long version = target.apply(new SessionChange(updated.get(), description).restored(targetKey, finalName));
            log("Ported emitter " + emitterName + " -> " + targetKey + " as " + finalName);
            return MutationOutcome.success("Ported emitter \"" + finalName + "\"", description, version)
                .with("emitterName", finalName)
                .with("assets", AssetReferences.find(emitterText));
        });
        return copyAssets(outcome, donor, target);
    }

    /**
     * Ports every emitter of a donor system, skipping emitters that were
     * deleted from the target system during this session.
     */
    public MutationOutcome portAllEmitters(EditSession target, EditSession donor, String donorSystemKey,
                                           String targetSystemKey, BulkPortMonitor monitor) {
        BulkPortMonitor progress = monitor != null ? monitor : new BulkPortMonitor();
        VfxTree donorTree;
        synchronized (donor) {
            donorTree = donor.getTree();
        }
        MutationOutcome outcome = VfxMutationService.guarded(target, "port all emitters", () -> {
            String targetKey = targetSystemKey != null ? targetSystemKey : target.getSelectedSystemKey();
            if (targetKey == null) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Please select a target system first");
            }
            VfxSystem targetSystem = target.getTree().getSystem(targetKey);
            if (targetSystem == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Target system not found: " + targetKey);
            }
            VfxSystem donorSystem = donorTree.getSystem(donorSystemKey);
            if (donorSystem == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Donor system not found: " + donorSystemKey);
            }

            Set<String> taken = new LinkedHashSet<>(targetSystem.emitterNames());
            Set<String> assets = new LinkedHashSet<>();
            List<String> ported = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            String block = targetSystem.getRawContent();
            progress.start(donorSystem.getEmitters().size());
            try {
                for (VfxEmitter candidate : donorSystem.getEmitters()) {
                    if (progress.isCancelled()) {
                        break;
                    }
                    String name = candidate.getName();
                    progress.advance(name);
                    if (name == null || target.isDeleted(targetKey, name)) {
                        skipped.add(name);
                        continue;
                    }
                    Optional<VfxEmitter> emitter = PropertyTreeParser.loadEmitter(donorSystem, name);
                    if (emitter.isEmpty()) {
                        skipped.add(name);
                        continue;
                    }
                    String finalName = UniqueNameResolver.resolve(name, taken);
                    taken.add(finalName);
                    String text = finalName.equals(name)
                        ? emitter.get().getContent()
                        : EmitterBlocks.rename(emitter.get().getContent(), finalName);
                    block = EmitterBlocks.append(block, text);
                    assets.addAll(AssetReferences.find(text));
                    ported.add(finalName);
                }
            } finally {
                progress.finish();
            }

            if (ported.isEmpty()) {
                return MutationOutcome.failure(progress.isCancelled() ? EditErrorKind.INVALID_INPUT : EditErrorKind.NOT_FOUND,
                    progress.isCancelled() ? "Port cancelled before any emitter was copied" : "No emitters to port");
            }
            Optional<String> updated = BlockReplacer.replace(target.getFileText(), BlockKind.SYSTEM, targetKey, block);
            if (updated.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + targetKey);
            }
            String description = "Port all emitters from \"" + donorSystem.getName() + "\"";
            long version = target.apply(new SessionChange(updated.get(), description));
            String message = "Ported " + ported.size() + " emitters to \"" + targetSystem.getName() + "\""
                + (skipped.isEmpty() ? "" : " (" + skipped.size() + " skipped)")
                + (progress.isCancelled() ? " before cancel" : "");
            log(message);
            return MutationOutcome.success(message, description, version)
                .with("ported", ported)
                .with("skipped", skipped)
                .with("cancelled", progress.isCancelled())
                .with("assets", assets);
        });
        return copyAssets(outcome, donor, target);
    }

    public MutationOutcome portSystem(EditSession target, EditSession donor, String donorSystemKey) {
        VfxTree donorTree;
        synchronized (donor) {
            donorTree = donor.getTree();
        }
        MutationOutcome outcome = VfxMutationService.guarded(target, "port system", () -> {
            VfxSystem donorSystem = donorTree.getSystem(donorSystemKey);
            if (donorSystem == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Donor system not found: " + donorSystemKey);
            }
            Set<String> taken = new LinkedHashSet<>(target.getTree().getSystems().keySet());
            String finalKey = UniqueNameResolver.resolve(donorSystem.getKey(), taken);
            String updated = insertSystem(target.getFileText(), donorTree, donorSystem, finalKey);
            String description = "Port system \"" + finalKey + "\"";
            long version = target.apply(new SessionChange(updated, description).created(finalKey));
            String message = finalKey.equals(donorSystem.getKey())
                ? "Ported system \"" + finalKey + "\""
                : "Ported system \"" + donorSystem.getKey() + "\" as \"" + finalKey + "\"";
            log(message);
            return MutationOutcome.success(message, description, version)
                .with("systemKey", finalKey)
                .with("assets", AssetReferences.find(donorSystem.getRawContent()));
        });
        return copyAssets(outcome, donor, target);
    }

    /**
     * Ports every donor system. Progress is published on the monitor and a
     * cancel request stops the loop between systems; systems already copied
     * are kept.
     */
    public MutationOutcome portAllSystems(EditSession target, EditSession donor, BulkPortMonitor monitor) {
        BulkPortMonitor progress = monitor != null ? monitor : new BulkPortMonitor();
        VfxTree donorTree;
        synchronized (donor) {
            donorTree = donor.getTree();
        }
        MutationOutcome outcome = VfxMutationService.guarded(target, "port all systems", () -> {
            if (donorTree.getSystems().isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Donor has no VFX systems");
            }
            Set<String> taken = new LinkedHashSet<>(target.getTree().getSystems().keySet());
            Set<String> assets = new LinkedHashSet<>();
            List<String> ported = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            String text = target.getFileText();
            progress.start(donorTree.getSystems().size());
            try {
                for (VfxSystem donorSystem : donorTree.getSystems().values()) {
                    if (progress.isCancelled()) {
                        break;
                    }
                    progress.advance(donorSystem.getKey());
                    try {
                        String finalKey = UniqueNameResolver.resolve(donorSystem.getKey(), taken);
                        text = insertSystem(text, donorTree, donorSystem, finalKey);
                        taken.add(finalKey);
                        ported.add(finalKey);
                        assets.addAll(AssetReferences.find(donorSystem.getRawContent()));
                    } catch (RuntimeException e) {
                        errors.add("Failed to port " + donorSystem.getKey() + ": " + e.getMessage());
                    }
                }
            } finally {
                progress.finish();
            }
            if (ported.isEmpty()) {
                return MutationOutcome.failure(progress.isCancelled() ? EditErrorKind.INVALID_INPUT : EditErrorKind.MALFORMED,
                    progress.isCancelled() ? "Port cancelled before any system was copied" : String.join("; ", errors));
            }
            String description = "Port all systems (" + ported.size() + ")";
            SessionChange change = new SessionChange(text, description);
            ported.forEach(change::created);
            long version = target.apply(change);
            String message = "Ported " + ported.size() + " systems"
                + (errors.isEmpty() ? "" : ", " + errors.size() + " failed")
                + (progress.isCancelled() ? " before cancel" : "");
            log(message);
            return MutationOutcome.success(message, description, version)
                .with("ported", ported)
                .with("errors", errors)
                .with("cancelled", progress.isCancelled())
                .with("assets", assets);
        });
        return copyAssets(outcome, donor, target);
    }

    /**
     * Inserts a donor system under {@code finalKey} and carries over the
     * donor's resource-map entries that point at it.
     */
    private String insertSystem(String targetText, VfxTree donorTree, VfxSystem donorSystem, String finalKey) {
        String block = donorSystem.getRawContent();
        if (!finalKey.equals(donorSystem.getKey())) {
            block = SystemBlocks.rename(block, finalKey);
        }
        String text = BlockReplacer.insert(targetText, block);
        boolean mapped = false;
        for (ResourceMapEntry entry : donorTree.getResourceMap()) {
            var match = ResourceMapSynchronizer.match(entry.getKey(), entry.getValue(), donorSystem.getKey());
            if (match.kind() != MatchKind.EXACT_KEY && match.kind() != MatchKind.EXACT_VALUE) {
                continue;
            }
            String key = match.getKey().isMatch() ? finalKey : EntryKeys.unquote(entry.getKey());
            String value = match.getValue().isMatch() ? finalKey : EntryKeys.unquote(entry.getValue());
            text = ResourceMapSynchronizer.ensureEntry(text, key, value);
            mapped = true;
        }
        if (!mapped) {
            text = ResourceMapSynchronizer.ensureEntry(text, finalKey, finalKey);
        }
        return text;
    }

    @SuppressWarnings("unchecked")
    private MutationOutcome copyAssets(MutationOutcome outcome, EditSession donor, EditSession target) {
        if (!outcome.isSuccess() || assetCopier == null) {
            return outcome;
        }
        Object assets = outcome.getDetails().remove("assets");
        if (!(assets instanceof Set) || ((Set<String>) assets).isEmpty()) {
            return outcome;
        }
        AssetCopyReport report = assetCopier.copy(donor.getSourcePath(), target.getSourcePath(), (Set<String>) assets);
        if (!report.getFailed().isEmpty()) {
            logWarning("Asset copy reported " + report.getFailed().size() + " failures");
        }
        return outcome.with("assetReport", report);
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[PortService] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[PortService] " + message);
        }
    }
}
