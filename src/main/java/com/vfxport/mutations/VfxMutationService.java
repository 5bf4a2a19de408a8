package com.vfxport.mutations;

import com.vfxport.AppLogger;
import com.vfxport.models.VfxEmitter;
import com.vfxport.models.VfxSystem;
import com.vfxport.naming.UniqueNameResolver;
import com.vfxport.resources.ResourceMapSynchronizer;
import com.vfxport.session.EditSession;
import com.vfxport.session.SessionChange;
import com.vfxport.tree.BlockKind;
import com.vfxport.tree.BlockReplacer;
import com.vfxport.tree.EmitterBlocks;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.PropertyTreeParser;
import com.vfxport.tree.SystemBlocks;
import com.vfxport.tree.SystemTransforms;
import com.vfxport.tree.TextLines;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Structural edits on a single session: create, rename, delete and move.
 * <p>
 * Every operation computes the complete new text first and installs it with
 * one {@link EditSession#apply(SessionChange)} call, so a failure at any step
 * leaves the session exactly as it was.
 */
public class VfxMutationService {

    private final AppLogger logger = AppLogger.get();

    public MutationOutcome createSystem(EditSession session, String requestedName) {
        String name = requestedName == null ? "" : requestedName.trim();
        if (name.isEmpty()) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Enter a system name");
        }
        String problem = EntryKeys.literalProblem(name);
        if (problem != null) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, problem);
        }
        return guarded(session, "create system", () -> {
            String key = UniqueNameResolver.resolve(name, session.getTree().getSystems().keySet());
            String text = session.getFileText();
            String block = SystemBlocks.minimalSystem(key, TextLines.separatorOf(text));
            String updated = BlockReplacer.insert(text, block);
            updated = ResourceMapSynchronizer.ensureEntry(updated, key, key);

            String description = "Create VFX system \"" + key + "\"";
            long version = session.apply(new SessionChange(updated, description).created(key).select(key));
            String message = session.getTree().isHasResourceResolver()
                ? "Created VFX system \"" + key + "\" and updated ResourceResolver"
                : "Created VFX system \"" + key + "\"";
            log(message);
            return MutationOutcome.success(message, description, version).with("systemKey", key);
        });
    }

    public MutationOutcome renameSystem(EditSession session, String systemKey, String requestedName) {
        String newName = requestedName == null ? "" : requestedName.trim();
        if (newName.isEmpty()) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "System name cannot be empty");
        }
        String problem = EntryKeys.literalProblem(newName);
        if (problem != null) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, problem);
        }
        return guarded(session, "rename system", () -> {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            if (newName.equals(systemKey)) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "System name unchanged");
            }
            if (session.getTree().getSystem(newName) != null) {
                return MutationOutcome.failure(EditErrorKind.COLLISION, "A system named \"" + newName + "\" already exists");
            }
            String renamedBlock = SystemBlocks.rename(system.getRawContent(), newName);
            Optional<String> replaced = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, systemKey, renamedBlock);
            if (replaced.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + systemKey);
            }
            ResourceMapSynchronizer.RenameResult synced =
                ResourceMapSynchronizer.renameReferences(replaced.get(), systemKey, newName);

            String description = "Rename system \"" + systemKey + "\" to \"" + newName + "\"";
            long version = session.apply(new SessionChange(synced.getText(), description).renamed(systemKey, newName));
            String message = "Renamed system to \"" + newName + "\""
                + (synced.getChangedCount() > 0 ? " (" + synced.getChangedCount() + " resource entries updated)" : "");
            log(message);
            return MutationOutcome.success(message, description, version)
                .with("systemKey", newName)
                .with("resourceChanges", synced.getChanges());
        });
    }

    public MutationOutcome renameEmitter(EditSession session, String systemKey, String oldName, String requestedName) {
        String newName = requestedName == null ? "" : requestedName.trim();
        if (newName.isEmpty()) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Emitter name cannot be empty");
        }
        String problem = EntryKeys.literalProblem(newName);
        if (problem != null) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, problem);
        }
        return guarded(session, "rename emitter", () -> {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            if (system.findEmitter(oldName) == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Emitter not found: " + oldName);
            }
            if (newName.equals(oldName)) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Emitter name unchanged");
            }
            if (system.findEmitter(newName) != null) {
                return MutationOutcome.failure(EditErrorKind.COLLISION,
                    "An emitter named \"" + newName + "\" already exists in this system");
            }
            Optional<String> block = EmitterBlocks.rename(system.getRawContent(), oldName, newName);
            Optional<String> replaced = block.flatMap(b ->
                BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, systemKey, b));
            if (replaced.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not rewrite emitter " + oldName);
            }
            String description = "Rename emitter \"" + oldName + "\" to \"" + newName + "\"";
            long version = session.apply(new SessionChange(replaced.get(), description)
                .restored(systemKey, oldName)
                .restored(systemKey, newName));
            String message = "Renamed emitter \"" + oldName + "\" to \"" + newName + "\"";
            log(message);
            return MutationOutcome.success(message, description, version);
        });
    }

    public MutationOutcome deleteEmitter(EditSession session, String systemKey, String emitterName) {
        return guarded(session, "delete emitter", () -> {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            if (emitterName == null || system.findEmitter(emitterName) == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Emitter not found: " + emitterName);
            }
            Optional<String> replaced = EmitterBlocks.remove(system.getRawContent(), emitterName)
                .flatMap(b -> BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, systemKey, b));
            if (replaced.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not remove emitter " + emitterName);
            }
            String description = "Delete emitter \"" + emitterName + "\"";
            long version = session.apply(new SessionChange(replaced.get(), description).deleted(systemKey, emitterName));
            String message = "Deleted emitter \"" + emitterName + "\" from \"" + system.getName() + "\"";
            log(message);
            return MutationOutcome.success(message, description, version);
        });
    }

    public MutationOutcome deleteAllEmitters(EditSession session, String systemKey) {
        return guarded(session, "delete all emitters", () -> {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            if (system.getEmitters().isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System has no emitters: " + systemKey);
            }
            String block = EmitterBlocks.removeAll(system.getRawContent());
            Optional<String> replaced = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, systemKey, block);
            if (replaced.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + systemKey);
            }
            List<String> names = system.emitterNames();
            String description = "Delete all emitters from \"" + system.getName() + "\"";
            SessionChange change = new SessionChange(replaced.get(), description);
            for (String name : names) {
                change.deleted(systemKey, name);
            }
            long version = session.apply(change);
            String message = "Deleted " + system.getEmitters().size() + " emitters from \"" + system.getName() + "\"";
            log(message);
            return MutationOutcome.success(message, description, version).with("deleted", names);
        });
    }

    /**
     * Moves an emitter between two systems of the same session. The emitter
     * is renamed with a numeric suffix when the destination already has one
     * by that name.
     */
    public MutationOutcome moveEmitter(EditSession session, String sourceKey, String emitterName, String destinationKey) {
        return guarded(session, "move emitter", () -> {
            if (sourceKey == null || sourceKey.equals(destinationKey)) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Source and destination must be different systems");
            }
            VfxSystem source = session.getTree().getSystem(sourceKey);
            VfxSystem destination = session.getTree().getSystem(destinationKey);
            if (source == null || destination == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND,
                    "System not found: " + (source == null ? sourceKey : destinationKey));
            }
            Optional<VfxEmitter> emitter = PropertyTreeParser.loadEmitter(source, emitterName);
            if (emitter.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Emitter not found: " + emitterName);
            }
            String finalName = UniqueNameResolver.resolve(emitterName, destination.emitterNames());
            String emitterText = emitter.get().getContent();
            if (!finalName.equals(emitterName)) {
                emitterText = EmitterBlocks.rename(emitterText, finalName);
            }

            Optional<String> newSource = EmitterBlocks.remove(source.getRawContent(), emitterName);
            if (newSource.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not remove emitter " + emitterName);
            }
            String newDestination = EmitterBlocks.append(destination.getRawContent(), emitterText);
            Optional<String> updated = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, sourceKey, newSource.get())
                .flatMap(t -> BlockReplacer.replace(t, BlockKind.SYSTEM, destinationKey, newDestination));
            if (updated.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not rewrite systems for move");
            }
            String description = "Move emitter \"" + emitterName + "\" to \"" + destination.getName() + "\"";
            long version = session.apply(new SessionChange(updated.get(), description).restored(destinationKey, finalName));
            String message = finalName.equals(emitterName)
                ? "Moved emitter \"" + emitterName + "\" to \"" + destination.getName() + "\""
                : "Moved emitter \"" + emitterName + "\" to \"" + destination.getName() + "\" as \"" + finalName + "\"";
            log(message);
            return MutationOutcome.success(message, description, version).with("emitterName", finalName);
        });
    }

    /** The system's transform, or identity when it has none. */
    public Optional<double[]> systemTransform(EditSession session, String systemKey) {
        synchronized (session) {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return Optional.empty();
            }
            return Optional.of(SystemTransforms.read(system.getRawContent()).orElseGet(SystemTransforms::identity));
        }
    }

    /** Writes the system's {@code transform: mtx44} field, adding it when missing. */
    public MutationOutcome setSystemTransform(EditSession session, String systemKey, double[] matrix) {
        if (matrix == null || matrix.length != SystemTransforms.SIZE) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Matrix must have 16 values");
        }
        for (double value : matrix) {
            if (!Double.isFinite(value)) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Matrix values must be finite numbers");
            }
        }
        return guarded(session, "set system transform", () -> {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            String block = SystemTransforms.upsert(system.getRawContent(), matrix);
            if (block.equals(system.getRawContent())) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Matrix unchanged");
            }
            Optional<String> replaced = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, systemKey, block);
            if (replaced.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + systemKey);
            }
            String description = "Update matrix for \"" + system.getName() + "\"";
            long version = session.apply(new SessionChange(replaced.get(), description));
            log(description);
            return MutationOutcome.success("Updated matrix for \"" + system.getName() + "\"", description, version);
        });
    }

    public MutationOutcome selectSystem(EditSession session, String systemKey) {
        if (!session.select(systemKey)) {
            return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
        }
        return MutationOutcome.success("Selected " + (systemKey == null ? "nothing" : systemKey), null, session.getVersion());
    }

    /**
     * Runs an operation under the session monitor and converts anything it
     * throws into a failed outcome. Failures never reach {@code apply}, so
     * the session is untouched.
     */
    public static MutationOutcome guarded(EditSession session, String operation, Supplier<MutationOutcome> body) {
        synchronized (session) {
            try {
                return body.get();
            } catch (RuntimeException e) {
                AppLogger logger = AppLogger.get();
                if (logger != null) {
                    logger.error("[Mutation] " + operation + " failed: " + e.getMessage(), e);
                }
                return MutationOutcome.failure(EditErrorKind.MALFORMED, operation + " failed: " + e.getMessage());
            }
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[VfxMutationService] " + message);
        }
    }
}
