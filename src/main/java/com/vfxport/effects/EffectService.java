package com.vfxport.effects;

import com.vfxport.AppLogger;
import com.vfxport.models.VfxEmitter;
import com.vfxport.models.VfxSystem;
import com.vfxport.mutations.EditErrorKind;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.mutations.VfxMutationService;
import com.vfxport.naming.UniqueNameResolver;
import com.vfxport.resources.ResourceMapSynchronizer;
import com.vfxport.session.EditSession;
import com.vfxport.session.SessionChange;
import com.vfxport.tree.BlockKind;
import com.vfxport.tree.BlockReplacer;
import com.vfxport.tree.EmitterBlocks;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.PropertyTreeParser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Effect-condition edits on the target session: idle particles, child
 * particles and persistent effects. All of them need the file to carry a
 * ResourceResolver and a SkinCharacterDataProperties entry.
 */
public class EffectService {

    static final String LOCKED_MESSAGE = "Locked: target bin missing ResourceResolver or SkinCharacterDataProperties";

    private final AppLogger logger = AppLogger.get();

    // Idle particles

    public List<String> idleBones(EditSession session, String systemKey) {
        synchronized (session) {
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null || system.getParticleName() == null) {
                return new ArrayList<>();
            }
            return IdleParticleBuilder.bonesFor(session.getFileText(), system.getParticleName());
        }
    }

    public MutationOutcome setIdleParticles(EditSession session, String systemKey, List<String> bones) {
        return VfxMutationService.guarded(session, "idle particles", () -> {
            MutationOutcome locked = checkUnlocked(session);
            if (locked != null) {
                return locked;
            }
            VfxSystem system = session.getTree().getSystem(systemKey);
            if (system == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + systemKey);
            }
            String particleName = system.getParticleName();
            if (particleName == null || particleName.isBlank()) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT,
                    "System " + system.getName() + " has no particleName");
            }
            List<String> cleaned = new ArrayList<>(new LinkedHashSet<>(trimmed(bones)));
            for (String bone : cleaned) {
                String problem = EntryKeys.literalProblem(bone);
                if (problem != null) {
                    return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, problem);
                }
            }
            String updated = IdleParticleBuilder.replaceBones(session.getFileText(), particleName, cleaned);
            if (!cleaned.isEmpty()) {
                updated = ResourceMapSynchronizer.ensureEntry(updated, particleName, systemKey);
            }
            if (updated.equals(session.getFileText())) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "No idle particles to change");
            }
            String description = cleaned.isEmpty()
                ? "Remove idle particles for " + system.getName()
                : "Set idle particles for " + system.getName() + " on " + String.join(", ", cleaned);
            long version = session.apply(new SessionChange(updated, description));
            log(description);
            return MutationOutcome.success(description, description, version).with("bones", cleaned);
        });
    }

    // Child particles

    public List<ChildParticleOptions> childParticles(EditSession session, String parentKey) {
        synchronized (session) {
            List<ChildParticleOptions> result = new ArrayList<>();
            VfxSystem parent = session.getTree().getSystem(parentKey);
            if (parent == null) {
                return result;
            }
            for (String name : parent.emitterNames()) {
                PropertyTreeParser.loadEmitter(parent, name)
                    .flatMap(emitter -> ChildParticleBuilder.readOptions(emitter.getContent()))
                    .ifPresent(result::add);
            }
            return result;
        }
    }

    public Optional<ChildParticleOptions> readChildParticle(EditSession session, String parentKey, String emitterName) {
        synchronized (session) {
            VfxSystem parent = session.getTree().getSystem(parentKey);
            if (parent == null) {
                return Optional.empty();
            }
            return PropertyTreeParser.loadEmitter(parent, emitterName)
                .flatMap(emitter -> ChildParticleBuilder.readOptions(emitter.getContent()));
        }
    }

    public MutationOutcome addChildParticle(EditSession session, String parentKey, ChildParticleOptions options) {
        return VfxMutationService.guarded(session, "add child particle", () -> {
            MutationOutcome invalid = checkChildRequest(session, parentKey, options);
            if (invalid != null) {
                return invalid;
            }
            VfxSystem parent = session.getTree().getSystem(parentKey);
            String desired = options.getEmitterName() == null || options.getEmitterName().isBlank()
                ? EntryKeys.displayName(options.getChildSystemKey())
                : options.getEmitterName().trim();
            String finalName = UniqueNameResolver.resolve(desired, parent.emitterNames());
            options.setEmitterName(finalName);

            String newBlock = EmitterBlocks.append(parent.getRawContent(), ChildParticleBuilder.emitterText(options));
            Optional<String> updated = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, parentKey, newBlock);
            if (updated.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + parentKey);
            }
            String description = "Add child particle \"" + finalName + "\" to " + parent.getName();
            long version = session.apply(new SessionChange(updated.get(), description).restored(parentKey, finalName));
            String message = finalName.equals(desired)
                ? "Added child particle \"" + finalName + "\""
                : "Added child particle as \"" + finalName + "\" (name was taken)";
            log(message);
            return MutationOutcome.success(message, description, version).with("emitterName", finalName);
        });
    }

    /** Deletes the child emitter and re-creates it under the same name at the end of the list. */
    public MutationOutcome updateChildParticle(EditSession session, String parentKey, String emitterName,
                                               ChildParticleOptions options) {
        return VfxMutationService.guarded(session, "update child particle", () -> {
            MutationOutcome invalid = checkChildRequest(session, parentKey, options);
            if (invalid != null) {
                return invalid;
            }
            VfxSystem parent = session.getTree().getSystem(parentKey);
            Optional<VfxEmitter> existing = PropertyTreeParser.loadEmitter(parent, emitterName);
            if (existing.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Emitter not found: " + emitterName);
            }
            if (!ChildParticleBuilder.isChildEmitter(existing.get().getContent())) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, emitterName + " is not a child particle emitter");
            }
            options.setEmitterName(emitterName);
            Optional<String> without = EmitterBlocks.remove(parent.getRawContent(), emitterName);
            if (without.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not remove emitter " + emitterName);
            }
            String newBlock = EmitterBlocks.append(without.get(), ChildParticleBuilder.emitterText(options));
            Optional<String> updated = BlockReplacer.replace(session.getFileText(), BlockKind.SYSTEM, parentKey, newBlock);
            if (updated.isEmpty()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "Could not locate system block for " + parentKey);
            }
            String description = "Edit child particle \"" + emitterName + "\" in " + parent.getName();
            long version = session.apply(new SessionChange(updated.get(), description));
            log(description);
            return MutationOutcome.success("Updated child particle \"" + emitterName + "\"", description, version)
                .with("emitterName", emitterName);
        });
    }

    // Persistent effects

    public List<PersistentCondition> persistentEffects(EditSession session) {
        synchronized (session) {
            return PersistentEffectBuilder.existing(session.getFileText());
        }
    }

    /**
     * Adds a persistent condition, or replaces the one at {@code editIndex}
     * (the replacement goes to the end of the list).
     */
    public MutationOutcome savePersistentEffect(EditSession session, PersistentCondition condition, Integer editIndex) {
        return VfxMutationService.guarded(session, "persistent effect", () -> {
            MutationOutcome locked = checkUnlocked(session);
            if (locked != null) {
                return locked;
            }
            try {
                PersistentEffectBuilder.validate(condition);
            } catch (IllegalArgumentException e) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, e.getMessage());
            }
            String text = session.getFileText();
            if (editIndex != null && (editIndex < 0 || editIndex >= PersistentEffectBuilder.conditionSpans(text).size())) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "No persistent condition at index " + editIndex);
            }
            String updated = PersistentEffectBuilder.upsert(text, condition, editIndex);
            int mapped = 0;
            List<PersistentVfx> vfxList = condition.getVfx() == null ? List.of() : condition.getVfx();
            for (PersistentVfx vfx : vfxList) {
                String key = EntryKeys.unquote(vfx.getEffectKey());
                if (!EntryKeys.isHash(key) && vfx.getSystemKey() != null && !vfx.getSystemKey().isBlank()) {
                    String before = updated;
                    updated = ResourceMapSynchronizer.ensureEntry(updated, key, vfx.getSystemKey());
                    if (!before.equals(updated)) {
                        mapped++;
                    }
                }
            }
            String description = (editIndex == null ? "Add" : "Edit") + " persistent effect ("
                + condition.getPreset().getId() + ")";
            long version = session.apply(new SessionChange(updated, description));
            log(description + ", " + mapped + " resolver mapping(s) added");
            return MutationOutcome.success(description, description, version).with("resolverMappingsAdded", mapped);
        });
    }

    public MutationOutcome removePersistentEffect(EditSession session, int index) {
        return VfxMutationService.guarded(session, "remove persistent effect", () -> {
            MutationOutcome locked = checkUnlocked(session);
            if (locked != null) {
                return locked;
            }
            String text = session.getFileText();
            if (index < 0 || index >= PersistentEffectBuilder.conditionSpans(text).size()) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "No persistent condition at index " + index);
            }
            String description = "Remove persistent effect #" + (index + 1);
            long version = session.apply(new SessionChange(PersistentEffectBuilder.removeAt(text, index), description));
            log(description);
            return MutationOutcome.success(description, description, version);
        });
    }

    private MutationOutcome checkChildRequest(EditSession session, String parentKey, ChildParticleOptions options) {
        MutationOutcome locked = checkUnlocked(session);
        if (locked != null) {
            return locked;
        }
        if (options == null || options.getChildSystemKey() == null || options.getChildSystemKey().isBlank()) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Choose a child system");
        }
        String problem = EntryKeys.literalProblem(options.getEmitterName());
        if (problem != null) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, problem);
        }
        if (session.getTree().getSystem(parentKey) == null) {
            return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "System not found: " + parentKey);
        }
        if (session.getTree().getSystem(options.getChildSystemKey()) == null) {
            return MutationOutcome.failure(EditErrorKind.NOT_FOUND,
                "Child system not found in target: " + options.getChildSystemKey());
        }
        return null;
    }

    static MutationOutcome checkUnlocked(EditSession session) {
        if (!session.getTree().isHasResourceResolver() || !session.getTree().isHasSkinCharacterData()) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, LOCKED_MESSAGE);
        }
        return null;
    }

    private static List<String> trimmed(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim());
            }
        }
        return result;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[EffectService] " + message);
        }
    }
}
