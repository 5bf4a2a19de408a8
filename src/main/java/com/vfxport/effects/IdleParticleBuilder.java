package com.vfxport.effects;

import com.vfxport.tree.BlockScanner;
import com.vfxport.tree.BlockSpan;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.ListBlocks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bone-bound idle effects stored as
 * {@code SkinCharacterDataProperties_CharacterIdleEffect} records in the skin
 * data's {@code idleParticlesEffects} list.
 */
public final class IdleParticleBuilder {

    public static final String LIST_FIELD = "idleParticlesEffects";
    public static final String LIST_HEADER = LIST_FIELD + ": list[embed] = ";
    public static final String RECORD_TYPE = "SkinCharacterDataProperties_CharacterIdleEffect";

    private static final Pattern EFFECT_KEY = Pattern.compile(
        "effectKey:\\s*hash\\s*=\\s*(\"[^\"]*\"|0x[0-9a-fA-F]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BONE_NAME = Pattern.compile(
        "boneName:\\s*string\\s*=\\s*\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);

    private IdleParticleBuilder() {
    }

    public static String record(String effectKey, String boneName) {
        return new BlockWriter()
            .open(RECORD_TYPE)
            .hash("effectKey", effectKey)
            .string("boneName", boneName)
            .close()
            .toString();
    }

    public static List<IdleParticle> existing(String text) {
        List<IdleParticle> result = new ArrayList<>();
        for (BlockSpan span : recordSpans(text)) {
            String record = span.text(text);
            String key = SkinDataBlocks.capture(EFFECT_KEY, record);
            result.add(new IdleParticle(EntryKeys.unquote(key), SkinDataBlocks.capture(BONE_NAME, record)));
        }
        return result;
    }

    public static List<String> bonesFor(String text, String effectKey) {
        List<String> bones = new ArrayList<>();
        for (IdleParticle idle : existing(text)) {
            if (EntryKeys.sameKey(idle.getEffectKey(), effectKey)) {
                bones.add(idle.getBoneName());
            }
        }
        return bones;
    }

    /**
     * Replaces every idle record of {@code effectKey} with one record per bone.
     * An empty bone list only removes.
     */
    public static String replaceBones(String text, String effectKey, List<String> bones) {
        String result = removeAll(text, effectKey);
        if (bones.isEmpty()) {
            return result;
        }
        List<String> records = new ArrayList<>();
        for (String bone : bones) {
            records.add(record(effectKey, bone));
        }
        return SkinDataBlocks.append(result, LIST_FIELD, LIST_HEADER, String.join("\n", records));
    }

    static String removeAll(String text, String effectKey) {
        Optional<BlockSpan> list = SkinDataBlocks.list(text, LIST_FIELD);
        if (list.isEmpty()) {
            return text;
        }
        List<BlockSpan> matching = new ArrayList<>();
        for (BlockSpan span : recordSpans(text)) {
            String key = SkinDataBlocks.capture(EFFECT_KEY, span.text(text));
            if (EntryKeys.sameKey(key, effectKey)) {
                matching.add(span);
            }
        }
        return matching.isEmpty() ? text : ListBlocks.removeItems(text, list.get(), matching);
    }

    private static List<BlockSpan> recordSpans(String text) {
        Optional<BlockSpan> list = SkinDataBlocks.list(text, LIST_FIELD);
        if (list.isEmpty()) {
            return new ArrayList<>();
        }
        return BlockScanner.scanTyped(text, RECORD_TYPE, list.get().getOpenBrace() + 1, list.get().getCloseBrace());
    }
}
