package com.vfxport.effects;

import com.vfxport.tree.BlockScanner;
import com.vfxport.tree.BlockSpan;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.ListBlocks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persistent effects: {@code PersistentEffectConditionData} records in the skin
 * data's {@code PersistentEffectConditions} list. Records are addressed by
 * their position in that list.
 */
public final class PersistentEffectBuilder {

    public static final String LIST_FIELD = "PersistentEffectConditions";
    public static final String LIST_HEADER = LIST_FIELD + ": list2[pointer] = ";
    public static final String RECORD_TYPE = "PersistentEffectConditionData";
    public static final String VFX_TYPE = "PersistentVfxData";
    public static final String DELAY_DRIVER = "DelayedBoolMaterialDriver";
    public static final String BUFF_COUNTER_DRIVER = "BuffCounterDynamicMaterialFloatDriver";

    private static final String KEY = "(\"[^\"]*\"|0x[0-9a-fA-F]+)";
    private static final String NUMBER = "([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)";

    private static final Pattern OWNER_DRIVER = field("OwnerCondition:\\s*pointer\\s*=\\s*([A-Za-z_]\\w*)");
    private static final Pattern BOOL_DRIVER = field("mBoolDriver:\\s*pointer\\s*=\\s*([A-Za-z_]\\w*)");
    private static final Pattern DELAY_ON = field("mDelayOn:\\s*f32\\s*=\\s*" + NUMBER);
    private static final Pattern DELAY_OFF = field("mDelayOff:\\s*f32\\s*=\\s*" + NUMBER);
    private static final Pattern ANIMATION = field("mAnimationNames:\\s*list\\[hash\\]\\s*=\\s*\\{\\s*" + KEY);
    private static final Pattern SPELL = field("Spell:\\s*hash\\s*=\\s*" + KEY);
    private static final Pattern SLOT = field("Slot:\\s*u8\\s*=\\s*(\\d+)");
    private static final Pattern SPELL_SLOT = field("SpellSlot:\\s*u32\\s*=\\s*(\\d+)");
    private static final Pattern GEAR_INDEX = field("mGearIndex:\\s*u8\\s*=\\s*(\\d+)");
    private static final Pattern OPERATOR = field("mOperator:\\s*u32\\s*=\\s*(\\d+)");
    private static final Pattern VALUE = field("mValue:\\s*f32\\s*=\\s*" + NUMBER);
    private static final Pattern EFFECT_KEY = field("effectKey:\\s*hash\\s*=\\s*" + KEY);
    private static final Pattern BONE_NAME = field("boneName:\\s*string\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern OWNER_ONLY = field("OwnerOnly:\\s*bool\\s*=\\s*(true|false)");
    private static final Pattern ATTACH_TO_CAMERA = field("AttachToCamera:\\s*bool\\s*=\\s*(true|false)");
    private static final Pattern LIST_ITEM = Pattern.compile(KEY);

    private PersistentEffectBuilder() {
    }

    /**
     * @throws IllegalArgumentException when the preset is missing a value it
     *         needs or the condition would show nothing
     */
    public static void validate(PersistentCondition condition) {
        if (condition == null || condition.getPreset() == null) {
            throw new IllegalArgumentException("Choose an owner condition");
        }
        if (condition.isEmpty()) {
            throw new IllegalArgumentException("Add at least one VFX or submesh");
        }
        switch (condition.getPreset()) {
            case IS_ANIMATION_PLAYING:
                requireText(condition.getAnimationName(), "Animation name is required");
                break;
            case HAS_BUFF_SCRIPT:
            case BUFF_COUNTER_FLOAT_COMPARISON:
                requireText(condition.getSpellName(), "Buff name is required");
                break;
            default:
                break;
        }
        requireLiteral(condition.getAnimationName());
        requireLiteral(condition.getSpellName());
        requireLiterals(condition.getShowSubmeshes());
        requireLiterals(condition.getHideSubmeshes());
        if (condition.getVfx() != null) {
            for (PersistentVfx vfx : condition.getVfx()) {
                requireText(vfx.getEffectKey(), "Every VFX needs an effect key");
                requireLiteral(vfx.getEffectKey());
                requireLiteral(vfx.getBoneName());
            }
        }
    }

    public static String conditionText(PersistentCondition condition) {
        validate(condition);
        BlockWriter w = new BlockWriter().open(RECORD_TYPE);
        if (condition.isDelayed()) {
            w.open("OwnerCondition: pointer = " + DELAY_DRIVER);
            w.open("mBoolDriver: pointer = " + condition.getPreset().getDriverType());
            writeDriverFields(w, condition);
            w.close();
            w.f32("mDelayOn", condition.getDelayOn());
            w.f32("mDelayOff", condition.getDelayOff());
            w.close();
        } else {
            w.open("OwnerCondition: pointer = " + condition.getPreset().getDriverType());
            writeDriverFields(w, condition);
            w.close();
        }
        if (condition.getShowSubmeshes() != null && !condition.getShowSubmeshes().isEmpty()) {
            w.hashList("SubmeshesToShow", condition.getShowSubmeshes());
        }
        if (condition.getHideSubmeshes() != null && !condition.getHideSubmeshes().isEmpty()) {
            w.hashList("SubmeshesToHide", condition.getHideSubmeshes());
        }
        if (condition.getVfx() != null && !condition.getVfx().isEmpty()) {
            w.open("PersistentVfxs: list2[embed] =");
            for (PersistentVfx vfx : condition.getVfx()) {
                w.open(VFX_TYPE).hash("effectKey", vfx.getEffectKey());
                if (vfx.getBoneName() != null && !vfx.getBoneName().isBlank()) {
                    w.string("boneName", vfx.getBoneName());
                }
                if (vfx.isOwnerOnly()) {
                    w.line("OwnerOnly: bool = true");
                }
                if (vfx.isAttachToCamera()) {
                    w.line("AttachToCamera: bool = true");
                }
                w.close();
            }
            w.close();
        }
        return w.close().toString();
    }

    private static void writeDriverFields(BlockWriter w, PersistentCondition condition) {
        switch (condition.getPreset()) {
            case IS_ANIMATION_PLAYING:
                w.hashList("mAnimationNames", List.of(condition.getAnimationName()));
                break;
            case HAS_BUFF_SCRIPT:
                w.hash("Spell", condition.getSpellName());
                break;
            case LEARNED_SPELL:
                w.line("Slot: u8 = " + condition.getSlot());
                break;
            case HAS_GEAR:
                w.line("mGearIndex: u8 = " + condition.getGearIndex());
                break;
            case FLOAT_COMPARISON:
                w.line("mOperator: u32 = " + condition.getOperator());
                w.open("mValueA: pointer = SpellRankIntDriver")
                    .line("SpellSlot: u32 = " + condition.getSlot())
                    .close();
                w.open("mValueB: pointer = FloatLiteralMaterialDriver").f32("mValue", condition.getValue()).close();
                break;
            case BUFF_COUNTER_FLOAT_COMPARISON:
                w.line("mOperator: u32 = " + condition.getOperator());
                w.open("mValueA: pointer = " + BUFF_COUNTER_DRIVER).hash("Spell", condition.getSpellName()).close();
                w.open("mValueB: pointer = FloatLiteralMaterialDriver").f32("mValue", condition.getValue()).close();
                break;
            default:
                throw new IllegalArgumentException("Unsupported owner condition: " + condition.getPreset());
        }
    }

    public static List<BlockSpan> conditionSpans(String text) {
        Optional<BlockSpan> list = SkinDataBlocks.list(text, LIST_FIELD);
        if (list.isEmpty()) {
            return new ArrayList<>();
        }
        return BlockScanner.scanTyped(text, RECORD_TYPE, list.get().getOpenBrace() + 1, list.get().getCloseBrace());
    }

    public static List<PersistentCondition> existing(String text) {
        List<PersistentCondition> result = new ArrayList<>();
        for (BlockSpan span : conditionSpans(text)) {
            result.add(read(span.text(text)));
        }
        return result;
    }

    /**
     * Appends {@code condition}; with an {@code editIndex} the record at that
     * position is removed first.
     */
    public static String upsert(String text, PersistentCondition condition, Integer editIndex) {
        String record = conditionText(condition);
        String base = editIndex == null ? text : removeAt(text, editIndex);
        return SkinDataBlocks.append(base, LIST_FIELD, LIST_HEADER, record);
    }

    public static String removeAt(String text, int index) {
        List<BlockSpan> spans = conditionSpans(text);
        if (index < 0 || index >= spans.size()) {
            throw new IllegalArgumentException("No persistent condition at index " + index);
        }
        BlockSpan list = SkinDataBlocks.list(text, LIST_FIELD)
            .orElseThrow(() -> new IllegalStateException("Persistent condition list disappeared"));
        return ListBlocks.removeItems(text, list, List.of(spans.get(index)));
    }

    static PersistentCondition read(String record) {
        PersistentCondition condition = new PersistentCondition();
        String driver = SkinDataBlocks.capture(OWNER_DRIVER, record);
        if (DELAY_DRIVER.equals(driver)) {
            condition.setDelayOn(SkinDataBlocks.captureNumber(DELAY_ON, record, 0));
            condition.setDelayOff(SkinDataBlocks.captureNumber(DELAY_OFF, record, 0));
            driver = SkinDataBlocks.capture(BOOL_DRIVER, record);
        }
        condition.setDriverType(driver);
        condition.setPreset(presetFor(driver, record));

        condition.setAnimationName(EntryKeys.unquote(SkinDataBlocks.capture(ANIMATION, record)));
        condition.setSpellName(EntryKeys.unquote(SkinDataBlocks.capture(SPELL, record)));
        String slot = SkinDataBlocks.capture(SPELL_SLOT, record);
        condition.setSlot((int) SkinDataBlocks.captureNumber(slot != null ? SPELL_SLOT : SLOT, record, 0));
        condition.setGearIndex((int) SkinDataBlocks.captureNumber(GEAR_INDEX, record, 0));
        condition.setOperator((int) SkinDataBlocks.captureNumber(OPERATOR, record, 0));
        condition.setValue(SkinDataBlocks.captureNumber(VALUE, record, 0));

        condition.setShowSubmeshes(listItems(record, "SubmeshesToShow"));
        condition.setHideSubmeshes(listItems(record, "SubmeshesToHide"));
        List<PersistentVfx> vfx = new ArrayList<>();
        for (BlockSpan span : BlockScanner.scanTyped(record, VFX_TYPE, 0, record.length())) {
            String body = span.text(record);
            PersistentVfx item = new PersistentVfx(EntryKeys.unquote(SkinDataBlocks.capture(EFFECT_KEY, body)),
                SkinDataBlocks.capture(BONE_NAME, body));
            item.setOwnerOnly(Boolean.parseBoolean(SkinDataBlocks.capture(OWNER_ONLY, body)));
            item.setAttachToCamera(Boolean.parseBoolean(SkinDataBlocks.capture(ATTACH_TO_CAMERA, body)));
            vfx.add(item);
        }
        condition.setVfx(vfx);
        return condition;
    }

    private static OwnerPreset presetFor(String driver, String record) {
        if (driver == null) {
            return null;
        }
        if (OwnerPreset.FLOAT_COMPARISON.getDriverType().equals(driver)) {
            return record.contains(BUFF_COUNTER_DRIVER)
                ? OwnerPreset.BUFF_COUNTER_FLOAT_COMPARISON
                : OwnerPreset.FLOAT_COMPARISON;
        }
        for (OwnerPreset preset : OwnerPreset.values()) {
            if (preset.getDriverType().equals(driver)) {
                return preset;
            }
        }
        return null;
    }

    private static List<String> listItems(String record, String fieldName) {
        List<String> items = new ArrayList<>();
        Optional<BlockSpan> list = BlockScanner.findField(record, fieldName);
        if (list.isEmpty()) {
            return items;
        }
        Matcher m = LIST_ITEM.matcher(list.get().innerText(record));
        while (m.find()) {
            items.add(EntryKeys.unquote(m.group(1)));
        }
        return items;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void requireLiteral(String value) {
        String problem = EntryKeys.literalProblem(value);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
    }

    private static void requireLiterals(List<String> values) {
        if (values != null) {
            for (String value : values) {
                requireLiteral(value);
            }
        }
    }

    private static Pattern field(String regex) {
        return Pattern.compile("\\b" + regex, Pattern.CASE_INSENSITIVE);
    }
}
