package com.vfxport.effects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Owner conditions a persistent effect can be gated on.
 */
public enum OwnerPreset {
    IS_ANIMATION_PLAYING("IsAnimationPlaying", "IsAnimationPlayingDynamicMaterialBoolDriver"),
    HAS_BUFF_SCRIPT("HasBuffScript", "HasBuffDynamicMaterialBoolDriver"),
    LEARNED_SPELL("LearnedSpell", "LearnedSpellDynamicMaterialBoolDriver"),
    HAS_GEAR("HasGear", "HasGearDynamicMaterialBoolDriver"),
    FLOAT_COMPARISON("FloatComparison", "FloatComparisonMaterialDriver"),
    BUFF_COUNTER_FLOAT_COMPARISON("BuffCounterFloatComparison", "FloatComparisonMaterialDriver");

    private final String id;
    private final String driverType;

    OwnerPreset(String id, String driverType) {
        this.id = id;
        this.driverType = driverType;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDriverType() {
        return driverType;
    }

    @JsonCreator
    public static OwnerPreset fromId(String id) {
        for (OwnerPreset preset : values()) {
            if (preset.id.equalsIgnoreCase(id) || preset.name().equalsIgnoreCase(id)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown owner condition: " + id);
    }
}
