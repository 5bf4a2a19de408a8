package com.vfxport.effects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code PersistentEffectConditionData} record: an owner condition plus what
 * to show while it holds. Which of the preset fields matter depends on the
 * preset; the rest are ignored when writing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersistentCondition {

    private OwnerPreset preset = OwnerPreset.IS_ANIMATION_PLAYING;
    private String driverType;
    private String animationName = "Spell4";
    private String spellName;
    private int slot;
    private int gearIndex;
    private int operator;
    private double value;
    private double delayOn;
    private double delayOff;
    private List<String> showSubmeshes = new ArrayList<>();
    private List<String> hideSubmeshes = new ArrayList<>();
    private List<PersistentVfx> vfx = new ArrayList<>();

    public OwnerPreset getPreset() { return preset; }
    public void setPreset(OwnerPreset preset) { this.preset = preset; }

    /** Owner-condition type found when reading a record back. */
    public String getDriverType() { return driverType; }
    public void setDriverType(String driverType) { this.driverType = driverType; }

    public String getAnimationName() { return animationName; }
    public void setAnimationName(String animationName) { this.animationName = animationName; }

    public String getSpellName() { return spellName; }
    public void setSpellName(String spellName) { this.spellName = spellName; }

    public int getSlot() { return slot; }
    public void setSlot(int slot) { this.slot = slot; }

    public int getGearIndex() { return gearIndex; }
    public void setGearIndex(int gearIndex) { this.gearIndex = gearIndex; }

    public int getOperator() { return operator; }
    public void setOperator(int operator) { this.operator = operator; }

    public double getValue() { return value; }
    public void setValue(double value) { this.value = value; }

    public double getDelayOn() { return delayOn; }
    public void setDelayOn(double delayOn) { this.delayOn = delayOn; }

    public double getDelayOff() { return delayOff; }
    public void setDelayOff(double delayOff) { this.delayOff = delayOff; }

    public List<String> getShowSubmeshes() { return showSubmeshes; }
    public void setShowSubmeshes(List<String> showSubmeshes) { this.showSubmeshes = showSubmeshes; }

    public List<String> getHideSubmeshes() { return hideSubmeshes; }
    public void setHideSubmeshes(List<String> hideSubmeshes) { this.hideSubmeshes = hideSubmeshes; }

    public List<PersistentVfx> getVfx() { return vfx; }
    public void setVfx(List<PersistentVfx> vfx) { this.vfx = vfx; }

    public boolean isDelayed() {
        return delayOn != 0 || delayOff != 0;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (vfx == null || vfx.isEmpty())
            && (showSubmeshes == null || showSubmeshes.isEmpty())
            && (hideSubmeshes == null || hideSubmeshes.isEmpty());
    }
}
