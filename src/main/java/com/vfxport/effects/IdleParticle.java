package com.vfxport.effects;

public class IdleParticle {

    private String effectKey;
    private String boneName;

    public IdleParticle() {
    }

    public IdleParticle(String effectKey, String boneName) {
        this.effectKey = effectKey;
        this.boneName = boneName;
    }

    public String getEffectKey() { return effectKey; }
    public void setEffectKey(String effectKey) { this.effectKey = effectKey; }

    public String getBoneName() { return boneName; }
    public void setBoneName(String boneName) { this.boneName = boneName; }
}
