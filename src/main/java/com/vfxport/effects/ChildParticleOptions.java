package com.vfxport.effects;

import java.util.Arrays;

/**
 * Settings for an emitter that spawns another system as its particle.
 * Defaults describe a single, effectively endless child.
 */
public class ChildParticleOptions {

    private String emitterName;
    private String childSystemKey;
    private double rate = 1;
    private double lifetime = 9999;
    private double bindWeight = 1;
    private double timeBeforeFirstEmission = 0;
    private double[] translationOverride = new double[] { 0, 0, 0 };
    private boolean singleParticle = true;

    public String getEmitterName() { return emitterName; }
    public void setEmitterName(String emitterName) { this.emitterName = emitterName; }

    public String getChildSystemKey() { return childSystemKey; }
    public void setChildSystemKey(String childSystemKey) { this.childSystemKey = childSystemKey; }

    public double getRate() { return rate; }
    public void setRate(double rate) { this.rate = rate; }

    public double getLifetime() { return lifetime; }
    public void setLifetime(double lifetime) { this.lifetime = lifetime; }

    public double getBindWeight() { return bindWeight; }
    public void setBindWeight(double bindWeight) { this.bindWeight = bindWeight; }

    public double getTimeBeforeFirstEmission() { return timeBeforeFirstEmission; }
    public void setTimeBeforeFirstEmission(double timeBeforeFirstEmission) {
        this.timeBeforeFirstEmission = timeBeforeFirstEmission;
    }

    public double[] getTranslationOverride() { return translationOverride; }
    public void setTranslationOverride(double[] translationOverride) { this.translationOverride = translationOverride; }

    public boolean isSingleParticle() { return singleParticle; }
    public void setSingleParticle(boolean singleParticle) { this.singleParticle = singleParticle; }

    @Override
    public String toString() {
        return "ChildParticleOptions{" + emitterName + " -> " + childSystemKey + ", rate=" + rate
            + ", lifetime=" + lifetime + ", translation=" + Arrays.toString(translationOverride) + "}";
    }
}
