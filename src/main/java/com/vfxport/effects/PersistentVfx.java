package com.vfxport.effects;

/**
 * One effect shown while a persistent condition holds. {@code systemKey},
 * when set, is the system a readable {@code effectKey} should resolve to.
 */
public class PersistentVfx {

    private String effectKey;
    private String systemKey;
    private String boneName;
    private boolean ownerOnly;
    private boolean attachToCamera;

    public PersistentVfx() {
    }

    public PersistentVfx(String effectKey, String boneName) {
        this.effectKey = effectKey;
        this.boneName = boneName;
    }

    public String getEffectKey() { return effectKey; }
    public void setEffectKey(String effectKey) { this.effectKey = effectKey; }

    public String getSystemKey() { return systemKey; }
    public void setSystemKey(String systemKey) { this.systemKey = systemKey; }

    public String getBoneName() { return boneName; }
    public void setBoneName(String boneName) { this.boneName = boneName; }

    public boolean isOwnerOnly() { return ownerOnly; }
    public void setOwnerOnly(boolean ownerOnly) { this.ownerOnly = ownerOnly; }

    public boolean isAttachToCamera() { return attachToCamera; }
    public void setAttachToCamera(boolean attachToCamera) { this.attachToCamera = attachToCamera; }
}
