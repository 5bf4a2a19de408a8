package com.vfxport.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed view of one ritobin text file. Maps keep file order.
 */
public class VfxTree {
    private final Map<String, VfxSystem> systems = new LinkedHashMap<>();
    private final Map<String, Material> materials = new LinkedHashMap<>();
    private List<ResourceMapEntry> resourceMap = new ArrayList<>();
    private boolean hasResourceResolver;
    private boolean hasSkinCharacterData;

    public Map<String, VfxSystem> getSystems() { return systems; }
    public Map<String, Material> getMaterials() { return materials; }

    public List<ResourceMapEntry> getResourceMap() { return resourceMap; }
    public void setResourceMap(List<ResourceMapEntry> resourceMap) { this.resourceMap = resourceMap; }

    public boolean isHasResourceResolver() { return hasResourceResolver; }
    public void setHasResourceResolver(boolean hasResourceResolver) { this.hasResourceResolver = hasResourceResolver; }

    public boolean isHasSkinCharacterData() { return hasSkinCharacterData; }
    public void setHasSkinCharacterData(boolean hasSkinCharacterData) { this.hasSkinCharacterData = hasSkinCharacterData; }

    public VfxSystem getSystem(String key) {
        return systems.get(key);
    }

    public boolean addSystem(VfxSystem system) {
        return systems.putIfAbsent(system.getKey(), system) == null;
    }

    public void addMaterial(Material material) {
        materials.putIfAbsent(material.getKey(), material);
    }

    public int emitterCount() {
        int total = 0;
        for (VfxSystem system : systems.values()) {
            total += system.getEmitters().size();
        }
        return total;
    }

    /** Structural copy; lazily loaded emitter bodies come along. */
    public VfxTree copy() {
        VfxTree copy = new VfxTree();
        for (VfxSystem system : systems.values()) {
            copy.systems.put(system.getKey(), system.copy());
        }
        copy.materials.putAll(materials);
        copy.resourceMap = new ArrayList<>(resourceMap);
        copy.hasResourceResolver = hasResourceResolver;
        copy.hasSkinCharacterData = hasSkinCharacterData;
        return copy;
    }
}
