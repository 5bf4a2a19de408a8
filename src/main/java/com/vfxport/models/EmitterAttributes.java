package com.vfxport.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values pulled out of an emitter body by targeted scans.
 */
public class EmitterAttributes {
    private List<String> textures = new ArrayList<>();
    private Integer blendMode;
    private Map<String, double[]> colors = new LinkedHashMap<>();

    public List<String> getTextures() { return textures; }
    public void setTextures(List<String> textures) { this.textures = textures; }

    public Integer getBlendMode() { return blendMode; }
    public void setBlendMode(Integer blendMode) { this.blendMode = blendMode; }

    public Map<String, double[]> getColors() { return colors; }
    public void setColors(Map<String, double[]> colors) { this.colors = colors; }
}
