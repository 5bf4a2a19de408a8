package com.vfxport.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code VfxSystemDefinitionData} entry.
 */
public class VfxSystem {
    private String key;
    private String rawKey;
    private String name;
    private String particleName;
    private String particlePath;
    private List<VfxEmitter> emitters = new ArrayList<>();
    private String rawContent;
    private int startLine;
    private int endLine;

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    /** Key exactly as written in the file, quotes included. */
    public String getRawKey() { return rawKey; }
    public void setRawKey(String rawKey) { this.rawKey = rawKey; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getParticleName() { return particleName; }
    public void setParticleName(String particleName) { this.particleName = particleName; }

    public String getParticlePath() { return particlePath; }
    public void setParticlePath(String particlePath) { this.particlePath = particlePath; }

    public List<VfxEmitter> getEmitters() { return emitters; }
    public void setEmitters(List<VfxEmitter> emitters) { this.emitters = emitters; }

    @JsonIgnore
    public String getRawContent() { return rawContent; }
    public void setRawContent(String rawContent) { this.rawContent = rawContent; }

    public int getStartLine() { return startLine; }
    public void setStartLine(int startLine) { this.startLine = startLine; }

    public int getEndLine() { return endLine; }
    public void setEndLine(int endLine) { this.endLine = endLine; }

    public VfxEmitter findEmitter(String emitterName) {
        for (VfxEmitter emitter : emitters) {
            if (emitter.getName() != null && emitter.getName().equals(emitterName)) {
                return emitter;
            }
        }
        return null;
    }

    public List<String> emitterNames() {
        List<String> names = new ArrayList<>();
        for (VfxEmitter emitter : emitters) {
            if (emitter.getName() != null) {
                names.add(emitter.getName());
            }
        }
        return names;
    }

    public VfxSystem copy() {
        VfxSystem copy = new VfxSystem();
        copy.key = key;
        copy.rawKey = rawKey;
        copy.name = name;
        copy.particleName = particleName;
        copy.particlePath = particlePath;
        copy.rawContent = rawContent;
        copy.startLine = startLine;
        copy.endLine = endLine;
        for (VfxEmitter emitter : emitters) {
            copy.emitters.add(emitter.copy());
        }
        return copy;
    }
}
