package com.vfxport.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code StaticMaterialDef} entry with its shader parameters.
 */
public class Material {
    private String key;
    private String name;
    private List<ColorParam> params = new ArrayList<>();
    private int startLine;
    private int endLine;

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<ColorParam> getParams() { return params; }
    public void setParams(List<ColorParam> params) { this.params = params; }

    public int getStartLine() { return startLine; }
    public void setStartLine(int startLine) { this.startLine = startLine; }

    public int getEndLine() { return endLine; }
    public void setEndLine(int endLine) { this.endLine = endLine; }

    public ColorParam findParam(String paramName) {
        for (ColorParam param : params) {
            if (param.getName() != null && param.getName().equals(paramName)) {
                return param;
            }
        }
        return null;
    }
}
