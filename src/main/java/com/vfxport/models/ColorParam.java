package com.vfxport.models;

public class ColorParam {
    private String name;
    private double[] value;
    private boolean color;
    private int valueLine;

    public ColorParam() {
    }

    public ColorParam(String name, double[] value, boolean color, int valueLine) {
        this.name = name;
        this.value = value;
        this.color = color;
        this.valueLine = valueLine;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public double[] getValue() { return value; }
    public void setValue(double[] value) { this.value = value; }

    public boolean isColor() { return color; }
    public void setColor(boolean color) { this.color = color; }

    /** 1-based line holding the {@code value: vec4} assignment. */
    public int getValueLine() { return valueLine; }
    public void setValueLine(int valueLine) { this.valueLine = valueLine; }
}
