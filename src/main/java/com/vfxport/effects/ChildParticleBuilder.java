package com.vfxport.effects;

import com.vfxport.tree.EmitterInspector;
import com.vfxport.tree.EntryKeys;
import com.vfxport.tree.PropertyTreeParser;
import com.vfxport.tree.TextLines;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Writes and reads back child-particle emitters: emitters whose
 * {@code childParticleSetDefinition} points at another system.
 */
public final class ChildParticleBuilder {

    public static final String CHILD_SET_FIELD = "childParticleSetDefinition";

    private static final String NUMBER = "[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?";

    private static final Pattern CHILD_SET = Pattern.compile(
        CHILD_SET_FIELD + "\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHILD_KEY = Pattern.compile(
        "VfxChildIdentifier\\s*\\{[^}]*?effectKey:\\s*hash\\s*=\\s*(\"[^\"]*\"|0x[0-9a-fA-F]+)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern RATE = valueFloat("rate");
    private static final Pattern LIFETIME = valueFloat("particleLifetime");
    private static final Pattern BIND_WEIGHT = valueFloat("bindWeight");
    private static final Pattern FIRST_EMISSION = Pattern.compile(
        "timeBeforeFirstEmission:\\s*f32\\s*=\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSLATION = Pattern.compile(
        "translationOverride:\\s*vec3\\s*=\\s*\\{([^}]*)\\}", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE = Pattern.compile(
        "isSingleParticle:\\s*flag\\s*=\\s*(true|false)", Pattern.CASE_INSENSITIVE);

    private ChildParticleBuilder() {
    }

    public static String emitterText(ChildParticleOptions options) {
        double[] t = options.getTranslationOverride() == null ? new double[3] : options.getTranslationOverride();
        BlockWriter w = new BlockWriter().open(PropertyTreeParser.EMITTER_TYPE);
        w.open("rate: embed = ValueFloat").f32("constantValue", options.getRate()).close();
        w.open("particleLifetime: embed = ValueFloat").f32("constantValue", options.getLifetime()).close();
        w.f32("timeBeforeFirstEmission", options.getTimeBeforeFirstEmission());
        w.line("translationOverride: vec3 = { " + TextLines.formatNumber(component(t, 0)) + ", "
            + TextLines.formatNumber(component(t, 1)) + ", " + TextLines.formatNumber(component(t, 2)) + " }");
        w.open("bindWeight: embed = ValueFloat").f32("constantValue", options.getBindWeight()).close();
        w.open(CHILD_SET_FIELD + ": pointer = VfxChildParticleSetDefinitionData")
            .open("childrenIdentifiers: list[embed] =")
            .open("VfxChildIdentifier")
            .hash("effectKey", options.getChildSystemKey())
            .close()
            .close()
            .close();
        if (options.isSingleParticle()) {
            w.line("isSingleParticle: flag = true");
        }
        w.string("emitterName", options.getEmitterName());
        return w.close().toString();
    }

    public static boolean isChildEmitter(String emitterText) {
        return emitterText != null && CHILD_SET.matcher(emitterText).find();
    }

    /**
     * Reads the options an existing child emitter was built with. Fields the
     * emitter does not carry keep their defaults.
     */
    public static Optional<ChildParticleOptions> readOptions(String emitterText) {
        if (!isChildEmitter(emitterText)) {
            return Optional.empty();
        }
        ChildParticleOptions options = new ChildParticleOptions();
        options.setEmitterName(PropertyTreeParser.emitterName(emitterText));
        options.setChildSystemKey(EntryKeys.unquote(SkinDataBlocks.capture(CHILD_KEY, emitterText)));
        options.setRate(SkinDataBlocks.captureNumber(RATE, emitterText, options.getRate()));
        options.setLifetime(SkinDataBlocks.captureNumber(LIFETIME, emitterText, options.getLifetime()));
        options.setBindWeight(SkinDataBlocks.captureNumber(BIND_WEIGHT, emitterText, options.getBindWeight()));
        options.setTimeBeforeFirstEmission(
            SkinDataBlocks.captureNumber(FIRST_EMISSION, emitterText, options.getTimeBeforeFirstEmission()));
        String translation = SkinDataBlocks.capture(TRANSLATION, emitterText);
        if (translation != null) {
            double[] parsed = EmitterInspector.parseVector(translation);
            if (parsed != null && parsed.length == 3) {
                options.setTranslationOverride(parsed);
            }
        }
        String single = SkinDataBlocks.capture(SINGLE, emitterText);
        options.setSingleParticle(single != null && Boolean.parseBoolean(single));
        return Optional.of(options);
    }

    private static double component(double[] values, int index) {
        return index < values.length ? values[index] : 0;
    }

    private static Pattern valueFloat(String field) {
        return Pattern.compile("\\b" + field + ":\\s*embed\\s*=\\s*ValueFloat\\s*\\{\\s*constantValue:\\s*f32\\s*=\\s*("
            + NUMBER + ")", Pattern.CASE_INSENSITIVE);
    }
}
