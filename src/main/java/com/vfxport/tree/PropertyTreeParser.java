package com.vfxport.tree;

import com.vfxport.materials.ColorParameterClassifier;
import com.vfxport.models.ColorParam;
import com.vfxport.models.Material;
import com.vfxport.models.ResourceMapEntry;
import com.vfxport.models.VfxEmitter;
import com.vfxport.models.VfxSystem;
import com.vfxport.models.VfxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link VfxTree} from ritobin text. Emitter bodies are not
 * materialized here; see {@link #loadEmitter(VfxSystem, String)}.
 */
public final class PropertyTreeParser {

    public static final String EMITTER_TYPE = "VfxEmitterDefinitionData";
    public static final String PARAM_TYPE = "StaticMaterialShaderParamDef";

    private static final Pattern EMITTER_NAME = Pattern.compile(
        "emitterName:\\s*string\\s*=\\s*\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARTICLE_NAME = Pattern.compile("particleName:\\s*string\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern PARTICLE_PATH = Pattern.compile("particlePath:\\s*string\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern NAME_FIELD = Pattern.compile(
        "(?m)^[ \\t]*name:\\s*string\\s*=\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALUE_VEC4 = Pattern.compile(
        "(?m)^[ \\t]*[Vv]alue:\\s*vec4\\s*=\\s*\\{([^}]+)\\}");
    private static final Pattern RESOURCE_ENTRY = Pattern.compile(
        "(?m)^[ \\t]*(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)[ \\t]*=[ \\t]*(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)[ \\t]*\\r?$");

    private PropertyTreeParser() {
    }

    public static VfxTree parse(String text) {
        VfxTree tree = new VfxTree();
        if (text == null || text.isEmpty()) {
            return tree;
        }
        LineIndex lines = new LineIndex(text);
        for (BlockSpan span : BlockScanner.scanEntries(text, 0, text.length(), lines)) {
            switch (span.getKind()) {
                case SYSTEM:
                    tree.addSystem(parseSystem(text, span, lines));
                    break;
                case MATERIAL:
                    tree.addMaterial(parseMaterial(text, span, lines));
                    break;
                case RESOURCE_RESOLVER:
                    tree.setHasResourceResolver(true);
                    tree.getResourceMap().addAll(parseResourceMap(text, span, lines));
                    break;
                case SKIN_DATA:
                    tree.setHasSkinCharacterData(true);
                    break;
                default:
                    break;
            }
        }
        return tree;
    }

    static VfxSystem parseSystem(String text, BlockSpan span, LineIndex lines) {
        VfxSystem system = new VfxSystem();
        String key = EntryKeys.unquote(span.getKey());
        system.setKey(key);
        system.setRawKey(span.getKey());
        system.setName(EntryKeys.displayName(key));
        system.setStartLine(span.getStartLine());
        system.setEndLine(span.getEndLine());
        String content = span.text(text);
        system.setRawContent(content);
        system.setParticleName(firstGroup(PARTICLE_NAME, content));
        system.setParticlePath(firstGroup(PARTICLE_PATH, content));
        for (BlockSpan emitterSpan : BlockScanner.scanTyped(text, EMITTER_TYPE, span.getOpenBrace() + 1, span.getCloseBrace(), lines)) {
            String name = firstGroup(EMITTER_NAME, emitterSpan.text(text));
            system.getEmitters().add(new VfxEmitter(name, key, emitterSpan.getStartLine(), emitterSpan.getEndLine()));
        }
        return system;
    }

    static Material parseMaterial(String text, BlockSpan span, LineIndex lines) {
        Material material = new Material();
        String key = EntryKeys.unquote(span.getKey());
        material.setKey(key);
        material.setStartLine(span.getStartLine());
        material.setEndLine(span.getEndLine());

        List<BlockSpan> paramSpans = BlockScanner.scanTyped(text, PARAM_TYPE, span.getOpenBrace() + 1, span.getCloseBrace(), lines);
        String displaySource = key;
        Matcher nameMatcher = NAME_FIELD.matcher(text);
        nameMatcher.region(span.getOpenBrace() + 1, span.getCloseBrace());
        while (nameMatcher.find()) {
            if (!insideAny(paramSpans, nameMatcher.start())) {
                displaySource = nameMatcher.group(1);
                break;
            }
        }
        material.setName(materialDisplayName(displaySource));

        for (BlockSpan paramSpan : paramSpans) {
            Matcher paramName = NAME_FIELD.matcher(text);
            paramName.region(paramSpan.getOpenBrace() + 1, paramSpan.getCloseBrace());
            Matcher value = VALUE_VEC4.matcher(text);
            value.region(paramSpan.getOpenBrace() + 1, paramSpan.getCloseBrace());
            if (!paramName.find() || !value.find()) {
                continue;
            }
            double[] values = EmitterInspector.parseVector(value.group(1));
            if (values == null || values.length < 4) {
                continue;
            }
            double[] rgba = new double[] {values[0], values[1], values[2], values[3]};
            String name = paramName.group(1);
            material.getParams().add(new ColorParam(name, rgba,
                ColorParameterClassifier.isColorParameter(name, rgba), lines.lineOf(value.start())));
        }
        return material;
    }

    static List<ResourceMapEntry> parseResourceMap(String text, BlockSpan resolver, LineIndex lines) {
        List<ResourceMapEntry> entries = new ArrayList<>();
        Optional<BlockSpan> map = BlockScanner.findField(text, "resourceMap", resolver.getOpenBrace() + 1, resolver.getCloseBrace());
        if (map.isEmpty()) {
            return entries;
        }
        Matcher m = RESOURCE_ENTRY.matcher(text);
        m.region(map.get().getOpenBrace() + 1, map.get().getCloseBrace());
        m.useAnchoringBounds(false);
        while (m.find()) {
            entries.add(new ResourceMapEntry(m.group(1), m.group(2), lines.lineOf(m.start(1))));
        }
        return entries;
    }

    /**
     * Returns the emitter with its block text and attributes filled in,
     * re-hydrating from the system's raw content when not yet loaded.
     */
    public static Optional<VfxEmitter> loadEmitter(VfxSystem system, String emitterName) {
        if (system == null) {
            return Optional.empty();
        }
        VfxEmitter emitter = system.findEmitter(emitterName);
        if (emitter == null) {
            return Optional.empty();
        }
        if (!emitter.isLoaded()) {
            Optional<String> body = EmitterBlocks.extract(system.getRawContent(), emitterName);
            if (body.isEmpty()) {
                return Optional.empty();
            }
            emitter.setContent(body.get());
            emitter.setAttributes(EmitterInspector.inspect(body.get()));
        }
        return Optional.of(emitter);
    }

    public static String emitterName(String emitterText) {
        return firstGroup(EMITTER_NAME, emitterText);
    }

    /** {@code "Characters/Foo/Materials/Glow_Mat"} shows as {@code "Glow"}. */
    static String materialDisplayName(String fullPath) {
        String name = EntryKeys.displayName(fullPath);
        if (name != null && name.endsWith("_Mat")) {
            name = name.substring(0, name.length() - 4);
        }
        return name;
    }

    private static boolean insideAny(List<BlockSpan> spans, int offset) {
        for (BlockSpan span : spans) {
            if (span.contains(offset)) {
                return true;
            }
        }
        return false;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}
