package com.vfxport.effects;

import com.vfxport.Fixtures;
import com.vfxport.models.VfxSystem;
import com.vfxport.tree.PropertyTreeParser;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChildParticleBuilderTest {

    @Test
    void defaultsDescribeSingleEndlessChild() {
        ChildParticleOptions options = new ChildParticleOptions();
        options.setEmitterName("Child");
        options.setChildSystemKey("Fx_Child");

        assertEquals("VfxEmitterDefinitionData {\n"
            + "    rate: embed = ValueFloat {\n"
            + "        constantValue: f32 = 1\n"
            + "    }\n"
            + "    particleLifetime: embed = ValueFloat {\n"
            + "        constantValue: f32 = 9999\n"
            + "    }\n"
            + "    timeBeforeFirstEmission: f32 = 0\n"
            + "    translationOverride: vec3 = { 0, 0, 0 }\n"
            + "    bindWeight: embed = ValueFloat {\n"
            + "        constantValue: f32 = 1\n"
            + "    }\n"
            + "    childParticleSetDefinition: pointer = VfxChildParticleSetDefinitionData {\n"
            + "        childrenIdentifiers: list[embed] = {\n"
            + "            VfxChildIdentifier {\n"
            + "                effectKey: hash = \"Fx_Child\"\n"
            + "            }\n"
            + "        }\n"
            + "    }\n"
            + "    isSingleParticle: flag = true\n"
            + "    emitterName: string = \"Child\"\n"
            + "}", ChildParticleBuilder.emitterText(options));
    }

    @Test
    void readsBackCustomValues() {
        ChildParticleOptions options = new ChildParticleOptions();
        options.setEmitterName("Orbit");
        options.setChildSystemKey("Characters/Demo/Skins/Skin0/Particles/Orb");
        options.setRate(2.5);
        options.setLifetime(3);
        options.setBindWeight(0.5);
        options.setTimeBeforeFirstEmission(0.25);
        options.setTranslationOverride(new double[] { 1.5, -2, 0 });
        options.setSingleParticle(false);

        String text = ChildParticleBuilder.emitterText(options);
        assertTrue(text.contains("translationOverride: vec3 = { 1.5, -2, 0 }"));
        assertFalse(text.contains("isSingleParticle"));

        ChildParticleOptions read = ChildParticleBuilder.readOptions(text).orElseThrow();
        assertEquals("Orbit", read.getEmitterName());
        assertEquals("Characters/Demo/Skins/Skin0/Particles/Orb", read.getChildSystemKey());
        assertEquals(2.5, read.getRate());
        assertEquals(3, read.getLifetime());
        assertEquals(0.5, read.getBindWeight());
        assertEquals(0.25, read.getTimeBeforeFirstEmission());
        assertArrayEquals(new double[] { 1.5, -2, 0 }, read.getTranslationOverride());
        assertFalse(read.isSingleParticle());
    }

    @Test
    void plainEmittersAreNotChildren() {
        VfxSystem idle = PropertyTreeParser.parse(Fixtures.sampleSkin()).getSystem(Fixtures.IDLE_KEY);
        String glow = PropertyTreeParser.loadEmitter(idle, "Glow").orElseThrow().getContent();

        assertFalse(ChildParticleBuilder.isChildEmitter(glow));
        assertEquals(Optional.empty(), ChildParticleBuilder.readOptions(glow));
        assertFalse(ChildParticleBuilder.isChildEmitter(null));
    }

    @Test
    void rateDoesNotMatchPrefixedFields() {
        String text = "VfxEmitterDefinitionData {\n"
            + "    birthRate: embed = ValueFloat {\n"
            + "        constantValue: f32 = 7\n"
            + "    }\n"
            + "    childParticleSetDefinition: pointer = VfxChildParticleSetDefinitionData {\n"
            + "        childrenIdentifiers: list[embed] = {\n"
            + "            VfxChildIdentifier {\n"
            + "                effectKey: hash = 0xDEADBEEF\n"
            + "            }\n"
            + "        }\n"
            + "    }\n"
            + "    emitterName: string = \"Spawner\"\n"
            + "}";

        ChildParticleOptions read = ChildParticleBuilder.readOptions(text).orElseThrow();

        assertEquals(1, read.getRate());
        assertEquals(9999, read.getLifetime());
        assertEquals("0xDEADBEEF", read.getChildSystemKey());
        assertFalse(read.isSingleParticle());
        assertArrayEquals(new double[] { 0, 0, 0 }, read.getTranslationOverride());
    }
}
