package com.vfxport.external;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssetReferencesTest {

    @Test
    void findsAssetAndDataPathsOnly() {
        String block = "VfxEmitterDefinitionData {\n"
            + "    texture: string = \"ASSETS/Characters/Demo/glow.dds\"\n"
            + "    mesh: string = \"DATA\\Characters\\Demo\\orb.scb\"\n"
            + "    emitterName: string = \"Glow\"\n"
            + "    particlePath: string = \"Characters/Demo/Skins/Skin0/Particles/Fx\"\n"
            + "    folder: string = \"assets/characters\"\n"
            + "    texture: string = \"ASSETS/Characters/Demo/glow.dds\"\n"
            + "}";

        Set<String> found = AssetReferences.find(block);

        assertEquals(List.of("ASSETS/Characters/Demo/glow.dds", "DATA/Characters/Demo/orb.scb"), List.copyOf(found));
    }

    @Test
    void nullTextHasNoReferences() {
        assertTrue(AssetReferences.find(null).isEmpty());
    }
}
