package com.vfxport.tree;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EmitterBlocksTest {

    private static final String TWO_EMITTERS = "\"Fx\" = VfxSystemDefinitionData {\n"
        + "    complexEmitterDefinitionData: list[pointer] = {\n"
        + "        VfxEmitterDefinitionData {\n"
        + "            emitterName: string = \"One\"\n"
        + "        }\n"
        + "        VfxEmitterDefinitionData {\n"
        + "            emitterName: string = \"Two\"\n"
        + "        }\n"
        + "    }\n"
        + "    particleName: string = \"Fx\"\n"
        + "}";

    private static final String NEW_EMITTER = "VfxEmitterDefinitionData {\n    emitterName: string = \"New\"\n}";

    @Test
    void findsEmittersByName() {
        assertEquals(2, EmitterBlocks.emitterSpans(TWO_EMITTERS).size());
        Optional<String> two = EmitterBlocks.extract(TWO_EMITTERS, "Two");
        assertTrue(two.isPresent());
        assertTrue(two.get().contains("\"Two\""));
        assertTrue(EmitterBlocks.extract(TWO_EMITTERS, "Three").isEmpty());
    }

    @Test
    void removeLeavesSiblingsUntouched() {
        String result = EmitterBlocks.remove(TWO_EMITTERS, "One").orElseThrow();
        assertEquals("\"Fx\" = VfxSystemDefinitionData {\n"
            + "    complexEmitterDefinitionData: list[pointer] = {\n"
            + "        VfxEmitterDefinitionData {\n"
            + "            emitterName: string = \"Two\"\n"
            + "        }\n"
            + "    }\n"
            + "    particleName: string = \"Fx\"\n"
            + "}", result);
    }

    @Test
    void removingOnlyEmitterLeavesEmptyList() {
        String single = EmitterBlocks.remove(TWO_EMITTERS, "One").orElseThrow();
        String result = EmitterBlocks.remove(single, "Two").orElseThrow();
        assertEquals("\"Fx\" = VfxSystemDefinitionData {\n"
            + "    complexEmitterDefinitionData: list[pointer] = {}\n"
            + "    particleName: string = \"Fx\"\n"
            + "}", result);
    }

    @Test
    void removeAllEmptiesList() {
        String result = EmitterBlocks.removeAll(TWO_EMITTERS);
        assertTrue(result.contains("    complexEmitterDefinitionData: list[pointer] = {}\n"));
        assertTrue(EmitterBlocks.emitterSpans(result).isEmpty());
    }

    @Test
    void removeUnknownEmitterIsEmpty() {
        assertTrue(EmitterBlocks.remove(TWO_EMITTERS, "Missing").isEmpty());
    }

    @Test
    void appendExpandsEmptyList() {
        String system = SystemBlocks.minimalSystem("Fx", "\n");
        String result = EmitterBlocks.append(system, NEW_EMITTER);
        assertTrue(result.contains("    complexEmitterDefinitionData: list[pointer] = {\n"
            + "        VfxEmitterDefinitionData {\n"
            + "            emitterName: string = \"New\"\n"
            + "        }\n"
            + "    }\n"));
        assertEquals(1, EmitterBlocks.emitterSpans(result).size());
    }

    @Test
    void appendGoesAfterExistingEmitters() {
        String result = EmitterBlocks.append(TWO_EMITTERS, NEW_EMITTER);
        assertEquals(3, EmitterBlocks.emitterSpans(result).size());
        assertTrue(result.indexOf("\"Two\"") < result.indexOf("\"New\""));
        assertTrue(result.contains("        VfxEmitterDefinitionData {\n            emitterName: string = \"New\"\n        }\n    }"));
    }

    @Test
    void appendCreatesMissingList() {
        String system = "\"Fx\" = VfxSystemDefinitionData {\n    particleName: string = \"Fx\"\n}";
        String result = EmitterBlocks.append(system, NEW_EMITTER);
        assertEquals("\"Fx\" = VfxSystemDefinitionData {\n"
            + "    complexEmitterDefinitionData: list[pointer] = {\n"
            + "        VfxEmitterDefinitionData {\n"
            + "            emitterName: string = \"New\"\n"
            + "        }\n"
            + "    }\n"
            + "    particleName: string = \"Fx\"\n"
            + "}", result);
    }

    @Test
    void renameTouchesOnlyTheNamedEmitter() {
        String result = EmitterBlocks.rename(TWO_EMITTERS, "One", "Uno").orElseThrow();
        assertEquals(TWO_EMITTERS.replace("\"One\"", "\"Uno\""), result);
        assertTrue(EmitterBlocks.rename(TWO_EMITTERS, "Missing", "X").isEmpty());
    }
}
