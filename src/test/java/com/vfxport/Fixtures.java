package com.vfxport;

import com.vfxport.session.EditSession;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Shared test data: the sample skin file and sessions built from text.
 */
public final class Fixtures {

    public static final String SKIN_KEY = "Characters/Demo/Skins/Skin0";
    public static final String IDLE_KEY = "Characters/Demo/Skins/Skin0/Particles/Demo_Idle";
    public static final String CAST_KEY = "Characters/Demo/Skins/Skin0/Particles/Demo_Q_Cast";
    public static final String MATERIAL_KEY = "Characters/Demo/Skins/Skin0/Materials/Glow_Mat";
    public static final String GLOW_TEXTURE = "ASSETS/Characters/Demo/Skins/Base/Particles/glow.dds";

    private Fixtures() {
    }

    public static String sampleSkin() {
        return read("fixtures/sample_skin.py");
    }

    public static String read(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static EditSession target(String text) {
        return new EditSession(EditSession.Role.TARGET, Path.of("target", "skin0.py"),
            Path.of("target", "skin0.py"), Path.of("target", "skin0.bin"), text, 10);
    }

    public static EditSession donor(String text) {
        return new EditSession(EditSession.Role.DONOR, Path.of("donor", "skin0.py"),
            Path.of("donor", "skin0.py"), Path.of("donor", "skin0.bin"), text, 10);
    }

    /** A keyed system block at top level with the given emitter names. */
    public static String system(String key, String... emitterNames) {
        StringBuilder sb = new StringBuilder();
        sb.append("    \"").append(key).append("\" = VfxSystemDefinitionData {\n");
        if (emitterNames.length == 0) {
            sb.append("        complexEmitterDefinitionData: list[pointer] = {}\n");
        } else {
            sb.append("        complexEmitterDefinitionData: list[pointer] = {\n");
            for (String name : emitterNames) {
                sb.append("            VfxEmitterDefinitionData {\n")
                    .append("                emitterName: string = \"").append(name).append("\"\n")
                    .append("            }\n");
            }
            sb.append("        }\n");
        }
        sb.append("        particleName: string = \"").append(key).append("\"\n");
        sb.append("    }\n");
        return sb.toString();
    }

    /** Wraps blocks in an {@code entries} map. */
    public static String file(String... blocks) {
        StringBuilder sb = new StringBuilder("#PROP_text\nentries: map[hash,embed] = {\n");
        for (String block : blocks) {
            sb.append(block);
        }
        return sb.append("}\n").toString();
    }

    public static String resolver(String... keyValues) {
        StringBuilder sb = new StringBuilder();
        sb.append("    \"Res\" = ResourceResolver {\n");
        sb.append("        resourceMap: map[hash,link] = {\n");
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            sb.append("            \"").append(keyValues[i]).append("\" = \"").append(keyValues[i + 1]).append("\"\n");
        }
        sb.append("        }\n");
        sb.append("    }\n");
        return sb.toString();
    }
}
