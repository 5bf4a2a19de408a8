package com.vfxport.tree;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text templates and rewrites for whole system blocks.
 */
public final class SystemBlocks {

    private static final Pattern HEADER_KEY = Pattern.compile("^([ \\t]*)(\"[^\"\\r\\n]*\"|0x[0-9a-fA-F]+)");
    private static final Pattern PARTICLE_NAME = Pattern.compile("(particleName:\\s*string\\s*=\\s*)\"[^\"]*\"");
    private static final Pattern PARTICLE_PATH = Pattern.compile("(particlePath:\\s*string\\s*=\\s*)\"[^\"]*\"");

    private SystemBlocks() {
    }

    /** Smallest block the game accepts as a system. */
    public static String minimalSystem(String name, String separator) {
        String quoted = "\"" + EntryKeys.unquote(name) + "\"";
        return EntryKeys.format(name) + " = VfxSystemDefinitionData {" + separator
            + TextLines.INDENT_UNIT + EmitterBlocks.EMITTER_LIST_HEADER + "{}" + separator
            + TextLines.INDENT_UNIT + "particleName: string = " + quoted + separator
            + TextLines.INDENT_UNIT + "particlePath: string = " + quoted + separator
            + "}";
    }

    /**
     * Rewrites the header key and every {@code particleName} and
     * {@code particlePath} field of a system block to {@code newName}.
     */
    public static String rename(String systemBlock, String newName) {
        Matcher header = HEADER_KEY.matcher(systemBlock);
        String result = systemBlock;
        if (header.find()) {
            result = header.group(1) + EntryKeys.format(newName) + systemBlock.substring(header.end());
        }
        String replacement = "$1" + Matcher.quoteReplacement("\"" + EntryKeys.unquote(newName) + "\"");
        result = PARTICLE_NAME.matcher(result).replaceAll(replacement);
        result = PARTICLE_PATH.matcher(result).replaceAll(replacement);
        return result;
    }
}
