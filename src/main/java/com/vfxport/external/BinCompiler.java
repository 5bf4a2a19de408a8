package com.vfxport.external;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converter between the binary property format and its text form.
 */
public interface BinCompiler {

    CompilerResult toText(Path binFile, Path textFile) throws IOException;

    CompilerResult toBinary(Path textFile, Path binFile) throws IOException;

    boolean isConfigured();
}
