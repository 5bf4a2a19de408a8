package com.vfxport.external;

/**
 * Exit code and combined output of one compiler run.
 */
public final class CompilerResult {

    private final int exitCode;
    private final String output;

    private CompilerResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    public static CompilerResult of(int exitCode, String output) {
        return new CompilerResult(exitCode, output);
    }

    /** Used when the compiler could not be started at all. */
    public static CompilerResult notRun(String reason) {
        return new CompilerResult(-1, reason);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public int getExitCode() { return exitCode; }
    public String getOutput() { return output; }
}
