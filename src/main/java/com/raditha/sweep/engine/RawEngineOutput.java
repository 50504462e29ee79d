package com.raditha.sweep.engine;

/**
 * What one engine process left behind.
 *
 * @param stdout   standard output text
 * @param stderr   standard error text
 * @param exitCode process exit status
 */
public record RawEngineOutput(String stdout, String stderr, int exitCode) {
    public RawEngineOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
