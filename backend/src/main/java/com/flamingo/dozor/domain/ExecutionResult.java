package com.flamingo.dozor.domain;

import java.nio.file.Path;

/**
 * Outcome of one external program run.
 *
 * @param success whether the program reported success
 * @param output captured standard output and error
 * @param exitCode process exit code, or -1 if the process could not be started
 * @param workingDirectory directory the program ran in
 */
public record ExecutionResult(
    boolean success, String output, int exitCode, Path workingDirectory) {}
