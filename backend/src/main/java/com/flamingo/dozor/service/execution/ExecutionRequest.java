package com.flamingo.dozor.service.execution;

import java.nio.file.Path;

/**
 * One dozor invocation.
 *
 * @param commandFile contents of {@code dozor.dat}
 * @param workingDirectory directory the command file and all outputs are written to
 * @param submit run through the cluster scheduler
 * @param mesh run the mesh analysis ({@code -mesh})
 * @param radiationDamage run the radiation damage analysis ({@code -rd})
 */
public record ExecutionRequest(
    String commandFile,
    Path workingDirectory,
    boolean submit,
    boolean mesh,
    boolean radiationDamage) {}
