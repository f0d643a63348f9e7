package com.flamingo.dozor.service.execution;

import com.flamingo.dozor.domain.ExecutionResult;
import java.nio.file.Path;
import java.util.List;

/** Runs external programs in a working directory and captures their output. */
public interface ExecutionService {

  String COMMAND_FILE = "dozor.dat";
  String LOG_FILE = "dozor.log";

  /**
   * Writes the command file and runs dozor on it. Blocks until the process exits.
   *
   * @return captured output and exit status; an unsuccessful result rather than an exception when
   *     the process fails
   * @throws com.flamingo.dozor.exception.ExecutionFailureException if the working directory or
   *     the command file cannot be written
   */
  ExecutionResult runDozor(ExecutionRequest request);

  /** Runs an arbitrary command, capturing its merged output to {@code logFileName}. */
  ExecutionResult runCommand(List<String> command, Path workingDirectory, String logFileName);
}
