package com.flamingo.dozor.service.execution;

import com.flamingo.dozor.config.DozorConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the shell command that starts dozor, locally or through the cluster scheduler. */
@Component
@RequiredArgsConstructor
public class CommandLineBuilder {

  private final DozorConfig dozorConfig;

  /** The dozor invocation as one shell command line. */
  public String dozorCommandLine(ExecutionRequest request) {
    DozorConfig.Executor executor = dozorConfig.getExecutor();
    StringBuilder commandLine = new StringBuilder();
    if (request.submit()) {
      String path = executor.getSlurmPath();
      commandLine
          .append("export PATH=")
          .append(path)
          .append(":$PATH")
          .append(";export LD_LIBRARY_PATH=")
          .append(path)
          .append(":$LD_LIBRARY_PATH;")
          .append(path)
          .append('/')
          .append(executor.getSlurmExecutable());
    } else {
      commandLine.append(executor.getExecutable());
    }
    commandLine.append(" -pall");
    if (request.mesh()) {
      commandLine.append(" -mesh");
    }
    if (request.radiationDamage()) {
      commandLine.append(" -rd ").append(ExecutionService.COMMAND_FILE);
    } else {
      commandLine.append(" -p ").append(ExecutionService.COMMAND_FILE);
    }
    return commandLine.toString();
  }

  /** Arguments running {@code commandLine} in a shell, wrapped by the scheduler when submitting. */
  public List<String> processArguments(String commandLine, boolean submit) {
    List<String> arguments = new ArrayList<>();
    if (submit) {
      DozorConfig.Executor executor = dozorConfig.getExecutor();
      arguments.add(executor.getSchedulerCommand());
      if (executor.getSlurmPartition() != null && !executor.getSlurmPartition().isBlank()) {
        arguments.add("--partition=" + executor.getSlurmPartition());
      }
    }
    arguments.add("/bin/bash");
    arguments.add("-c");
    arguments.add(commandLine);
    return arguments;
  }
}
