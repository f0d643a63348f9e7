package com.flamingo.dozor.service.execution;

import com.flamingo.dozor.domain.ExecutionResult;
import com.flamingo.dozor.exception.ExecutionFailureException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs programs as child processes of this JVM. Standard output and error are merged into a log
 * file in the working directory, which is read back as the captured output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalProcessExecutionService implements ExecutionService {

  private final CommandLineBuilder commandLineBuilder;

  @Override
  @Timed(value = "dozor.execution", description = "Time spent running dozor")
  public ExecutionResult runDozor(ExecutionRequest request) {
    Path workingDirectory = request.workingDirectory();
    try {
      Files.createDirectories(workingDirectory);
      Files.writeString(
          workingDirectory.resolve(COMMAND_FILE), request.commandFile(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ExecutionFailureException(
          workingDirectory, "Cannot write " + COMMAND_FILE + " in " + workingDirectory, e);
    }
    String commandLine = commandLineBuilder.dozorCommandLine(request);
    List<String> arguments = commandLineBuilder.processArguments(commandLine, request.submit());
    return runCommand(arguments, workingDirectory, LOG_FILE);
  }

  @Override
  public ExecutionResult runCommand(
      List<String> command, Path workingDirectory, String logFileName) {
    Path logFile = workingDirectory.resolve(logFileName);
    log.info("Running {} in {}", String.join(" ", command), workingDirectory);

    int exitCode;
    try {
      Files.createDirectories(workingDirectory);
      Process process =
          new ProcessBuilder(command)
              .directory(workingDirectory.toFile())
              .redirectErrorStream(true)
              .redirectOutput(logFile.toFile())
              .start();
      exitCode = process.waitFor();
    } catch (IOException e) {
      log.error("Could not start {}: {}", command.get(0), e.getMessage());
      return new ExecutionResult(false, "", -1, workingDirectory);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExecutionFailureException(workingDirectory, "Interrupted while running dozor", e);
    }

    String output;
    try {
      output = readLog(logFile);
    } catch (IOException e) {
      log.error("Could not read log file {}: {}", logFile, e.getMessage());
      return new ExecutionResult(false, "", exitCode, workingDirectory);
    }
    if (exitCode != 0) {
      log.warn("{} exited with code {} in {}", command.get(0), exitCode, workingDirectory);
    } else {
      log.debug("{} finished in {}", command.get(0), workingDirectory);
    }
    return new ExecutionResult(exitCode == 0, output, exitCode, workingDirectory);
  }

  /** Malformed UTF-8 sequences become U+FFFD; the rest of the log stays readable. */
  static String readLog(Path logFile) throws IOException {
    return new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
  }
}
