package com.flamingo.dozor.service.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.ExecutionResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("LocalProcessExecutionService Tests")
class LocalProcessExecutionServiceTest {

  @TempDir Path workingDirectory;

  private DozorConfig config;
  private LocalProcessExecutionService service;

  @BeforeEach
  void setUp() {
    config = new DozorConfig();
    service = new LocalProcessExecutionService(new CommandLineBuilder(config));
  }

  @Test
  @DisplayName("Should capture merged output in the log file")
  void shouldCaptureOutput() throws IOException {
    ExecutionResult result =
        service.runCommand(
            List.of("/bin/sh", "-c", "echo out; echo err 1>&2"), workingDirectory, "test.log");

    assertThat(result.success()).isTrue();
    assertThat(result.exitCode()).isZero();
    assertThat(result.output()).contains("out").contains("err");
    assertThat(Files.readString(workingDirectory.resolve("test.log"))).isEqualTo(result.output());
  }

  @Test
  @DisplayName("Should keep output that contains bytes which are not UTF-8")
  void shouldReadLogWithInvalidBytes() {
    ExecutionResult result =
        service.runCommand(
            List.of("/bin/sh", "-c", "printf 'banner \\351\\n    5 | 12 1.0\\n'"),
            workingDirectory,
            "test.log");

    assertThat(result.success()).isTrue();
    assertThat(result.output()).startsWith("banner \uFFFD\n").contains("    5 | 12 1.0");
  }

  @Test
  @DisplayName("Should report a run whose log cannot be read as failure")
  void shouldReportUnreadableLog() {
    ExecutionResult result =
        service.runCommand(
            List.of("/bin/sh", "-c", "echo lost; rm test.log"), workingDirectory, "test.log");

    assertThat(result.success()).isFalse();
    assertThat(result.exitCode()).isZero();
    assertThat(result.output()).isEmpty();
  }

  @Test
  @DisplayName("Should report a non-zero exit code as failure")
  void shouldReportFailure() {
    ExecutionResult result =
        service.runCommand(List.of("/bin/sh", "-c", "exit 3"), workingDirectory, "test.log");

    assertThat(result.success()).isFalse();
    assertThat(result.exitCode()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should report a program that cannot be started")
  void shouldReportUnstartableProgram() {
    ExecutionResult result =
        service.runCommand(
            List.of("/nonexistent/dozor-binary"), workingDirectory, "test.log");

    assertThat(result.success()).isFalse();
    assertThat(result.exitCode()).isEqualTo(-1);
  }

  @Test
  @DisplayName("Should write the command file before running dozor")
  void shouldWriteCommandFile() throws IOException {
    config.getExecutor().setExecutable("true");
    Path batchDirectory = workingDirectory.resolve("0001_0005");

    ExecutionResult result =
        service.runDozor(new ExecutionRequest("!\nend\n", batchDirectory, false, false, false));

    assertThat(result.success()).isTrue();
    assertThat(Files.readString(batchDirectory.resolve(ExecutionService.COMMAND_FILE)))
        .isEqualTo("!\nend\n");
    assertThat(batchDirectory.resolve(ExecutionService.LOG_FILE)).exists();
  }
}
