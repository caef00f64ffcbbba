package io.dsh.shell.cli.completion.dynamic;

import static org.junit.jupiter.api.Assertions.*;

import io.dsh.shell.cli.completion.CompletionSourceException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SystemProcessRunnerTest {

  @TempDir Path dir;

  private SystemProcessRunner runner;

  @BeforeEach
  void setUp() {
    runner = new SystemProcessRunner();
  }

  @Test
  void capturesStandardOutputLines() throws CompletionSourceException {
    List<String> lines =
        runner.run(
            List.of("sh", "-c", "echo one; echo two; echo noise >&2"),
            dir,
            Duration.ofSeconds(5),
            CancellationSignal.none());

    assertEquals(List.of("one", "two"), lines);
  }

  @Test
  void runsInWorkingDirectory() throws CompletionSourceException {
    List<String> lines =
        runner.run(List.of("pwd"), dir, Duration.ofSeconds(5), CancellationSignal.none());

    assertEquals(1, lines.size());
    assertTrue(lines.get(0).endsWith(dir.getFileName().toString()), lines.get(0));
  }

  @Test
  void nonZeroExitFails() {
    assertThrows(
        CompletionSourceException.class,
        () ->
            runner.run(
                List.of("sh", "-c", "exit 3"),
                dir,
                Duration.ofSeconds(5),
                CancellationSignal.none()));
  }

  @Test
  void slowCommandTimesOut() {
    long started = System.nanoTime();

    CompletionSourceException e =
        assertThrows(
            CompletionSourceException.class,
            () ->
                runner.run(
                    List.of("sleep", "10"),
                    dir,
                    Duration.ofMillis(200),
                    CancellationSignal.none()));

    assertTrue(e.getMessage().startsWith("Timed out"), e.getMessage());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 5);
  }

  @Test
  void cancelledSignalPreventsStart() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();

    assertThrows(
        CompletionSourceException.class,
        () -> runner.run(List.of("echo", "x"), dir, Duration.ofSeconds(5), signal));
  }

  @Test
  void missingProgramFails() {
    assertThrows(
        CompletionSourceException.class,
        () ->
            runner.run(
                List.of("definitely-not-a-real-program-dsh"),
                dir,
                Duration.ofSeconds(5),
                CancellationSignal.none()));
  }
}
