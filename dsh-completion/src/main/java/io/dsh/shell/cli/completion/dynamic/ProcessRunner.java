package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CompletionSourceException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** Runs an external command and returns its standard output. */
public interface ProcessRunner {

  /**
   * Runs {@code argv} and waits for it to exit.
   *
   * @param argv program and arguments
   * @param workingDirectory directory to run in
   * @param timeout hard limit; the process is killed when it is exceeded
   * @param signal checked while waiting; the process is killed once it is set
   * @return standard output lines
   * @throws CompletionSourceException if the process cannot start, times out, is cancelled or
   *     exits with a non-zero status
   */
  List<String> run(
      List<String> argv, Path workingDirectory, Duration timeout, CancellationSignal signal)
      throws CompletionSourceException;
}
