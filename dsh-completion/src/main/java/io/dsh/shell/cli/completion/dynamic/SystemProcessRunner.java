package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CompletionSourceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Output goes to a temporary file so the
 * child never blocks on a full pipe; stderr is discarded.
 */
public final class SystemProcessRunner implements ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);

  private static final long POLL_MILLIS = 25;

  @Override
  public List<String> run(
      List<String> argv, Path workingDirectory, Duration timeout, CancellationSignal signal)
      throws CompletionSourceException {
    if (signal.isCancelled()) {
      throw new CompletionSourceException("Cancelled before start: " + argv);
    }

    Path output = null;
    Process process = null;
    try {
      output = Files.createTempFile("dsh-completion-", ".out");
      ProcessBuilder builder =
          new ProcessBuilder(argv)
              .redirectOutput(output.toFile())
              .redirectError(ProcessBuilder.Redirect.DISCARD);
      if (workingDirectory != null && Files.isDirectory(workingDirectory)) {
        builder.directory(workingDirectory.toFile());
      }

      long started = System.nanoTime();
      process = builder.start();
      process.getOutputStream().close();

      long deadline = started + timeout.toNanos();
      while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (signal.isCancelled()) {
          throw new CompletionSourceException("Cancelled: " + argv);
        }
        if (System.nanoTime() - deadline >= 0) {
          throw new CompletionSourceException(
              "Timed out after " + timeout.toMillis() + "ms: " + argv);
        }
      }

      int exit = process.exitValue();
      if (exit != 0) {
        throw new CompletionSourceException(argv.get(0) + " exited with status " + exit);
      }
      log.debug(
          "{} finished in {}ms", argv, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
      return text.lines().collect(Collectors.toList());
    } catch (IOException e) {
      throw new CompletionSourceException("Failed to run " + argv + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CompletionSourceException("Interrupted while running " + argv, e);
    } finally {
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      if (output != null) {
        deleteQuietly(output);
      }
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not delete {}: {}", file, e.getMessage());
    }
  }
}
