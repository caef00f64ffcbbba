package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * External queries of one completion request. Output is cached per working directory and argv
 * across requests; the timeout and cancellation signal belong to this request.
 */
public final class CommandQuery {

  /** Cache key: where and what was run. */
  public record Key(Path workingDirectory, List<String> argv) {}

  private final ProcessRunner runner;
  private final CompletionCache<Key, List<String>> cache;
  private final Path workingDirectory;
  private final Duration timeout;
  private final CancellationSignal signal;

  public CommandQuery(
      ProcessRunner runner,
      CompletionCache<Key, List<String>> cache,
      Path workingDirectory,
      Duration timeout,
      CancellationSignal signal) {
    this.runner = runner;
    this.cache = cache;
    this.workingDirectory = workingDirectory;
    this.timeout = timeout;
    this.signal = signal;
  }

  /**
   * Output lines of {@code argv}, from the cache when a fresh entry exists.
   *
   * @param argv program and arguments
   * @return standard output lines
   * @throws CompletionSourceException if the command fails, times out or the request is cancelled
   */
  public List<String> lines(String... argv) throws CompletionSourceException {
    List<String> command = List.of(argv);
    return cache.getOrLoad(
        new Key(workingDirectory, command),
        () -> List.copyOf(runner.run(command, workingDirectory, timeout, signal)));
  }

  public boolean isCancelled() {
    return signal.isCancelled();
  }
}
