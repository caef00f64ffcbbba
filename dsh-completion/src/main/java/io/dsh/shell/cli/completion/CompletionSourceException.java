package io.dsh.shell.cli.completion;

/**
 * A source of candidates failed: an external query timed out or exited abnormally, or a system
 * listing could not be read.
 */
public final class CompletionSourceException extends Exception {
  public CompletionSourceException(String message) {
    super(message);
  }

  public CompletionSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
