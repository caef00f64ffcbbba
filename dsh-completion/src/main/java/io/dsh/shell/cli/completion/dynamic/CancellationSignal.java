package io.dsh.shell.cli.completion.dynamic;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag of one completion request. Set when a newer request supersedes it; external
 * queries poll it and stop their subprocess.
 */
public final class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** A signal that is never cancelled by anyone else. */
  public static CancellationSignal none() {
    return new CancellationSignal();
  }
}
