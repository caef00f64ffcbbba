package io.dsh.shell.cli.completion;

import java.util.List;

/** Read-only view of previously entered command lines. */
@FunctionalInterface
public interface CommandHistory {

  /**
   * Returns past command lines.
   *
   * @return entries, oldest first and most recent last
   */
  List<String> entries();

  static CommandHistory empty() {
    return List::of;
  }

  static CommandHistory of(List<String> entries) {
    List<String> copy = List.copyOf(entries);
    return () -> copy;
  }
}
