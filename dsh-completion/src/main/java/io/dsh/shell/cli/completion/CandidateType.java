package io.dsh.shell.cli.completion;

/** Category of a completion candidate. Declaration order is the default tie-break order. */
public enum CandidateType {
  COMMAND,
  SUBCOMMAND,
  SHORT_OPTION,
  LONG_OPTION,
  ARGUMENT,
  EXECUTABLE,
  DIRECTORY,
  FILE,
  HISTORY;

  public int sortOrder() {
    return ordinal();
  }

  /** Whether the candidate names something on disk. */
  public boolean isPath() {
    return this == FILE || this == DIRECTORY || this == EXECUTABLE;
  }
}
