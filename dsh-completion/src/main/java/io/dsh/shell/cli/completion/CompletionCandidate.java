package io.dsh.shell.cli.completion;

import java.util.Objects;

/**
 * One proposed completion.
 *
 * @param text the replacement text for the current token
 * @param description help text shown next to the candidate, may be null
 * @param type category tag
 * @param priority higher sorts first
 */
public record CompletionCandidate(
    String text, String description, CandidateType type, int priority) {

  public static final int PRIORITY_HIGH = 100;
  public static final int PRIORITY_NORMAL = 50;
  public static final int PRIORITY_LOW = 10;

  public CompletionCandidate {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(type, "type");
  }

  public static CompletionCandidate of(String text, String description, CandidateType type) {
    return new CompletionCandidate(text, description, type, defaultPriority(type));
  }

  public static CompletionCandidate of(String text, CandidateType type) {
    return of(text, null, type);
  }

  /** Same candidate with a different priority. */
  public CompletionCandidate withPriority(int newPriority) {
    return new CompletionCandidate(text, description, type, newPriority);
  }

  /** Final path segment of the text, ignoring a trailing separator. */
  public String baseName() {
    String trimmed = text;
    while (trimmed.length() > 1 && trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = trimmed.lastIndexOf('/');
    return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
  }

  /** Whether the shell should append a space once this candidate is accepted. */
  public boolean isComplete() {
    return type != CandidateType.DIRECTORY;
  }

  static int defaultPriority(CandidateType type) {
    return switch (type) {
      case SUBCOMMAND, COMMAND -> PRIORITY_HIGH;
      case HISTORY -> PRIORITY_LOW;
      default -> PRIORITY_NORMAL;
    };
  }
}
