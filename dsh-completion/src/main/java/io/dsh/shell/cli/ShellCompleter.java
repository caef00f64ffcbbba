package io.dsh.shell.cli;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CommandHistory;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionEngine;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * JLine completer backed by the {@link CompletionEngine}. Candidates are grouped by category;
 * directories do not get a trailing space so that completion can continue inside them.
 */
public class ShellCompleter implements Completer {

  private final CompletionEngine engine;
  private final Supplier<Path> workingDirectory;

  public ShellCompleter(CompletionEngine engine) {
    this(engine, () -> Paths.get("").toAbsolutePath());
  }

  /**
   * Creates a completer for a shell whose working directory changes over time.
   *
   * @param engine the completion engine
   * @param workingDirectory current directory of the shell, queried per request
   */
  public ShellCompleter(CompletionEngine engine, Supplier<Path> workingDirectory) {
    this.engine = engine;
    this.workingDirectory = workingDirectory;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String text = line.line();
    int cursor = Math.min(Math.max(line.cursor(), 0), text.length());
    CommandHistory history =
        reader == null || reader.getHistory() == null
            ? CommandHistory.empty()
            : new LineReaderHistory(reader.getHistory());

    for (CompletionCandidate candidate :
        engine.complete(text, cursor, workingDirectory.get(), 0, history)) {
      candidates.add(toCandidate(candidate));
    }
  }

  static Candidate toCandidate(CompletionCandidate candidate) {
    return new Candidate(
        candidate.text(),
        candidate.text(),
        group(candidate.type()),
        candidate.description(),
        null,
        null,
        candidate.isComplete());
  }

  private static String group(CandidateType type) {
    return switch (type) {
      case SHORT_OPTION, LONG_OPTION -> "options";
      case FILE, DIRECTORY -> "files";
      case EXECUTABLE, COMMAND -> "commands";
      default -> type.name().toLowerCase(Locale.ROOT);
    };
  }
}
