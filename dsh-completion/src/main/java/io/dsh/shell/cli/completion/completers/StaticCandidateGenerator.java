package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.ContextCompleter;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;

/** Dispatches a parsed line to the completer for its context. */
public final class StaticCandidateGenerator {

  private final List<ContextCompleter> completers;

  public StaticCandidateGenerator() {
    TypedArgumentGenerator arguments = new TypedArgumentGenerator();
    // Register completers in priority order
    this.completers =
        List.of(
            new CommandCompleter(),
            new SubCommandCompleter(arguments),
            new OptionCompleter(),
            new ArgumentCompleter(arguments));
  }

  public StaticCandidateGenerator(List<ContextCompleter> completers) {
    this.completers = List.copyOf(completers);
  }

  /**
   * Runs the first completer that handles the line.
   *
   * @param parsed the parsed line
   * @param sources generators of the current request
   * @return candidates, possibly empty
   */
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CompletionSources sources) {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (ContextCompleter completer : completers) {
      if (completer.canHandle(parsed)) {
        completer.complete(parsed, sources, candidates);
        break;
      }
    }
    return candidates;
  }
}
