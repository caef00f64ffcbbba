package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionContext;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.List;

/** Completion for command patterns whose candidates come from live system state. */
public sealed interface DynamicHandler
    permits KillHandler, SudoHandler, GitHandler, PackageHandler, ScriptHandler {

  /** Whether this handler applies to the parsed line. */
  boolean matches(ParsedCommandLine parsed);

  /**
   * Produces candidates for the parsed line.
   *
   * @param parsed a line this handler {@link #matches matches}
   * @param query external queries of the current request
   * @return candidates, possibly empty
   * @throws CompletionSourceException if the underlying query fails
   */
  List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException;

  /** Whether the cursor is on a word that is neither an option nor an option's value. */
  static boolean isPositional(ParsedCommandLine parsed) {
    CompletionContext ctx = parsed.completionContext();
    return ctx instanceof CompletionContext.Argument || ctx instanceof CompletionContext.SubCommand;
  }
}
