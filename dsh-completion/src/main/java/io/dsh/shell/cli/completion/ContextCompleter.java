package io.dsh.shell.cli.completion;

import java.util.List;

/**
 * Strategy interface for context-specific candidate providers. Each implementation handles one
 * or a few completion contexts.
 */
public interface ContextCompleter {

  /**
   * Checks if this completer can handle the parsed line.
   *
   * @param parsed the parsed command line
   * @return true if this completer should run
   */
  boolean canHandle(ParsedCommandLine parsed);

  /**
   * Generates candidates for the parsed line.
   *
   * @param parsed the parsed command line
   * @param sources schemas and generators of the current request
   * @param candidates list to add candidates to
   */
  void complete(
      ParsedCommandLine parsed, CompletionSources sources, List<CompletionCandidate> candidates);
}
