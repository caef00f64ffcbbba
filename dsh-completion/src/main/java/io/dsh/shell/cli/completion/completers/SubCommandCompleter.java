package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionContext;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.ContextCompleter;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import io.dsh.shell.cli.completion.schema.Argument;
import io.dsh.shell.cli.completion.schema.CommandCompletion;
import io.dsh.shell.cli.completion.schema.CommandOption;
import io.dsh.shell.cli.completion.schema.SubCommand;
import java.util.List;
import java.util.Optional;

/**
 * Completer for subcommands. Offers the children of the node reached by the subcommand path, or
 * the top-level subcommands when the path leaves the tree. When no subcommand matches, falls back
 * to the first unfilled positional argument and the global options.
 */
public class SubCommandCompleter implements ContextCompleter {

  private final TypedArgumentGenerator arguments;

  public SubCommandCompleter(TypedArgumentGenerator arguments) {
    this.arguments = arguments;
  }

  @Override
  public boolean canHandle(ParsedCommandLine parsed) {
    return parsed.completionContext() instanceof CompletionContext.SubCommand;
  }

  @Override
  public void complete(
      ParsedCommandLine parsed, CompletionSources sources, List<CompletionCandidate> candidates) {
    Optional<CommandCompletion> schema = sources.database().get(parsed.command());
    if (schema.isEmpty()) {
      return;
    }
    CommandCompletion command = schema.get();
    String partial = parsed.currentToken();
    List<String> path = parsed.subcommandPath();

    int before = candidates.size();
    for (SubCommand sub : command.subcommandsAfter(path)) {
      if (sub.name().startsWith(partial)) {
        candidates.add(
            CompletionCandidate.of(sub.name(), sub.description(), CandidateType.SUBCOMMAND));
      }
      for (String alias : sub.aliases()) {
        if (alias.startsWith(partial)) {
          candidates.add(
              CompletionCandidate.of(alias, "alias for " + sub.name(), CandidateType.SUBCOMMAND));
        }
      }
    }
    if (candidates.size() > before) {
      return;
    }

    List<Argument> declared = command.argumentsAfter(path);
    int next = parsed.specifiedArguments().size();
    if (next < declared.size() && declared.get(next).argType() != null) {
      arguments.generate(declared.get(next).argType(), partial, sources, candidates);
    }
    for (CommandOption option : command.globalOptions()) {
      OptionCompleter.addForms(option, partial, parsed.specifiedOptions(), candidates);
    }
  }
}
