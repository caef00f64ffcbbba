package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionContext;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.ContextCompleter;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import io.dsh.shell.cli.completion.schema.CommandCompletion;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Completer for the first word on the line: commands with a schema, then common commands. */
public class CommandCompleter implements ContextCompleter {

  static final List<String> COMMON_COMMANDS =
      List.of(
          "ls", "cd", "pwd", "mkdir", "rmdir", "rm", "cp", "mv", "cat", "less", "more", "grep",
          "find", "which", "whereis", "man", "help", "echo", "printf", "git", "cargo", "rustc",
          "npm", "node", "python", "python3", "pip", "docker", "kubectl", "ssh", "scp", "curl",
          "wget", "tar", "zip", "unzip");

  @Override
  public boolean canHandle(ParsedCommandLine parsed) {
    return parsed.completionContext() instanceof CompletionContext.Command;
  }

  @Override
  public void complete(
      ParsedCommandLine parsed, CompletionSources sources, List<CompletionCandidate> candidates) {
    String partial = parsed.currentToken();
    Set<String> offered = new HashSet<>();

    for (String name : sources.database().commandNames()) {
      if (name.startsWith(partial) && offered.add(name)) {
        String description =
            sources.database().get(name).map(CommandCompletion::description).orElse(null);
        candidates.add(CompletionCandidate.of(name, description, CandidateType.COMMAND));
      }
    }
    for (String name : COMMON_COMMANDS) {
      if (name.startsWith(partial) && offered.add(name)) {
        candidates.add(CompletionCandidate.of(name, CandidateType.COMMAND));
      }
    }
  }
}
