package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;

/** Process ids for {@code kill}, described by the process name. */
public final class KillHandler implements DynamicHandler {

  @Override
  public boolean matches(ParsedCommandLine parsed) {
    return "kill".equals(parsed.command()) && DynamicHandler.isPositional(parsed);
  }

  @Override
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException {
    String partial = parsed.currentToken();
    List<String> lines = query.lines("ps", "-eo", "pid,comm");
    List<CompletionCandidate> candidates = new ArrayList<>();
    // first line is the header
    for (int i = 1; i < lines.size(); i++) {
      String[] parts = lines.get(i).trim().split("\\s+", 2);
      if (parts.length < 2 || !parts[0].startsWith(partial)) {
        continue;
      }
      candidates.add(
          new CompletionCandidate(
              parts[0],
              parts[1].trim(),
              CandidateType.ARGUMENT,
              CompletionCandidate.PRIORITY_HIGH));
    }
    return candidates;
  }
}
