package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;

/** Account names for {@code sudo} before any argument is typed. */
public final class SudoHandler implements DynamicHandler {

  @Override
  public boolean matches(ParsedCommandLine parsed) {
    return "sudo".equals(parsed.command())
        && parsed.cursorTokenIndex() == 1
        && DynamicHandler.isPositional(parsed);
  }

  @Override
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException {
    String partial = parsed.currentToken();
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String line : query.lines("getent", "passwd")) {
      int colon = line.indexOf(':');
      String user = colon >= 0 ? line.substring(0, colon) : line.trim();
      if (!user.isEmpty() && user.startsWith(partial)) {
        candidates.add(
            new CompletionCandidate(
                user, "user", CandidateType.ARGUMENT, CompletionCandidate.PRIORITY_HIGH));
      }
    }
    return candidates;
  }
}
