package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Runs the shell command of a {@link ScriptDefinition} and offers its output lines. */
public final class ScriptHandler implements DynamicHandler {

  private static final Pattern VARIABLE =
      Pattern.compile("\\$(COMMAND|SUBCOMMAND|CURRENT_TOKEN)\\b");

  private final ScriptDefinition definition;

  public ScriptHandler(ScriptDefinition definition) {
    this.definition = definition;
  }

  public ScriptDefinition definition() {
    return definition;
  }

  @Override
  public boolean matches(ParsedCommandLine parsed) {
    return DynamicHandler.isPositional(parsed)
        && definition.matchCondition().matches(definition, parsed);
  }

  @Override
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException {
    String partial = parsed.currentToken();
    String filter = definition.filterOutput();
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String line : query.lines("sh", "-c", expand(definition.shellCommand(), parsed))) {
      String text = line.trim();
      if (text.isEmpty() || !text.startsWith(partial)) {
        continue;
      }
      if (filter != null && !text.contains(filter)) {
        continue;
      }
      candidates.add(
          new CompletionCandidate(
              text, definition.description(), CandidateType.ARGUMENT, definition.priority()));
    }
    return candidates;
  }

  /**
   * Substitutes the line's values into {@code template} in a single pass, so a substituted value
   * is never expanded again.
   */
  static String expand(String template, ParsedCommandLine parsed) {
    Matcher m = VARIABLE.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String value =
          switch (m.group(1)) {
            case "COMMAND" -> parsed.command();
            case "SUBCOMMAND" ->
                parsed.subcommandPath().isEmpty() ? "" : parsed.subcommandPath().get(0);
            default -> parsed.currentToken();
          };
      m.appendReplacement(sb, Matcher.quoteReplacement(quote(value)));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  static String quote(String value) {
    return "'" + value.replace("'", "'\\''") + "'";
  }

  @Override
  public String toString() {
    return "ScriptHandler[" + definition.command() + ": " + definition.description() + "]";
  }
}
