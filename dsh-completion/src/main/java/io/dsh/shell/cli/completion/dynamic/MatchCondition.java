package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.List;

/** When a {@link ScriptDefinition} applies to a parsed line. */
public sealed interface MatchCondition
    permits MatchCondition.StartsWithCommand,
        MatchCondition.HasSubcommand,
        MatchCondition.SecondArgument,
        MatchCondition.ThirdArgument,
        MatchCondition.CustomPattern {

  /**
   * Tests the line against this condition.
   *
   * @param definition the definition owning this condition
   * @param parsed the parsed line
   * @return whether the definition's script should run
   */
  boolean matches(ScriptDefinition definition, ParsedCommandLine parsed);

  /** The line's command is the definition's command. */
  record StartsWithCommand() implements MatchCondition {
    @Override
    public boolean matches(ScriptDefinition definition, ParsedCommandLine parsed) {
      return definition.command().equals(parsed.command());
    }
  }

  /** The command matches and the first subcommand is one of the definition's subcommands. */
  record HasSubcommand() implements MatchCondition {
    @Override
    public boolean matches(ScriptDefinition definition, ParsedCommandLine parsed) {
      List<String> path = parsed.subcommandPath();
      return definition.command().equals(parsed.command())
          && !path.isEmpty()
          && definition.subcommands().contains(path.get(0));
    }
  }

  /** The command matches and at least one word follows it. */
  record SecondArgument() implements MatchCondition {
    @Override
    public boolean matches(ScriptDefinition definition, ParsedCommandLine parsed) {
      return definition.command().equals(parsed.command()) && !wordsAfterCommand(parsed).isEmpty();
    }
  }

  /** The command matches and at least two words follow it. */
  record ThirdArgument() implements MatchCondition {
    @Override
    public boolean matches(ScriptDefinition definition, ParsedCommandLine parsed) {
      return definition.command().equals(parsed.command())
          && wordsAfterCommand(parsed).size() >= 2;
    }
  }

  /**
   * Combination of optional constraints; an unset constraint always holds. Word constraints test
   * by substring against the words between the command and the cursor.
   *
   * @param command required command, or null
   * @param subcommands allowed first subcommands; empty means any
   * @param argsContains values each of which some word must contain
   * @param optionsContains values each of which some specified option must contain
   * @param argsMustBeEmpty whether no word may follow the command yet
   * @param argsPositional values that the word at a given index must contain
   */
  record CustomPattern(
      String command,
      List<String> subcommands,
      List<String> argsContains,
      List<String> optionsContains,
      boolean argsMustBeEmpty,
      List<Positional> argsPositional)
      implements MatchCondition {

    public CustomPattern {
      subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
      argsContains = argsContains == null ? List.of() : List.copyOf(argsContains);
      optionsContains = optionsContains == null ? List.of() : List.copyOf(optionsContains);
      argsPositional = argsPositional == null ? List.of() : List.copyOf(argsPositional);
    }

    @Override
    public boolean matches(ScriptDefinition definition, ParsedCommandLine parsed) {
      if (command != null && !command.equals(parsed.command())) {
        return false;
      }
      List<String> path = parsed.subcommandPath();
      if (!subcommands.isEmpty() && (path.isEmpty() || !subcommands.contains(path.get(0)))) {
        return false;
      }
      List<String> words = wordsAfterCommand(parsed);
      for (String value : argsContains) {
        if (words.stream().noneMatch(w -> w.contains(value))) {
          return false;
        }
      }
      for (String value : optionsContains) {
        if (parsed.specifiedOptions().stream().noneMatch(o -> o.contains(value))) {
          return false;
        }
      }
      if (argsMustBeEmpty && !words.isEmpty()) {
        return false;
      }
      for (Positional positional : argsPositional) {
        if (positional.index() >= words.size()
            || !words.get(positional.index()).contains(positional.value())) {
          return false;
        }
      }
      return true;
    }
  }

  /** A value the word at {@code index} (0 is the first word after the command) must contain. */
  record Positional(int index, String value) {}

  /** Words between the command and the token under the cursor. */
  static List<String> wordsAfterCommand(ParsedCommandLine parsed) {
    List<String> preceding = parsed.precedingWords();
    return preceding.isEmpty() ? List.of() : preceding.subList(1, preceding.size());
  }
}
