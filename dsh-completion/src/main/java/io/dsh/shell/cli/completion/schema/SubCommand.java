package io.dsh.shell.cli.completion.schema;

import java.util.List;

/**
 * A subcommand, possibly with its own nested subcommands ({@code git remote add}).
 *
 * @param name subcommand name
 * @param description help text, may be null
 * @param aliases alternative names
 * @param options options specific to this subcommand
 * @param arguments positional arguments
 * @param subcommands nested subcommands
 */
public record SubCommand(
    String name,
    String description,
    List<String> aliases,
    List<CommandOption> options,
    List<Argument> arguments,
    List<SubCommand> subcommands) {

  public SubCommand {
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
    options = options == null ? List.of() : List.copyOf(options);
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
    subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
  }

  /** Checks whether {@code word} names this subcommand or one of its aliases. */
  public boolean isNamed(String word) {
    return name.equals(word) || aliases.contains(word);
  }
}
