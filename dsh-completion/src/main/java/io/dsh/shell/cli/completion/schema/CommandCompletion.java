package io.dsh.shell.cli.completion.schema;

import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Completion schema of one command: global options, nested subcommands and positional
 * arguments.
 */
public record CommandCompletion(
    String command,
    String description,
    @SerializedName("global_options") List<CommandOption> globalOptions,
    List<SubCommand> subcommands,
    List<Argument> arguments) {

  public CommandCompletion {
    globalOptions = globalOptions == null ? List.of() : List.copyOf(globalOptions);
    subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  /**
   * Walks the subcommand tree along {@code path}.
   *
   * @param path subcommand names from the command line
   * @return the innermost subcommand, or empty if the path is empty or leaves the tree
   */
  public Optional<SubCommand> resolve(List<String> path) {
    if (path.isEmpty()) {
      return Optional.empty();
    }
    List<SubCommand> level = subcommands;
    SubCommand found = null;
    for (String name : path) {
      found = find(level, name);
      if (found == null) {
        return Optional.empty();
      }
      level = found.subcommands();
    }
    return Optional.of(found);
  }

  /** Subcommands offered after {@code path}: the children of the resolved node, else top level. */
  public List<SubCommand> subcommandsAfter(List<String> path) {
    return resolve(path).map(SubCommand::subcommands).orElse(subcommands);
  }

  /** Positional arguments of the resolved node, else of the command itself. */
  public List<Argument> argumentsAfter(List<String> path) {
    return resolve(path).map(SubCommand::arguments).orElse(arguments);
  }

  /** Global options followed by the options of the resolved subcommand. */
  public List<CommandOption> optionsAfter(List<String> path) {
    List<CommandOption> options = new ArrayList<>(globalOptions);
    resolve(path).ifPresent(sub -> options.addAll(sub.options()));
    return options;
  }

  /**
   * Finds an option by one of its forms among the options visible after {@code path}.
   *
   * @param path subcommand path
   * @param form {@code -m} or {@code --message}
   * @return the option, if declared
   */
  public Optional<CommandOption> findOption(List<String> path, String form) {
    for (CommandOption option : optionsAfter(path)) {
      if (option.hasForm(form)) {
        return Optional.of(option);
      }
    }
    return Optional.empty();
  }

  private static SubCommand find(List<SubCommand> level, String name) {
    for (SubCommand sub : level) {
      if (sub.isNamed(name)) {
        return sub;
      }
    }
    return null;
  }
}
