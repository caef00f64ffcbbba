package io.dsh.shell.cli.completion.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, name-keyed registry of command schemas. Built once at startup and shared by handle;
 * safe to read from any number of threads without locking.
 */
public final class CommandSchemaDatabase {

  private static final CommandSchemaDatabase EMPTY = new CommandSchemaDatabase(Map.of());

  private final Map<String, CommandCompletion> commands;

  private CommandSchemaDatabase(Map<String, CommandCompletion> commands) {
    this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
  }

  public static CommandSchemaDatabase empty() {
    return EMPTY;
  }

  public static CommandSchemaDatabase of(CommandCompletion... completions) {
    Builder builder = builder();
    for (CommandCompletion completion : completions) {
      builder.register(completion);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Looks up the schema of {@code command}. */
  public Optional<CommandCompletion> get(String command) {
    return Optional.ofNullable(command == null ? null : commands.get(command));
  }

  public boolean contains(String command) {
    return command != null && commands.containsKey(command);
  }

  /** Names of all registered commands, sorted. */
  public List<String> commandNames() {
    List<String> names = new ArrayList<>(commands.keySet());
    Collections.sort(names);
    return names;
  }

  public int size() {
    return commands.size();
  }

  public boolean isEmpty() {
    return commands.isEmpty();
  }

  /** Collects schemas; the first registrant for a name wins. */
  public static final class Builder {
    private final Map<String, CommandCompletion> commands = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Registers a schema unless one with the same command name is already present.
     *
     * @param completion the schema
     * @return true if registered, false if the name was taken
     */
    public boolean register(CommandCompletion completion) {
      return commands.putIfAbsent(completion.command(), completion) == null;
    }

    public boolean contains(String command) {
      return commands.containsKey(command);
    }

    public CommandSchemaDatabase build() {
      return new CommandSchemaDatabase(commands);
    }
  }
}
