package io.dsh.shell.cli.completion;

import io.dsh.shell.cli.completion.schema.ArgumentType;

/**
 * Syntactic role of the token under the cursor. Drives which completers run.
 */
public sealed interface CompletionContext
    permits CompletionContext.Command,
        CompletionContext.SubCommand,
        CompletionContext.ShortOption,
        CompletionContext.LongOption,
        CompletionContext.OptionValue,
        CompletionContext.Argument,
        CompletionContext.Unknown {

  /** First word on the line. */
  record Command() implements CompletionContext {}

  /** A subcommand of the command (or of the subcommand path so far). */
  record SubCommand() implements CompletionContext {}

  /** A single-dash, single-letter option such as {@code -v}. */
  record ShortOption() implements CompletionContext {}

  /** A {@code --long} option, or a longer single-dash word such as {@code -am}. */
  record LongOption() implements CompletionContext {}

  /**
   * The value of the option right before the cursor.
   *
   * @param optionName the option as typed, e.g. {@code -m}
   * @param valueType declared type of the value, or null when no schema declares it
   */
  record OptionValue(String optionName, ArgumentType valueType) implements CompletionContext {
    public OptionValue(String optionName) {
      this(optionName, null);
    }
  }

  /**
   * A positional argument.
   *
   * @param argIndex zero-based position among positional arguments
   * @param argType declared type, or null when unknown
   */
  record Argument(int argIndex, ArgumentType argType) implements CompletionContext {
    public Argument(int argIndex) {
      this(argIndex, null);
    }
  }

  record Unknown() implements CompletionContext {}

  CompletionContext COMMAND = new Command();
  CompletionContext SUBCOMMAND = new SubCommand();
  CompletionContext SHORT_OPTION = new ShortOption();
  CompletionContext LONG_OPTION = new LongOption();
  CompletionContext UNKNOWN = new Unknown();

  /** Whether candidates for this context are options. */
  default boolean isOption() {
    return this instanceof ShortOption || this instanceof LongOption;
  }
}
