package io.dsh.shell.cli.completion.schema;

/**
 * Structural checks applied to every loaded schema.
 *
 * <ul>
 *   <li>command and subcommand names are non-empty and contain no whitespace
 *   <li>every option has a short or a long form
 *   <li>a short form is one dash followed by at least one character other than a dash
 *   <li>a long form is two dashes followed by at least one character
 * </ul>
 */
public final class SchemaValidator {

  public void validate(CommandCompletion completion) throws SchemaValidationException {
    String command = completion.command();
    if (command == null || command.isEmpty()) {
      throw new SchemaValidationException("Command name cannot be empty");
    }
    if (containsWhitespace(command)) {
      throw new SchemaValidationException(
          "Command name cannot contain whitespace: '" + command + "'");
    }

    for (CommandOption option : completion.globalOptions()) {
      validateOption(option, command);
    }
    for (Argument argument : completion.arguments()) {
      validateArgument(argument, command);
    }
    for (SubCommand sub : completion.subcommands()) {
      validateSubCommand(sub, command);
    }
  }

  private void validateSubCommand(SubCommand sub, String parent) throws SchemaValidationException {
    String name = sub.name();
    if (name == null || name.isEmpty()) {
      throw new SchemaValidationException("Subcommand name cannot be empty in '" + parent + "'");
    }
    if (containsWhitespace(name)) {
      throw new SchemaValidationException(
          "Subcommand name cannot contain whitespace: '" + name + "' in '" + parent + "'");
    }
    String context = parent + " " + name;
    for (String alias : sub.aliases()) {
      if (alias == null || alias.isEmpty() || containsWhitespace(alias)) {
        throw new SchemaValidationException("Invalid alias '" + alias + "' in '" + context + "'");
      }
    }
    for (CommandOption option : sub.options()) {
      validateOption(option, context);
    }
    for (Argument argument : sub.arguments()) {
      validateArgument(argument, context);
    }
    for (SubCommand nested : sub.subcommands()) {
      validateSubCommand(nested, context);
    }
  }

  /**
   * Validates a single option.
   *
   * @param option the option
   * @param context command path used in the error message
   * @throws SchemaValidationException if the option has no form or a malformed form
   */
  public void validateOption(CommandOption option, String context)
      throws SchemaValidationException {
    if (option == null) {
      throw new SchemaValidationException("Null option in '" + context + "'");
    }
    if (option.shortForm() == null && option.longForm() == null) {
      throw new SchemaValidationException(
          "Option must have either short or long form in '" + context + "'");
    }
    if (option.shortForm() != null && !isValidShortForm(option.shortForm())) {
      throw new SchemaValidationException(
          "Invalid short option format '" + option.shortForm() + "' in '" + context + "'");
    }
    if (option.longForm() != null && !isValidLongForm(option.longForm())) {
      throw new SchemaValidationException(
          "Invalid long option format '" + option.longForm() + "' in '" + context + "'");
    }
  }

  private void validateArgument(Argument argument, String context)
      throws SchemaValidationException {
    if (argument == null || argument.name() == null || argument.name().isEmpty()) {
      throw new SchemaValidationException("Argument name cannot be empty in '" + context + "'");
    }
  }

  static boolean isValidShortForm(String form) {
    return form.length() >= 2
        && form.charAt(0) == '-'
        && form.charAt(1) != '-'
        && !containsWhitespace(form);
  }

  static boolean isValidLongForm(String form) {
    return form.length() > 2 && form.startsWith("--") && !containsWhitespace(form);
  }

  private static boolean containsWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
