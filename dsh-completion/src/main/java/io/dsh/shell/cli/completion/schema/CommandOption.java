package io.dsh.shell.cli.completion.schema;

import com.google.gson.annotations.SerializedName;

/**
 * An option accepted by a command or subcommand.
 *
 * @param shortForm short form such as {@code -v}, may be null
 * @param longForm long form such as {@code --verbose}, may be null
 * @param description help text, may be null
 * @param takesValue whether the next word is the option's value
 * @param valueType type of that value, may be null
 */
public record CommandOption(
    @SerializedName("short") String shortForm,
    @SerializedName("long") String longForm,
    String description,
    @SerializedName("takes_value") boolean takesValue,
    @SerializedName("value_type") ArgumentType valueType) {

  public static CommandOption flag(String shortForm, String longForm, String description) {
    return new CommandOption(shortForm, longForm, description, false, null);
  }

  public static CommandOption withValue(
      String shortForm, String longForm, String description, ArgumentType valueType) {
    return new CommandOption(shortForm, longForm, description, true, valueType);
  }

  /** Checks whether {@code word} is one of this option's forms. */
  public boolean hasForm(String word) {
    return word.equals(shortForm) || word.equals(longForm);
  }
}
