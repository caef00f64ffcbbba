package io.dsh.shell.cli.completion.schema;

import com.google.gson.annotations.SerializedName;

/**
 * A positional argument.
 *
 * @param name argument name
 * @param description help text, may be null
 * @param argType value type, may be null for untyped arguments
 * @param multiple whether the argument repeats to the end of the line
 */
public record Argument(
    String name,
    String description,
    @SerializedName("arg_type") ArgumentType argType,
    boolean multiple) {

  public static Argument of(String name, ArgumentType argType) {
    return new Argument(name, null, argType, false);
  }
}
