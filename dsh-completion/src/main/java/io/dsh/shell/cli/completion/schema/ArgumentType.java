package io.dsh.shell.cli.completion.schema;

import java.util.List;

/**
 * Value type of a positional argument or of an option value. Drives which generator produces
 * candidates for it.
 */
public sealed interface ArgumentType
    permits ArgumentType.File,
        ArgumentType.Directory,
        ArgumentType.Choice,
        ArgumentType.Command,
        ArgumentType.CommandWithArgs,
        ArgumentType.Environment,
        ArgumentType.Text,
        ArgumentType.Signal,
        ArgumentType.User,
        ArgumentType.Group,
        ArgumentType.Interface {

  /** Name used for this type in schema files. */
  String typeName();

  /** A file path, optionally restricted to the given extensions (e.g. {@code ".rs"}). */
  record File(List<String> extensions) implements ArgumentType {
    public File {
      extensions = extensions == null ? List.of() : List.copyOf(extensions);
    }

    public static File any() {
      return new File(List.of());
    }

    /** Checks a file name against the extension filter. Directories are never filtered. */
    public boolean accepts(String fileName) {
      if (extensions.isEmpty()) {
        return true;
      }
      for (String ext : extensions) {
        String dotted = ext.startsWith(".") ? ext : "." + ext;
        if (fileName.endsWith(dotted) && fileName.length() > dotted.length()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String typeName() {
      return "File";
    }
  }

  record Directory() implements ArgumentType {
    @Override
    public String typeName() {
      return "Directory";
    }
  }

  /** One of a fixed list of values. */
  record Choice(List<String> values) implements ArgumentType {
    public Choice {
      values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public String typeName() {
      return "Choice";
    }
  }

  /** Name of an executable command. */
  record Command() implements ArgumentType {
    @Override
    public String typeName() {
      return "Command";
    }
  }

  /** An executable followed by its own arguments, as taken by {@code sudo} or {@code env}. */
  record CommandWithArgs() implements ArgumentType {
    @Override
    public String typeName() {
      return "CommandWithArgs";
    }
  }

  /** Name of an environment variable. */
  record Environment() implements ArgumentType {
    @Override
    public String typeName() {
      return "Environment";
    }
  }

  /** Free text; has no candidates of its own. Spelled {@code String} in schema files. */
  record Text() implements ArgumentType {
    @Override
    public String typeName() {
      return "String";
    }
  }

  /** Signal name or number. */
  record Signal() implements ArgumentType {
    @Override
    public String typeName() {
      return "Signal";
    }
  }

  /** Login name of a system account. */
  record User() implements ArgumentType {
    @Override
    public String typeName() {
      return "User";
    }
  }

  /** System group name. */
  record Group() implements ArgumentType {
    @Override
    public String typeName() {
      return "Group";
    }
  }

  /** Network interface name. */
  record Interface() implements ArgumentType {
    @Override
    public String typeName() {
      return "Interface";
    }
  }
}
