package io.dsh.shell.cli.completion;

import io.dsh.shell.cli.completion.schema.Argument;
import io.dsh.shell.cli.completion.schema.ArgumentType;
import io.dsh.shell.cli.completion.schema.CommandCompletion;
import io.dsh.shell.cli.completion.schema.CommandOption;
import io.dsh.shell.cli.completion.schema.CommandSchemaDatabase;
import io.dsh.shell.cli.completion.schema.SubCommand;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses a partial command line and classifies the token under the cursor.
 *
 * <p>Only tokens before the cursor token feed the subcommand path, the options and the
 * positional arguments. When the root command has a schema, subcommands are recognized by exact
 * name or alias along the declared tree; otherwise a lexical heuristic recognizes at most two
 * leading subcommands.
 *
 * <p>Classification, first match wins:
 *
 * <ol>
 *   <li>first word: {@link CompletionContext.Command}
 *   <li>{@code --x}: long option; {@code -x}: short option; longer single-dash words: long option
 *   <li>previous word takes a value: {@link CompletionContext.OptionValue}
 *   <li>previous word is a redirect, or the current word is one: file argument
 *   <li>still in subcommand position: {@link CompletionContext.SubCommand}
 *   <li>otherwise {@link CompletionContext.Argument}
 * </ol>
 */
public final class CommandLineParser {

  /** Options that take a value regardless of schema. */
  static final Set<String> VALUE_OPTIONS =
      Set.of("-m", "--message", "--target", "--features", "--git", "--path", "--name");

  static final int MAX_HEURISTIC_SUBCOMMANDS = 2;

  private static final Pattern REDIRECT = Pattern.compile("^(\\d*(>>?|<)|&>>?)$");
  private static final Pattern GLUED_REDIRECT = Pattern.compile("^(\\d*(>>?|<)|&>>?)\\S+$");
  private static final String VOWELS = "aeiou";

  private final CommandLineTokenizer tokenizer = new CommandLineTokenizer();
  private final CommandSchemaDatabase database;

  public CommandLineParser() {
    this(CommandSchemaDatabase.empty());
  }

  public CommandLineParser(CommandSchemaDatabase database) {
    this.database = Objects.requireNonNull(database, "database");
  }

  /**
   * Parses {@code input} for completion at {@code cursor}.
   *
   * @param input the line being edited
   * @param cursor cursor position, {@code 0 <= cursor <= input.length()}
   * @return the parsed line
   * @throws IllegalArgumentException if the cursor is outside the input
   */
  public ParsedCommandLine parse(String input, int cursor) {
    String line = input == null ? "" : input;
    if (cursor < 0 || cursor > line.length()) {
      throw new IllegalArgumentException(
          "Cursor " + cursor + " outside input of length " + line.length());
    }

    List<Token> tokens = tokenizer.tokenize(line);
    int index = tokenizer.tokenIndexAt(tokens, cursor);
    String current;
    int spanStart;
    if (tokenizer.isInsideToken(tokens, index, cursor)) {
      Token token = tokens.get(index);
      current = token.prefixAt(cursor);
      spanStart = token.start();
    } else {
      current = "";
      spanStart = cursor;
    }

    String command = tokens.isEmpty() ? "" : tokens.get(0).value();
    ParsedCommandLine.Builder builder =
        ParsedCommandLine.builder()
            .command(command)
            .currentToken(current)
            .cursorIndex(cursor)
            .tokens(tokens)
            .cursorTokenIndex(index)
            .tokenSpan(spanStart, cursor);

    if (index == 0) {
      return builder.completionContext(CompletionContext.COMMAND).build();
    }

    CommandCompletion schema = database.get(command).orElse(null);
    List<String> path = new ArrayList<>();
    List<String> options = new ArrayList<>();
    List<String> arguments = new ArrayList<>();
    walkPrecedingTokens(tokens, index, schema, path, options, arguments);

    builder.subcommandPath(path).specifiedOptions(options).specifiedArguments(arguments);
    String previous = index >= 2 ? tokens.get(index - 1).value() : null;
    return builder
        .completionContext(classify(current, previous, schema, path, arguments))
        .build();
  }

  private void walkPrecedingTokens(
      List<Token> tokens,
      int index,
      CommandCompletion schema,
      List<String> path,
      List<String> options,
      List<String> arguments) {
    boolean subcommandsOpen = true;
    boolean endOfOptions = false;
    for (int i = 1; i < index; i++) {
      String word = tokens.get(i).value();
      if (isRedirect(word)) {
        i++; // skip the redirect target
        continue;
      }
      if (GLUED_REDIRECT.matcher(word).matches()) {
        continue;
      }
      if (!endOfOptions && "--".equals(word)) {
        endOfOptions = true;
        subcommandsOpen = false;
        continue;
      }
      if (!endOfOptions && isOption(word)) {
        options.add(word);
        if (schema == null) {
          subcommandsOpen = false;
        }
        if (takesValue(schema, path, word) && i + 1 < index) {
          i++;
        }
        continue;
      }
      if (subcommandsOpen && isSubcommand(schema, path, word)) {
        path.add(word);
        continue;
      }
      subcommandsOpen = false;
      arguments.add(word);
    }
  }

  private CompletionContext classify(
      String current,
      String previous,
      CommandCompletion schema,
      List<String> path,
      List<String> arguments) {
    if (current.startsWith("--")) {
      return CompletionContext.LONG_OPTION;
    }
    if (current.startsWith("-")) {
      return current.length() == 2 ? CompletionContext.SHORT_OPTION : CompletionContext.LONG_OPTION;
    }

    if (previous != null && isOption(previous) && takesValue(schema, path, previous)) {
      ArgumentType valueType =
          schema == null
              ? null
              : schema.findOption(path, previous).map(CommandOption::valueType).orElse(null);
      return new CompletionContext.OptionValue(previous, valueType);
    }

    if ((previous != null && isRedirect(previous)) || isRedirect(current)) {
      return new CompletionContext.Argument(arguments.size(), ArgumentType.File.any());
    }

    if (isSubcommandPosition(current, schema, path, arguments)) {
      return CompletionContext.SUBCOMMAND;
    }

    int argIndex = arguments.size();
    if (!current.isEmpty() && arguments.contains(current)) {
      argIndex--;
    }
    return new CompletionContext.Argument(argIndex, argumentType(schema, path, argIndex));
  }

  private boolean isSubcommandPosition(
      String current, CommandCompletion schema, List<String> path, List<String> arguments) {
    if (schema != null) {
      return arguments.isEmpty() && !childrenOf(schema, path).isEmpty();
    }
    // the two-word cap limits recognition only, not classification
    return path.isEmpty() || looksLikeSubcommand(current);
  }

  private boolean isSubcommand(CommandCompletion schema, List<String> path, String word) {
    if (schema != null) {
      for (SubCommand sub : childrenOf(schema, path)) {
        if (sub.isNamed(word)) {
          return true;
        }
      }
      return false;
    }
    return path.size() < MAX_HEURISTIC_SUBCOMMANDS && looksLikeSubcommand(word);
  }

  private static List<SubCommand> childrenOf(CommandCompletion schema, List<String> path) {
    if (path.isEmpty()) {
      return schema.subcommands();
    }
    return schema.resolve(path).map(SubCommand::subcommands).orElse(List.of());
  }

  private static ArgumentType argumentType(
      CommandCompletion schema, List<String> path, int argIndex) {
    if (schema == null || argIndex < 0) {
      return null;
    }
    List<Argument> declared = schema.argumentsAfter(path);
    if (declared.isEmpty()) {
      return null;
    }
    if (argIndex < declared.size()) {
      return declared.get(argIndex).argType();
    }
    Argument last = declared.get(declared.size() - 1);
    return last.multiple() ? last.argType() : null;
  }

  private static boolean takesValue(CommandCompletion schema, List<String> path, String option) {
    if (VALUE_OPTIONS.contains(option)) {
      return true;
    }
    return schema != null
        && schema.findOption(path, option).map(CommandOption::takesValue).orElse(false);
  }

  static boolean isOption(String word) {
    return word.length() > 1 && word.charAt(0) == '-';
  }

  /** Whether {@code word} is a redirect operator such as {@code >}, {@code 2>>} or {@code &>}. */
  public static boolean isRedirect(String word) {
    return REDIRECT.matcher(word).matches();
  }

  /**
   * Lexical test for subcommand-like words, used when the command has no schema.
   *
   * <p>A word qualifies when it is not an option, has no file extension or path separator, is 2
   * to 15 characters long, contains both a vowel and a consonant, and is not a four-letter
   * consonant-vowel-consonant-vowel word (plain nouns such as {@code file} or {@code data}).
   */
  static boolean looksLikeSubcommand(String word) {
    if (word.isEmpty() || word.charAt(0) == '-') {
      return false;
    }
    if (word.length() < 2 || word.length() > 15) {
      return false;
    }
    int dot = word.indexOf('.');
    if (dot > 0 && dot < word.length() - 1) {
      return false;
    }
    if (word.indexOf('/') >= 0 || word.indexOf('\\') >= 0) {
      return false;
    }

    boolean vowel = false;
    boolean consonant = false;
    for (int i = 0; i < word.length(); i++) {
      char c = Character.toLowerCase(word.charAt(i));
      if (isVowel(c)) {
        vowel = true;
      } else if (c >= 'a' && c <= 'z') {
        consonant = true;
      }
    }
    if (!vowel || !consonant) {
      return false;
    }
    return !(word.length() == 4 && isConsonantVowelPattern(word.toLowerCase(Locale.ROOT)));
  }

  private static boolean isConsonantVowelPattern(String word) {
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      boolean letter = c >= 'a' && c <= 'z';
      boolean expectVowel = i % 2 == 1;
      if (!letter || isVowel(c) != expectVowel) {
        return false;
      }
    }
    return true;
  }

  private static boolean isVowel(char c) {
    return VOWELS.indexOf(c) >= 0;
  }
}
