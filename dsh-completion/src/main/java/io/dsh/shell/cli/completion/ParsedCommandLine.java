package io.dsh.shell.cli.completion;

import java.util.Collections;
import java.util.List;

/**
 * Immutable result of parsing a command line for completion. Created fresh for every request.
 *
 * @param command the first word, empty when the line is blank
 * @param subcommandPath recognized subcommands before the cursor, in order
 * @param specifiedOptions option tokens before the cursor
 * @param specifiedArguments positional tokens before the cursor, without redirects, their targets
 *     and option values
 * @param currentToken the in-progress token truncated at the cursor
 * @param completionContext role of the token under the cursor
 * @param cursorIndex cursor position in the line
 * @param tokens all tokens of the line
 * @param cursorTokenIndex index of the token under the cursor, {@code tokens.size()} past the end
 * @param tokenStart start of the span a chosen candidate replaces
 * @param tokenEnd end (exclusive) of that span
 */
public record ParsedCommandLine(
    String command,
    List<String> subcommandPath,
    List<String> specifiedOptions,
    List<String> specifiedArguments,
    String currentToken,
    CompletionContext completionContext,
    int cursorIndex,
    List<Token> tokens,
    int cursorTokenIndex,
    int tokenStart,
    int tokenEnd) {

  public ParsedCommandLine {
    if (command == null) {
      command = "";
    }
    subcommandPath = subcommandPath == null ? Collections.emptyList() : List.copyOf(subcommandPath);
    specifiedOptions =
        specifiedOptions == null ? Collections.emptyList() : List.copyOf(specifiedOptions);
    specifiedArguments =
        specifiedArguments == null ? Collections.emptyList() : List.copyOf(specifiedArguments);
    if (currentToken == null) {
      currentToken = "";
    }
    if (completionContext == null) {
      completionContext = CompletionContext.UNKNOWN;
    }
    tokens = tokens == null ? Collections.emptyList() : List.copyOf(tokens);
  }

  /** Builder for convenient construction */
  public static Builder builder() {
    return new Builder();
  }

  /** Whether the token under the cursor is the first word of the line. */
  public boolean isCommandPosition() {
    return cursorTokenIndex == 0;
  }

  /**
   * Words typed before the token under the cursor.
   *
   * @return token values preceding the cursor token
   */
  public List<String> precedingWords() {
    int limit = Math.min(cursorTokenIndex, tokens.size());
    return tokens.subList(0, limit).stream().map(Token::value).toList();
  }

  /** Returns a copy with a different current token, used for unfiltered fuzzy re-runs. */
  public ParsedCommandLine withCurrentToken(String token) {
    return new ParsedCommandLine(
        command,
        subcommandPath,
        specifiedOptions,
        specifiedArguments,
        token,
        completionContext,
        cursorIndex,
        tokens,
        cursorTokenIndex,
        tokenStart,
        tokenEnd);
  }

  public static class Builder {
    private String command = "";
    private List<String> subcommandPath = Collections.emptyList();
    private List<String> specifiedOptions = Collections.emptyList();
    private List<String> specifiedArguments = Collections.emptyList();
    private String currentToken = "";
    private CompletionContext completionContext = CompletionContext.UNKNOWN;
    private int cursorIndex;
    private List<Token> tokens = Collections.emptyList();
    private int cursorTokenIndex;
    private int tokenStart;
    private int tokenEnd;

    public Builder command(String command) {
      this.command = command;
      return this;
    }

    public Builder subcommandPath(List<String> subcommandPath) {
      this.subcommandPath = subcommandPath;
      return this;
    }

    public Builder specifiedOptions(List<String> specifiedOptions) {
      this.specifiedOptions = specifiedOptions;
      return this;
    }

    public Builder specifiedArguments(List<String> specifiedArguments) {
      this.specifiedArguments = specifiedArguments;
      return this;
    }

    public Builder currentToken(String currentToken) {
      this.currentToken = currentToken;
      return this;
    }

    public Builder completionContext(CompletionContext completionContext) {
      this.completionContext = completionContext;
      return this;
    }

    public Builder cursorIndex(int cursorIndex) {
      this.cursorIndex = cursorIndex;
      return this;
    }

    public Builder tokens(List<Token> tokens) {
      this.tokens = tokens;
      return this;
    }

    public Builder cursorTokenIndex(int cursorTokenIndex) {
      this.cursorTokenIndex = cursorTokenIndex;
      return this;
    }

    public Builder tokenSpan(int start, int end) {
      this.tokenStart = start;
      this.tokenEnd = end;
      return this;
    }

    public ParsedCommandLine build() {
      return new ParsedCommandLine(
          command,
          subcommandPath,
          specifiedOptions,
          specifiedArguments,
          currentToken,
          completionContext,
          cursorIndex,
          tokens,
          cursorTokenIndex,
          tokenStart,
          tokenEnd);
    }
  }
}
