package io.dsh.shell.cli.completion;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into quote-aware tokens.
 *
 * <p>Whitespace outside single or double quotes separates tokens. Quote characters stay in the
 * token text, and a quote that is never closed extends the token to the end of the input. Each
 * token keeps its exact character span for cursor tracking.
 */
public final class CommandLineTokenizer {

  /**
   * Tokenizes a command line.
   *
   * @param line the input line, may be null
   * @return tokens in order of appearance, never null
   */
  public List<Token> tokenize(String line) {
    if (line == null || line.isEmpty()) {
      return List.of();
    }

    List<Token> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int start = -1;
    char quote = 0;

    for (int pos = 0; pos < line.length(); pos++) {
      char c = line.charAt(pos);

      if (quote != 0) {
        current.append(c);
        if (c == quote) {
          quote = 0;
        }
        continue;
      }

      if (Character.isWhitespace(c)) {
        if (start >= 0) {
          tokens.add(new Token(current.toString(), start, pos));
          current.setLength(0);
          start = -1;
        }
        continue;
      }

      if (start < 0) {
        start = pos;
      }
      if (c == '"' || c == '\'') {
        quote = c;
      }
      current.append(c);
    }

    if (start >= 0) {
      tokens.add(new Token(current.toString(), start, line.length()));
    }
    return tokens;
  }

  /**
   * Finds the index of the token that owns the cursor.
   *
   * <p>The owner is the first token whose span contains the cursor. When the cursor sits in
   * whitespace, the returned index is where an empty token would be inserted, i.e. the number of
   * tokens ending before the cursor.
   *
   * @param tokens tokens of the line
   * @param cursor cursor position
   * @return index into {@code tokens}, or {@code tokens.size()} past the last token
   */
  public int tokenIndexAt(List<Token> tokens, int cursor) {
    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.containsCursor(cursor)) {
        return i;
      }
      if (token.start() > cursor) {
        return i;
      }
    }
    return tokens.size();
  }

  /**
   * Checks whether the cursor position is covered by an existing token.
   *
   * @param tokens tokens of the line
   * @param index result of {@link #tokenIndexAt(List, int)}
   * @param cursor cursor position
   * @return true if the cursor lies inside (or at an edge of) {@code tokens.get(index)}
   */
  public boolean isInsideToken(List<Token> tokens, int index, int cursor) {
    return index < tokens.size() && tokens.get(index).containsCursor(cursor);
  }

  /**
   * Strips one level of surrounding quotes, as a shell would before passing the word on.
   *
   * @param value token text
   * @return the unquoted text
   */
  public static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    if (!value.isEmpty() && (value.charAt(0) == '"' || value.charAt(0) == '\'')) {
      return value.substring(1);
    }
    return value;
  }
}
