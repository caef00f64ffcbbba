package io.dsh.shell.cli.completion;

/**
 * A single whitespace-delimited, quote-aware token of a command line.
 *
 * <p>Quote characters are part of {@link #value()}; the span maps back to the original input so
 * that the cursor can be located and the caller can replace exactly the completed token.
 *
 * @param value the token text, quotes included
 * @param start character position in line where token starts (inclusive)
 * @param end character position in line where token ends (exclusive)
 */
public record Token(String value, int start, int end) {

  /**
   * Returns the length of this token in characters.
   *
   * @return the number of characters in this token
   */
  public int length() {
    return end - start;
  }

  /**
   * Checks if the given cursor position is within this token (including boundaries).
   *
   * @param cursor the cursor position to check
   * @return true if cursor is at or between start and end positions
   */
  public boolean containsCursor(int cursor) {
    return cursor >= start && cursor <= end;
  }

  /**
   * Returns the part of this token that lies before the cursor.
   *
   * @param cursor cursor position inside this token
   * @return the token text truncated at the cursor
   */
  public String prefixAt(int cursor) {
    int cut = Math.max(0, Math.min(cursor, end) - start);
    return value.substring(0, cut);
  }

  @Override
  public String toString() {
    return String.format("'%s'@%d-%d", value, start, end);
  }
}
