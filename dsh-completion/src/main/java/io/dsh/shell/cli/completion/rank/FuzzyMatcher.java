package io.dsh.shell.cli.completion.rank;

import java.util.Locale;

/**
 * Case-insensitive subsequence matching with a score that favours matches at the start, after
 * a separator and in consecutive runs.
 */
public final class FuzzyMatcher {

  /** Returned by {@link #score} when the pattern is not a subsequence of the text. */
  public static final int NO_MATCH = -1;

  private static final int MATCH = 16;
  private static final int CONSECUTIVE = 24;
  private static final int AT_START = 32;
  private static final int AFTER_SEPARATOR = 20;
  private static final int GAP = 2;

  /**
   * Scores {@code text} against {@code pattern}.
   *
   * @param pattern the typed text
   * @param text a candidate
   * @return a non-negative score, higher is better, or {@link #NO_MATCH}
   */
  public int score(String pattern, String text) {
    if (pattern.isEmpty()) {
      return 0;
    }
    String p = pattern.toLowerCase(Locale.ROOT);
    String t = text.toLowerCase(Locale.ROOT);

    int score = 0;
    int previous = -2;
    int ti = 0;
    for (int pi = 0; pi < p.length(); pi++) {
      char c = p.charAt(pi);
      while (ti < t.length() && t.charAt(ti) != c) {
        ti++;
      }
      if (ti == t.length()) {
        return NO_MATCH;
      }
      score += MATCH;
      if (ti == 0) {
        score += AT_START;
      } else if (isSeparator(t.charAt(ti - 1))) {
        score += AFTER_SEPARATOR;
      }
      if (ti == previous + 1) {
        score += CONSECUTIVE;
      } else if (previous >= 0) {
        score -= GAP * (ti - previous - 1);
      }
      previous = ti;
      ti++;
    }
    // shorter candidates first among equal matches
    score -= t.length() - p.length();
    return Math.max(score, 0);
  }

  public boolean matches(String pattern, String text) {
    return score(pattern, text) != NO_MATCH;
  }

  private static boolean isSeparator(char c) {
    return c == '-' || c == '_' || c == '/' || c == '.' || c == ' ';
  }
}
