package io.dsh.shell.cli.completion.rank;

import io.dsh.shell.cli.completion.CompletionCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders candidates for display: exact matches, then prefix matches, then fuzzy matches by
 * score, then the rest. Ties fall back to {@link #DEFAULT_ORDER}.
 */
public final class SmartRanker {

  /** Priority descending, then category, then text. */
  public static final Comparator<CompletionCandidate> DEFAULT_ORDER =
      Comparator.comparingInt(CompletionCandidate::priority)
          .reversed()
          .thenComparingInt(c -> c.type().sortOrder())
          .thenComparing(CompletionCandidate::text);

  private final FuzzyMatcher matcher;

  public SmartRanker() {
    this(new FuzzyMatcher());
  }

  public SmartRanker(FuzzyMatcher matcher) {
    this.matcher = matcher;
  }

  /**
   * Sorts {@code candidates} by how well they match {@code token}.
   *
   * @param candidates candidates to order
   * @param token the typed text
   * @return a new, ordered list
   */
  public List<CompletionCandidate> rank(List<CompletionCandidate> candidates, String token) {
    List<Scored> scored = new ArrayList<>(candidates.size());
    for (CompletionCandidate candidate : candidates) {
      scored.add(new Scored(candidate, tier(candidate, token), fuzzyScore(candidate, token)));
    }
    scored.sort(
        Comparator.comparingInt(Scored::tier)
            .thenComparing(Comparator.comparingInt(Scored::fuzzy).reversed())
            .thenComparing(Scored::candidate, DEFAULT_ORDER));

    List<CompletionCandidate> ranked = new ArrayList<>(scored.size());
    for (Scored s : scored) {
      ranked.add(s.candidate());
    }
    return ranked;
  }

  /** Candidates whose text fuzzily matches {@code token}, best first. */
  public List<CompletionCandidate> fuzzyFilter(List<CompletionCandidate> candidates, String token) {
    List<CompletionCandidate> matches = new ArrayList<>();
    for (CompletionCandidate candidate : candidates) {
      if (matcher.matches(token, candidate.text())) {
        matches.add(candidate);
      }
    }
    return rank(matches, token);
  }

  private int tier(CompletionCandidate candidate, String token) {
    String text = candidate.text();
    if (text.equals(token)) {
      return 0;
    }
    if (text.startsWith(token)) {
      return 1;
    }
    if (matcher.matches(token, text)) {
      return 2;
    }
    return 3;
  }

  private int fuzzyScore(CompletionCandidate candidate, String token) {
    String text = candidate.text();
    if (text.startsWith(token)) {
      // prefix matches keep the default order among themselves
      return 0;
    }
    return Math.max(matcher.score(token, text), 0);
  }

  private record Scored(CompletionCandidate candidate, int tier, int fuzzy) {}
}
