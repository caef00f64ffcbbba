package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CommandHistory;
import io.dsh.shell.cli.completion.CommandLineTokenizer;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import io.dsh.shell.cli.completion.Token;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Suggests the word that followed the same leading words in earlier command lines, most recent
 * first.
 */
public class HistoryCompleter {

  static final int MAX_ENTRIES_SCANNED = 500;
  static final int MAX_SUGGESTIONS = 5;

  private final CommandLineTokenizer tokenizer = new CommandLineTokenizer();

  /**
   * Adds history candidates for the parsed line.
   *
   * @param parsed the parsed line
   * @param history past command lines
   * @param candidates list to add candidates to
   */
  public void complete(
      ParsedCommandLine parsed, CommandHistory history, List<CompletionCandidate> candidates) {
    List<String> entries = history.entries();
    if (entries.isEmpty()) {
      return;
    }
    List<String> preceding = parsed.precedingWords();
    String partial = parsed.currentToken();
    Set<String> seen = new HashSet<>();

    int scanned = 0;
    for (int i = entries.size() - 1; i >= 0 && scanned < MAX_ENTRIES_SCANNED; i--, scanned++) {
      List<Token> words = tokenizer.tokenize(entries.get(i));
      if (words.size() <= preceding.size() || !startsWith(words, preceding)) {
        continue;
      }
      String next = words.get(preceding.size()).value();
      if (next.startsWith(partial) && seen.add(next)) {
        candidates.add(CompletionCandidate.of(next, "history", CandidateType.HISTORY));
        if (seen.size() >= MAX_SUGGESTIONS) {
          return;
        }
      }
    }
  }

  private static boolean startsWith(List<Token> words, List<String> preceding) {
    for (int i = 0; i < preceding.size(); i++) {
      if (!words.get(i).value().equals(preceding.get(i))) {
        return false;
      }
    }
    return true;
  }
}
