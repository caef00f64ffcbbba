package io.dsh.shell.cli.completion.completers;

import static org.junit.jupiter.api.Assertions.*;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CommandHistory;
import io.dsh.shell.cli.completion.CommandLineParser;
import io.dsh.shell.cli.completion.CompletionCandidate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HistoryCompleterTest {

  private CommandLineParser parser;
  private HistoryCompleter completer;

  @BeforeEach
  void setUp() {
    parser = new CommandLineParser();
    completer = new HistoryCompleter();
  }

  private List<CompletionCandidate> complete(String line, List<String> history) {
    List<CompletionCandidate> candidates = new ArrayList<>();
    completer.complete(parser.parse(line, line.length()), CommandHistory.of(history), candidates);
    return candidates;
  }

  private static List<String> texts(List<CompletionCandidate> candidates) {
    return candidates.stream().map(CompletionCandidate::text).toList();
  }

  @Test
  void suggestsNextWordMostRecentFirst() {
    List<CompletionCandidate> candidates =
        complete("git c", List.of("git status", "git commit -m x", "git checkout main"));

    assertEquals(List.of("checkout", "commit"), texts(candidates));
    assertEquals(CandidateType.HISTORY, candidates.get(0).type());
    assertEquals("history", candidates.get(0).description());
    assertEquals(CompletionCandidate.PRIORITY_LOW, candidates.get(0).priority());
  }

  @Test
  void precedingWordsMustMatchExactly() {
    List<CompletionCandidate> candidates =
        complete("git commit ", List.of("git commit --amend", "git checkout -b x", "hg commit y"));

    assertEquals(List.of("--amend"), texts(candidates));
  }

  @Test
  void commandPositionUsesFirstWords() {
    assertEquals(List.of("make", "mvn"), texts(complete("m", List.of("mvn test", "make all"))));
  }

  @Test
  void repeatedWordsAreSuggestedOnce() {
    assertEquals(
        List.of("push"), texts(complete("git p", List.of("git push", "git push", "git push -f"))));
  }

  @Test
  void atMostFiveSuggestions() {
    List<String> history = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      history.add("make target" + i);
    }

    List<CompletionCandidate> candidates = complete("make ", history);

    assertEquals(HistoryCompleter.MAX_SUGGESTIONS, candidates.size());
    assertEquals("target9", candidates.get(0).text());
  }

  @Test
  void onlyRecentEntriesAreScanned() {
    List<String> history = new ArrayList<>();
    history.add("deploy ancient");
    for (int i = 0; i < HistoryCompleter.MAX_ENTRIES_SCANNED; i++) {
      history.add("ls");
    }

    assertTrue(complete("deploy ", history).isEmpty());
  }

  @Test
  void emptyHistoryAddsNothing() {
    assertTrue(complete("git ", List.of()).isEmpty());
  }
}
