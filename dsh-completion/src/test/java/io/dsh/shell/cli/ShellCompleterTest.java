package io.dsh.shell.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CommandHistory;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ShellCompleterTest {

  private static final Path WORK = Path.of("/work");

  @Mock private CompletionEngine engine;
  @Mock private LineReader reader;
  @Mock private ParsedLine line;
  @Mock private History history;

  private ShellCompleter completer;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    completer = new ShellCompleter(engine, () -> WORK);
    when(reader.getHistory()).thenReturn(history);
  }

  private History.Entry entry(String text) {
    History.Entry entry = mock(History.Entry.class);
    when(entry.line()).thenReturn(text);
    return entry;
  }

  @Test
  void optionsAreGroupedAndComplete() {
    Candidate candidate =
        ShellCompleter.toCandidate(
            CompletionCandidate.of("--message", "commit message", CandidateType.LONG_OPTION));

    assertEquals("--message", candidate.value());
    assertEquals("options", candidate.group());
    assertEquals("commit message", candidate.descr());
    assertTrue(candidate.complete());
  }

  @Test
  void directoriesStayOpen() {
    Candidate candidate =
        ShellCompleter.toCandidate(CompletionCandidate.of("src/", CandidateType.DIRECTORY));

    assertEquals("files", candidate.group());
    assertFalse(candidate.complete());
  }

  @Test
  void otherTypesUseLowercaseGroup() {
    assertEquals(
        "commands",
        ShellCompleter.toCandidate(CompletionCandidate.of("gitk", CandidateType.EXECUTABLE))
            .group());
    assertEquals(
        "history",
        ShellCompleter.toCandidate(CompletionCandidate.of("build", CandidateType.HISTORY))
            .group());
  }

  @Test
  void delegatesToEngineWithHistory() {
    when(line.line()).thenReturn("git c");
    when(line.cursor()).thenReturn(5);
    List<History.Entry> entries = List.of(entry("git commit"), entry("git checkout main"));
    when(history.size()).thenReturn(entries.size());
    when(history.iterator()).thenAnswer(inv -> entries.listIterator());
    when(engine.complete(eq("git c"), eq(5), eq(WORK), anyInt(), any()))
        .thenReturn(List.of(CompletionCandidate.of("commit", CandidateType.SUBCOMMAND)));

    List<Candidate> candidates = new ArrayList<>();
    completer.complete(reader, line, candidates);

    assertEquals(1, candidates.size());
    assertEquals("commit", candidates.get(0).value());
    ArgumentCaptor<CommandHistory> captor = ArgumentCaptor.forClass(CommandHistory.class);
    verify(engine).complete(eq("git c"), eq(5), eq(WORK), eq(0), captor.capture());
    assertEquals(List.of("git commit", "git checkout main"), captor.getValue().entries());
  }

  @Test
  void cursorIsClampedToLine() {
    when(line.line()).thenReturn("ls");
    when(line.cursor()).thenReturn(9);
    when(engine.complete(any(), anyInt(), any(), anyInt(), any())).thenReturn(List.of());

    completer.complete(null, line, new ArrayList<>());

    verify(engine).complete(eq("ls"), eq(2), eq(WORK), eq(0), any());
  }
}
