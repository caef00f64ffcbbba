package io.dsh.shell.cli.completion.generators;

import static org.junit.jupiter.api.Assertions.*;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutableSearchTest {

  private static final Path USR_BIN = Path.of("/usr/bin");
  private static final Path LOCAL_BIN = Path.of("/usr/local/bin");

  private AtomicInteger listings;
  private ExecutableSearch search;

  @BeforeEach
  void setUp() {
    listings = new AtomicInteger();
    Map<Path, List<DirectoryLister.Entry>> tree =
        Map.of(
            LOCAL_BIN,
            List.of(
                new DirectoryLister.Entry("python3", false, true),
                new DirectoryLister.Entry("pip", false, true)),
            USR_BIN,
            List.of(
                new DirectoryLister.Entry("python3", false, true),
                new DirectoryLister.Entry("perl", false, true),
                new DirectoryLister.Entry("pydoc", false, false),
                new DirectoryLister.Entry("pkgs", true, true)));
    DirectoryLister lister =
        dir -> {
          listings.incrementAndGet();
          List<DirectoryLister.Entry> entries = tree.get(dir);
          if (entries == null) {
            throw new IOException("No such directory: " + dir);
          }
          return entries;
        };
    String path = String.join(File.pathSeparator, "/usr/local/bin", "/missing", "", "/usr/bin");
    search =
        new ExecutableSearch(
            ShellEnvironment.of(Map.of("PATH", path)),
            lister,
            new CompletionCache<>(CompletionCache.PATH_TTL));
  }

  private static List<String> texts(List<CompletionCandidate> candidates) {
    return candidates.stream().map(CompletionCandidate::text).toList();
  }

  @Test
  void firstPathEntryWins() {
    List<CompletionCandidate> candidates = search.search("py");

    assertEquals(List.of("python3"), texts(candidates));
    assertEquals("/usr/local/bin/python3", candidates.get(0).description());
    assertEquals(CandidateType.EXECUTABLE, candidates.get(0).type());
  }

  @Test
  void skipsDirectoriesAndNonExecutables() {
    assertEquals(List.of("python3", "pip", "perl"), texts(search.search("p")));
  }

  @Test
  void prefixWithSlashIsNotSearched() {
    assertTrue(search.search("./py").isEmpty());
  }

  @Test
  void unreadableDirectoriesAreSkipped() {
    assertFalse(search.search("").isEmpty());
  }

  @Test
  void listingsAreCached() {
    search.search("p");
    assertEquals(3, listings.get());
    search.search("py");

    // only the failed directory is listed again
    assertEquals(4, listings.get());
  }

  @Test
  void locationUnderHomeIsShownWithTilde() {
    ExecutableSearch personal =
        new ExecutableSearch(
            ShellEnvironment.of(Map.of("HOME", "/home/alice", "PATH", "/home/alice/bin")),
            dir -> List.of(new DirectoryLister.Entry("deploy", false, true)),
            new CompletionCache<>(CompletionCache.PATH_TTL));

    assertEquals("~/bin/deploy", personal.search("de").get(0).description());
  }

  @Test
  void emptyPathYieldsNothing() {
    ExecutableSearch none =
        new ExecutableSearch(
            ShellEnvironment.of(Map.of()),
            dir -> List.of(new DirectoryLister.Entry("x", false, true)),
            new CompletionCache<>(CompletionCache.PATH_TTL));

    assertTrue(none.search("").isEmpty());
  }
}
