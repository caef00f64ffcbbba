package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds executables on {@code PATH} by name prefix. Every directory is scanned in order and the
 * first hit for a name wins.
 */
public final class ExecutableSearch {
  private static final Logger log = LoggerFactory.getLogger(ExecutableSearch.class);

  private final ShellEnvironment environment;
  private final DirectoryLister lister;
  private final CompletionCache<Path, List<String>> cache;

  public ExecutableSearch(ShellEnvironment environment) {
    this(
        environment, DirectoryLister.fileSystem(), new CompletionCache<>(CompletionCache.PATH_TTL));
  }

  public ExecutableSearch(
      ShellEnvironment environment,
      DirectoryLister lister,
      CompletionCache<Path, List<String>> cache) {
    this.environment = environment;
    this.lister = lister;
    this.cache = cache;
  }

  /**
   * Executables whose name starts with {@code prefix}.
   *
   * @param prefix typed prefix; a prefix containing {@code /} never matches
   * @return candidates in search path order, described by their location with home shown as
   *     {@code ~}
   */
  public List<CompletionCandidate> search(String prefix) {
    if (prefix.indexOf('/') >= 0) {
      return List.of();
    }
    Set<String> seen = new HashSet<>();
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (Path dir : environment.searchPath()) {
      for (String name : executablesIn(dir)) {
        if (name.startsWith(prefix) && seen.add(name)) {
          String location = environment.contractHome(dir.resolve(name).toString());
          candidates.add(CompletionCandidate.of(name, location, CandidateType.EXECUTABLE));
        }
      }
    }
    return candidates;
  }

  private List<String> executablesIn(Path dir) {
    Path key = dir.toAbsolutePath().normalize();
    try {
      return cache.getOrLoad(key, () -> listExecutables(key));
    } catch (IOException e) {
      log.debug("Skipping PATH directory {}: {}", dir, e.getMessage());
      return List.of();
    }
  }

  private List<String> listExecutables(Path dir) throws IOException {
    List<String> names = new ArrayList<>();
    for (DirectoryLister.Entry entry : lister.list(dir)) {
      if (entry.executable() && !entry.directory()) {
        names.add(entry.name());
      }
    }
    return names;
  }
}
