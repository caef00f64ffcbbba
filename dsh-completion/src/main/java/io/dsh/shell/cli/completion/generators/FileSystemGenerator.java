package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CommandLineTokenizer;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import io.dsh.shell.cli.completion.schema.ArgumentType;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File and directory candidates for a partially typed path.
 *
 * <p>The token is split at its last {@code /} into a directory part and a name prefix; a token
 * ending in {@code /} lists that directory entirely. {@code ~} expands through {@code HOME}, and
 * candidate text keeps the directory part exactly as typed. Dot files are offered only when the
 * prefix starts with a dot. Listings are cached per absolute directory.
 */
public final class FileSystemGenerator {
  private static final Logger log = LoggerFactory.getLogger(FileSystemGenerator.class);

  private final ShellEnvironment environment;
  private final DirectoryLister lister;
  private final CompletionCache<Path, List<DirectoryLister.Entry>> cache;

  public FileSystemGenerator(ShellEnvironment environment) {
    this(
        environment, DirectoryLister.fileSystem(), new CompletionCache<>(CompletionCache.PATH_TTL));
  }

  public FileSystemGenerator(
      ShellEnvironment environment,
      DirectoryLister lister,
      CompletionCache<Path, List<DirectoryLister.Entry>> cache) {
    this.environment = environment;
    this.lister = lister;
    this.cache = cache;
  }

  /**
   * Files and directories matching {@code token}.
   *
   * @param token path as typed, possibly quoted
   * @param currentDir directory relative paths resolve against
   * @param filter extension filter for plain files; directories always pass
   * @return candidates sorted by name
   */
  public List<CompletionCandidate> files(String token, Path currentDir, ArgumentType.File filter) {
    return generate(
        token,
        currentDir,
        entry -> entry.directory() || filter == null || filter.accepts(entry.name()));
  }

  /** Directories matching {@code token}. */
  public List<CompletionCandidate> directories(String token, Path currentDir) {
    return generate(token, currentDir, DirectoryLister.Entry::directory);
  }

  /**
   * The first file or directory whose path starts with {@code token}, for callers that can
   * only take a single answer.
   *
   * @param token path prefix
   * @param currentDir directory relative paths resolve against
   * @return the first match in name order
   */
  public Optional<String> bestMatch(String token, Path currentDir) {
    if (token == null || token.isEmpty()) {
      return Optional.empty();
    }
    for (CompletionCandidate candidate : files(token, currentDir, null)) {
      if (candidate.text().startsWith(token)) {
        return Optional.of(candidate.text());
      }
    }
    return Optional.empty();
  }

  private List<CompletionCandidate> generate(
      String token, Path currentDir, Predicate<DirectoryLister.Entry> filter) {
    String typed = CommandLineTokenizer.unquote(token == null ? "" : token);
    int slash = typed.lastIndexOf('/');
    String typedDir = slash >= 0 ? typed.substring(0, slash + 1) : "";
    String prefix = typed.substring(slash + 1);

    Optional<Path> dir = resolveDirectory(typedDir, currentDir);
    if (dir.isEmpty()) {
      return List.of();
    }

    List<DirectoryLister.Entry> entries;
    try {
      entries = cache.getOrLoad(dir.get(), () -> lister.list(dir.get()));
    } catch (IOException e) {
      log.debug("Cannot list {}: {}", dir.get(), e.getMessage());
      return List.of();
    }

    boolean showHidden = prefix.startsWith(".");
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (DirectoryLister.Entry entry : entries) {
      String name = entry.name();
      if (!name.startsWith(prefix) || (!showHidden && name.startsWith("."))) {
        continue;
      }
      if (!filter.test(entry)) {
        continue;
      }
      if (entry.directory()) {
        candidates.add(CompletionCandidate.of(typedDir + name + "/", CandidateType.DIRECTORY));
      } else {
        candidates.add(CompletionCandidate.of(typedDir + name, CandidateType.FILE));
      }
    }
    return candidates;
  }

  /** Absolute, normalized directory for the typed directory part; used as the cache key. */
  Optional<Path> resolveDirectory(String typedDir, Path currentDir) {
    if (typedDir.isEmpty()) {
      return Optional.of(currentDir.toAbsolutePath().normalize());
    }
    String expanded = environment.expandHome(typedDir);
    if (expanded.startsWith("~")) {
      return Optional.empty();
    }
    try {
      Path path = Path.of(expanded);
      Path resolved = path.isAbsolute() ? path : currentDir.resolve(path);
      return Optional.of(resolved.toAbsolutePath().normalize());
    } catch (InvalidPathException e) {
      log.debug("Not a path: '{}'", typedDir);
      return Optional.empty();
    }
  }
}
