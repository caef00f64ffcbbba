package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Group names from the group database, described by their numeric id. */
public final class GroupGenerator {

  static final Path GROUP = Path.of("/etc/group");
  private static final String ALL = "";

  private final Path groupFile;
  private final CompletionCache<String, List<CompletionCandidate>> cache;

  public GroupGenerator() {
    this(GROUP, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));
  }

  public GroupGenerator(Path groupFile, CompletionCache<String, List<CompletionCandidate>> cache) {
    this.groupFile = groupFile;
    this.cache = cache;
  }

  public List<CompletionCandidate> generate(String prefix) throws CompletionSourceException {
    return AccountFiles.filter(cache.getOrLoad(ALL, this::readGroups), prefix);
  }

  private List<CompletionCandidate> readGroups() throws CompletionSourceException {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String[] fields : AccountFiles.records(groupFile)) {
      if (fields[0].isEmpty()) {
        continue;
      }
      String description = null;
      if (fields.length > 2) {
        try {
          description = "GID: " + Integer.parseInt(fields[2]);
        } catch (NumberFormatException e) {
          description = null;
        }
      }
      candidates.add(CompletionCandidate.of(fields[0], description, CandidateType.ARGUMENT));
    }
    candidates.sort(Comparator.comparing(CompletionCandidate::text));
    return List.copyOf(candidates);
  }
}
