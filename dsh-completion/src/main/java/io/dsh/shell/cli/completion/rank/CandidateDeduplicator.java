package io.dsh.shell.cli.completion.rank;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges candidates that share a base name. An executable replaces a plain file of the same name
 * in the file's position; otherwise the first candidate seen is kept.
 */
public final class CandidateDeduplicator {

  public List<CompletionCandidate> deduplicate(List<CompletionCandidate> candidates) {
    Map<String, CompletionCandidate> byName = new LinkedHashMap<>();
    for (CompletionCandidate candidate : candidates) {
      String key = candidate.baseName();
      CompletionCandidate existing = byName.get(key);
      if (existing == null) {
        byName.put(key, candidate);
      } else if (existing.type() == CandidateType.FILE
          && candidate.type() == CandidateType.EXECUTABLE) {
        byName.put(key, candidate);
      }
    }
    return new ArrayList<>(byName.values());
  }
}
