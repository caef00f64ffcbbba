package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Helpers shared by the colon-separated account database readers. */
final class AccountFiles {
  private AccountFiles() {}

  /** Non-comment, non-blank lines of {@code file}, split on {@code :}. */
  static List<String[]> records(Path file) throws CompletionSourceException {
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CompletionSourceException("Cannot read " + file, e);
    }
    List<String[]> records = new ArrayList<>(lines.size());
    for (String line : lines) {
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      records.add(line.split(":", -1));
    }
    return records;
  }

  /** Case-insensitive prefix filter. */
  static List<CompletionCandidate> filter(List<CompletionCandidate> candidates, String prefix) {
    if (prefix.isEmpty()) {
      return candidates;
    }
    String lower = prefix.toLowerCase(Locale.ROOT);
    List<CompletionCandidate> matches = new ArrayList<>();
    for (CompletionCandidate candidate : candidates) {
      if (candidate.text().toLowerCase(Locale.ROOT).startsWith(lower)) {
        matches.add(candidate);
      }
    }
    return matches;
  }
}
