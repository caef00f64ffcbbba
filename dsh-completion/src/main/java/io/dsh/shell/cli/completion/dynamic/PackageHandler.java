package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Package names for {@code pacman -S} and {@code apt install} / {@code apt-get install},
 * optionally run through {@code sudo}.
 */
public final class PackageHandler implements DynamicHandler {

  private static final Pattern PACKAGE_PREFIX = Pattern.compile("[A-Za-z0-9@._+-]*");

  enum Manager {
    PACMAN,
    APT
  }

  @Override
  public boolean matches(ParsedCommandLine parsed) {
    return DynamicHandler.isPositional(parsed)
        && manager(parsed.precedingWords()) != null
        && PACKAGE_PREFIX.matcher(parsed.currentToken()).matches();
  }

  @Override
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException {
    String partial = parsed.currentToken();
    List<String> lines =
        switch (manager(parsed.precedingWords())) {
          case PACMAN -> query.lines("pacman", "-Ssq", "^" + partial);
          case APT -> partial.isEmpty()
              ? query.lines("apt-cache", "pkgnames")
              : query.lines("apt-cache", "pkgnames", partial);
        };

    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String line : lines) {
      String name = line.trim();
      if (!name.isEmpty() && name.startsWith(partial)) {
        candidates.add(
            new CompletionCandidate(
                name, "package", CandidateType.ARGUMENT, CompletionCandidate.PRIORITY_HIGH));
      }
    }
    return candidates;
  }

  /** The package manager install invocation in {@code words}, or null. */
  static Manager manager(List<String> words) {
    int start = !words.isEmpty() && "sudo".equals(words.get(0)) ? 1 : 0;
    if (words.size() <= start) {
      return null;
    }
    String program = words.get(start);
    List<String> rest = words.subList(start + 1, words.size());
    if ("pacman".equals(program)) {
      for (String word : rest) {
        if (word.startsWith("-S") && !word.startsWith("--")) {
          return Manager.PACMAN;
        }
      }
      return null;
    }
    if ("apt".equals(program) || "apt-get".equals(program)) {
      return rest.contains("install") ? Manager.APT : null;
    }
    return null;
  }
}
