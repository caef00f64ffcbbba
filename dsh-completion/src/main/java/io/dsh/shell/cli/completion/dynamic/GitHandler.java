package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Branch and remote names for git subcommands that take them.
 *
 * <p>{@code push}, {@code pull} and {@code fetch} take a remote first and then one of that
 * remote's branches. {@code checkout}, {@code switch}, {@code merge} and {@code rebase} take a
 * branch: local branches plus remote-tracking ones, or, once the word reads {@code remote/...},
 * the branches of that remote with the remote kept in the text.
 */
public final class GitHandler implements DynamicHandler {

  static final Set<String> REMOTE_FIRST = Set.of("push", "pull", "fetch");
  static final Set<String> BRANCH_FIRST = Set.of("checkout", "switch", "merge", "rebase");

  @Override
  public boolean matches(ParsedCommandLine parsed) {
    if (!"git".equals(parsed.command()) || parsed.subcommandPath().isEmpty()) {
      return false;
    }
    String sub = parsed.subcommandPath().get(0);
    if (!REMOTE_FIRST.contains(sub) && !BRANCH_FIRST.contains(sub)) {
      return false;
    }
    return DynamicHandler.isPositional(parsed) && positionals(parsed).size() <= 1;
  }

  @Override
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query)
      throws CompletionSourceException {
    String sub = parsed.subcommandPath().get(0);
    List<String> positionals = positionals(parsed);
    String partial = parsed.currentToken();

    if (REMOTE_FIRST.contains(sub)) {
      if (positionals.isEmpty()) {
        return remotes(partial, query);
      }
      String remote = positionals.get(0);
      if (!remoteNames(query).contains(remote)) {
        return List.of();
      }
      return remoteBranches(remote, partial, query, false);
    }

    int slash = partial.indexOf('/');
    if (slash > 0) {
      String remote = partial.substring(0, slash);
      if (remoteNames(query).contains(remote)) {
        return remoteBranches(remote, partial.substring(slash + 1), query, true);
      }
    }
    return localAndTrackingBranches(partial, query);
  }

  /** Words after the git subcommand, whether recognized as nested subcommands or arguments. */
  static List<String> positionals(ParsedCommandLine parsed) {
    List<String> path = parsed.subcommandPath();
    List<String> words = new ArrayList<>(path.subList(1, path.size()));
    words.addAll(parsed.specifiedArguments());
    if (!parsed.currentToken().isEmpty() && words.contains(parsed.currentToken())) {
      words.remove(parsed.currentToken());
    }
    return words;
  }

  private static List<CompletionCandidate> remotes(String partial, CommandQuery query)
      throws CompletionSourceException {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String remote : remoteNames(query)) {
      if (remote.startsWith(partial)) {
        candidates.add(candidate(remote, "remote"));
      }
    }
    return candidates;
  }

  private static Set<String> remoteNames(CommandQuery query) throws CompletionSourceException {
    Set<String> names = new LinkedHashSet<>();
    for (String line : query.lines("git", "remote")) {
      String name = line.trim();
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    return names;
  }

  /**
   * Branches of {@code remote} starting with {@code partial}.
   *
   * @param keepRemote whether candidate text is {@code remote/branch} rather than {@code branch}
   */
  private static List<CompletionCandidate> remoteBranches(
      String remote, String partial, CommandQuery query, boolean keepRemote)
      throws CompletionSourceException {
    String pattern = remote + "/" + partial + "*";
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String line : query.lines("git", "branch", "-r", "--list", pattern)) {
      String ref = line.trim();
      if (ref.isEmpty() || ref.contains(" -> ") || !ref.startsWith(remote + "/")) {
        continue;
      }
      String branch = ref.substring(remote.length() + 1);
      if (branch.startsWith(partial)) {
        candidates.add(candidate(keepRemote ? ref : branch, "branch on " + remote));
      }
    }
    return candidates;
  }

  private static List<CompletionCandidate> localAndTrackingBranches(
      String partial, CommandQuery query) throws CompletionSourceException {
    Set<String> local = new LinkedHashSet<>();
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String line : query.lines("git", "branch")) {
      boolean current = line.startsWith("* ");
      String branch = (current ? line.substring(2) : line).trim();
      if (branch.isEmpty() || branch.startsWith("(")) {
        continue;
      }
      local.add(branch);
      if (branch.startsWith(partial)) {
        candidates.add(candidate(branch, current ? "current branch" : "local branch"));
      }
    }

    Set<String> tracking = new LinkedHashSet<>();
    for (String line : query.lines("git", "branch", "-r")) {
      String ref = line.trim();
      int slash = ref.indexOf('/');
      if (ref.isEmpty() || ref.contains(" -> ") || slash <= 0) {
        continue;
      }
      String branch = ref.substring(slash + 1);
      if (!local.contains(branch) && branch.startsWith(partial) && tracking.add(branch)) {
        candidates.add(candidate(branch, "tracking " + ref));
      }
    }
    return candidates;
  }

  private static CompletionCandidate candidate(String text, String description) {
    return new CompletionCandidate(
        text, description, CandidateType.ARGUMENT, CompletionCandidate.PRIORITY_HIGH);
  }
}
