package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.schema.ArgumentType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Produces candidates for a value of a declared {@link ArgumentType}. */
public final class TypedArgumentGenerator {
  private static final Logger log = LoggerFactory.getLogger(TypedArgumentGenerator.class);

  /**
   * Adds candidates for {@code type} to {@code candidates}. A failing source is logged and adds
   * nothing.
   *
   * @param type declared value type
   * @param prefix typed text
   * @param sources generators of the current request
   * @param candidates list to add candidates to
   */
  public void generate(
      ArgumentType type,
      String prefix,
      CompletionSources sources,
      List<CompletionCandidate> candidates) {
    try {
      candidates.addAll(candidatesFor(type, prefix, sources));
    } catch (CompletionSourceException e) {
      log.warn("{} completion failed: {}", type.typeName(), e.getMessage());
    }
  }

  private List<CompletionCandidate> candidatesFor(
      ArgumentType type, String prefix, CompletionSources sources)
      throws CompletionSourceException {
    if (type instanceof ArgumentType.File file) {
      return sources.files().files(prefix, sources.currentDirectory(), file);
    }
    if (type instanceof ArgumentType.Directory) {
      return sources.files().directories(prefix, sources.currentDirectory());
    }
    if (type instanceof ArgumentType.Choice choice) {
      return choices(choice, prefix);
    }
    if (type instanceof ArgumentType.Command || type instanceof ArgumentType.CommandWithArgs) {
      return sources.executables().search(prefix);
    }
    if (type instanceof ArgumentType.Environment) {
      return environmentVariables(prefix, sources);
    }
    if (type instanceof ArgumentType.Signal) {
      return sources.signals().generate(prefix);
    }
    if (type instanceof ArgumentType.User) {
      return sources.users().generate(prefix);
    }
    if (type instanceof ArgumentType.Group) {
      return sources.groups().generate(prefix);
    }
    if (type instanceof ArgumentType.Interface) {
      return sources.interfaces().generate(prefix);
    }
    // free text
    return List.of();
  }

  private static List<CompletionCandidate> choices(ArgumentType.Choice choice, String prefix) {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String value : choice.values()) {
      if (value.startsWith(prefix)) {
        candidates.add(CompletionCandidate.of(value, CandidateType.ARGUMENT));
      }
    }
    return candidates;
  }

  private static List<CompletionCandidate> environmentVariables(
      String prefix, CompletionSources sources) {
    String sigil = prefix.startsWith("$") ? "$" : "";
    String name = prefix.substring(sigil.length());
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String variable : sources.environment().names()) {
      if (variable.startsWith(name)) {
        candidates.add(CompletionCandidate.of(sigil + variable, CandidateType.ARGUMENT));
      }
    }
    return candidates;
  }
}
