package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.ContextCompleter;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import io.dsh.shell.cli.completion.schema.CommandCompletion;
import io.dsh.shell.cli.completion.schema.CommandOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Completer for options: global options plus those of the current subcommand, without the forms
 * already on the line. A bundle of known short flags such as {@code -am} is extended by each
 * further flag that takes no value ({@code -amv}).
 */
public class OptionCompleter implements ContextCompleter {

  @Override
  public boolean canHandle(ParsedCommandLine parsed) {
    return parsed.completionContext().isOption();
  }

  @Override
  public void complete(
      ParsedCommandLine parsed, CompletionSources sources, List<CompletionCandidate> candidates) {
    Optional<CommandCompletion> schema = sources.database().get(parsed.command());
    if (schema.isEmpty()) {
      return;
    }
    String partial = parsed.currentToken();
    List<CommandOption> options = schema.get().optionsAfter(parsed.subcommandPath());
    for (CommandOption option : options) {
      addForms(option, partial, parsed.specifiedOptions(), candidates);
    }
    completeBundle(partial, options, parsed.specifiedOptions(), candidates);
  }

  static void addForms(
      CommandOption option,
      String partial,
      List<String> specified,
      List<CompletionCandidate> candidates) {
    String shortForm = option.shortForm();
    if (shortForm != null && shortForm.startsWith(partial) && !specified.contains(shortForm)) {
      candidates.add(
          CompletionCandidate.of(shortForm, option.description(), CandidateType.SHORT_OPTION));
    }
    String longForm = option.longForm();
    if (longForm != null && longForm.startsWith(partial) && !specified.contains(longForm)) {
      candidates.add(
          CompletionCandidate.of(longForm, option.description(), CandidateType.LONG_OPTION));
    }
  }

  /**
   * Extends {@code -xy} when every letter is a declared flag that takes no value.
   *
   * @param partial typed token
   * @param options visible options
   * @param specified options already on the line
   * @param candidates list to add candidates to
   */
  static void completeBundle(
      String partial,
      List<CommandOption> options,
      List<String> specified,
      List<CompletionCandidate> candidates) {
    if (partial.length() < 3 || partial.charAt(0) != '-' || partial.charAt(1) == '-') {
      return;
    }
    Map<Character, CommandOption> flags = new TreeMap<>();
    for (CommandOption option : options) {
      String form = option.shortForm();
      if (form != null && form.length() == 2) {
        flags.put(form.charAt(1), option);
      }
    }
    String letters = partial.substring(1);
    for (int i = 0; i < letters.length(); i++) {
      CommandOption flag = flags.get(letters.charAt(i));
      // a flag that takes a value ends the bundle
      if (flag == null || flag.takesValue()) {
        return;
      }
    }
    for (Map.Entry<Character, CommandOption> entry : flags.entrySet()) {
      char letter = entry.getKey();
      CommandOption flag = entry.getValue();
      if (flag.takesValue()
          || letters.indexOf(letter) >= 0
          || specified.contains(flag.shortForm())) {
        continue;
      }
      candidates.add(
          CompletionCandidate.of(
              partial + letter, flag.description(), CandidateType.SHORT_OPTION));
    }
  }
}
