package io.dsh.shell.cli.completion.dynamic;

import com.google.gson.annotations.SerializedName;
import io.dsh.shell.cli.completion.CompletionCandidate;
import java.util.List;

/**
 * A dynamic completion declared in a definition file: when {@link #matchCondition} holds, {@link
 * #shellCommand} runs through {@code sh -c} and each output line becomes a candidate.
 *
 * <p>The template may reference {@code $COMMAND}, {@code $SUBCOMMAND} (the first subcommand) and
 * {@code $CURRENT_TOKEN}; values are substituted single-quoted, so templates use them unquoted.
 *
 * @param command command this definition belongs to
 * @param subcommands subcommands for {@link MatchCondition.HasSubcommand}
 * @param description shown next to every candidate
 * @param matchCondition when to run; {@link MatchCondition.StartsWithCommand} when absent
 * @param shellCommand shell command template
 * @param filterOutput substring every output line must contain, or null
 * @param priority candidate priority; {@link CompletionCandidate#PRIORITY_HIGH} when absent
 */
public record ScriptDefinition(
    String command,
    List<String> subcommands,
    String description,
    @SerializedName("match_condition") MatchCondition matchCondition,
    @SerializedName("shell_command") String shellCommand,
    @SerializedName("filter_output") String filterOutput,
    Integer priority) {

  public ScriptDefinition {
    subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
    if (matchCondition == null) {
      matchCondition = new MatchCondition.StartsWithCommand();
    }
    if (priority == null) {
      priority = CompletionCandidate.PRIORITY_HIGH;
    }
  }
}
