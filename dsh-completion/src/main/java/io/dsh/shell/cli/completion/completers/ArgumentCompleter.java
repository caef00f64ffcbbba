package io.dsh.shell.cli.completion.completers;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionContext;
import io.dsh.shell.cli.completion.CompletionSources;
import io.dsh.shell.cli.completion.ContextCompleter;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import io.dsh.shell.cli.completion.schema.ArgumentType;
import java.util.List;

/** Completer for positional arguments and option values with a declared type. */
public class ArgumentCompleter implements ContextCompleter {

  private final TypedArgumentGenerator arguments;

  public ArgumentCompleter(TypedArgumentGenerator arguments) {
    this.arguments = arguments;
  }

  @Override
  public boolean canHandle(ParsedCommandLine parsed) {
    CompletionContext ctx = parsed.completionContext();
    return ctx instanceof CompletionContext.Argument
        || ctx instanceof CompletionContext.OptionValue;
  }

  @Override
  public void complete(
      ParsedCommandLine parsed, CompletionSources sources, List<CompletionCandidate> candidates) {
    ArgumentType type = typeOf(parsed.completionContext());
    if (type != null) {
      arguments.generate(type, parsed.currentToken(), sources, candidates);
    }
  }

  private static ArgumentType typeOf(CompletionContext ctx) {
    if (ctx instanceof CompletionContext.Argument argument) {
      return argument.argType();
    }
    if (ctx instanceof CompletionContext.OptionValue value) {
      return value.valueType();
    }
    return null;
  }
}
