package io.dsh.shell.cli.completion;

import io.dsh.shell.cli.completion.generators.ExecutableSearch;
import io.dsh.shell.cli.completion.generators.FileSystemGenerator;
import io.dsh.shell.cli.completion.generators.GroupGenerator;
import io.dsh.shell.cli.completion.generators.InterfaceGenerator;
import io.dsh.shell.cli.completion.generators.ShellEnvironment;
import io.dsh.shell.cli.completion.generators.SignalGenerator;
import io.dsh.shell.cli.completion.generators.UserGenerator;
import io.dsh.shell.cli.completion.schema.CommandSchemaDatabase;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a completer may draw candidates from. The generators own their caches, so one
 * instance is kept for the engine's lifetime and re-targeted at each request's working directory.
 */
public record CompletionSources(
    CommandSchemaDatabase database,
    Path currentDirectory,
    ShellEnvironment environment,
    FileSystemGenerator files,
    ExecutableSearch executables,
    SignalGenerator signals,
    UserGenerator users,
    GroupGenerator groups,
    InterfaceGenerator interfaces) {

  public CompletionSources {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(currentDirectory, "currentDirectory");
    Objects.requireNonNull(environment, "environment");
  }

  /** Sources reading the live system through the given environment. */
  public static CompletionSources create(
      CommandSchemaDatabase database, ShellEnvironment environment) {
    return new CompletionSources(
        database,
        Path.of("").toAbsolutePath(),
        environment,
        new FileSystemGenerator(environment),
        new ExecutableSearch(environment),
        new SignalGenerator(),
        new UserGenerator(),
        new GroupGenerator(),
        new InterfaceGenerator());
  }

  public CompletionSources withCurrentDirectory(Path directory) {
    if (directory == null || directory.equals(currentDirectory)) {
      return this;
    }
    return new CompletionSources(
        database, directory, environment, files, executables, signals, users, groups, interfaces);
  }
}
