package io.dsh.shell.cli.completion;

import io.dsh.shell.cli.completion.cache.CompletionCache;
import io.dsh.shell.cli.completion.generators.DirectoryLister;
import io.dsh.shell.cli.completion.generators.ExecutableSearch;
import io.dsh.shell.cli.completion.generators.FileSystemGenerator;
import io.dsh.shell.cli.completion.generators.GroupGenerator;
import io.dsh.shell.cli.completion.generators.InterfaceGenerator;
import io.dsh.shell.cli.completion.generators.ShellEnvironment;
import io.dsh.shell.cli.completion.generators.SignalGenerator;
import io.dsh.shell.cli.completion.generators.UserGenerator;
import io.dsh.shell.cli.completion.schema.Argument;
import io.dsh.shell.cli.completion.schema.ArgumentType;
import io.dsh.shell.cli.completion.schema.CommandCompletion;
import io.dsh.shell.cli.completion.schema.CommandOption;
import io.dsh.shell.cli.completion.schema.CommandSchemaDatabase;
import io.dsh.shell.cli.completion.schema.SubCommand;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Builds completion sources backed by a scratch directory instead of the real system. */
public final class TestSources {

  /** Directory the fake PATH points at. */
  public static final Path BIN = Path.of("/test-bin");

  /** Executables found in {@link #BIN}. */
  public static final List<String> EXECUTABLES = List.of("gitk", "grep", "python3", "tool");

  private TestSources() {}

  /**
   * Creates sources rooted at {@code root}: {@code root/work} is the current directory, {@code
   * root/home} is {@code $HOME}, and account files live under {@code root/etc}.
   */
  public static CompletionSources create(CommandSchemaDatabase database, Path root)
      throws IOException {
    Path work = Files.createDirectories(root.resolve("work"));
    Path home = Files.createDirectories(root.resolve("home"));
    Path etc = Files.createDirectories(root.resolve("etc"));
    Path net = Files.createDirectories(root.resolve("net"));
    Files.writeString(
        etc.resolve("passwd"),
        String.join(
            "\n",
            "root:x:0:0:root:/root:/bin/bash",
            "daemon:x:1:1:daemon:/usr/sbin:/usr/sbin/nologin",
            "alice:x:1000:1000:Alice Liddell:/home/alice:/bin/bash",
            "bob:x:1001:1001::/home/bob:/bin/zsh"),
        StandardCharsets.UTF_8);
    Files.writeString(
        etc.resolve("group"),
        String.join("\n", "root:x:0:", "wheel:x:10:alice", "users:x:100:alice,bob"),
        StandardCharsets.UTF_8);

    ShellEnvironment environment =
        ShellEnvironment.of(
            Map.of("PATH", BIN.toString(), "HOME", home.toString(), "EDITOR", "vi"));
    DirectoryLister bin =
        dir -> {
          if (!dir.equals(BIN)) {
            throw new IOException("no such directory: " + dir);
          }
          return EXECUTABLES.stream()
              .map(name -> new DirectoryLister.Entry(name, false, true))
              .toList();
        };

    return new CompletionSources(
        database,
        work,
        environment,
        new FileSystemGenerator(
            environment, DirectoryLister.fileSystem(), new CompletionCache<>(Duration.ofMillis(1))),
        new ExecutableSearch(environment, bin, new CompletionCache<>(CompletionCache.PATH_TTL)),
        new SignalGenerator(),
        new UserGenerator(
            etc.resolve("passwd"), false, new CompletionCache<>(CompletionCache.ACCOUNT_TTL)),
        new GroupGenerator(
            etc.resolve("group"), new CompletionCache<>(CompletionCache.ACCOUNT_TTL)),
        new InterfaceGenerator(net, new CompletionCache<>(CompletionCache.INTERFACE_TTL)));
  }

  /** A small git-like schema with nested subcommands, aliases and typed values. */
  public static CommandCompletion gitSchema() {
    SubCommand commit =
        new SubCommand(
            "commit",
            "Record changes",
            List.of("ci"),
            List.of(
                CommandOption.withValue(
                    "-m", "--message", "Commit message", new ArgumentType.Text()),
                CommandOption.flag("-a", "--all", "Commit all changed files"),
                CommandOption.flag("-v", "--verbose", "Show diff"),
                CommandOption.flag("-s", "--signoff", "Add Signed-off-by"),
                CommandOption.withValue("-F", "--file", "Message file", ArgumentType.File.any())),
            List.of(),
            List.of());
    SubCommand checkout =
        new SubCommand(
            "checkout",
            "Switch branches",
            List.of("co"),
            List.of(CommandOption.flag("-b", null, "Create branch")),
            List.of(Argument.of("branch", new ArgumentType.Text())),
            List.of());
    SubCommand remoteAdd =
        new SubCommand(
            "add",
            "Add a remote",
            List.of(),
            List.of(),
            List.of(
                Argument.of("name", new ArgumentType.Text()),
                Argument.of("url", new ArgumentType.Text())),
            List.of());
    SubCommand remote =
        new SubCommand(
            "remote", "Manage remotes", List.of(), List.of(), List.of(), List.of(remoteAdd));
    SubCommand add =
        new SubCommand(
            "add",
            "Add files",
            List.of(),
            List.of(CommandOption.flag("-p", "--patch", "Pick hunks")),
            List.of(new Argument("pathspec", null, ArgumentType.File.any(), true)),
            List.of());
    return new CommandCompletion(
        "git",
        "Version control",
        List.of(
            CommandOption.withValue("-C", null, "Run in directory", new ArgumentType.Directory()),
            CommandOption.flag(null, "--version", "Print version")),
        List.of(add, commit, checkout, remote),
        List.of());
  }

  /** A command with one subcommand and a typed top-level argument. */
  public static CommandCompletion toolSchema() {
    return new CommandCompletion(
        "tool",
        "Test tool",
        List.of(
            CommandOption.withValue(
                null,
                "--color",
                "Coloring",
                new ArgumentType.Choice(List.of("auto", "always", "never")))),
        List.of(new SubCommand("init", "Initialize", List.of(), List.of(), List.of(), List.of())),
        List.of(Argument.of("dir", new ArgumentType.Directory())));
  }

  public static CommandSchemaDatabase database() {
    return CommandSchemaDatabase.of(gitSchema(), toolSchema());
  }
}
