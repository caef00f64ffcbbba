package io.dsh.shell.cli.completion.generators;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Environment variables visible to completion: search path, home directory, variable names. */
public final class ShellEnvironment {
  private static final Logger log = LoggerFactory.getLogger(ShellEnvironment.class);

  private final Map<String, String> variables;

  private ShellEnvironment(Map<String, String> variables) {
    this.variables = Map.copyOf(variables);
  }

  /** The environment of this process. */
  public static ShellEnvironment system() {
    return new ShellEnvironment(System.getenv());
  }

  public static ShellEnvironment of(Map<String, String> variables) {
    return new ShellEnvironment(variables);
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  /** Variable names in sorted order. */
  public Set<String> names() {
    return new TreeSet<>(variables.keySet());
  }

  /**
   * Directories of {@code PATH}, in search order. Empty and malformed entries are skipped.
   *
   * @return search path directories
   */
  public List<Path> searchPath() {
    String path = variables.get("PATH");
    if (path == null || path.isEmpty()) {
      return List.of();
    }
    List<Path> dirs = new ArrayList<>();
    for (String entry : path.split(File.pathSeparator)) {
      if (entry.isEmpty()) {
        continue;
      }
      try {
        dirs.add(Path.of(entry));
      } catch (InvalidPathException e) {
        log.debug("Skipping malformed PATH entry '{}': {}", entry, e.getMessage());
      }
    }
    return dirs;
  }

  public Optional<Path> home() {
    String home = variables.get("HOME");
    if (home == null || home.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(home));
  }

  /**
   * Expands a leading {@code ~} or {@code ~/} to the home directory.
   *
   * @param path path as typed
   * @return the expanded path, or {@code path} unchanged when there is no home directory
   */
  public String expandHome(String path) {
    if (!path.equals("~") && !path.startsWith("~/")) {
      return path;
    }
    return home().map(h -> h + path.substring(1)).orElse(path);
  }

  /**
   * Replaces the home directory prefix of an absolute path with {@code ~}.
   *
   * @param path absolute path
   * @return the {@code ~/}-relative display form, or {@code path} if it is outside home
   */
  public String contractHome(String path) {
    Optional<Path> home = home();
    if (home.isEmpty()) {
      return path;
    }
    String prefix = home.get().toString();
    if (path.equals(prefix)) {
      return "~";
    }
    if (path.startsWith(prefix + "/")) {
      return "~" + path.substring(prefix.length());
    }
    return path;
  }
}
