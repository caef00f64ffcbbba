package io.dsh.shell.cli.completion.dynamic;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.dsh.shell.cli.completion.CompletionConfig;
import io.dsh.shell.cli.completion.schema.SchemaLoader;
import io.dsh.shell.cli.completion.schema.SchemaValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ScriptDefinition}s from definition files of the form {@code {"dynamic_completions":
 * [...]}}.
 *
 * <p>Bundled files on the classpath under {@code dynamic-completions/} (listed by {@code
 * dynamic-completions/index.txt}) load first, then every {@code *.json} file in the {@code
 * dynamic-completions} lookup directories. All definitions are kept; several may apply to one
 * command. A file that fails to parse or validate is logged and skipped.
 */
public final class ScriptDefinitionLoader {
  private static final Logger log = LoggerFactory.getLogger(ScriptDefinitionLoader.class);

  static final String BUNDLED_DIR = "dynamic-completions/";
  static final String BUNDLED_INDEX = BUNDLED_DIR + "index.txt";
  private static final String DEFINITIONS_DIR = "dynamic-completions";

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(MatchCondition.class, new MatchConditionAdapter())
          .create();

  private final List<Path> directories;
  private final boolean includeBundled;
  private final ClassLoader classLoader;

  public ScriptDefinitionLoader(List<Path> directories) {
    this(directories, true, ScriptDefinitionLoader.class.getClassLoader());
  }

  ScriptDefinitionLoader(List<Path> directories, boolean includeBundled, ClassLoader classLoader) {
    this.directories = List.copyOf(directories);
    this.includeBundled = includeBundled;
    this.classLoader = classLoader;
  }

  /** Creates a loader over the same lookup locations as the command schemas. */
  public static ScriptDefinitionLoader withDefaultDirectories(
      CompletionConfig config, Path workingDir) {
    return new ScriptDefinitionLoader(
        SchemaLoader.lookupDirectories(config, workingDir, DEFINITIONS_DIR));
  }

  /** Loads all sources, bundled definitions first. */
  public List<ScriptDefinition> load() {
    List<ScriptDefinition> definitions = new ArrayList<>();
    if (includeBundled) {
      loadBundled(definitions);
    }
    for (Path dir : directories) {
      loadDirectory(dir, definitions);
    }
    log.debug("Loaded {} dynamic completion definitions", definitions.size());
    return definitions;
  }

  /**
   * Parses and validates one definition file.
   *
   * @param json the JSON text
   * @param source name used in error messages
   * @return the definitions in file order
   * @throws SchemaValidationException if the file is malformed or a definition is invalid
   */
  public List<ScriptDefinition> parse(String json, String source)
      throws SchemaValidationException {
    DefinitionFile file;
    try {
      file = GSON.fromJson(json, DefinitionFile.class);
    } catch (JsonParseException | IllegalStateException e) {
      throw new SchemaValidationException(
          "Malformed definitions in " + source + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new SchemaValidationException(
          "Unreadable definitions in " + source + ": " + e.getMessage(), e);
    }
    if (file == null || file.dynamicCompletions() == null) {
      throw new SchemaValidationException("No dynamic_completions in " + source);
    }
    for (ScriptDefinition definition : file.dynamicCompletions()) {
      validate(definition, source);
    }
    return List.copyOf(file.dynamicCompletions());
  }

  static void validate(ScriptDefinition definition, String source)
      throws SchemaValidationException {
    if (definition == null) {
      throw new SchemaValidationException("Null definition in " + source);
    }
    if (definition.command() == null || definition.command().isBlank()) {
      throw new SchemaValidationException("Definition without command in " + source);
    }
    if (definition.shellCommand() == null || definition.shellCommand().isBlank()) {
      throw new SchemaValidationException(
          "Definition for '" + definition.command() + "' without shell_command in " + source);
    }
    if (definition.matchCondition() instanceof MatchCondition.HasSubcommand
        && definition.subcommands().isEmpty()) {
      throw new SchemaValidationException(
          "HasSubcommand for '" + definition.command() + "' lists no subcommands in " + source);
    }
  }

  private void loadBundled(List<ScriptDefinition> definitions) {
    String index = readResource(BUNDLED_INDEX);
    if (index == null) {
      log.debug("No bundled dynamic completion index found");
      return;
    }
    for (String line : index.split("\\R")) {
      String name = line.trim();
      if (name.isEmpty() || name.startsWith("#")) {
        continue;
      }
      String json = readResource(BUNDLED_DIR + name);
      if (json == null) {
        log.warn("Bundled dynamic completion '{}' listed in index but missing", name);
        continue;
      }
      register(json, "bundled:" + name, definitions);
    }
  }

  private void loadDirectory(Path dir, List<ScriptDefinition> definitions) {
    if (!Files.isDirectory(dir)) {
      return;
    }
    List<Path> files;
    try (Stream<Path> stream = Files.list(dir)) {
      files =
          stream
              .filter(p -> p.getFileName().toString().endsWith(".json"))
              .filter(Files::isRegularFile)
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException e) {
      log.warn("Cannot list dynamic completion directory {}: {}", dir, e.getMessage());
      return;
    }
    for (Path file : files) {
      try {
        register(Files.readString(file, StandardCharsets.UTF_8), file.toString(), definitions);
      } catch (IOException e) {
        log.warn("Failed to read dynamic completion file {}: {}", file, e.getMessage());
      }
    }
  }

  private void register(String json, String source, List<ScriptDefinition> definitions) {
    try {
      List<ScriptDefinition> parsed = parse(json, source);
      log.debug("Loaded {} dynamic completions from {}", parsed.size(), source);
      definitions.addAll(parsed);
    } catch (SchemaValidationException e) {
      log.warn("Skipping dynamic completion file {}: {}", source, e.getMessage());
    }
  }

  private String readResource(String name) {
    try (InputStream in = classLoader.getResourceAsStream(name)) {
      if (in == null) {
        return null;
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Failed to read bundled resource {}: {}", name, e.getMessage());
      return null;
    }
  }

  record DefinitionFile(
      @SerializedName("dynamic_completions") List<ScriptDefinition> dynamicCompletions) {}
}
