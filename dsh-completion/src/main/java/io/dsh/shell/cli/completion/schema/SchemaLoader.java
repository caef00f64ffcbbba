package io.dsh.shell.cli.completion.schema;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.dsh.shell.cli.completion.CompletionConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads command schemas into a {@link CommandSchemaDatabase}.
 *
 * <p>Sources, in registration order (the first registrant for a command name wins):
 *
 * <ol>
 *   <li>bundled definitions on the classpath under {@code completions/}, listed by {@code
 *       completions/index.txt}
 *   <li>{@code <config-dir>/completions}
 *   <li>{@code ~/.config/dsh/completions}
 *   <li>{@code ./completions} relative to the working directory
 * </ol>
 *
 * <p>A file that fails to parse or validate is logged and skipped; it never aborts the load.
 */
public final class SchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

  static final String BUNDLED_DIR = "completions/";
  static final String BUNDLED_INDEX = BUNDLED_DIR + "index.txt";
  private static final String COMPLETIONS_DIR = "completions";
  private static final String APP_NAME = "dsh";

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(ArgumentType.class, new ArgumentTypeAdapter())
          .setPrettyPrinting()
          .create();

  private final List<Path> directories;
  private final boolean includeBundled;
  private final ClassLoader classLoader;
  private final SchemaValidator validator = new SchemaValidator();

  public SchemaLoader(List<Path> directories) {
    this(directories, true, SchemaLoader.class.getClassLoader());
  }

  /**
   * Constructor for testing that can skip the bundled definitions.
   *
   * @param directories user directories in lookup order
   * @param includeBundled whether to load classpath definitions first
   * @param classLoader class loader for bundled definitions
   */
  SchemaLoader(List<Path> directories, boolean includeBundled, ClassLoader classLoader) {
    this.directories = List.copyOf(directories);
    this.includeBundled = includeBundled;
    this.classLoader = classLoader;
  }

  /** Creates a loader over the standard lookup directories. */
  public static SchemaLoader withDefaultDirectories(CompletionConfig config, Path workingDir) {
    return new SchemaLoader(defaultDirectories(config, workingDir));
  }

  static List<Path> defaultDirectories(CompletionConfig config, Path workingDir) {
    return lookupDirectories(config, workingDir, COMPLETIONS_DIR);
  }

  /**
   * Directories named {@code name} in lookup order: under the config directory, under {@code
   * ~/.config/dsh}, then under the working directory. Duplicates are dropped.
   *
   * @param config supplies the config directory
   * @param workingDir directory for the project-local lookup
   * @param name directory name to resolve in each location
   * @return absolute, normalized paths
   */
  public static List<Path> lookupDirectories(
      CompletionConfig config, Path workingDir, String name) {
    Set<Path> dirs = new LinkedHashSet<>();
    dirs.add(config.configDirectory().resolve(name).toAbsolutePath().normalize());
    String userHome = System.getProperty("user.home");
    if (userHome != null && !userHome.isBlank()) {
      dirs.add(Paths.get(userHome, ".config", APP_NAME, name).toAbsolutePath().normalize());
    }
    dirs.add(workingDir.resolve(name).toAbsolutePath().normalize());
    return new ArrayList<>(dirs);
  }

  /**
   * Returns the database loaded from the default sources, loading it on first use. Later calls
   * return the same instance.
   */
  public static CommandSchemaDatabase sharedDatabase() {
    return Holder.INSTANCE;
  }

  private static final class Holder {
    static final CommandSchemaDatabase INSTANCE =
        withDefaultDirectories(CompletionConfig.load(), Paths.get("").toAbsolutePath()).load();
  }

  /** Loads all sources into a new database. */
  public CommandSchemaDatabase load() {
    CommandSchemaDatabase.Builder builder = CommandSchemaDatabase.builder();
    if (includeBundled) {
      int count = loadBundled(builder);
      log.debug("Loaded {} bundled completion schemas", count);
    }
    for (Path dir : directories) {
      int count = loadDirectory(dir, builder);
      if (count > 0) {
        log.debug("Loaded {} completion schemas from {}", count, dir);
      }
    }
    CommandSchemaDatabase database = builder.build();
    log.debug("Completion database ready: {}", database.commandNames());
    return database;
  }

  /**
   * Parses and validates a single schema document.
   *
   * @param json the JSON text
   * @param source name used in error messages
   * @return the validated schema
   * @throws SchemaValidationException if the document is malformed or invalid
   */
  public CommandCompletion parse(String json, String source) throws SchemaValidationException {
    CommandCompletion completion;
    try {
      completion = GSON.fromJson(json, CommandCompletion.class);
    } catch (JsonParseException | IllegalStateException e) {
      throw new SchemaValidationException(
          "Malformed schema in " + source + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      // Gson wraps failures of record constructors, e.g. null list elements
      throw new SchemaValidationException(
          "Unreadable schema in " + source + ": " + e.getMessage(), e);
    }
    if (completion == null) {
      throw new SchemaValidationException("Empty schema in " + source);
    }
    validator.validate(completion);
    return completion;
  }

  /** Serializes a schema in the canonical file format. */
  public static String toJson(CommandCompletion completion) {
    return GSON.toJson(completion);
  }

  private int loadBundled(CommandSchemaDatabase.Builder builder) {
    String index = readResource(BUNDLED_INDEX);
    if (index == null) {
      log.debug("No bundled completion index found");
      return 0;
    }
    int count = 0;
    for (String line : index.split("\\R")) {
      String name = line.trim();
      if (name.isEmpty() || name.startsWith("#")) {
        continue;
      }
      String json = readResource(BUNDLED_DIR + name);
      if (json == null) {
        log.warn("Bundled completion '{}' listed in index but missing", name);
        continue;
      }
      if (register(json, "bundled:" + name, builder)) {
        count++;
      }
    }
    return count;
  }

  private int loadDirectory(Path dir, CommandSchemaDatabase.Builder builder) {
    if (!Files.isDirectory(dir)) {
      return 0;
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
      log.warn("Cannot list completion directory {}: {}", dir, e.getMessage());
      return 0;
    }

    int count = 0;
    for (Path file : files) {
      String json;
      try {
        json = Files.readString(file, StandardCharsets.UTF_8);
      } catch (IOException e) {
        log.warn("Failed to read completion file {}: {}", file, e.getMessage());
        continue;
      }
      if (register(json, file.toString(), builder)) {
        count++;
      }
    }
    return count;
  }

  private boolean register(String json, String source, CommandSchemaDatabase.Builder builder) {
    CommandCompletion completion;
    try {
      completion = parse(json, source);
    } catch (SchemaValidationException e) {
      log.warn("Skipping completion schema {}: {}", source, e.getMessage());
      return false;
    }
    if (!builder.register(completion)) {
      log.debug("Command '{}' from {} already registered, skipping", completion.command(), source);
      return false;
    }
    return true;
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
}
