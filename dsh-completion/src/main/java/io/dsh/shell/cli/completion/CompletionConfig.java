package io.dsh.shell.cli.completion;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of the completion engine. Each value is taken from a system property, then an
 * environment variable, then a default.
 *
 * @param maxResults upper bound on candidates returned per request
 * @param commandTimeout hard limit for one external query
 * @param fuzzyFallback whether an empty prefix match is retried with fuzzy matching
 * @param configDirectory directory holding user configuration, including {@code completions/}
 */
public record CompletionConfig(
    int maxResults, Duration commandTimeout, boolean fuzzyFallback, Path configDirectory) {
  private static final Logger log = LoggerFactory.getLogger(CompletionConfig.class);

  public static final String PROP_MAX_RESULTS = "dsh.completion.max-results";
  public static final String ENV_MAX_RESULTS = "DSH_COMPLETION_MAX_RESULTS";
  public static final String PROP_TIMEOUT_MS = "dsh.completion.timeout-ms";
  public static final String ENV_TIMEOUT_MS = "DSH_COMPLETION_TIMEOUT_MS";
  public static final String PROP_FUZZY = "dsh.completion.fuzzy";
  public static final String ENV_FUZZY = "DSH_COMPLETION_FUZZY";
  public static final String PROP_CONFIG_DIR = "dsh.config.dir";
  public static final String ENV_CONFIG_DIR = "DSH_CONFIG_DIR";

  public static final int DEFAULT_MAX_RESULTS = 30;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(1500);

  public CompletionConfig {
    if (maxResults <= 0) {
      throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
    }
    if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
      throw new IllegalArgumentException("commandTimeout must be positive: " + commandTimeout);
    }
    if (configDirectory == null) {
      configDirectory = defaultConfigDirectory(System::getenv);
    }
  }

  /**
   * Creates the default configuration, ignoring system properties and environment.
   *
   * @return default configuration
   */
  public static CompletionConfig defaults() {
    return new CompletionConfig(
        DEFAULT_MAX_RESULTS, DEFAULT_TIMEOUT, true, defaultConfigDirectory(System::getenv));
  }

  /** Resolves the configuration from system properties and the process environment. */
  public static CompletionConfig load() {
    return resolve(System::getProperty, System::getenv);
  }

  /**
   * Resolves the configuration from the given lookups. Malformed values are logged and replaced
   * by the default.
   *
   * @param properties system property lookup
   * @param environment environment variable lookup
   * @return resolved configuration
   */
  static CompletionConfig resolve(
      UnaryOperator<String> properties, UnaryOperator<String> environment) {
    int maxResults =
        parseInt(
            lookup(properties, PROP_MAX_RESULTS, environment, ENV_MAX_RESULTS),
            PROP_MAX_RESULTS,
            DEFAULT_MAX_RESULTS);
    long timeoutMs =
        parseInt(
            lookup(properties, PROP_TIMEOUT_MS, environment, ENV_TIMEOUT_MS),
            PROP_TIMEOUT_MS,
            (int) DEFAULT_TIMEOUT.toMillis());
    String fuzzy = lookup(properties, PROP_FUZZY, environment, ENV_FUZZY);
    boolean fuzzyFallback = fuzzy == null || Boolean.parseBoolean(fuzzy.trim());

    String dir = lookup(properties, PROP_CONFIG_DIR, environment, ENV_CONFIG_DIR);
    Path configDirectory =
        dir != null ? Path.of(dir.trim()) : defaultConfigDirectory(environment);

    return new CompletionConfig(
        maxResults, Duration.ofMillis(timeoutMs), fuzzyFallback, configDirectory);
  }

  private static String lookup(
      UnaryOperator<String> properties,
      String property,
      UnaryOperator<String> environment,
      String variable) {
    String value = properties.apply(property);
    if (value == null || value.isBlank()) {
      value = environment.apply(variable);
    }
    return value == null || value.isBlank() ? null : value;
  }

  private static int parseInt(String value, String name, int fallback) {
    if (value == null) {
      return fallback;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      log.warn("Ignoring non-positive {}={}", name, value);
    } catch (NumberFormatException e) {
      log.warn("Ignoring malformed {}={}", name, value);
    }
    return fallback;
  }

  /** {@code $XDG_CONFIG_HOME/dsh}, else {@code ~/.config/dsh}. */
  static Path defaultConfigDirectory(UnaryOperator<String> environment) {
    String xdg = environment.apply("XDG_CONFIG_HOME");
    if (xdg != null && !xdg.isBlank()) {
      return Path.of(xdg, "dsh");
    }
    return Path.of(System.getProperty("user.home"), ".config", "dsh");
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "CompletionConfig[maxResults=%d, timeout=%dms, fuzzy=%s, configDir=%s]",
        maxResults,
        commandTimeout.toMillis(),
        fuzzyFallback,
        configDirectory);
  }
}
