package io.dsh.shell.cli.completion;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompletionConfigTest {

  private Map<String, String> properties;
  private Map<String, String> environment;

  @BeforeEach
  void setUp() {
    properties = new HashMap<>();
    environment = new HashMap<>();
    environment.put("XDG_CONFIG_HOME", "/x");
  }

  private CompletionConfig resolve() {
    return CompletionConfig.resolve(properties::get, environment::get);
  }

  @Test
  void defaultsWhenNothingIsSet() {
    CompletionConfig config = resolve();

    assertEquals(30, config.maxResults());
    assertEquals(Duration.ofMillis(1500), config.commandTimeout());
    assertTrue(config.fuzzyFallback());
    assertEquals(Path.of("/x", "dsh"), config.configDirectory());
  }

  @Test
  void propertyWinsOverEnvironment() {
    properties.put(CompletionConfig.PROP_MAX_RESULTS, "12");
    environment.put(CompletionConfig.ENV_MAX_RESULTS, "50");
    environment.put(CompletionConfig.ENV_TIMEOUT_MS, "250");

    CompletionConfig config = resolve();

    assertEquals(12, config.maxResults());
    assertEquals(Duration.ofMillis(250), config.commandTimeout());
  }

  @Test
  void blankPropertyFallsThroughToEnvironment() {
    properties.put(CompletionConfig.PROP_MAX_RESULTS, "  ");
    environment.put(CompletionConfig.ENV_MAX_RESULTS, "7");

    assertEquals(7, resolve().maxResults());
  }

  @Test
  void malformedAndNonPositiveValuesUseDefaults() {
    properties.put(CompletionConfig.PROP_MAX_RESULTS, "lots");
    properties.put(CompletionConfig.PROP_TIMEOUT_MS, "-5");

    CompletionConfig config = resolve();

    assertEquals(CompletionConfig.DEFAULT_MAX_RESULTS, config.maxResults());
    assertEquals(CompletionConfig.DEFAULT_TIMEOUT, config.commandTimeout());
  }

  @Test
  void fuzzyFallbackCanBeDisabled() {
    environment.put(CompletionConfig.ENV_FUZZY, "false");

    assertFalse(resolve().fuzzyFallback());
  }

  @Test
  void configDirectoryFromProperty() {
    properties.put(CompletionConfig.PROP_CONFIG_DIR, "/etc/dsh-user");

    assertEquals(Path.of("/etc/dsh-user"), resolve().configDirectory());
  }

  @Test
  void constructorRejectsInvalidLimits() {
    Path dir = Path.of("/x");
    assertThrows(
        IllegalArgumentException.class,
        () -> new CompletionConfig(0, Duration.ofSeconds(1), true, dir));
    assertThrows(
        IllegalArgumentException.class, () -> new CompletionConfig(10, Duration.ZERO, true, dir));
  }
}
