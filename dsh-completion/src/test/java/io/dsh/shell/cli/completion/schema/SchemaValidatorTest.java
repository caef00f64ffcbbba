package io.dsh.shell.cli.completion.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {

  private SchemaValidator validator;

  @BeforeEach
  void setUp() {
    validator = new SchemaValidator();
  }

  private static CommandCompletion command(String name, List<CommandOption> options) {
    return new CommandCompletion(name, null, options, List.of(), List.of());
  }

  @Nested
  class Options {

    @Test
    void rejectsOptionWithoutAnyForm() {
      CommandOption option = new CommandOption(null, null, "nothing", false, null);

      SchemaValidationException e =
          assertThrows(
              SchemaValidationException.class, () -> validator.validateOption(option, "x"));
      assertTrue(e.getMessage().contains("either short or long"));
    }

    @Test
    void rejectsShortFormWithTwoDashes() {
      assertThrows(
          SchemaValidationException.class,
          () -> validator.validateOption(CommandOption.flag("--x", null, null), "x"));
    }

    @Test
    void rejectsBareDoubleDashLongForm() {
      assertThrows(
          SchemaValidationException.class,
          () -> validator.validateOption(CommandOption.flag(null, "--", null), "x"));
    }

    @Test
    void rejectsLongFormWithSingleDash() {
      assertThrows(
          SchemaValidationException.class,
          () -> validator.validateOption(CommandOption.flag(null, "-verbose", null), "x"));
    }

    @Test
    void acceptsNumericShortForm() {
      assertDoesNotThrow(() -> validator.validateOption(CommandOption.flag("-1", null, null), "x"));
    }

    @Test
    void acceptsMultiCharacterShortForm() {
      assertDoesNotThrow(
          () -> validator.validateOption(CommandOption.flag("-Syu", null, null), "pacman"));
    }

    @Test
    void formHelpers() {
      assertTrue(SchemaValidator.isValidShortForm("-v"));
      assertFalse(SchemaValidator.isValidShortForm("-"));
      assertFalse(SchemaValidator.isValidShortForm("v"));
      assertTrue(SchemaValidator.isValidLongForm("--verbose"));
      assertFalse(SchemaValidator.isValidLongForm("--"));
      assertFalse(SchemaValidator.isValidLongForm("--no pager"));
    }
  }

  @Nested
  class Commands {

    @Test
    void acceptsWellFormedCommand() {
      CommandCompletion git =
          command("git", List.of(CommandOption.flag("-v", "--version", "Print version")));

      assertDoesNotThrow(() -> validator.validate(git));
    }

    @Test
    void rejectsEmptyCommandName() {
      assertThrows(
          SchemaValidationException.class, () -> validator.validate(command("", List.of())));
      assertThrows(
          SchemaValidationException.class, () -> validator.validate(command(null, List.of())));
    }

    @Test
    void rejectsWhitespaceInCommandName() {
      assertThrows(
          SchemaValidationException.class, () -> validator.validate(command("my cmd", List.of())));
    }

    @Test
    void rejectsEmptyAlias() {
      SubCommand sub = new SubCommand("status", null, List.of(""), null, null, null);
      CommandCompletion git = new CommandCompletion("git", null, null, List.of(sub), null);

      assertThrows(SchemaValidationException.class, () -> validator.validate(git));
    }

    @Test
    void rejectsArgumentWithoutName() {
      CommandCompletion cd =
          new CommandCompletion(
              "cd", null, null, null, List.of(Argument.of("", new ArgumentType.Directory())));

      assertThrows(SchemaValidationException.class, () -> validator.validate(cd));
    }

    @Test
    void reportsFullPathOfNestedSubcommand() {
      SubCommand add =
          new SubCommand(
              "add", null, null, List.of(CommandOption.flag("bad", null, null)), null, null);
      SubCommand remote = new SubCommand("remote", null, null, null, null, List.of(add));
      CommandCompletion git = new CommandCompletion("git", null, null, List.of(remote), null);

      SchemaValidationException e =
          assertThrows(SchemaValidationException.class, () -> validator.validate(git));
      assertTrue(e.getMessage().contains("git remote add"), e.getMessage());
    }
  }
}
