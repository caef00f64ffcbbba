package io.dsh.shell.cli.completion.schema;

/** Thrown when a completion schema or dynamic completion definition is structurally invalid. */
public final class SchemaValidationException extends Exception {

  public SchemaValidationException(String message) {
    super(message);
  }

  public SchemaValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
