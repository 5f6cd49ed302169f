package io.github.stratum.dbu.exception;

import java.util.List;
import java.util.Map;

/**
 * Missing or malformed configuration.
 */
public class ConfigException extends StratumException {

  private final List<String> missingVariables;

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public ConfigException(final String message) {
    this(message, List.of());
  }

  /**
   * Instantiates a new exception listing the variables that were not set.
   *
   * @param message          the message
   * @param missingVariables the missing variable names
   */
  public ConfigException(final String message, final List<String> missingVariables) {
    super(message, missingVariables.isEmpty() ? Map.of() : Map.of("missingVariables", List.copyOf(missingVariables)),
        null);
    this.missingVariables = List.copyOf(missingVariables);
  }

  /**
   * Missing variables.
   *
   * @return the names, empty when the problem is a malformed value
   */
  public List<String> missingVariables() {
    return missingVariables;
  }
}
