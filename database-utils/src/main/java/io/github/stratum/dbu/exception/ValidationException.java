package io.github.stratum.dbu.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Invalid input, such as a malformed migration artifact.
 */
public class ValidationException extends StratumException {

  private final String field;
  private final Object value;

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public ValidationException(final String message) {
    this(message, null, null);
  }

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
    this.field = null;
    this.value = null;
  }

  /**
   * Instantiates a new exception naming the offending field.
   *
   * @param message the message
   * @param field   the field, may be null
   * @param value   the rejected value, may be null
   */
  public ValidationException(final String message, final String field, final Object value) {
    super(message, details(field, value), null);
    this.field = field;
    this.value = value;
  }

  private static Map<String, Object> details(final String field, final Object value) {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("field", field);
    details.put("value", value == null ? null : String.valueOf(value));
    return details;
  }

  /**
   * The field that failed validation.
   *
   * @return the field
   */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }

  /**
   * The rejected value.
   *
   * @return the value
   */
  public Optional<Object> value() {
    return Optional.ofNullable(value);
  }
}
