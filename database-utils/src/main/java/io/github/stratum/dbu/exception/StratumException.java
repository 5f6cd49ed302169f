package io.github.stratum.dbu.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure raised by stratum.
 *
 * <p>Besides the message, an exception carries a map of details naming what failed, so callers
 * can report it without parsing the message.
 */
public class StratumException extends RuntimeException {

  private final Map<String, Object> details;

  /**
   * Instantiates a new Stratum exception.
   *
   * @param message the message
   */
  public StratumException(final String message) {
    this(message, Map.of(), null);
  }

  /**
   * Instantiates a new Stratum exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StratumException(final String message, final Throwable cause) {
    this(message, Map.of(), cause);
  }

  /**
   * Instantiates a new Stratum exception with details.
   *
   * @param message the message
   * @param details the details, entries with null values are dropped
   * @param cause   the cause, may be null
   */
  protected StratumException(final String message, final Map<String, ?> details, final Throwable cause) {
    super(message, cause);
    final Map<String, Object> copy = new LinkedHashMap<>();
    details.forEach((key, value) -> {
      if (value != null) {
        copy.put(key, value);
      }
    });
    this.details = Collections.unmodifiableMap(copy);
  }

  /**
   * Details.
   *
   * @return the details, never null
   */
  public Map<String, Object> details() {
    return details;
  }

  /**
   * The exception as a map with the keys {@code error}, {@code message} and {@code details}.
   *
   * @return the map
   */
  public Map<String, Object> toMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("error", getClass().getSimpleName());
    map.put("message", getMessage());
    map.put("details", details);
    return map;
  }
}
