package io.github.stratum.dbu.exception;

import java.util.Map;
import java.util.Optional;

/**
 * The operation conflicts with existing state.
 */
public class ConflictException extends StratumException {

  private final String existingId;

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public ConflictException(final String message) {
    this(message, null);
  }

  /**
   * Instantiates a new exception naming what is already there.
   *
   * @param message    the message
   * @param existingId the id of the existing resource, may be null
   */
  public ConflictException(final String message, final String existingId) {
    super(message, existingId == null ? Map.of() : Map.of("existingId", existingId), null);
    this.existingId = existingId;
  }

  /**
   * The id of the existing resource.
   *
   * @return the id
   */
  public Optional<String> existingId() {
    return Optional.ofNullable(existingId);
  }
}
