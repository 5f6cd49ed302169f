package io.github.stratum.dbu.exception;

/**
 * Connection or query failure against the database.
 */
public class DatabaseException extends StratumException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public DatabaseException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DatabaseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
