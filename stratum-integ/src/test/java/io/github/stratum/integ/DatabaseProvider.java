package io.github.stratum.integ;

import io.github.stratum.dbu.model.Database;

/**
 * A database the migration runner can be exercised against.
 */
public interface DatabaseProvider extends AutoCloseable {

  /**
   * Whether this database can be started in the current environment.
   *
   * @return true if available
   */
  boolean isAvailable();

  /**
   * Start the database.
   *
   * @throws Exception if the database cannot be started
   */
  void start() throws Exception;

  /**
   * Connection settings of the started database.
   *
   * @return the database
   */
  Database getDatabase();

  /**
   * Provider name for logging.
   *
   * @return the name
   */
  String getProviderName();
}
