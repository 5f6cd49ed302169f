package io.github.stratum.dbu.config;

import io.github.stratum.dbu.exception.ConfigException;
import io.github.stratum.dbu.model.Database;
import io.github.stratum.dbu.model.ImmutableDatabase;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads connection settings from environment variables.
 *
 * <p>The environment is passed in rather than read from {@link System#getenv()} directly, so
 * callers can supply their own map.
 */
public class DatabaseConfigLoader {

  /**
   * JDBC url of the target database. Required.
   */
  public static final String DB_URL = "STRATUM_DB_URL";

  /**
   * Database username. Defaults to empty.
   */
  public static final String DB_USER = "STRATUM_DB_USER";

  /**
   * Database password. Defaults to empty.
   */
  public static final String DB_PASSWORD = "STRATUM_DB_PASSWORD";

  /**
   * Directory holding the migration artifacts. Defaults to {@link #DEFAULT_MIGRATIONS_DIR}.
   */
  public static final String MIGRATIONS_DIR = "STRATUM_MIGRATIONS_DIR";

  /**
   * The default migrations directory.
   */
  public static final String DEFAULT_MIGRATIONS_DIR = "migrations";

  private final Map<String, String> environment;

  /**
   * Instantiates a loader over the process environment.
   */
  public DatabaseConfigLoader() {
    this(System.getenv());
  }

  /**
   * Instantiates a loader over the given environment.
   *
   * @param environment the environment
   */
  public DatabaseConfigLoader(final Map<String, String> environment) {
    this.environment = Map.copyOf(environment);
  }

  /**
   * Load the database settings.
   *
   * @return the database
   * @throws ConfigException if the url is missing
   */
  public Database database() {
    final String url = value(DB_URL)
        .orElseThrow(() -> new ConfigException(DB_URL + " is not set", List.of(DB_URL)));
    if (!url.startsWith("jdbc:")) {
      throw new ConfigException(DB_URL + " must be a JDBC url, got: " + url);
    }
    return ImmutableDatabase.builder()
        .url(url)
        .username(value(DB_USER).orElse(""))
        .password(value(DB_PASSWORD).orElse(""))
        .build();
  }

  /**
   * Migrations directory.
   *
   * @return the directory name
   */
  public String migrationsDirectory() {
    return value(MIGRATIONS_DIR).orElse(DEFAULT_MIGRATIONS_DIR);
  }

  private Optional<String> value(final String key) {
    return Optional.ofNullable(environment.get(key))
        .map(String::trim)
        .filter(s -> !s.isEmpty());
  }
}
