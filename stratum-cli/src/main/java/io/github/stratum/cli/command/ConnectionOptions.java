package io.github.stratum.cli.command;

import io.github.stratum.dbu.config.DatabaseConfigLoader;
import io.github.stratum.model.Configuration;
import io.github.stratum.model.ImmutableConfiguration;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import picocli.CommandLine.Option;

/**
 * Database and directory options shared by the commands that talk to a database.
 */
public class ConnectionOptions {

  @Option(
      names = {"--db-url"},
      description = "Database JDBC URL (default: env STRATUM_DB_URL)",
      defaultValue = "${STRATUM_DB_URL}")
  private String dbUrl;

  @Option(
      names = {"--db-user"},
      description = "Database username (default: env STRATUM_DB_USER)",
      defaultValue = "${STRATUM_DB_USER}")
  private String dbUser;

  @Option(
      names = {"--db-password"},
      description = "Database password (default: env STRATUM_DB_PASSWORD)",
      defaultValue = "${STRATUM_DB_PASSWORD}")
  private String dbPassword;

  @Option(
      names = {"--migrations-dir", "-d"},
      description = "Directory holding the migrations (default: env STRATUM_MIGRATIONS_DIR or 'migrations')",
      defaultValue = "${STRATUM_MIGRATIONS_DIR}")
  private String migrationsDir;

  /**
   * Build the configuration from the options. Unset options fall back to the loader defaults.
   *
   * @return the configuration
   * @throws io.github.stratum.dbu.exception.ConfigException if no database url was given
   */
  public Configuration configuration() {
    final Map<String, String> values = new HashMap<>();
    put(values, DatabaseConfigLoader.DB_URL, dbUrl);
    put(values, DatabaseConfigLoader.DB_USER, dbUser);
    put(values, DatabaseConfigLoader.DB_PASSWORD, dbPassword);
    put(values, DatabaseConfigLoader.MIGRATIONS_DIR, migrationsDir);
    final DatabaseConfigLoader loader = new DatabaseConfigLoader(values);
    return ImmutableConfiguration.builder()
        .database(loader.database())
        .migrationsDirectory(Path.of(loader.migrationsDirectory()))
        .build();
  }

  private static void put(final Map<String, String> values, final String key, final String value) {
    if (value != null) {
      values.put(key, value);
    }
  }
}
