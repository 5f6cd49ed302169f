package io.github.stratum.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.stratum.dbu.model.Database;
import io.github.stratum.model.Configuration;
import io.github.stratum.runner.MigrationRunner;
import java.nio.file.Path;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Supplies the configuration values to the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Database.
   *
   * @return the database
   */
  @Provides
  @Singleton
  public Database database() {
    return configuration.database();
  }

  /**
   * Migrations directory.
   *
   * @return the path
   */
  @Provides
  @Singleton
  @Named(MigrationRunner.MIGRATIONS_DIRECTORY)
  public Path migrationsDirectory() {
    return configuration.migrationsDirectory();
  }
}
