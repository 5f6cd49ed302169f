package io.github.stratum.model;

import io.github.stratum.dbu.model.Database;
import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * The configuration of a stratum instance.
 */
@Value.Immutable
public interface Configuration {

  /**
   * The target database.
   *
   * @return the database
   */
  Database database();

  /**
   * The directory holding the migration artifacts.
   *
   * @return the path
   */
  @Value.Default
  default Path migrationsDirectory() {
    return Path.of("migrations");
  }

}
