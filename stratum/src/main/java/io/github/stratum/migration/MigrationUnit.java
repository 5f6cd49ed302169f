package io.github.stratum.migration;

import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * A single versioned, reversible schema change loaded from one artifact.
 */
@Value.Immutable
public interface MigrationUnit {

  /**
   * Longest version the ledger can record.
   */
  int MAX_VERSION_LENGTH = 255;

  /**
   * Longest description the ledger can record.
   */
  int MAX_DESCRIPTION_LENGTH = 1024;

  /**
   * Version, unique across the migrations directory. Ordering is lexical.
   *
   * @return the version
   */
  String version();

  /**
   * Description.
   *
   * @return the description
   */
  String description();

  /**
   * Checksum of the artifact content, see {@link Checksums}.
   *
   * @return the checksum
   */
  String checksum();

  /**
   * Forward change.
   *
   * @return the action
   */
  @Value.Auxiliary
  MigrationAction up();

  /**
   * Reverse change.
   *
   * @return the action
   */
  @Value.Auxiliary
  MigrationAction down();

  /**
   * The artifact this unit was loaded from.
   *
   * @return the path
   */
  Path source();

}
