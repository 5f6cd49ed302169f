package io.github.stratum.runner;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Whether a discovered migration has been applied.
 */
@Value.Immutable
public interface MigrationStatus {

  String version();

  String description();

  String checksum();

  /**
   * Whether the ledger has an entry for this version.
   *
   * @return true if applied
   */
  boolean applied();

  /**
   * When it was applied, if it was.
   *
   * @return the applied time
   */
  Optional<Instant> appliedAt();

}
