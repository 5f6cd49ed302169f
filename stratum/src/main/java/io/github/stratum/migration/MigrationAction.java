package io.github.stratum.migration;

import org.jdbi.v3.core.Handle;

/**
 * One direction of a migration: the forward or the reverse schema change.
 */
@FunctionalInterface
public interface MigrationAction {

  /**
   * Apply the change using the given handle. The caller owns the transaction.
   *
   * @param handle the handle
   */
  void apply(Handle handle);

}
