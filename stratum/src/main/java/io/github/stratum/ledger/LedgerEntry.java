package io.github.stratum.ledger;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * A row of the ledger: one applied migration.
 */
@Value.Immutable
public interface LedgerEntry {

  String version();

  String description();

  String checksum();

  Instant appliedAt();

}
