package io.github.stratum.ledger;

import io.github.stratum.dbu.exception.NotFoundException;
import io.github.stratum.migration.MigrationUnit;
import java.time.Instant;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the record of applied migrations. Every call works on the caller's handle, so
 * writes join whatever transaction the caller has open.
 */
@Singleton
public class Ledger {

  private static final Logger log = LoggerFactory.getLogger(Ledger.class);

  /**
   * Instantiates a new Ledger.
   */
  @Inject
  public Ledger() {
    // Stateless
  }

  /**
   * Create the ledger table if it does not exist yet.
   *
   * @param handle the handle
   */
  public void ensureTable(final Handle handle) {
    log.trace("ensureTable()");
    dao(handle).createTable();
  }

  /**
   * All applied migrations, ordered by version.
   *
   * @param handle the handle
   * @return the entries
   */
  public List<LedgerEntry> entries(final Handle handle) {
    return dao(handle).entries();
  }

  /**
   * The most recently applied migrations, newest first.
   *
   * @param handle the handle
   * @param limit  maximum number of entries
   * @return the entries
   */
  public List<LedgerEntry> mostRecent(final Handle handle, final int limit) {
    final List<LedgerEntry> entries = dao(handle).entriesNewestFirst();
    return entries.size() <= limit ? entries : List.copyOf(entries.subList(0, limit));
  }

  /**
   * Number of applied migrations.
   *
   * @param handle the handle
   * @return the count
   */
  public long count(final Handle handle) {
    return dao(handle).count();
  }

  /**
   * Record a migration as applied.
   *
   * @param handle    the handle
   * @param unit      the migration
   * @param appliedAt when it was applied
   */
  public void record(final Handle handle, final MigrationUnit unit, final Instant appliedAt) {
    log.trace("record({}, {})", unit.version(), appliedAt);
    dao(handle).insert(unit.version(), unit.description(), unit.checksum(), appliedAt);
  }

  /**
   * Remove the entry for a version.
   *
   * @param handle  the handle
   * @param version the version
   * @throws NotFoundException if the ledger has no such version
   */
  public void remove(final Handle handle, final String version) {
    log.trace("remove({})", version);
    if (dao(handle).delete(version) == 0) {
      throw new NotFoundException("Ledger entry", version);
    }
  }

  private LedgerDao dao(final Handle handle) {
    return handle.attach(LedgerDao.class);
  }
}
