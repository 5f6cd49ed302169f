package io.github.stratum.ledger;

import io.github.stratum.migration.MigrationUnit;
import java.time.Instant;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * SQL for the {@code schema_migrations} ledger table. The table name is fixed.
 */
public interface LedgerDao {

  /**
   * The ledger table name.
   */
  String TABLE = "schema_migrations";

  @SqlUpdate("CREATE TABLE IF NOT EXISTS schema_migrations ("
      + "version VARCHAR(" + MigrationUnit.MAX_VERSION_LENGTH + ") NOT NULL PRIMARY KEY, "
      + "description VARCHAR(" + MigrationUnit.MAX_DESCRIPTION_LENGTH + ") NOT NULL, "
      + "checksum VARCHAR(64) NOT NULL, "
      + "applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL)")
  void createTable();

  @SqlQuery("SELECT version, description, checksum, applied_at FROM schema_migrations ORDER BY version")
  List<LedgerEntry> entries();

  @SqlQuery("SELECT version, description, checksum, applied_at FROM schema_migrations "
      + "ORDER BY applied_at DESC, version DESC")
  List<LedgerEntry> entriesNewestFirst();

  @SqlQuery("SELECT COUNT(*) FROM schema_migrations")
  long count();

  @SqlUpdate("INSERT INTO schema_migrations (version, description, checksum, applied_at) "
      + "VALUES (:version, :description, :checksum, :appliedAt)")
  void insert(@Bind("version") String version,
              @Bind("description") String description,
              @Bind("checksum") String checksum,
              @Bind("appliedAt") Instant appliedAt);

  @SqlUpdate("DELETE FROM schema_migrations WHERE version = :version")
  int delete(@Bind("version") String version);

}
