package io.github.stratum.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.stratum.BaseJdbiTest;
import io.github.stratum.MigrationFiles;
import io.github.stratum.StepClock;
import io.github.stratum.dbu.connection.ConnectionProvider;
import io.github.stratum.dbu.exception.ConflictException;
import io.github.stratum.dbu.exception.DatabaseException;
import io.github.stratum.dbu.exception.NotFoundException;
import io.github.stratum.dbu.exception.ValidationException;
import io.github.stratum.ledger.Ledger;
import io.github.stratum.migration.MigrationScanner;
import io.github.stratum.migration.MigrationUnit;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MigrationRunnerTest extends BaseJdbiTest {

  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path migrationsDir;

  @Mock private ConnectionProvider failingProvider;

  private StepClock clock;
  private MigrationRunner runner;

  @BeforeEach
  void setUp() {
    clock = new StepClock(T0, Duration.ofMinutes(1));
    runner = runnerWith(connectionProvider);
  }

  private MigrationRunner runnerWith(final ConnectionProvider provider) {
    return new MigrationRunner(migrationsDir, provider, MigrationScanner.create(), new Ledger(), clock);
  }

  private void writeStandardMigrations() throws Exception {
    MigrationFiles.write(migrationsDir, "001", "init",
        "CREATE TABLE accounts (id INT PRIMARY KEY);",
        "DROP TABLE accounts;");
    MigrationFiles.write(migrationsDir, "002", "add users",
        "CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(100));",
        "DROP TABLE users;");
    MigrationFiles.write(migrationsDir, "003", "add index",
        "CREATE INDEX idx_users_name ON users (name);",
        "DROP INDEX idx_users_name;");
  }

  @Test
  void fullLifecycle() throws Exception {
    // Given
    writeStandardMigrations();

    // When
    final List<String> applied = runner.up();

    // Then
    assertThat(applied).containsExactly("001", "002", "003");
    assertThat(ledgerRows()).isEqualTo(3);
    assertThat(tableExists("users")).isTrue();

    // When
    final List<String> rolledBack = runner.down(1);

    // Then
    assertThat(rolledBack).containsExactly("003");
    assertThat(ledgerRows()).isEqualTo(2);
    assertThatThrownBy(() -> runner.bootstrap())
        .isInstanceOf(ConflictException.class)
        .hasMessageStartingWith("Cannot bootstrap");
  }

  @Test
  void up_nothingPending_returnsEmpty() throws Exception {
    writeStandardMigrations();
    runner.up();

    assertThat(runner.up()).isEmpty();
    assertThat(ledgerRows()).isEqualTo(3);
  }

  @Test
  void up_emptyDirectory_createsLedgerOnly() {
    assertThat(runner.up()).isEmpty();
    assertThat(tableExists("schema_migrations")).isTrue();
    assertThat(ledgerRows()).isZero();
  }

  @Test
  void up_dryRun_changesNothing() throws Exception {
    // Given
    writeStandardMigrations();

    // When
    final List<String> wouldApply = runner.up(true);

    // Then
    assertThat(wouldApply).containsExactly("001", "002", "003");
    assertThat(ledgerRows()).isZero();
    assertThat(tableExists("accounts")).isFalse();
    assertThat(runner.status()).noneMatch(MigrationStatus::applied);
  }

  @Test
  void up_failingMigration_keepsEarlierOnes() throws Exception {
    // Given
    MigrationFiles.write(migrationsDir, "001", "init",
        "CREATE TABLE accounts (id INT PRIMARY KEY);", "DROP TABLE accounts;");
    MigrationFiles.write(migrationsDir, "002", "broken",
        "CREATE TABLE broken (;", "DROP TABLE broken;");
    MigrationFiles.write(migrationsDir, "003", "never",
        "CREATE TABLE never_created (id INT);", "DROP TABLE never_created;");

    // When / Then
    assertThatThrownBy(() -> runner.up())
        .isInstanceOf(DatabaseException.class)
        .hasMessageContaining("002");
    assertThat(runner.status())
        .extracting(MigrationStatus::version, MigrationStatus::applied)
        .containsExactly(
            tuple("001", true),
            tuple("002", false),
            tuple("003", false));
    assertThat(tableExists("never_created")).isFalse();
  }

  @Test
  void discover_isCachedUntilInvalidated() throws Exception {
    MigrationFiles.writeNoop(migrationsDir, "001", "first");

    final List<MigrationUnit> first = runner.discover();
    MigrationFiles.writeNoop(migrationsDir, "002", "second");

    assertThat(runner.discover()).isSameAs(first).hasSize(1);

    runner.invalidateCache();

    assertThat(runner.discover()).extracting(MigrationUnit::version).containsExactly("001", "002");
  }

  @Test
  void down_emptyLedger_returnsEmpty() throws Exception {
    writeStandardMigrations();

    assertThat(runner.down(2)).isEmpty();
  }

  @Test
  void down_stepsBelowOne_throwsValidationException() {
    assertThatThrownBy(() -> runner.down(0))
        .isInstanceOf(ValidationException.class)
        .extracting(e -> ((ValidationException) e).details())
        .isEqualTo(Map.of("field", "steps", "value", "0"));
  }

  @Test
  void down_moreStepsThanApplied_rollsBackEverything() throws Exception {
    writeStandardMigrations();
    runner.up();

    assertThat(runner.down(10)).containsExactly("003", "002", "001");
    assertThat(ledgerRows()).isZero();
    assertThat(tableExists("accounts")).isFalse();
  }

  @Test
  void down_missingArtifact_rollsBackNothing() throws Exception {
    // Given
    writeStandardMigrations();
    runner.up();
    Files.delete(migrationsDir.resolve("002_add_users.yaml"));
    runner.invalidateCache();

    // When / Then
    assertThatThrownBy(() -> runner.down(2))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("002")
        .extracting(e -> ((NotFoundException) e).resourceId())
        .isEqualTo("002");
    assertThat(ledgerRows()).isEqualTo(3);
    assertThat(tableExists("users")).isTrue();
  }

  @Test
  void down_followsApplicationOrder() throws Exception {
    // Given
    MigrationFiles.writeNoop(migrationsDir, "001", "first");
    MigrationFiles.writeNoop(migrationsDir, "003", "third");
    runner.up();
    MigrationFiles.writeNoop(migrationsDir, "002", "late arrival");
    runner.invalidateCache();
    assertThat(runner.up()).containsExactly("002");

    // When
    final List<String> rolledBack = runner.down(3);

    // Then
    assertThat(rolledBack).containsExactly("002", "003", "001");
  }

  @Test
  void bootstrap_recordsEarliestWithoutRunningIt() throws Exception {
    // Given
    MigrationFiles.write(migrationsDir, "001", "baseline",
        "CREATE TABLE baseline_marker (id INT);", "DROP TABLE baseline_marker;");
    MigrationFiles.write(migrationsDir, "002", "add users",
        "CREATE TABLE users (id INT PRIMARY KEY);", "DROP TABLE users;");

    // When
    final Optional<String> recorded = runner.bootstrap();

    // Then
    assertThat(recorded).contains("001");
    assertThat(tableExists("baseline_marker")).isFalse();
    assertThat(ledgerRows()).isEqualTo(1);
    assertThat(runner.up()).containsExactly("002");
  }

  @Test
  void bootstrap_conflictNamesMostRecentlyApplied() throws Exception {
    // Given 002 is applied after 003
    MigrationFiles.writeNoop(migrationsDir, "001", "first");
    MigrationFiles.writeNoop(migrationsDir, "003", "third");
    runner.up();
    MigrationFiles.writeNoop(migrationsDir, "002", "late arrival");
    runner.invalidateCache();
    runner.up();

    // When / Then
    assertThatThrownBy(() -> runner.bootstrap())
        .isInstanceOf(ConflictException.class)
        .hasMessageEndingWith("most recently 002")
        .extracting(e -> ((ConflictException) e).existingId())
        .isEqualTo(Optional.of("002"));
  }

  @Test
  void up_descriptionTooLongForLedger_appliesNothing() throws Exception {
    // Given
    MigrationFiles.writeNamed(migrationsDir, "001_long.yaml", "001",
        "d".repeat(MigrationUnit.MAX_DESCRIPTION_LENGTH + 476),
        "CREATE TABLE too_long (id INT);", "DROP TABLE too_long;");

    // When / Then
    assertThatThrownBy(() -> runner.up())
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("001_long.yaml");
    assertThat(tableExists("too_long")).isFalse();
    assertThat(ledgerRows()).isZero();
  }

  @Test
  void checkConnection_liveDatabase_returnsTrue() {
    assertThat(runner.checkConnection()).isTrue();
  }

  @Test
  void checkConnection_unreachable_returnsFalse() {
    when(failingProvider.checkConnection()).thenReturn(false);

    assertThat(runnerWith(failingProvider).checkConnection()).isFalse();
  }

  @Test
  void bootstrap_noMigrations_returnsEmpty() {
    assertThat(runner.bootstrap()).isEmpty();
    assertThat(ledgerRows()).isZero();
  }

  @Test
  void status_reportsAppliedState() throws Exception {
    // Given
    writeStandardMigrations();
    runner.up();
    runner.down(1);

    // When
    final List<MigrationStatus> status = runner.status();

    // Then
    assertThat(status).hasSize(3);
    assertThat(status.get(0).applied()).isTrue();
    assertThat(status.get(0).appliedAt()).contains(T0);
    assertThat(status.get(0).description()).isEqualTo("init");
    assertThat(status.get(0).checksum()).hasSize(16);
    assertThat(status.get(2).applied()).isFalse();
    assertThat(status.get(2).appliedAt()).isEmpty();
  }

  @Test
  void status_ignoresLedgerRowsWithoutArtifact() throws Exception {
    writeStandardMigrations();
    runner.up();
    Files.delete(migrationsDir.resolve("003_add_index.yaml"));
    runner.invalidateCache();

    assertThat(runner.status()).extracting(MigrationStatus::version).containsExactly("001", "002");
  }

  @Test
  void everyAcquiredConnectionIsReleased() throws Exception {
    // Given
    writeStandardMigrations();
    final ConnectionProvider tracked = spy(connectionProvider);
    final MigrationRunner trackedRunner = runnerWith(tracked);

    // When
    trackedRunner.up();

    // Then: one read of the ledger plus one connection per migration
    verify(tracked, times(4)).acquire();
    verify(tracked, times(4)).release(any());
  }

  @Test
  void dryRun_neverTouchesMigrationConnections() throws Exception {
    writeStandardMigrations();
    final ConnectionProvider tracked = spy(connectionProvider);

    runnerWith(tracked).up(true);

    // Only the ledger read
    verify(tracked, times(1)).acquire();
  }

  @Test
  void acquireFailure_propagates() {
    // Given
    when(failingProvider.acquire()).thenThrow(new DatabaseException("Unable to acquire a database connection"));
    final MigrationRunner failing = runnerWith(failingProvider);

    // When / Then
    assertThatThrownBy(failing::status)
        .isInstanceOf(DatabaseException.class)
        .hasMessage("Unable to acquire a database connection");
    verify(failingProvider, never()).release(any());
  }

  @Test
  void createMigration_writesArtifact() {
    final Path created = MigrationRunner.createMigration(migrationsDir, "add users table");

    assertThat(created.getFileName().toString()).isEqualTo("001_add_users_table.yaml");
    assertThat(runner.discover()).extracting(MigrationUnit::version).containsExactly("001");
  }
}
