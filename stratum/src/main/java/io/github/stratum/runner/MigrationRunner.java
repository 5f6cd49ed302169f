package io.github.stratum.runner;

import io.github.stratum.dbu.connection.ConnectionProvider;
import io.github.stratum.dbu.exception.ConflictException;
import io.github.stratum.dbu.exception.DatabaseException;
import io.github.stratum.dbu.exception.NotFoundException;
import io.github.stratum.dbu.exception.ValidationException;
import io.github.stratum.ledger.Ledger;
import io.github.stratum.ledger.LedgerEntry;
import io.github.stratum.migration.MigrationScanner;
import io.github.stratum.migration.MigrationTemplate;
import io.github.stratum.migration.MigrationUnit;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies and reverts the migrations of one directory against one database.
 *
 * <p>Pending migrations are the discovered ones the ledger has no entry for. Each migration runs in
 * its own transaction together with its ledger write, so a failure leaves earlier migrations of the
 * same call applied and the failing one untouched. Calls are not coordinated across runners.
 */
@Singleton
public class MigrationRunner {

  /**
   * Qualifier for the migrations directory.
   */
  public static final String MIGRATIONS_DIRECTORY = "MigrationRunner.migrationsDirectory";

  private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

  private final Path migrationsDirectory;
  private final ConnectionProvider connectionProvider;
  private final MigrationScanner scanner;
  private final Ledger ledger;
  private final Clock clock;

  private List<MigrationUnit> migrations;

  /**
   * Instantiates a new Migration runner.
   *
   * @param migrationsDirectory the migrations directory
   * @param connectionProvider  the connection provider
   * @param scanner             the scanner
   * @param ledger              the ledger
   * @param clock               the clock used for ledger timestamps
   */
  @Inject
  public MigrationRunner(@Named(MIGRATIONS_DIRECTORY) final Path migrationsDirectory,
                         final ConnectionProvider connectionProvider,
                         final MigrationScanner scanner,
                         final Ledger ledger,
                         final Clock clock) {
    this.migrationsDirectory = migrationsDirectory;
    this.connectionProvider = connectionProvider;
    this.scanner = scanner;
    this.ledger = ledger;
    this.clock = clock;
  }

  /**
   * Instantiates a new Migration runner with the default scanner, ledger and system clock.
   *
   * @param migrationsDirectory the migrations directory
   * @param connectionProvider  the connection provider
   */
  public MigrationRunner(final Path migrationsDirectory, final ConnectionProvider connectionProvider) {
    this(migrationsDirectory, connectionProvider, MigrationScanner.create(), new Ledger(), Clock.systemUTC());
  }

  /**
   * Create a new migration artifact in a directory, numbered after the highest existing version.
   *
   * @param directory   the directory, created if absent
   * @param description the description
   * @return the path of the new artifact
   */
  public static Path createMigration(final Path directory, final String description) {
    return MigrationTemplate.create(directory, description);
  }

  /**
   * The migrations directory.
   *
   * @return the path
   */
  public Path migrationsDirectory() {
    return migrationsDirectory;
  }

  /**
   * The migrations in the directory, sorted by version. The first call scans the directory, later
   * calls return the same list until {@link #invalidateCache()} is called.
   *
   * @return the migrations
   */
  public List<MigrationUnit> discover() {
    if (migrations == null) {
      migrations = scanner.scan(migrationsDirectory);
    } else {
      log.trace("discover(): cached");
    }
    return migrations;
  }

  /**
   * Forget the discovered migrations so the next {@link #discover()} scans again.
   */
  public void invalidateCache() {
    migrations = null;
  }

  /**
   * Applied state of every discovered migration.
   *
   * @return the statuses in version order
   */
  public List<MigrationStatus> status() {
    final Map<String, LedgerEntry> applied = appliedEntries().stream()
        .collect(Collectors.toMap(LedgerEntry::version, Function.identity()));
    final List<MigrationUnit> units = discover();
    final Set<String> known = units.stream().map(MigrationUnit::version).collect(Collectors.toSet());
    applied.keySet().stream()
        .filter(version -> !known.contains(version))
        .sorted()
        .forEach(version -> log.warn("Ledger records migration {} but no artifact defines it", version));
    return units.stream()
        .<MigrationStatus>map(unit -> {
          final Optional<LedgerEntry> entry = Optional.ofNullable(applied.get(unit.version()));
          return ImmutableMigrationStatus.builder()
              .version(unit.version())
              .description(unit.description())
              .checksum(unit.checksum())
              .applied(entry.isPresent())
              .appliedAt(entry.map(LedgerEntry::appliedAt))
              .build();
        })
        .collect(Collectors.toList());
  }

  /**
   * Apply all pending migrations.
   *
   * @return the applied versions in order
   */
  public List<String> up() {
    return up(false);
  }

  /**
   * Apply all pending migrations in version order.
   *
   * @param dryRun when true, report what would be applied without running anything or writing the
   *               ledger
   * @return the versions applied, or that would be applied
   */
  public List<String> up(final boolean dryRun) {
    final Set<String> applied = appliedEntries().stream()
        .map(LedgerEntry::version)
        .collect(Collectors.toSet());
    final List<MigrationUnit> pending = discover().stream()
        .filter(unit -> !applied.contains(unit.version()))
        .collect(Collectors.toList());
    if (pending.isEmpty()) {
      log.info("No pending migrations");
      return List.of();
    }

    final List<String> processed = new ArrayList<>();
    for (MigrationUnit unit : pending) {
      if (dryRun) {
        log.info("[dry-run] Would apply {} - {}", unit.version(), unit.description());
      } else {
        log.info("Applying {} - {}", unit.version(), unit.description());
        inTransaction("Migration " + unit.version(), handle -> {
          unit.up().apply(handle);
          ledger.record(handle, unit, clock.instant());
        });
      }
      processed.add(unit.version());
    }
    return List.copyOf(processed);
  }

  /**
   * Roll back the most recently applied migration.
   *
   * @return the rolled back versions
   */
  public List<String> down() {
    return down(1);
  }

  /**
   * Roll back the most recently applied migrations, newest first. Every version is resolved to its
   * artifact before anything is rolled back.
   *
   * @param steps how many migrations to roll back
   * @return the rolled back versions in the order processed, empty if nothing is applied
   * @throws ValidationException if steps is less than one
   * @throws NotFoundException   if an applied version has no artifact
   */
  public List<String> down(final int steps) {
    if (steps < 1) {
      throw new ValidationException("steps must be at least 1, got " + steps, "steps", steps);
    }
    final List<LedgerEntry> latest = withConnection("Reading ledger", handle -> {
      ledger.ensureTable(handle);
      return ledger.mostRecent(handle, steps);
    });
    if (latest.isEmpty()) {
      log.info("No applied migrations to roll back");
      return List.of();
    }

    final Map<String, MigrationUnit> byVersion = discover().stream()
        .collect(Collectors.toMap(MigrationUnit::version, Function.identity()));
    final List<MigrationUnit> targets = new ArrayList<>();
    for (LedgerEntry entry : latest) {
      final MigrationUnit unit = byVersion.get(entry.version());
      if (unit == null) {
        throw new NotFoundException("Cannot roll back migration " + entry.version()
            + ": no artifact defines it in " + migrationsDirectory, "Migration", entry.version());
      }
      targets.add(unit);
    }

    final List<String> processed = new ArrayList<>();
    for (MigrationUnit unit : targets) {
      log.info("Rolling back {} - {}", unit.version(), unit.description());
      inTransaction("Rollback of " + unit.version(), handle -> {
        unit.down().apply(handle);
        ledger.remove(handle, unit.version());
      });
      processed.add(unit.version());
    }
    return List.copyOf(processed);
  }

  /**
   * Mark the earliest migration as applied without running it, for a database whose baseline
   * schema was created outside stratum.
   *
   * @return the recorded version, empty if there are no migrations
   * @throws ConflictException if the ledger already has entries
   */
  public Optional<String> bootstrap() {
    final List<LedgerEntry> existing = appliedEntries();
    if (!existing.isEmpty()) {
      final String mostRecent = existing.stream()
          .max(Comparator.comparing(LedgerEntry::appliedAt).thenComparing(LedgerEntry::version))
          .map(LedgerEntry::version)
          .orElseThrow();
      throw new ConflictException("Cannot bootstrap: ledger already records " + existing.size()
          + " applied migration(s), most recently " + mostRecent, mostRecent);
    }
    final List<MigrationUnit> units = discover();
    if (units.isEmpty()) {
      log.warn("Nothing to bootstrap: no migrations in {}", migrationsDirectory);
      return Optional.empty();
    }
    final MigrationUnit baseline = units.get(0);
    log.info("Bootstrapping ledger at {} - {}", baseline.version(), baseline.description());
    inTransaction("Bootstrap of " + baseline.version(),
        handle -> ledger.record(handle, baseline, clock.instant()));
    return Optional.of(baseline.version());
  }

  /**
   * Whether the database can be reached.
   *
   * @return true if a connection was obtained and answered
   */
  public boolean checkConnection() {
    final boolean reachable = connectionProvider.checkConnection();
    if (!reachable) {
      log.warn("Database is not reachable");
    }
    return reachable;
  }

  private List<LedgerEntry> appliedEntries() {
    return withConnection("Reading ledger", handle -> {
      ledger.ensureTable(handle);
      return ledger.entries(handle);
    });
  }

  private void inTransaction(final String step, final Consumer<Handle> work) {
    withConnection(step, handle -> {
      handle.useTransaction(work::accept);
      return null;
    });
  }

  private <T> T withConnection(final String step, final Function<Handle, T> work) {
    final Handle handle = connectionProvider.acquire();
    try {
      return work.apply(handle);
    } catch (JdbiException e) {
      log.error("{} failed", step, e);
      throw new DatabaseException(step + " failed: " + e.getMessage(), e);
    } finally {
      connectionProvider.release(handle);
    }
  }
}
