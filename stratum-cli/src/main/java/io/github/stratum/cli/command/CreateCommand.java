package io.github.stratum.cli.command;

import io.github.stratum.dbu.config.DatabaseConfigLoader;
import io.github.stratum.dbu.exception.StratumException;
import io.github.stratum.runner.MigrationRunner;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Writes a new, empty migration artifact. Needs no database.
 */
@Command(
    name = "create",
    description = "Create the next migration file")
public class CreateCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(CreateCommand.class);

  @Parameters(
      index = "0",
      description = "What the migration does, used in the file name")
  private String description;

  @Option(
      names = {"--migrations-dir", "-d"},
      description = "Directory holding the migrations (default: env STRATUM_MIGRATIONS_DIR or 'migrations')",
      defaultValue = "${STRATUM_MIGRATIONS_DIR:-" + DatabaseConfigLoader.DEFAULT_MIGRATIONS_DIR + "}")
  private Path migrationsDir;

  @Spec
  private CommandSpec spec;

  @Override
  public Integer call() {
    try {
      final Path created = MigrationRunner.createMigration(migrationsDir, description);
      spec.commandLine().getOut().println(created);
      spec.commandLine().getOut().flush();
      return 0;
    } catch (StratumException e) {
      return ErrorReporter.report(log, spec, e);
    }
  }
}
