package io.github.stratum.cli.command;

import io.github.stratum.dbu.exception.DatabaseException;
import io.github.stratum.runner.MigrationRunner;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

/**
 * Verifies that the configured database can be reached.
 */
@Command(
    name = "check",
    description = "Check the database connection")
public class CheckCommand extends RunnerCommand {

  @Override
  protected void execute(final MigrationRunner runner, final PrintWriter out) {
    if (!runner.checkConnection()) {
      throw new DatabaseException("Database is not reachable");
    }
    out.println("Connection OK");
  }
}
