package io.github.stratum.cli.command;

import io.github.stratum.runner.MigrationRunner;
import io.github.stratum.runner.MigrationStatus;
import java.io.PrintWriter;
import java.util.List;
import picocli.CommandLine.Command;

/**
 * Lists every discovered migration and whether it is applied.
 */
@Command(
    name = "status",
    description = "Show which migrations are applied")
public class StatusCommand extends RunnerCommand {

  @Override
  protected void execute(final MigrationRunner runner, final PrintWriter out) {
    final List<MigrationStatus> statuses = runner.status();
    if (statuses.isEmpty()) {
      out.println("No migrations found in " + runner.migrationsDirectory());
      return;
    }
    for (MigrationStatus status : statuses) {
      out.printf("[%s] %s %s%n", status.applied() ? "x" : " ", status.version(), status.description());
    }
  }
}
