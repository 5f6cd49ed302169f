package io.github.stratum.cli.command;

import io.github.stratum.runner.MigrationRunner;
import java.io.PrintWriter;
import java.util.Optional;
import picocli.CommandLine.Command;

/**
 * Marks the earliest migration as applied on a database that already has the baseline schema.
 */
@Command(
    name = "bootstrap",
    description = "Record the earliest migration as applied without running it")
public class BootstrapCommand extends RunnerCommand {

  @Override
  protected void execute(final MigrationRunner runner, final PrintWriter out) {
    final Optional<String> version = runner.bootstrap();
    out.println(version.map(v -> "Bootstrapped at " + v)
        .orElse("No migrations found in " + runner.migrationsDirectory()));
  }
}
