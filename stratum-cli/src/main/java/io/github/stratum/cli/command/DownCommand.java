package io.github.stratum.cli.command;

import io.github.stratum.runner.MigrationRunner;
import java.io.PrintWriter;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Rolls back the most recently applied migrations.
 */
@Command(
    name = "down",
    description = "Roll back the most recently applied migrations")
public class DownCommand extends RunnerCommand {

  @Option(
      names = {"--steps", "-n"},
      description = "Number of migrations to roll back (default: 1)",
      defaultValue = "1")
  private int steps;

  @Override
  protected void execute(final MigrationRunner runner, final PrintWriter out) {
    final List<String> versions = runner.down(steps);
    if (versions.isEmpty()) {
      out.println("Nothing to roll back");
      return;
    }
    versions.forEach(version -> out.println("Rolled back " + version));
  }
}
