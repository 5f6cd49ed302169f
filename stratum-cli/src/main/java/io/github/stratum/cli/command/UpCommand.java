package io.github.stratum.cli.command;

import io.github.stratum.runner.MigrationRunner;
import java.io.PrintWriter;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Applies all pending migrations.
 */
@Command(
    name = "up",
    description = "Apply all pending migrations in version order")
public class UpCommand extends RunnerCommand {

  @Option(
      names = {"--dry-run"},
      description = "Only list the migrations that would be applied")
  private boolean dryRun;

  @Override
  protected void execute(final MigrationRunner runner, final PrintWriter out) {
    final List<String> versions = runner.up(dryRun);
    if (versions.isEmpty()) {
      out.println("No pending migrations");
      return;
    }
    final String verb = dryRun ? "Would apply " : "Applied ";
    versions.forEach(version -> out.println(verb + version));
  }
}
