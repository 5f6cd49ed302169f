package io.github.stratum.cli;

import io.github.stratum.cli.command.BootstrapCommand;
import io.github.stratum.cli.command.CheckCommand;
import io.github.stratum.cli.command.CreateCommand;
import io.github.stratum.cli.command.DownCommand;
import io.github.stratum.cli.command.StatusCommand;
import io.github.stratum.cli.command.UpCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the Stratum migration runner.
 */
@Command(
    name = "stratum",
    description = "Apply, roll back and inspect versioned schema migrations",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        StatusCommand.class,
        UpCommand.class,
        DownCommand.class,
        BootstrapCommand.class,
        CheckCommand.class,
        CreateCommand.class})
public class StratumCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new StratumCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
