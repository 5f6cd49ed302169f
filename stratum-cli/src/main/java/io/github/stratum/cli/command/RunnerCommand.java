package io.github.stratum.cli.command;

import io.github.stratum.dagger.StratumComponent;
import io.github.stratum.dbu.exception.StratumException;
import io.github.stratum.runner.MigrationRunner;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base for commands that run against a configured {@link MigrationRunner}.
 */
public abstract class RunnerCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(RunnerCommand.class);

  @Mixin
  private ConnectionOptions connectionOptions;

  @Spec
  private CommandSpec spec;

  @Override
  public Integer call() {
    try {
      final StratumComponent component = StratumComponent.instance(connectionOptions.configuration());
      execute(component.migrationRunner(), spec.commandLine().getOut());
      return 0;
    } catch (StratumException e) {
      return ErrorReporter.report(log, spec, e);
    } finally {
      spec.commandLine().getOut().flush();
    }
  }

  /**
   * Run the command.
   *
   * @param runner the runner
   * @param out    where to write the command output
   */
  protected abstract void execute(MigrationRunner runner, PrintWriter out);
}
