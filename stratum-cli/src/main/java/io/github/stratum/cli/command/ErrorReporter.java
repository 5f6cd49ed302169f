package io.github.stratum.cli.command;

import io.github.stratum.dbu.exception.StratumException;
import java.io.PrintWriter;
import org.slf4j.Logger;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Reports a failed command on the error stream and picks its exit code.
 */
final class ErrorReporter {

  /**
   * Exit code of a command that failed with a {@link StratumException}.
   */
  static final int FAILURE = 1;

  private ErrorReporter() {
  }

  /**
   * Log the failure and print its message and details.
   *
   * @param log       the command's logger
   * @param spec      the command spec
   * @param exception the failure
   * @return the exit code
   */
  static int report(final Logger log, final CommandSpec spec, final StratumException exception) {
    log.error("{} failed: {}", spec.name(), exception.getMessage(), exception);
    final PrintWriter err = spec.commandLine().getErr();
    err.println("Error: " + exception.getMessage());
    exception.details().forEach((key, value) -> err.println("  " + key + ": " + value));
    err.flush();
    return FAILURE;
  }
}
