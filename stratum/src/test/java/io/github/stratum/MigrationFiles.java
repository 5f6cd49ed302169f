package io.github.stratum;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes migration artifacts for tests.
 */
public final class MigrationFiles {

  private MigrationFiles() {
  }

  public static Path write(final Path directory,
                           final String version,
                           final String description,
                           final String up,
                           final String down) throws IOException {
    final String fileName = version + "_" + description.toLowerCase().replaceAll("[^a-z0-9]+", "_") + ".yaml";
    return writeNamed(directory, fileName, version, description, up, down);
  }

  public static Path writeNamed(final Path directory,
                                final String fileName,
                                final String version,
                                final String description,
                                final String up,
                                final String down) throws IOException {
    return Files.writeString(directory.resolve(fileName),
        "version: \"" + version + "\"\n"
            + "description: \"" + description + "\"\n"
            + "up: |\n" + indent(up)
            + "down: |\n" + indent(down));
  }

  public static Path writeNoop(final Path directory, final String version, final String description)
      throws IOException {
    return write(directory, version, description, "-- nothing", "-- nothing");
  }

  private static String indent(final String sql) {
    final StringBuilder builder = new StringBuilder();
    for (String line : sql.split("\n")) {
      builder.append("  ").append(line).append('\n');
    }
    return builder.toString();
  }
}
