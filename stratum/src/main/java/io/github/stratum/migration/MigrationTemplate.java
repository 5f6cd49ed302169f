package io.github.stratum.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.stratum.dbu.exception.ConflictException;
import io.github.stratum.dbu.exception.StratumException;
import io.github.stratum.dbu.exception.ValidationException;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes new, empty migration artifacts.
 */
public final class MigrationTemplate {

  private static final Logger log = LoggerFactory.getLogger(MigrationTemplate.class);

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern NUMERIC = Pattern.compile("\\d+");
  private static final int MIN_VERSION_WIDTH = 3;
  private static final ObjectMapper JSON = new ObjectMapper();

  /**
   * Longest slug used in a file name. Longer descriptions are cut.
   */
  static final int MAX_SLUG_LENGTH = 60;

  private MigrationTemplate() {
  }

  /**
   * Create the next migration in a directory. The directory is created if needed.
   *
   * @param directory   the migrations directory
   * @param description the description
   * @return the path of the new artifact
   * @throws ValidationException if the description is blank or an existing artifact is malformed
   * @throws ConflictException   if the target file already exists
   */
  public static Path create(final Path directory, final String description) {
    if (description == null || description.isBlank()) {
      throw new ValidationException("Migration description must not be blank", "description", description);
    }
    if (description.trim().length() > MigrationUnit.MAX_DESCRIPTION_LENGTH) {
      throw new ValidationException("Migration description must be at most " + MigrationUnit.MAX_DESCRIPTION_LENGTH
          + " characters", "description", description.trim().length());
    }
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new StratumException("Unable to create migrations directory " + directory, e);
    }
    final String version = nextVersion(MigrationScanner.create().scan(directory));
    final String slug = slugify(description);
    final String fileName = slug.isEmpty() ? version + ".yaml" : version + "_" + slug + ".yaml";
    final Path target = directory.resolve(fileName);
    try {
      Files.writeString(target, render(version, description.trim()), StandardOpenOption.CREATE_NEW);
    } catch (FileAlreadyExistsException e) {
      throw new ConflictException("Migration file already exists: " + target, fileName);
    } catch (IOException e) {
      throw new StratumException("Unable to write migration " + target, e);
    }
    log.info("Created migration {} at {}", version, target);
    return target;
  }

  /**
   * The version following the highest numeric version present. It is zero padded to the width of
   * the widest numeric version, or to three digits when there is none.
   *
   * @param existing the existing migrations
   * @return the next version
   * @throws ValidationException if the next version needs more digits than the existing ones, since
   *                             it would then sort before them
   */
  static String nextVersion(final List<MigrationUnit> existing) {
    final List<String> numeric = existing.stream()
        .map(MigrationUnit::version)
        .filter(version -> NUMERIC.matcher(version).matches())
        .collect(Collectors.toList());
    final BigInteger highest = numeric.stream()
        .map(BigInteger::new)
        .max(Comparator.naturalOrder())
        .orElse(BigInteger.ZERO);
    final int width = numeric.stream()
        .mapToInt(String::length)
        .max()
        .orElse(MIN_VERSION_WIDTH);
    final String next = highest.add(BigInteger.ONE).toString();
    if (!numeric.isEmpty() && next.length() > width) {
      throw new ValidationException("Next version " + next + " would sort before " + highest
          + ", widen the existing versions to " + next.length() + " digits first", "version", next);
    }
    final StringBuilder padded = new StringBuilder();
    for (int i = next.length(); i < width; i++) {
      padded.append('0');
    }
    return padded.append(next).toString();
  }

  /**
   * Lower case, with every run of other characters collapsed to a single underscore, cut to
   * {@link #MAX_SLUG_LENGTH} characters.
   *
   * @param description the description
   * @return the slug
   */
  static String slugify(final String description) {
    final String slug = NON_ALPHANUMERIC.matcher(description.toLowerCase(Locale.ROOT)).replaceAll("_");
    final String trimmed = trimUnderscores(slug);
    return trimmed.length() <= MAX_SLUG_LENGTH ? trimmed : trimUnderscores(trimmed.substring(0, MAX_SLUG_LENGTH));
  }

  private static String trimUnderscores(final String slug) {
    int start = 0;
    int end = slug.length();
    while (start < end && slug.charAt(start) == '_') {
      start++;
    }
    while (end > start && slug.charAt(end - 1) == '_') {
      end--;
    }
    return slug.substring(start, end);
  }

  private static String render(final String version, final String description) {
    final String quoted;
    try {
      quoted = JSON.writeValueAsString(description);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to quote description", e);
    }
    return "version: \"" + version + "\"\n"
        + "description: " + quoted + "\n"
        + "up: |\n"
        + "  -- Forward schema change for " + version + "\n"
        + "down: |\n"
        + "  -- Reverse schema change for " + version + "\n";
  }
}
