package io.github.stratum.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.stratum.dbu.exception.StratumException;
import io.github.stratum.dbu.exception.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and loads the migration artifacts in a directory.
 *
 * <p>Only direct children ending in {@code .yaml} or {@code .yml} are considered, and names starting
 * with {@code __} or {@code .} are ignored. A YAML mapping that mentions none of the required
 * attributes is not a migration and is skipped. A mapping that mentions at least one of them is a
 * migration and must be complete, otherwise the whole scan fails.
 */
@Singleton
public class MigrationScanner {

  /**
   * Qualifier for the YAML object mapper used to read artifacts.
   */
  public static final String YAML_MAPPER = "MigrationScanner.yaml";

  /**
   * Names starting with this prefix are reserved and never scanned.
   */
  public static final String RESERVED_PREFIX = "__";

  /**
   * The attributes every migration artifact declares, in the order they are checked.
   */
  public static final List<String> REQUIRED_ATTRIBUTES = List.of("version", "description", "up", "down");

  private static final Logger log = LoggerFactory.getLogger(MigrationScanner.class);

  private final ObjectMapper yamlMapper;

  /**
   * Instantiates a new Migration scanner.
   *
   * @param yamlMapper the yaml mapper
   */
  @Inject
  public MigrationScanner(@Named(YAML_MAPPER) final ObjectMapper yamlMapper) {
    this.yamlMapper = yamlMapper;
  }

  /**
   * A scanner with its own YAML mapper, for use outside the injected graph.
   *
   * @return the migration scanner
   */
  public static MigrationScanner create() {
    return new MigrationScanner(new ObjectMapper(new YAMLFactory()));
  }

  /**
   * Scan a directory for migrations.
   *
   * @param directory the directory, which need not exist
   * @return the migrations sorted by version, empty if the directory is missing
   * @throws ValidationException if any artifact is malformed or two artifacts share a version
   */
  public List<MigrationUnit> scan(final Path directory) {
    if (!Files.isDirectory(directory)) {
      log.debug("Migrations directory {} does not exist", directory);
      return List.of();
    }
    final List<Path> candidates;
    try (Stream<Path> children = Files.list(directory)) {
      candidates = children
          .filter(Files::isRegularFile)
          .filter(this::isCandidate)
          .sorted(Comparator.comparing(path -> path.getFileName().toString()))
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new StratumException("Unable to list migrations in " + directory, e);
    }

    final Map<String, Path> versions = new HashMap<>();
    final List<MigrationUnit> units = new ArrayList<>();
    for (Path candidate : candidates) {
      final Optional<MigrationUnit> loaded = load(candidate);
      if (loaded.isEmpty()) {
        log.debug("Skipping {}: not a migration", candidate.getFileName());
        continue;
      }
      final MigrationUnit unit = loaded.get();
      final Path previous = versions.putIfAbsent(unit.version(), candidate);
      if (previous != null) {
        throw new ValidationException("Duplicate migration version '" + unit.version() + "' in "
            + previous.getFileName() + " and " + candidate.getFileName(), "version", unit.version());
      }
      units.add(unit);
    }
    units.sort(Comparator.comparing(MigrationUnit::version));
    log.debug("Found {} migration(s) in {}", units.size(), directory);
    return List.copyOf(units);
  }

  private boolean isCandidate(final Path path) {
    final String name = path.getFileName().toString();
    if (name.startsWith(RESERVED_PREFIX) || name.startsWith(".")) {
      return false;
    }
    final String lower = name.toLowerCase(Locale.ROOT);
    return lower.endsWith(".yaml") || lower.endsWith(".yml");
  }

  private Optional<MigrationUnit> load(final Path file) {
    final String name = file.getFileName().toString();
    final byte[] content;
    final JsonNode root;
    try {
      content = Files.readAllBytes(file);
      root = yamlMapper.readTree(content);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Migration " + name + " is not valid YAML: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new StratumException("Unable to read migration " + file, e);
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }
    if (REQUIRED_ATTRIBUTES.stream().noneMatch(root::has)) {
      return Optional.empty();
    }
    for (String attribute : REQUIRED_ATTRIBUTES) {
      final JsonNode value = root.get(attribute);
      if (value == null || value.isNull()) {
        throw new ValidationException("Migration " + name + " is missing required attribute '" + attribute + "'",
            attribute, null);
      }
      if (!value.isTextual()) {
        throw new ValidationException("Migration " + name + " attribute '" + attribute
            + "' must be a string, quote it if it looks like a number", attribute, value.asText());
      }
    }
    final String version = root.get("version").asText().trim();
    final String description = root.get("description").asText().trim();
    requireText(name, "version", version, MigrationUnit.MAX_VERSION_LENGTH);
    requireText(name, "description", description, MigrationUnit.MAX_DESCRIPTION_LENGTH);
    return Optional.of(ImmutableMigrationUnit.builder()
        .version(version)
        .description(description)
        .checksum(Checksums.of(content))
        .up(new SqlScriptAction(root.get("up").asText()))
        .down(new SqlScriptAction(root.get("down").asText()))
        .source(file)
        .build());
  }

  private static void requireText(final String name, final String attribute, final String value, final int maxLength) {
    if (value.isEmpty()) {
      throw new ValidationException("Migration " + name + " has a blank " + attribute, attribute, value);
    }
    if (value.length() > maxLength) {
      throw new ValidationException("Migration " + name + " " + attribute + " is " + value.length()
          + " characters long, at most " + maxLength + " are allowed", attribute, value.length());
    }
  }
}
