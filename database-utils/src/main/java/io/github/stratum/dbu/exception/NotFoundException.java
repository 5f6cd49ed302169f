package io.github.stratum.dbu.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A requested resource does not exist.
 */
public class NotFoundException extends StratumException {

  private final String resourceType;
  private final String resourceId;

  /**
   * Instantiates a new exception with the message {@code "<type> not found: <id>"}.
   *
   * @param resourceType the resource type
   * @param resourceId   the resource id
   */
  public NotFoundException(final String resourceType, final String resourceId) {
    this(resourceType + " not found: " + resourceId, resourceType, resourceId);
  }

  /**
   * Instantiates a new exception.
   *
   * @param message      the message
   * @param resourceType the resource type
   * @param resourceId   the resource id
   */
  public NotFoundException(final String message, final String resourceType, final String resourceId) {
    super(message, details(resourceType, resourceId), null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  private static Map<String, Object> details(final String resourceType, final String resourceId) {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("resourceType", resourceType);
    details.put("resourceId", resourceId);
    return details;
  }

  /**
   * Resource type.
   *
   * @return the type
   */
  public String resourceType() {
    return resourceType;
  }

  /**
   * Resource id.
   *
   * @return the id
   */
  public String resourceId() {
    return resourceId;
  }
}
