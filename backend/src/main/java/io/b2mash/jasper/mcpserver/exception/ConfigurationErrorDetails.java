package io.b2mash.jasper.mcpserver.exception;

import java.util.List;

/**
 * Describes a rejected configuration entry.
 *
 * @param reason e.g. {@code missing}, {@code invalid_format}, {@code out_of_range}
 */
public record ConfigurationErrorDetails(
    String configKey,
    Object configValue,
    String expectedType,
    List<String> validValues,
    String reason) {

  public ConfigurationErrorDetails {
    validValues = validValues == null ? List.of() : List.copyOf(validValues);
  }
}
