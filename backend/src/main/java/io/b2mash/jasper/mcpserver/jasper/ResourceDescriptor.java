package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Repository entry as described by the report server's resources service. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceDescriptor(
    String uri,
    String label,
    String description,
    String resourceType,
    String creationDate,
    String updateDate,
    Integer version) {

  public static final String REPORT_UNIT = "reportUnit";

  @JsonIgnore
  public boolean isReportUnit() {
    return REPORT_UNIT.equals(resourceType);
  }

  ResourceDescriptor withResourceType(String type) {
    return new ResourceDescriptor(uri, label, description, type, creationDate, updateDate, version);
  }
}
