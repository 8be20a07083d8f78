package io.b2mash.jasper.mcpserver.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.jasper.mcpserver.jasper.ResourceDescriptor;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportValidationResult(
    boolean valid, ResourceDescriptor resource, String error, String message) {

  static ReportValidationResult valid(ResourceDescriptor resource) {
    return new ReportValidationResult(true, resource, null, "Report is valid and accessible");
  }

  static ReportValidationResult invalid(String error) {
    return new ReportValidationResult(false, null, error, null);
  }
}
