package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteExecutionDetails(
    String requestId, String status, Integer totalPages, List<Export> exports) {

  public RemoteExecutionDetails {
    exports = exports == null ? List.of() : List.copyOf(exports);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Export(String id, String status, OutputResource outputResource) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record OutputResource(String contentType, String fileName) {}
}
