package io.b2mash.jasper.mcpserver.jasper;

import io.b2mash.jasper.mcpserver.format.OutputFormatDescriptor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

/**
 * Report server adapter over the REST v2 API. Repository URIs are appended to the service path
 * as-is; parameter values are passed as URI variables so they are always fully encoded.
 */
@Component
public class JasperRestClient implements ResourceLookup, InputControlLookup, ReportExecutionClient {

  private static final Logger log = LoggerFactory.getLogger(JasperRestClient.class);

  static final String RESOURCES_PATH = "/rest_v2/resources";
  static final String REPORTS_PATH = "/rest_v2/reports";
  static final String EXECUTIONS_PATH = "/rest_v2/reportExecutions";

  private static final String REPOSITORY_TYPE_PREFIX = "repository.";

  private final RestClient restClient;

  public JasperRestClient(@Qualifier("jasperRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public Optional<ResourceDescriptor> findResource(String uri) {
    ResponseEntity<ResourceDescriptor> response;
    try {
      response =
          restClient
              .get()
              .uri(builder -> builder.path(RESOURCES_PATH).path(uri).build())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .toEntity(ResourceDescriptor.class);
    } catch (HttpClientErrorException.NotFound e) {
      log.debug("Resource {} not found on report server", uri);
      return Optional.empty();
    }
    var descriptor = response.getBody();
    if (descriptor == null) {
      return Optional.empty();
    }
    if (descriptor.resourceType() == null) {
      // the parsed MediaType is lowercased; resource types are camel case
      var contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
      descriptor = descriptor.withResourceType(typeFromContentType(contentType));
    }
    return Optional.of(descriptor);
  }

  @Override
  public List<InputControl> getInputControls(String reportUri) {
    var response =
        restClient
            .get()
            .uri(
                builder ->
                    builder.path(REPORTS_PATH).path(reportUri).path("/inputControls").build())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .toEntity(InputControlsResponse.class);
    var body = response.getBody();
    if (response.getStatusCode() == HttpStatus.NO_CONTENT
        || body == null
        || body.inputControl() == null) {
      return List.of();
    }
    return List.copyOf(body.inputControl());
  }

  @Override
  public RenderedReport runReport(
      String reportUri,
      OutputFormatDescriptor format,
      Map<String, Object> parameters,
      ReportRunOptions options) {
    log.debug(
        "Running {} as {} with {} parameter(s)", reportUri, format.format(), parameters.size());
    var response =
        restClient
            .get()
            .uri(
                builder -> {
                  builder.path(REPORTS_PATH).path(reportUri + "." + format.format());
                  var variables = new HashMap<String, Object>();
                  parameters.forEach(
                      (name, value) -> addQueryValues(builder, variables, name, value));
                  addQueryValues(builder, variables, "pages", options.pages());
                  addQueryValues(builder, variables, "userLocale", options.locale());
                  addQueryValues(builder, variables, "userTimezone", options.timezone());
                  return builder.build(variables);
                })
            .accept(MediaType.parseMediaType(format.mimeType()), MediaType.ALL)
            .retrieve()
            .toEntity(byte[].class);
    return rendered(response);
  }

  @Override
  public RemoteExecution startExecution(
      String reportUri,
      OutputFormatDescriptor format,
      Map<String, Object> parameters,
      ReportRunOptions options) {
    var body = new LinkedHashMap<String, Object>();
    body.put("reportUnitUri", reportUri);
    body.put("outputFormat", format.format());
    body.put("async", true);
    putIfPresent(body, "freshData", options.freshData());
    putIfPresent(body, "saveDataSnapshot", options.saveDataSnapshot());
    putIfPresent(body, "ignorePagination", options.ignorePagination());
    putIfPresent(body, "pages", options.pages());
    putIfPresent(body, "locale", options.locale());
    putIfPresent(body, "timezone", options.timezone());
    if (!parameters.isEmpty()) {
      body.put("parameters", Map.of("reportParameter", reportParameters(parameters)));
    }

    var execution =
        restClient
            .post()
            .uri(EXECUTIONS_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(RemoteExecution.class);
    if (execution == null || execution.requestId() == null) {
      throw new IllegalStateException("Report server accepted execution without a requestId");
    }
    log.info("Report server accepted execution {} for {}", execution.requestId(), reportUri);
    return execution;
  }

  @Override
  public RemoteExecutionStatus getExecutionStatus(String requestId) {
    return restClient
        .get()
        .uri(EXECUTIONS_PATH + "/{requestId}/status", requestId)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(RemoteExecutionStatus.class);
  }

  @Override
  public RemoteExecutionDetails getExecutionDetails(String requestId) {
    return restClient
        .get()
        .uri(EXECUTIONS_PATH + "/{requestId}", requestId)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(RemoteExecutionDetails.class);
  }

  @Override
  public RenderedReport getExportOutput(String requestId, String exportId) {
    var response =
        restClient
            .get()
            .uri(
                EXECUTIONS_PATH + "/{requestId}/exports/{exportId}/outputResource",
                requestId,
                exportId)
            .retrieve()
            .toEntity(byte[].class);
    return rendered(response);
  }

  @Override
  public boolean cancelExecution(String requestId) {
    try {
      var response =
          restClient
              .put()
              .uri(EXECUTIONS_PATH + "/{requestId}/status", requestId)
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .body(Map.of("value", RemoteExecutionStatus.CANCELLED))
              .retrieve()
              .toEntity(RemoteExecutionStatus.class);
      // 204: the execution already finished
      if (response.getStatusCode() == HttpStatus.NO_CONTENT || response.getBody() == null) {
        return false;
      }
      return RemoteExecutionStatus.CANCELLED.equals(response.getBody().value());
    } catch (HttpClientErrorException.NotFound e) {
      log.debug("Execution {} unknown to report server, nothing to cancel", requestId);
      return false;
    }
  }

  static String typeFromContentType(String contentType) {
    if (contentType == null) {
      return null;
    }
    // application/repository.reportUnit+json
    int start = contentType.indexOf(REPOSITORY_TYPE_PREFIX);
    if (start < 0) {
      return null;
    }
    start += REPOSITORY_TYPE_PREFIX.length();
    int end = start;
    while (end < contentType.length() && "+;".indexOf(contentType.charAt(end)) < 0) {
      end++;
    }
    return end > start ? contentType.substring(start, end).trim() : null;
  }

  static List<Map<String, Object>> reportParameters(Map<String, Object> parameters) {
    var reportParameters = new ArrayList<Map<String, Object>>(parameters.size());
    parameters.forEach(
        (name, value) -> {
          var entry = new LinkedHashMap<String, Object>();
          entry.put("name", name);
          entry.put("value", value instanceof List<?> values ? values : List.of(value));
          reportParameters.add(entry);
        });
    return reportParameters;
  }

  private static void addQueryValues(
      UriBuilder builder, Map<String, Object> variables, String name, Object value) {
    if (value == null) {
      return;
    }
    List<?> values = value instanceof List<?> list ? list : List.of(value);
    for (Object single : values) {
      String variable = "qp" + variables.size();
      builder.queryParam(name, "{" + variable + "}");
      variables.put(variable, single);
    }
  }

  private static void putIfPresent(Map<String, Object> body, String key, Object value) {
    if (value != null) {
      body.put(key, value);
    }
  }

  private static RenderedReport rendered(ResponseEntity<byte[]> response) {
    byte[] content = response.getBody() == null ? new byte[0] : response.getBody();
    var headers = response.getHeaders();
    String contentType =
        headers.getContentType() == null ? null : headers.getContentType().toString();
    String fileName = headers.getContentDisposition().getFilename();
    return new RenderedReport(content, contentType, fileName);
  }
}
