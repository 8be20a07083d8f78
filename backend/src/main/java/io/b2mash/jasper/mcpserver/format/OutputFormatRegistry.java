package io.b2mash.jasper.mcpserver.format;

import io.b2mash.jasper.mcpserver.exception.FieldValidationError;
import io.b2mash.jasper.mcpserver.exception.McpErrorType;
import io.b2mash.jasper.mcpserver.exception.McpException;
import io.b2mash.jasper.mcpserver.exception.NormalizedError;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Fixed catalog of output formats. Stateless; iteration order is stable.
 *
 * <p>Asynchronous executions accept every format of {@link #list()} plus {@code json}, which the
 * report server only produces through its execution service.
 */
@Component
public class OutputFormatRegistry {

  private static final List<OutputFormatDescriptor> FORMATS =
      List.of(
          new OutputFormatDescriptor("pdf", "application/pdf", "pdf", true),
          new OutputFormatDescriptor("html", "text/html", "html", false),
          new OutputFormatDescriptor(
              "xlsx",
              "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
              "xlsx",
              true),
          new OutputFormatDescriptor("xls", "application/vnd.ms-excel", "xls", true),
          new OutputFormatDescriptor("csv", "text/csv", "csv", false),
          new OutputFormatDescriptor("rtf", "application/rtf", "rtf", true),
          new OutputFormatDescriptor(
              "docx",
              "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
              "docx",
              true),
          new OutputFormatDescriptor(
              "odt", "application/vnd.oasis.opendocument.text", "odt", true),
          new OutputFormatDescriptor(
              "ods", "application/vnd.oasis.opendocument.spreadsheet", "ods", true),
          new OutputFormatDescriptor("xml", "application/xml", "xml", false));

  private static final List<OutputFormatDescriptor> ASYNC_FORMATS =
      Stream.concat(
              FORMATS.stream(),
              Stream.of(new OutputFormatDescriptor("json", "application/json", "json", false)))
          .toList();

  private static final Map<String, OutputFormatDescriptor> BY_FORMAT = index(FORMATS);
  private static final Map<String, OutputFormatDescriptor> ASYNC_BY_FORMAT = index(ASYNC_FORMATS);

  public List<OutputFormatDescriptor> list() {
    return FORMATS;
  }

  public List<OutputFormatDescriptor> listAsync() {
    return ASYNC_FORMATS;
  }

  public Optional<OutputFormatDescriptor> find(String format) {
    return lookup(BY_FORMAT, format);
  }

  public Optional<OutputFormatDescriptor> findForAsync(String format) {
    return lookup(ASYNC_BY_FORMAT, format);
  }

  /** Resolves a format key case-insensitively, failing with a validation error when unknown. */
  public OutputFormatDescriptor resolve(String format) {
    return find(format).orElseThrow(() -> unsupported(format, FORMATS));
  }

  /** Like {@link #resolve(String)}, over the asynchronous catalog. */
  public OutputFormatDescriptor resolveForAsync(String format) {
    return findForAsync(format).orElseThrow(() -> unsupported(format, ASYNC_FORMATS));
  }

  private static Optional<OutputFormatDescriptor> lookup(
      Map<String, OutputFormatDescriptor> formats, String format) {
    if (format == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(formats.get(format.trim().toLowerCase(Locale.ROOT)));
  }

  private static Map<String, OutputFormatDescriptor> index(List<OutputFormatDescriptor> formats) {
    return formats.stream()
        .collect(Collectors.toUnmodifiableMap(OutputFormatDescriptor::format, Function.identity()));
  }

  private static McpException unsupported(String format, List<OutputFormatDescriptor> catalog) {
    var supported = catalog.stream().map(OutputFormatDescriptor::format).toList();
    var fieldError =
        new FieldValidationError(
            "outputFormat",
            format,
            "one of: " + String.join(", ", supported),
            "Unsupported output format: " + format);
    return new McpException(
        NormalizedError.of(
            McpErrorType.INVALID_PARAMS,
            "Unsupported output format: " + format,
            Map.of("validationResults", List.of(fieldError))));
  }
}
