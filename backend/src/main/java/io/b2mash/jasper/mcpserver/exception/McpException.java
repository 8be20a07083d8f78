package io.b2mash.jasper.mcpserver.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Carries a {@link NormalizedError} to the caller. The only exception type tools ever throw. */
public class McpException extends ErrorResponseException {

  private final NormalizedError error;

  public McpException(NormalizedError error) {
    this(error, null);
  }

  public McpException(NormalizedError error, Throwable cause) {
    super(httpStatusFor(error), createProblem(error), cause);
    this.error = error;
  }

  public NormalizedError getError() {
    return error;
  }

  /**
   * Status used when the error is rendered over HTTP: the error's own status when it is a 4xx/5xx
   * code, 502 for network failures that never produced one, 500 otherwise.
   */
  static HttpStatusCode httpStatusFor(NormalizedError error) {
    Integer statusCode = error.statusCode();
    if (statusCode != null && statusCode >= 400 && statusCode <= 599) {
      return HttpStatusCode.valueOf(statusCode);
    }
    if (error.category() == ErrorCategory.NETWORK) {
      return HttpStatus.BAD_GATEWAY;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static ProblemDetail createProblem(NormalizedError error) {
    var problem = ProblemDetail.forStatus(httpStatusFor(error));
    problem.setTitle(error.code());
    problem.setDetail(error.message());
    problem.setProperty("category", error.category().value());
    problem.setProperty("severity", error.severity().value());
    problem.setProperty("timestamp", error.timestamp());
    return problem;
  }
}
