package io.b2mash.jasper.mcpserver.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/** Renders every tool failure as a {@link NormalizedError} body. */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final ErrorMapper errorMapper;

  public GlobalExceptionHandler(ErrorMapper errorMapper) {
    this.errorMapper = errorMapper;
  }

  @ExceptionHandler(McpException.class)
  public ResponseEntity<NormalizedError> handleMcpException(
      McpException ex, HttpServletRequest request) {
    var error = ex.getError();
    log.debug(
        "Tool call failed: path={}, method={}, code={}",
        request.getRequestURI(),
        request.getMethod(),
        error.code());
    return ResponseEntity.status(ex.getStatusCode()).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<NormalizedError> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    var error = errorMapper.mapException(ex, request.getMethod() + " " + request.getRequestURI());
    return ResponseEntity.status(McpException.httpStatusFor(error)).body(error);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var fieldErrors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                fieldError ->
                    new FieldValidationError(
                        fieldError.getField(),
                        fieldError.getRejectedValue(),
                        fieldError.getCode(),
                        fieldError.getDefaultMessage()))
            .toList();
    var error = errorMapper.createValidationError(fieldErrors);
    log.debug("Rejected tool request: {}", error.message());
    return ResponseEntity.status(McpException.httpStatusFor(error)).headers(headers).body(error);
  }
}
