package io.b2mash.jasper.mcpserver.exception;

/** One rejected field of a tool request. */
public record FieldValidationError(
    String field, Object value, String constraint, String message) {}
