package io.b2mash.jasper.mcpserver.format;

/**
 * A rendering target supported by the report server.
 *
 * @param format lowercase registry key, also the extension used in synchronous run URLs
 * @param binary whether rendered content is binary (base64 on the wire) rather than text
 */
public record OutputFormatDescriptor(
    String format, String mimeType, String extension, boolean binary) {}
