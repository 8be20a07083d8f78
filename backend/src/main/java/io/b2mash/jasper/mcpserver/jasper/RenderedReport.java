package io.b2mash.jasper.mcpserver.jasper;

/** Raw output downloaded from the report server. {@code fileName} is null when not advertised. */
public record RenderedReport(byte[] content, String contentType, String fileName) {}
