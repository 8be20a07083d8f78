package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Handle returned by the report server when an asynchronous execution is accepted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteExecution(String requestId, String status) {}
