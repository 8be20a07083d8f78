package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InputControl(
    String id,
    String label,
    String description,
    String type,
    String uri,
    boolean mandatory,
    boolean readOnly,
    boolean visible,
    List<String> masterDependencies) {}
