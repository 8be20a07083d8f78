package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.format.OutputFormatDescriptor;
import io.b2mash.jasper.mcpserver.jasper.InputControl;
import java.util.List;

/** Repository description of a report together with its input controls. */
public record ReportMetadata(
    String uri,
    String label,
    String description,
    String resourceType,
    String creationDate,
    String updateDate,
    Integer version,
    List<InputControl> inputControls,
    List<OutputFormatDescriptor> supportedFormats) {}
