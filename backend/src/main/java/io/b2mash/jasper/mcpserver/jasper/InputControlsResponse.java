package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record InputControlsResponse(List<InputControl> inputControl) {}
