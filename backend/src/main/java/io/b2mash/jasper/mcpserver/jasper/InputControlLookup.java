package io.b2mash.jasper.mcpserver.jasper;

import java.util.List;

public interface InputControlLookup {

  /** Input controls declared by the report; empty when it declares none. */
  List<InputControl> getInputControls(String reportUri);
}
