package io.b2mash.jasper.mcpserver.jasper;

import java.util.Optional;

/** Port to the report server's repository. */
public interface ResourceLookup {

  /** Describes the resource at {@code uri}, or empty when the server has no such resource. */
  Optional<ResourceDescriptor> findResource(String uri);
}
