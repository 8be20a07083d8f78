package io.b2mash.jasper.mcpserver.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Connection settings for the report server.
 *
 * @param url base URL of the server, e.g. {@code http://localhost:8080/jasperserver}
 * @param organization tenant id; when set, a username without {@code |} is sent as {@code
 *     username|organization}
 * @param authType how credentials are attached to each request
 * @param execution limits applied by the execution engine
 */
@ConfigurationProperties(prefix = "jasper")
public record JasperServerProperties(
    String url,
    String username,
    String password,
    String organization,
    @DefaultValue("BASIC") AuthType authType,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("60s") Duration readTimeout,
    @DefaultValue Execution execution) {

  public enum AuthType {
    /** HTTP Basic header on every request. */
    BASIC,
    /** {@code j_username}/{@code j_password} query arguments on every request. */
    ARGUMENT
  }

  /**
   * @param historyLimit finished executions kept in memory
   * @param maxFileSize largest report output accepted from the server
   * @param maxConcurrentExecutions asynchronous executions that may be open at once
   * @param cleanupMaxAge age after which finished executions are dropped and open asynchronous
   *     executions are expired by the scheduled cleanup
   */
  public record Execution(
      @DefaultValue("100") int historyLimit,
      @DefaultValue("100MB") DataSize maxFileSize,
      @DefaultValue("10") int maxConcurrentExecutions,
      @DefaultValue("24h") Duration cleanupMaxAge) {}

  public String principal() {
    if (organization == null
        || organization.isBlank()
        || username == null
        || username.contains("|")) {
      return username;
    }
    return username + "|" + organization;
  }
}
