package io.b2mash.jasper.mcpserver.config;

import io.b2mash.jasper.mcpserver.exception.ErrorMapper;
import io.b2mash.jasper.mcpserver.exception.McpException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(JasperServerProperties.class)
public class JasperClientConfig {

  private static final Logger log = LoggerFactory.getLogger(JasperClientConfig.class);

  @Bean
  RestClient jasperRestClient(JasperServerProperties properties, ErrorMapper errorMapper) {
    validate(properties, errorMapper);

    var httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());

    var builder = RestClient.builder().baseUrl(properties.url()).requestFactory(requestFactory);
    if (properties.username() != null && !properties.username().isBlank()) {
      switch (properties.authType()) {
        case BASIC ->
            builder.defaultHeaders(
                headers ->
                    headers.setBasicAuth(
                        properties.principal(),
                        properties.password() == null ? "" : properties.password(),
                        StandardCharsets.UTF_8));
        case ARGUMENT ->
            builder.requestInterceptor(
                new ArgumentAuthInterceptor(properties.principal(), properties.password()));
      }
    }
    log.info(
        "Report server client configured: url={}, authType={}, user={}",
        properties.url(),
        properties.authType(),
        properties.principal());
    return builder.build();
  }

  static void validate(JasperServerProperties properties, ErrorMapper errorMapper) {
    String url = properties.url();
    if (url == null || url.isBlank()) {
      throw new McpException(
          errorMapper.createConfigurationError(
              "jasper.url", "must be set", Map.of("expectedType", "URL")));
    }
    URI parsed;
    try {
      parsed = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new McpException(
          errorMapper.createConfigurationError(
              "jasper.url",
              "is not a valid URL",
              Map.of("configValue", url, "expectedType", "URL")),
          e);
    }
    if (!"http".equalsIgnoreCase(parsed.getScheme())
        && !"https".equalsIgnoreCase(parsed.getScheme())) {
      throw new McpException(
          errorMapper.createConfigurationError(
              "jasper.url",
              "must use http or https",
              Map.of("configValue", url, "expectedType", "URL")));
    }
    if (properties.authType() == null) {
      throw new McpException(
          errorMapper.createConfigurationError(
              "jasper.auth-type",
              "must be set",
              Map.of("validValues", validAuthTypes())));
    }
    var execution = properties.execution();
    if (execution != null && execution.maxConcurrentExecutions() < 1) {
      throw new McpException(
          errorMapper.createConfigurationError(
              "jasper.execution.max-concurrent-executions",
              "must be at least 1",
              Map.of(
                  "configValue", execution.maxConcurrentExecutions(), "expectedType", "integer")));
    }
  }

  private static List<String> validAuthTypes() {
    return Arrays.stream(JasperServerProperties.AuthType.values()).map(Enum::name).toList();
  }
}
