package io.b2mash.jasper.mcpserver.config;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.support.HttpRequestWrapper;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/** Appends {@code j_username} and {@code j_password} to every outgoing request URI. */
class ArgumentAuthInterceptor implements ClientHttpRequestInterceptor {

  private final String encodedUsername;
  private final String encodedPassword;

  ArgumentAuthInterceptor(String username, String password) {
    this.encodedUsername = encode(username);
    this.encodedPassword = encode(password == null ? "" : password);
  }

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    URI authenticated =
        UriComponentsBuilder.fromUri(request.getURI())
            .queryParam("j_username", encodedUsername)
            .queryParam("j_password", encodedPassword)
            .build(true)
            .toUri();
    return execution.execute(
        new HttpRequestWrapper(request) {
          @Override
          public URI getURI() {
            return authenticated;
          }
        },
        body);
  }

  // '+' is legal in a query but decoded as a space by the server
  private static String encode(String value) {
    return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
  }
}
