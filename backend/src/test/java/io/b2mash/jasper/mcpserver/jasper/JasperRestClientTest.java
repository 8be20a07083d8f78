package io.b2mash.jasper.mcpserver.jasper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.jasper.mcpserver.format.OutputFormatRegistry;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

class JasperRestClientTest {

  private static final String BASE_URL = "http://jasper.test/jasperserver";
  private static final String REPORT_URI = "/reports/test_report";

  private final OutputFormatRegistry formats = new OutputFormatRegistry();

  private MockRestServiceServer server;
  private JasperRestClient client;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    client = new JasperRestClient(builder.build());
  }

  @Test
  void findResource_readsDescriptor() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/resources/reports/test_report"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                """
                {"uri":"/reports/test_report","label":"Test Report",
                 "resourceType":"reportUnit","version":3,"creationDate":"2024-01-01"}
                """,
                MediaType.APPLICATION_JSON));

    var resource = client.findResource(REPORT_URI);

    assertThat(resource).isPresent();
    assertThat(resource.get().label()).isEqualTo("Test Report");
    assertThat(resource.get().isReportUnit()).isTrue();
    assertThat(resource.get().version()).isEqualTo(3);
    server.verify();
  }

  @Test
  void findResource_takesTypeFromContentTypeWhenBodyOmitsIt() {
    var headers = new HttpHeaders();
    headers.add(HttpHeaders.CONTENT_TYPE, "application/repository.reportUnit+json");
    server
        .expect(requestTo(BASE_URL + "/rest_v2/resources/reports/test_report"))
        .andRespond(
            withSuccess("{\"uri\":\"/reports/test_report\",\"label\":\"Test Report\"}", null)
                .headers(headers));

    var resource = client.findResource(REPORT_URI);

    assertThat(resource)
        .get()
        .extracting(ResourceDescriptor::resourceType)
        .isEqualTo("reportUnit");
  }

  @Test
  void findResource_notFoundIsEmpty() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/resources/reports/missing"))
        .andRespond(withResourceNotFound());

    assertThat(client.findResource("/reports/missing")).isEmpty();
  }

  @Test
  void getInputControls_readsControls() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reports/reports/test_report/inputControls"))
        .andRespond(
            withSuccess(
                """
                {"inputControl":[{"id":"StartDate","label":"Start","type":"singleValueDate",
                  "mandatory":true,"readOnly":false,"visible":true,
                  "uri":"repo:/reports/test_report_files/StartDate"}]}
                """,
                MediaType.APPLICATION_JSON));

    var controls = client.getInputControls(REPORT_URI);

    assertThat(controls)
        .singleElement()
        .satisfies(
            control -> {
              assertThat(control.id()).isEqualTo("StartDate");
              assertThat(control.mandatory()).isTrue();
            });
  }

  @Test
  void getInputControls_noContentIsEmpty() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reports/reports/test_report/inputControls"))
        .andRespond(withNoContent());

    assertThat(client.getInputControls(REPORT_URI)).isEmpty();
  }

  @Test
  void runReport_sendsParametersAsRepeatedQueryArguments() {
    var parameters = new LinkedHashMap<String, Object>();
    parameters.put("ids", List.of("1", "2"));
    parameters.put("region", "EU");
    var pdf = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);
    server
        .expect(requestTo(startsWith(BASE_URL + "/rest_v2/reports/reports/test_report.pdf?")))
        .andExpect(method(HttpMethod.GET))
        .andExpect(queryParam("ids", "1", "2"))
        .andExpect(queryParam("region", "EU"))
        .andExpect(queryParam("pages", "1-3"))
        .andExpect(header(HttpHeaders.ACCEPT, containsString("application/pdf")))
        .andRespond(withSuccess(pdf, MediaType.APPLICATION_PDF));

    var rendered =
        client.runReport(
            REPORT_URI,
            formats.resolve("pdf"),
            parameters,
            new ReportRunOptions("1-3", null, null, null, null, null));

    assertThat(rendered.content()).isEqualTo(pdf);
    assertThat(rendered.contentType()).isEqualTo("application/pdf");
    server.verify();
  }

  @Test
  void runReport_encodesJsonParameterValues() {
    server
        .expect(
            request ->
                assertThat(request.getURI().getQuery()).isEqualTo("filter={\"k\":\"v w\"}"))
        .andRespond(withSuccess("a,b", MediaType.parseMediaType("text/csv")));

    var rendered =
        client.runReport(
            REPORT_URI,
            formats.resolve("csv"),
            Map.of("filter", "{\"k\":\"v w\"}"),
            ReportRunOptions.none());

    assertThat(new String(rendered.content(), StandardCharsets.UTF_8)).isEqualTo("a,b");
  }

  @Test
  void runReport_serverErrorIsNotTranslated() {
    server
        .expect(requestTo(startsWith(BASE_URL + "/rest_v2/reports/")))
        .andRespond(withServerError());

    assertThatThrownBy(
            () ->
                client.runReport(
                    REPORT_URI, formats.resolve("pdf"), Map.of(), ReportRunOptions.none()))
        .isInstanceOf(HttpServerErrorException.class);
  }

  @Test
  void startExecution_postsExecutionDescriptor() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(
            content()
                .json(
                    """
                    {"reportUnitUri":"/reports/test_report","outputFormat":"xlsx","async":true,
                     "freshData":true,
                     "parameters":{"reportParameter":[{"name":"ids","value":["1","2"]},
                                                      {"name":"region","value":["EU"]}]}}
                    """))
        .andRespond(
            withSuccess(
                "{\"requestId\":\"req-1\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

    var parameters = new LinkedHashMap<String, Object>();
    parameters.put("ids", List.of("1", "2"));
    parameters.put("region", "EU");
    var execution =
        client.startExecution(
            REPORT_URI,
            formats.resolve("xlsx"),
            parameters,
            new ReportRunOptions(null, null, null, true, null, null));

    assertThat(execution.requestId()).isEqualTo("req-1");
    assertThat(execution.status()).isEqualTo("queued");
    server.verify();
  }

  @Test
  void getExecutionStatus_readsErrorDescriptor() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-1/status"))
        .andRespond(
            withSuccess(
                """
                {"value":"failed","errorDescriptor":{"errorCode":"parameter.error",
                 "message":"Missing StartDate","parameters":["StartDate"]}}
                """,
                MediaType.APPLICATION_JSON));

    var status = client.getExecutionStatus("req-1");

    assertThat(status.value()).isEqualTo("failed");
    assertThat(status.errorDescriptor().errorCode()).isEqualTo("parameter.error");
    assertThat(status.errorDescriptor().parameters()).containsExactly("StartDate");
  }

  @Test
  void getExecutionStatus_readsProgress() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-1/status"))
        .andRespond(
            withSuccess(
                """
                {"value":"execution","progress":40,"currentPage":2,"totalPages":5,
                 "exports":[{"id":"exp-1","status":"queued"}]}
                """,
                MediaType.APPLICATION_JSON));

    var status = client.getExecutionStatus("req-1");

    assertThat(status.value()).isEqualTo("execution");
    assertThat(status.progress()).isEqualTo(40);
    assertThat(status.currentPage()).isEqualTo(2);
    assertThat(status.totalPages()).isEqualTo(5);
    assertThat(status.exports())
        .extracting(RemoteExecutionDetails.Export::id)
        .containsExactly("exp-1");
    assertThat(status.errorDescriptor()).isNull();
  }

  @Test
  void getExecutionDetails_readsExports() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-1"))
        .andRespond(
            withSuccess(
                """
                {"requestId":"req-1","status":"ready","totalPages":4,
                 "exports":[{"id":"exp-1","status":"ready",
                   "outputResource":{"contentType":"application/pdf",
                                     "fileName":"test_report.pdf"}}]}
                """,
                MediaType.APPLICATION_JSON));

    var details = client.getExecutionDetails("req-1");

    assertThat(details.totalPages()).isEqualTo(4);
    assertThat(details.exports())
        .singleElement()
        .satisfies(
            export -> {
              assertThat(export.id()).isEqualTo("exp-1");
              assertThat(export.outputResource().fileName()).isEqualTo("test_report.pdf");
            });
  }

  @Test
  void getExportOutput_readsContentAndFileName() {
    var headers = new HttpHeaders();
    headers.setContentDisposition(
        ContentDisposition.attachment().filename("test_report.pdf").build());
    server
        .expect(
            requestTo(BASE_URL + "/rest_v2/reportExecutions/req-1/exports/exp-1/outputResource"))
        .andRespond(
            withSuccess(new byte[] {1, 2, 3}, MediaType.APPLICATION_PDF).headers(headers));

    var rendered = client.getExportOutput("req-1", "exp-1");

    assertThat(rendered.content()).containsExactly(1, 2, 3);
    assertThat(rendered.fileName()).isEqualTo("test_report.pdf");
  }

  @Test
  void cancelExecution_reflectsServerAnswer() {
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-1/status"))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(content().json("{\"value\":\"cancelled\"}"))
        .andRespond(withSuccess("{\"value\":\"cancelled\"}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-2/status"))
        .andRespond(withNoContent());
    server
        .expect(requestTo(BASE_URL + "/rest_v2/reportExecutions/req-3/status"))
        .andRespond(withResourceNotFound());

    assertThat(client.cancelExecution("req-1")).isTrue();
    assertThat(client.cancelExecution("req-2")).isFalse();
    assertThat(client.cancelExecution("req-3")).isFalse();
    server.verify();
  }

  @Test
  void typeFromContentType_parsesRepositoryMediaTypes() {
    assertThat(JasperRestClient.typeFromContentType("application/repository.folder+json"))
        .isEqualTo("folder");
    assertThat(JasperRestClient.typeFromContentType("application/repository.jdbcDataSource"))
        .isEqualTo("jdbcDataSource");
    assertThat(JasperRestClient.typeFromContentType("application/json")).isNull();
    assertThat(JasperRestClient.typeFromContentType(null)).isNull();
  }
}
