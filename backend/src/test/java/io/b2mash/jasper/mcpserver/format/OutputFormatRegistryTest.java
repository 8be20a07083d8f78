package io.b2mash.jasper.mcpserver.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.jasper.mcpserver.exception.ErrorCategory;
import io.b2mash.jasper.mcpserver.exception.FieldValidationError;
import io.b2mash.jasper.mcpserver.exception.McpException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OutputFormatRegistryTest {

  private final OutputFormatRegistry registry = new OutputFormatRegistry();

  @Test
  void list_returnsEveryFormatInStableOrder() {
    assertThat(registry.list())
        .extracting(OutputFormatDescriptor::format)
        .containsExactly("pdf", "html", "xlsx", "xls", "csv", "rtf", "docx", "odt", "ods", "xml");
    assertThat(registry.list()).isSameAs(registry.list());
  }

  @Test
  void resolve_extensionIsLowercaseToken() {
    for (var descriptor : registry.list()) {
      var resolved = registry.resolve(descriptor.format());
      assertThat(resolved.extension()).isNotBlank().matches("[a-z]+");
    }
  }

  @Test
  void resolve_binaryFlagMatchesFormatNature() {
    for (String binary : Set.of("pdf", "xlsx", "rtf", "docx", "xls", "odt", "ods")) {
      assertThat(registry.resolve(binary).binary()).as(binary).isTrue();
    }
    for (String text : Set.of("html", "csv", "xml")) {
      assertThat(registry.resolve(text).binary()).as(text).isFalse();
    }
  }

  @Test
  void resolve_isCaseInsensitive() {
    var descriptor = registry.resolve(" PDF ");

    assertThat(descriptor.format()).isEqualTo("pdf");
    assertThat(descriptor.mimeType()).isEqualTo("application/pdf");
  }

  @Test
  void resolve_unknownFormatIsValidationError() {
    assertThatThrownBy(() -> registry.resolve("pptx"))
        .isInstanceOf(McpException.class)
        .satisfies(
            ex -> {
              var error = ((McpException) ex).getError();
              assertThat(error.code()).isEqualTo("InvalidParams");
              assertThat(error.category()).isEqualTo(ErrorCategory.VALIDATION);
              assertThat(error.message()).isEqualTo("Unsupported output format: pptx");
              @SuppressWarnings("unchecked")
              var results = (List<FieldValidationError>) error.details().get("validationResults");
              assertThat(results)
                  .extracting(FieldValidationError::field)
                  .containsExactly("outputFormat");
            });
  }

  @Test
  void resolveForAsync_addsJsonToTheCatalog() {
    assertThat(registry.listAsync())
        .extracting(OutputFormatDescriptor::format)
        .startsWith("pdf")
        .endsWith("json")
        .hasSize(registry.list().size() + 1);
    assertThat(registry.resolveForAsync("Json").mimeType()).isEqualTo("application/json");
    assertThat(registry.find("json")).isEmpty();
    assertThatThrownBy(() -> registry.resolveForAsync("pptx"))
        .isInstanceOf(McpException.class)
        .satisfies(
            ex ->
                assertThat(((McpException) ex).getError().message())
                    .isEqualTo("Unsupported output format: pptx"));
  }

  @Test
  void find_nullIsEmpty() {
    assertThat(registry.find(null)).isEmpty();
    assertThat(registry.find("docx")).isPresent();
  }
}
