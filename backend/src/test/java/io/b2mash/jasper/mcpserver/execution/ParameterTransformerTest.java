package io.b2mash.jasper.mcpserver.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.jasper.mcpserver.exception.McpException;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class ParameterTransformerTest {

  private final ParameterTransformer transformer =
      new ParameterTransformer(JsonMapper.builder().build());

  @Test
  void transform_coercesMixedParameters() {
    var parameters = new LinkedHashMap<String, Object>();
    parameters.put("a", 123);
    parameters.put("b", Date.from(Instant.parse("2023-01-01T00:00:00.000Z")));
    parameters.put("c", List.of("x", "y"));
    parameters.put("d", Map.of("k", "v"));

    var transformed = transformer.transform(parameters);

    assertThat(transformed)
        .containsExactly(
            Map.entry("a", "123"),
            Map.entry("b", "2023-01-01T00:00:00.000Z"),
            Map.entry("c", List.of("x", "y")),
            Map.entry("d", "{\"k\":\"v\"}"));
  }

  @Test
  void transform_dropsNullValues() {
    var parameters = new HashMap<String, Object>();
    parameters.put("kept", "value");
    parameters.put("dropped", null);

    assertThat(transformer.transform(parameters)).containsOnlyKeys("kept");
  }

  @Test
  void transform_nullOrEmptyIsEmpty() {
    assertThat(transformer.transform(null)).isEmpty();
    assertThat(transformer.transform(Map.of())).isEmpty();
  }

  @Test
  void transform_numbersAreCanonical() {
    var parameters = new LinkedHashMap<String, Object>();
    parameters.put("double", 1.50d);
    parameters.put("whole", 10.0d);
    parameters.put("decimal", new BigDecimal("1.50"));
    parameters.put("long", 9_000_000_000L);
    parameters.put("float", 2.25f);

    var transformed = transformer.transform(parameters);

    assertThat(transformed)
        .containsEntry("double", "1.5")
        .containsEntry("whole", "10")
        .containsEntry("decimal", "1.50")
        .containsEntry("long", "9000000000")
        .containsEntry("float", "2.25");
  }

  @Test
  void transform_booleansAndEnums() {
    var transformed = transformer.transform(Map.of("flag", true, "mode", ExecutionMode.ASYNC));

    assertThat(transformed).containsEntry("flag", "true").containsEntry("mode", "ASYNC");
  }

  @Test
  void transform_identifierLikeScalarsAreNotJsonQuoted() {
    var transformed =
        transformer.transform(
            Map.of(
                "id",
                UUID.fromString("123e4567-e89b-12d3-a456-426614174000"),
                "grade",
                'A',
                "source",
                URI.create("https://example.com/data"),
                "locale",
                Locale.US,
                "regionIds",
                List.of(UUID.fromString("00000000-0000-0000-0000-000000000001"))));

    assertThat(transformed)
        .containsEntry("id", "123e4567-e89b-12d3-a456-426614174000")
        .containsEntry("grade", "A")
        .containsEntry("source", "https://example.com/data")
        .containsEntry("locale", "en_US")
        .containsEntry("regionIds", List.of("00000000-0000-0000-0000-000000000001"));
  }

  @Test
  void transform_temporalValuesAreUtcIsoStrings() {
    var transformed =
        transformer.transform(
            Map.of(
                "offset",
                OffsetDateTime.of(2024, 3, 10, 12, 0, 0, 0, ZoneOffset.ofHours(2)),
                "date",
                LocalDate.of(2024, 3, 10)));

    assertThat(transformed)
        .containsEntry("offset", "2024-03-10T10:00:00.000Z")
        .containsEntry("date", "2024-03-10T00:00:00.000Z");
  }

  @Test
  void transform_arraysBecomeListsWithoutNullEntries() {
    var transformed =
        transformer.transform(
            Map.of("regions", Arrays.asList("EU", null, "US"), "ids", new int[] {1, 2}));

    assertThat(transformed)
        .containsEntry("regions", List.of("EU", "US"))
        .containsEntry("ids", List.of("1", "2"));
  }

  @Test
  void transform_resultIsImmutable() {
    var transformed = transformer.transform(Map.of("a", "b"));

    assertThatThrownBy(() -> transformed.put("c", "d"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void transform_circularCollectionIsRejected() {
    var selfReferencing = new ArrayList<Object>();
    selfReferencing.add(selfReferencing);

    assertThatThrownBy(() -> transformer.transform(Map.of("loop", selfReferencing)))
        .isInstanceOf(McpException.class)
        .satisfies(
            ex ->
                assertThat(((McpException) ex).getError().message())
                    .isEqualTo("Parameter 'loop' contains a circular reference"));
  }

  @Test
  void transform_circularMapIsRejected() {
    var selfReferencing = new HashMap<String, Object>();
    selfReferencing.put("self", selfReferencing);

    assertThatThrownBy(() -> transformer.transform(Map.of("loop", selfReferencing)))
        .isInstanceOf(McpException.class)
        .satisfies(
            ex -> assertThat(((McpException) ex).getError().code()).isEqualTo("InternalError"));
  }
}
