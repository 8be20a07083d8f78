package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.exception.McpErrorType;
import io.b2mash.jasper.mcpserver.exception.McpException;
import io.b2mash.jasper.mcpserver.exception.NormalizedError;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.Currency;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Coerces report parameters into the shapes the report server accepts: strings, and lists of
 * strings for multi-select inputs. Null values are dropped.
 */
@Component
public class ParameterTransformer {

  private static final DateTimeFormatter ISO_MILLIS_UTC =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  // values whose string form is the parameter value itself
  private static final List<Class<?>> TEXT_VALUE_TYPES =
      List.of(
          Character.class,
          UUID.class,
          URI.class,
          URL.class,
          Locale.class,
          Currency.class,
          ZoneId.class);

  private final ObjectMapper objectMapper;

  public ParameterTransformer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Map<String, Object> transform(Map<String, ?> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return Map.of();
    }
    var transformed = new LinkedHashMap<String, Object>();
    parameters.forEach(
        (name, value) -> {
          if (value != null) {
            transformed.put(name, transformValue(name, value, identitySet()));
          }
        });
    return Collections.unmodifiableMap(transformed);
  }

  private Object transformValue(String name, Object value, Set<Object> path) {
    if (value instanceof CharSequence text) {
      return text.toString();
    }
    if (value instanceof Boolean flag) {
      return flag.toString();
    }
    if (value instanceof Number number) {
      return canonical(number);
    }
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    if (isTextValue(value)) {
      return value.toString();
    }
    Instant instant = toInstant(value);
    if (instant != null) {
      return ISO_MILLIS_UTC.format(instant);
    }
    if (value instanceof Collection<?> || value.getClass().isArray()) {
      enter(name, value, path);
      var elements = new ArrayList<Object>();
      for (Object element : elements(value)) {
        // null entries carry no selection
        if (element != null) {
          elements.add(transformValue(name, element, path));
        }
      }
      path.remove(value);
      return List.copyOf(elements);
    }
    return toJson(name, value, path);
  }

  private static boolean isTextValue(Object value) {
    for (var type : TEXT_VALUE_TYPES) {
      if (type.isInstance(value)) {
        return true;
      }
    }
    return false;
  }

  private String toJson(String name, Object value, Set<Object> path) {
    assertAcyclic(name, value, path);
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JacksonException e) {
      throw new McpException(
          NormalizedError.of(
              McpErrorType.INTERNAL,
              "Parameter '" + name + "' cannot be serialized: " + e.getMessage(),
              Map.of("parameter", name)),
          e);
    }
  }

  private void assertAcyclic(String name, Object value, Set<Object> path) {
    if (value instanceof Map<?, ?> map) {
      enter(name, value, path);
      for (Object nested : map.values()) {
        if (nested != null) {
          assertAcyclic(name, nested, path);
        }
      }
      path.remove(value);
    } else if (value instanceof Collection<?> || value.getClass().isArray()) {
      enter(name, value, path);
      for (Object nested : elements(value)) {
        if (nested != null) {
          assertAcyclic(name, nested, path);
        }
      }
      path.remove(value);
    }
  }

  private static void enter(String name, Object value, Set<Object> path) {
    if (!path.add(value)) {
      throw new McpException(
          NormalizedError.of(
              McpErrorType.INTERNAL,
              "Parameter '" + name + "' contains a circular reference",
              Map.of("parameter", name)));
    }
  }

  private static Iterable<?> elements(Object container) {
    if (container instanceof Collection<?> collection) {
      return collection;
    }
    int length = Array.getLength(container);
    var elements = new ArrayList<Object>(length);
    for (int i = 0; i < length; i++) {
      elements.add(Array.get(container, i));
    }
    return elements;
  }

  private static String canonical(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (number instanceof BigInteger
        || number instanceof Long
        || number instanceof Integer
        || number instanceof Short
        || number instanceof Byte) {
      return number.toString();
    }
    double asDouble = number.doubleValue();
    if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
      return Double.toString(asDouble);
    }
    BigDecimal decimal =
        number instanceof Float ? new BigDecimal(number.toString()) : BigDecimal.valueOf(asDouble);
    return decimal.stripTrailingZeros().toPlainString();
  }

  private static Instant toInstant(Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Date date) {
      return Instant.ofEpochMilli(date.getTime());
    }
    if (value instanceof Calendar calendar) {
      return calendar.toInstant();
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant();
    }
    if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    return null;
  }

  private static Set<Object> identitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
