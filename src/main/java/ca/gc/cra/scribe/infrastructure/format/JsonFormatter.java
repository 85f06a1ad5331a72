package ca.gc.cra.scribe.infrastructure.format;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.domain.log.CapturedError;
import ca.gc.cra.scribe.domain.log.LogRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders records as single-line JSON objects (NDJSON).
 * <p><strong>Why:</strong> Machine consumers re-parse each line, so scalar field types (string, number, boolean,
 * null) are written natively and survive a round trip.</p>
 * <p><strong>Layout:</strong> {@code timestamp}, {@code level}, {@code logger}, {@code message}, {@code module},
 * {@code function}, {@code line}, then nested {@code context} and {@code extra} objects and, when present, an
 * {@code error} object with {@code type}, {@code message}, {@code frames} and an optional {@code cause}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @implNote Values that are neither scalars, maps, iterables nor arrays are written with
 *     {@link String#valueOf(Object)}; nesting deeper than {@value #MAX_DEPTH} is written as a placeholder string.
 * @since 0.1.0
 */
public final class JsonFormatter implements LogFormatter {
  /** ISO-8601 UTC timestamp with microsecond precision, always including the fraction. */
  public static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private static final int MAX_DEPTH = 16;

  private final JsonFactory factory = new JsonFactory();
  private final boolean includeExtra;

  /** Creates a formatter that includes the {@code extra} object. */
  public JsonFormatter() {
    this(true);
  }

  /**
   * Creates a formatter.
   *
   * @param includeExtra {@code false} to omit per-call fields, keeping only context
   */
  public JsonFormatter(boolean includeExtra) {
    this.includeExtra = includeExtra;
  }

  @Override
  public String render(LogRecord record) {
    Objects.requireNonNull(record, "record");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("timestamp", TIMESTAMP.format(record.timestamp()));
      gen.writeStringField("level", record.level().name());
      gen.writeStringField("logger", record.loggerName());
      gen.writeStringField("message", record.message());
      gen.writeStringField("module", record.origin().module());
      gen.writeStringField("function", record.origin().function());
      gen.writeNumberField("line", record.origin().line());
      gen.writeFieldName("context");
      writeMap(gen, record.context(), 1);
      if (includeExtra) {
        gen.writeFieldName("extra");
        writeMap(gen, record.extra(), 1);
      }
      if (record.error() != null) {
        gen.writeFieldName("error");
        writeError(gen, record.error());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render record as JSON", ex);
    }
    return out.toString();
  }

  private void writeError(JsonGenerator gen, CapturedError error) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("type", error.type());
    gen.writeStringField("message", error.message());
    gen.writeArrayFieldStart("frames");
    for (String frame : error.frames()) {
      gen.writeString(frame);
    }
    gen.writeEndArray();
    if (error.cause() != null) {
      gen.writeFieldName("cause");
      writeError(gen, error.cause());
    }
    gen.writeEndObject();
  }

  private void writeMap(JsonGenerator gen, Map<?, ?> map, int depth) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      gen.writeFieldName(String.valueOf(entry.getKey()));
      writeValue(gen, entry.getValue(), depth + 1);
    }
    gen.writeEndObject();
  }

  private void writeValue(JsonGenerator gen, Object value, int depth) throws IOException {
    if (depth > MAX_DEPTH) {
      gen.writeString("<max depth exceeded>");
      return;
    }
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      gen.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Map<?, ?> nested) {
      writeMap(gen, nested, depth);
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item, depth + 1);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] array) {
      gen.writeStartArray();
      for (Object item : array) {
        writeValue(gen, item, depth + 1);
      }
      gen.writeEndArray();
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name());
    } else if (value instanceof TemporalAccessor temporal) {
      gen.writeString(temporal.toString());
    } else {
      gen.writeString(ValueText.of(value));
    }
  }
}
