package ca.gc.cra.scribe.infrastructure.format;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.diagnostics.Truncation;
import ca.gc.cra.scribe.domain.log.CapturedError;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Human-readable single-line formatter.
 * <p><strong>Layout:</strong> {@code [time] LEVEL    logger: message | key=value key=value}. Context fields
 * come first, then extra fields; nested maps are flattened with dotted keys down to {@value #MAX_DEPTH} levels,
 * deeper maps are written as a placeholder. Line breaks in the logger name and message are escaped, so only a
 * captured error adds lines: a traceback block in the usual Java stack-trace shape.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleFormatter implements LogFormatter {
  /** Default byte budget per rendered value. */
  public static final int DEFAULT_MAX_VALUE_BYTES = 1024;

  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSS");
  private static final String RESET = "\u001B[0m";
  private static final int LEVEL_WIDTH = 8;
  private static final int MAX_DEPTH = 16;

  private final boolean useColors;
  private final DateTimeFormatter time;
  private final int maxValueBytes;

  /** Creates an uncolored formatter in the system time zone. */
  public ConsoleFormatter() {
    this(false);
  }

  /**
   * Creates a formatter in the system time zone.
   *
   * @param useColors {@code true} to wrap the level in ANSI color codes
   */
  public ConsoleFormatter(boolean useColors) {
    this(useColors, ZoneId.systemDefault(), DEFAULT_MAX_VALUE_BYTES);
  }

  /**
   * Creates a formatter.
   *
   * @param useColors {@code true} to wrap the level in ANSI color codes
   * @param zone zone used to render the timestamp
   * @param maxValueBytes UTF-8 byte budget per field value; must be positive
   */
  public ConsoleFormatter(boolean useColors, ZoneId zone, int maxValueBytes) {
    if (maxValueBytes <= 0) {
      throw new IllegalArgumentException("maxValueBytes must be positive");
    }
    this.useColors = useColors;
    this.time = TIME.withZone(Objects.requireNonNull(zone, "zone"));
    this.maxValueBytes = maxValueBytes;
  }

  /**
   * Creates a formatter that colors output only when the JVM is attached to an interactive console.
   *
   * @return console-aware formatter
   */
  public static ConsoleFormatter forConsole() {
    return new ConsoleFormatter(System.console() != null);
  }

  /**
   * Returns whether ANSI colors are emitted.
   *
   * @return {@code true} when colored
   */
  public boolean useColors() {
    return useColors;
  }

  @Override
  public String render(LogRecord record) {
    Objects.requireNonNull(record, "record");
    StringBuilder sb = new StringBuilder(128);
    sb.append('[').append(time.format(record.timestamp())).append("] ");
    appendLevel(sb, record.level());
    sb.append(' ');
    appendEscapingLineBreaks(sb, record.loggerName());
    sb.append(": ");
    appendEscapingLineBreaks(sb, record.message());

    StringBuilder fields = new StringBuilder();
    appendFields(fields, "", record.context(), 0);
    appendFields(fields, "", record.extra(), 0);
    if (fields.length() > 0) {
      sb.append(" |").append(fields);
    }
    if (record.error() != null) {
      appendTraceback(sb, record.error());
    }
    return sb.toString();
  }

  private void appendLevel(StringBuilder sb, LogLevel level) {
    String name = level.name();
    if (useColors) {
      sb.append(color(level)).append(name).append(RESET);
    } else {
      sb.append(name);
    }
    for (int i = name.length(); i < LEVEL_WIDTH; i++) {
      sb.append(' ');
    }
  }

  private static String color(LogLevel level) {
    return switch (level) {
      case DEBUG -> "\u001B[36m";
      case INFO -> "\u001B[32m";
      case WARNING -> "\u001B[33m";
      case ERROR -> "\u001B[31m";
      case CRITICAL -> "\u001B[35m";
    };
  }

  private void appendFields(StringBuilder sb, String prefix, Map<?, ?> fields, int depth) {
    for (Map.Entry<?, ?> entry : fields.entrySet()) {
      String key = prefix + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
        if (depth < MAX_DEPTH) {
          appendFields(sb, key + ".", nested, depth + 1);
        } else {
          sb.append(' ').append(key).append("=\"<max depth exceeded>\"");
        }
        continue;
      }
      sb.append(' ').append(key).append('=').append(renderValue(value));
    }
  }

  private String renderValue(Object value) {
    if (value == null) {
      return "null";
    }
    String text = Truncation.toUtf8Bytes(ValueText.of(value), maxValueBytes);
    if (value instanceof CharSequence && needsQuoting(text)) {
      return quote(text);
    }
    return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0 ? quote(text) : text;
  }

  private static boolean needsQuoting(String text) {
    if (text.isEmpty()) {
      return true;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c) || c == '=' || c == '"') {
        return true;
      }
    }
    return false;
  }

  private static void appendEscapingLineBreaks(StringBuilder sb, String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        default -> sb.append(c);
      }
    }
  }

  private static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  private static void appendTraceback(StringBuilder sb, CapturedError error) {
    CapturedError current = error;
    boolean first = true;
    while (current != null) {
      sb.append('\n');
      if (!first) {
        sb.append("Caused by: ");
      }
      sb.append(current.type());
      if (current.message() != null) {
        sb.append(": ").append(current.message());
      }
      for (String frame : current.frames()) {
        sb.append('\n').append("\tat ").append(frame);
      }
      first = false;
      current = current.cause();
    }
  }
}
