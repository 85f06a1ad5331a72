package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.application.context.ContextStore;
import ca.gc.cra.scribe.application.logger.AppLogger;
import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.config.HandlerContext;
import ca.gc.cra.scribe.config.HandlerSpec;
import ca.gc.cra.scribe.config.LoggerConfig;
import ca.gc.cra.scribe.config.LoggingSettings;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Cache resolving logger names to {@link AppLogger} instances.
 * <p><strong>Identity:</strong> Instances are keyed by name and configuration. {@link #get(String)} returns the
 * first instance built for a name, building it from the default configuration on a miss.
 * {@link #get(String, LoggerConfig)} returns an instance built from an equal configuration, or builds and
 * registers a separate one. Existing instances are never closed by a later incompatible request.</p>
 * <p><strong>Lifecycle:</strong> {@link #clear()} removes every entry atomically, then retires the removed
 * loggers: their handlers are closed and later calls on them are forwarded to the logger a fresh lookup returns,
 * so instances held in fields keep logging. Later lookups rebuild from scratch.</p>
 * <p><strong>Files:</strong> Loggers whose handlers write the same file (two names that sanitize to one file name,
 * or two configurations of one name) share a single open handler, so writes and rotation of that file stay
 * serialized. A file already open with different handler settings is a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Lookups and {@link #clear()} are mutually exclusive, so no caller observes a
 * half-cleared registry. Building a logger happens inside that critical section so a name is never built
 * twice.</p>
 * <p><strong>Errors:</strong> Configuration errors ({@link IllegalArgumentException}), including a file claimed
 * with conflicting settings, and unopenable sinks ({@link IllegalStateException}) propagate to the caller;
 * nothing is registered in that case.</p>
 *
 * @since 0.1.0
 */
public final class LoggerRegistry {
  private static final Logger log = LoggerFactory.getLogger(LoggerRegistry.class);

  private final Function<String, LoggerConfig> defaults;
  private final HandlerContext handlerContext;
  private final ContextStore contextStore;
  private final Map<String, Entry> primary = new HashMap<>();
  private final Map<CacheKey, Entry> instances = new LinkedHashMap<>();
  private final Map<Path, SharedFile> files = new HashMap<>();

  /**
   * Creates a registry whose defaults come from {@link LoggingSettings#fromEnvironment()}, read on every cache
   * miss.
   */
  public LoggerRegistry() {
    this(name -> LoggingSettings.fromEnvironment().configFor(name), HandlerContext.defaults(), ContextStore.shared());
  }

  /**
   * Creates a registry.
   *
   * @param defaults default configuration for a logger name
   * @param handlerContext collaborators used to open handlers
   * @param contextStore context merged into every record
   */
  public LoggerRegistry(
      Function<String, LoggerConfig> defaults, HandlerContext handlerContext, ContextStore contextStore) {
    this.defaults = Objects.requireNonNull(defaults, "defaults");
    this.handlerContext = Objects.requireNonNull(handlerContext, "handlerContext");
    this.contextStore = Objects.requireNonNull(contextStore, "contextStore");
  }

  /**
   * Returns the cached logger for {@code name}, building it from the default configuration on first use.
   *
   * @param name logger name
   * @return cached logger
   * @throws IllegalArgumentException if the name is blank or the default configuration is invalid
   * @throws IllegalStateException if a sink cannot be opened
   */
  public synchronized AppLogger get(String name) {
    Strings.requireNonBlank("name", name);
    Entry existing = primary.get(name);
    if (existing != null) {
      return existing.logger();
    }
    LoggerConfig config = Objects.requireNonNull(defaults.apply(name), "default config");
    return register(name, config.name().equals(name) ? config : config.withName(name), true);
  }

  /**
   * Returns a logger for {@code name} built from {@code config}.
   *
   * @param name logger name
   * @param config requested configuration; {@code null} behaves like {@link #get(String)}
   * @return cached logger with an equal configuration, or a newly built one
   * @throws IllegalArgumentException if {@code config} names a different logger or is invalid
   * @throws IllegalStateException if a sink cannot be opened
   */
  public synchronized AppLogger get(String name, LoggerConfig config) {
    if (config == null) {
      return get(name);
    }
    Strings.requireNonBlank("name", name);
    if (!config.name().equals(name)) {
      throw new IllegalArgumentException(
          "Configuration for '" + config.name() + "' cannot be used for logger '" + name + "'");
    }
    Entry cached = instances.get(new CacheKey(name, config));
    if (cached != null) {
      return cached.logger();
    }
    if (primary.containsKey(name)) {
      log.debug("Logger {} requested with a different configuration ({}); building a separate instance",
          name, config.fingerprint());
    }
    return register(name, config, false);
  }

  /**
   * Returns the configuration the primary logger for {@code name} was built from.
   *
   * @param name logger name
   * @return configuration, or {@code null} when no logger is cached for the name
   */
  public synchronized LoggerConfig configOf(String name) {
    Entry entry = primary.get(name);
    return entry == null ? null : entry.config();
  }

  /**
   * Returns the number of cached logger instances.
   *
   * @return instance count
   */
  public synchronized int size() {
    return instances.size();
  }

  /**
   * Returns the number of files currently held open by cached loggers.
   *
   * @return open file count
   */
  public synchronized int openFiles() {
    return files.size();
  }

  /**
   * Removes every cached logger and closes its handlers. Removed instances forward later calls to the logger
   * {@link #get(String)} (or {@link #get(String, LoggerConfig)} with the same configuration) then returns.
   */
  public void clear() {
    transferTo(this);
  }

  /**
   * Removes every cached logger and closes its handlers, forwarding later calls on removed instances to
   * {@code successor}. Used when one registry replaces another.
   *
   * @param successor registry resolving replacements for removed instances
   */
  public void transferTo(LoggerRegistry successor) {
    Objects.requireNonNull(successor, "successor");
    List<Entry> removed;
    synchronized (this) {
      removed = new ArrayList<>(instances.values());
      instances.clear();
      primary.clear();
    }
    for (Entry entry : removed) {
      if (entry.fromDefaults()) {
        entry.logger().retire(() -> successor.get(entry.name()));
      } else {
        entry.logger().retire(() -> successor.get(entry.name(), entry.config()));
      }
    }
    log.debug("Cleared {} cached loggers", removed.size());
  }

  private AppLogger register(String name, LoggerConfig config, boolean fromDefaults) {
    AppLogger logger = build(config);
    Entry entry = new Entry(name, config, logger, fromDefaults);
    instances.put(new CacheKey(name, config), entry);
    primary.putIfAbsent(name, entry);
    return logger;
  }

  private AppLogger build(LoggerConfig config) {
    List<LogHandler> handlers = new ArrayList<>(config.handlers().size());
    try {
      for (HandlerSpec spec : config.handlers()) {
        handlers.add(open(spec, config.name()));
      }
    } catch (RuntimeException ex) {
      for (LogHandler opened : handlers) {
        opened.close();
      }
      throw ex;
    }
    log.debug("Built logger {} ({} handlers, fingerprint {})", config.name(), handlers.size(), config.fingerprint());
    return new AppLogger(
        config.name(),
        config.level(),
        handlers,
        config.filters(),
        contextStore,
        handlerContext.clock(),
        handlerContext.metrics());
  }

  private LogHandler open(HandlerSpec spec, String loggerName) {
    Optional<Path> target = spec.target();
    if (target.isEmpty()) {
      return spec.open(handlerContext);
    }
    Path file = target.get().toAbsolutePath().normalize();
    SharedFile shared = files.get(file);
    if (shared == null) {
      shared = new SharedFile(file, spec, loggerName, spec.open(handlerContext));
      files.put(file, shared);
    } else if (!shared.spec.equals(spec)) {
      throw new IllegalArgumentException("Log file " + file + " is already written by logger '" + shared.owner
          + "' with different handler settings");
    } else {
      log.debug("Logger {} shares log file {} with logger {}", loggerName, file, shared.owner);
    }
    return shared.lease();
  }

  private synchronized void release(SharedFile shared) {
    shared.leases--;
    if (shared.leases == 0) {
      files.remove(shared.file, shared);
      shared.handler.close();
    }
  }

  private record CacheKey(String name, LoggerConfig config) {}

  private record Entry(String name, LoggerConfig config, AppLogger logger, boolean fromDefaults) {}

  /** One open file handler and the number of logger handlers writing through it. Guarded by the registry. */
  private final class SharedFile {
    private final Path file;
    private final HandlerSpec spec;
    private final String owner;
    private final LogHandler handler;
    private int leases;

    SharedFile(Path file, HandlerSpec spec, String owner, LogHandler handler) {
      this.file = file;
      this.spec = spec;
      this.owner = owner;
      this.handler = handler;
    }

    LogHandler lease() {
      leases++;
      return new Lease(this);
    }
  }

  /** A logger's view of a shared file handler; closing it releases the file once the last lease closes. */
  private final class Lease implements LogHandler {
    private final SharedFile shared;
    private final AtomicBoolean closed = new AtomicBoolean();

    Lease(SharedFile shared) {
      this.shared = shared;
    }

    @Override
    public LogLevel threshold() {
      return shared.handler.threshold();
    }

    @Override
    public void publish(LogRecord record) {
      if (!closed.get()) {
        shared.handler.publish(record);
      }
    }

    @Override
    public void close() {
      if (closed.compareAndSet(false, true)) {
        release(shared);
      }
    }

    @Override
    public String toString() {
      return shared.handler.toString();
    }
  }
}
