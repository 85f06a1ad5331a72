/**
 * <strong>Purpose:</strong> Logger configuration: environments, presets, handler specs and YAML overrides.
 * <p><strong>Pipeline role:</strong> Resolved once when a logger is built; never consulted per record.
 * <p><strong>Failure policy:</strong> Invalid settings raise {@link java.lang.IllegalArgumentException} to the
 * caller requesting the logger.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.config;
