/**
 * Logging helpers: runtime level changes for {@code --verbose} and truncation of captured payloads in log lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dualtap.logging;
