/**
 * CLI entry points for the DUALTAP {@code run}, {@code proxy} and {@code stats} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, resolves layered
 * configuration and hands off to {@link ca.gc.cra.dualtap.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Commands run on the main thread; a JVM shutdown hook cancels the report loop.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and network settings before any socket is bound.</p>
 */
package ca.gc.cra.dualtap.api;
