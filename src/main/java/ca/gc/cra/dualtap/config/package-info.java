/**
 * Configuration records, layered loading and composition root wiring for DUALTAP commands.
 * <p><strong>Role:</strong> Bootstrap layer selecting the proxy engine, instrumentation engine and event store.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates hosts, ports, header names and paths via {@code ca.gc.cra.dualtap.validation}.</p>
 */
package ca.gc.cra.dualtap.config;
