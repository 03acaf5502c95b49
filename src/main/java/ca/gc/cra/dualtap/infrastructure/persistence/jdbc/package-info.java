/**
 * JDBC persistence for capture rows on an embedded H2 database.
 * <p><strong>Role:</strong> Sink-side adapter implementing {@link ca.gc.cra.dualtap.application.port.EventStorePort}.</p>
 * <p><strong>Concurrency:</strong> Appends are serialized by the store's write lock; reads are lock-free.</p>
 * <p><strong>Metrics:</strong> Emits {@code store.append.*} counters and latency observations.</p>
 * <p><strong>Security:</strong> Rows contain raw headers and bodies; protect the database file accordingly.</p>
 */
package ca.gc.cra.dualtap.infrastructure.persistence.jdbc;
