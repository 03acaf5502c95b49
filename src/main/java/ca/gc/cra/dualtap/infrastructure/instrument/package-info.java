/**
 * Instrumentation engine adapters and the bundled hook script loader.
 * <p><strong>Role:</strong> Implementations of {@link ca.gc.cra.dualtap.application.port.InstrumentationEngine}
 * selected by the {@code instrumentation} configuration key.</p>
 * <p><strong>Concurrency:</strong> Hook messages are delivered on engine-owned daemon threads.</p>
 */
package ca.gc.cra.dualtap.infrastructure.instrument;
