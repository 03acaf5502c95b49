/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.dualtap.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for all capture threads.</p>
 * <p><strong>Metrics:</strong> Exports {@code traffic.*}, {@code instrumentation.*} and {@code store.*} instruments
 * over OTLP gRPC.</p>
 */
package ca.gc.cra.dualtap.infrastructure.metrics;
