/**
 * <strong>Purpose:</strong> Capture use cases joining the traffic and instrumentation channels into one store.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.dualtap.application.capture.TrafficCaptureUseCase} receives
 * proxy callbacks, {@link ca.gc.cra.dualtap.application.capture.InstrumentationCaptureUseCase} receives hook messages,
 * and {@link ca.gc.cra.dualtap.application.capture.CaptureOrchestrator} drives both and reports.</p>
 * <p><strong>Concurrency:</strong> Callbacks arrive on engine threads in parallel with the report loop; the event
 * store's write lock is the only arbitration point.</p>
 * <p><strong>Observability:</strong> MDC key {@code pipeline} identifies the channel in every log line.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dualtap.application.capture;
