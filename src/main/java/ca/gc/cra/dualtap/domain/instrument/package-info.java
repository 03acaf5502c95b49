/**
 * Typed messages exchanged with instrumentation engines.
 */
package ca.gc.cra.dualtap.domain.instrument;
