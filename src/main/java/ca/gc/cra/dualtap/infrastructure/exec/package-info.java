/**
 * Executor construction helpers producing named daemon threads.
 */
package ca.gc.cra.dualtap.infrastructure.exec;
