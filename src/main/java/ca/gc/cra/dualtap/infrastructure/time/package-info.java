/**
 * Clock adapters.
 */
package ca.gc.cra.dualtap.infrastructure.time;
