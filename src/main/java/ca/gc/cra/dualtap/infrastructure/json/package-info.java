/**
 * Jackson streaming helpers for JSON columns and replay recordings.
 */
package ca.gc.cra.dualtap.infrastructure.json;
