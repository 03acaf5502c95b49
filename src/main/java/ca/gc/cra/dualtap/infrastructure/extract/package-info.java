/**
 * HTML content extraction strategies used to enrich captured responses.
 */
package ca.gc.cra.dualtap.infrastructure.extract;
