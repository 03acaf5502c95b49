/**
 * Interception engine adapters.
 * <p><strong>Role:</strong> {@link ca.gc.cra.dualtap.infrastructure.proxy.HttpForwardProxyEngine} relays cleartext
 * HTTP and feeds each exchange to the traffic adapter.</p>
 * <p><strong>Security:</strong> Captured bodies are decoded in memory only for recording; nothing is rewritten apart
 * from the marker header set by the listener.</p>
 */
package ca.gc.cra.dualtap.infrastructure.proxy;
