/**
 * Upstream block-explorer adapter: paginated HTTP reads with retry, backoff and a short-TTL response cache.
 * <p>One page is one block: {@code GET {baseUrl}/{chain}/block/{height}/transactions}.</p>
 */
package ca.gc.cra.prism.infrastructure.source;
