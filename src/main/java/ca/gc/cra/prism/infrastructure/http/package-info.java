/**
 * Blocking HTTP transport shared by the upstream source client and the remote computation gateway.
 * <p>Adapters depend on {@link ca.gc.cra.prism.infrastructure.http.HttpTransport} so tests substitute scripted
 * replies without a server.</p>
 */
package ca.gc.cra.prism.infrastructure.http;
