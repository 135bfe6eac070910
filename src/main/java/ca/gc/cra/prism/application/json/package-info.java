/**
 * Jackson streaming helpers and the JSON views shared by stored payloads and CLI output.
 * <p><strong>Concurrency:</strong> Stateless apart from a thread-safe {@code JsonFactory}.</p>
 */
package ca.gc.cra.prism.application.json;
