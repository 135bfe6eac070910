/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p>Invalid inputs are rejected with {@link IllegalArgumentException} before adapters open network
 * connections or files.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.validation;
