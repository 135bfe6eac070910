/**
 * Domain model for PRISM: chain data, aggregates, encoded vectors, jobs, stored results and the error taxonomy.
 * <p><strong>Role:</strong> Innermost layer; depends on nothing outside the JDK.</p>
 * <p><strong>Concurrency:</strong> Types are immutable records or enums; safe to share across threads.</p>
 */
package ca.gc.cra.prism.domain;
