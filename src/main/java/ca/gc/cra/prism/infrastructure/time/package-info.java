/**
 * Clock adapters.
 */
package ca.gc.cra.prism.infrastructure.time;
