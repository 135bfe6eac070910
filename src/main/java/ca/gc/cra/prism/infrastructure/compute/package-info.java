/**
 * Computation gateway adapters.
 * <p>{@link ca.gc.cra.prism.infrastructure.compute.LocalComputationSimulator} runs an identity computation in
 * process; {@link ca.gc.cra.prism.infrastructure.compute.HttpComputationGateway} talks to a remote service over
 * a three-call JSON contract. Both exchange vectors in the envelope format of
 * {@link ca.gc.cra.prism.infrastructure.compute.VectorEnvelopeCodec}.</p>
 */
package ca.gc.cra.prism.infrastructure.compute;
