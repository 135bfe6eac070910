package ca.gc.cra.prism.infrastructure.compute;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.application.json.JsonViews;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.vector.DispersionConvention;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.domain.vector.VectorMetadata;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * JSON envelope carrying an {@link EncodedVector} to and from a computation service.
 *
 * <pre>{"values":[...], "metadata":{"layout_version":1, "scaling_factor":..., "bucket_count":..., ...}}</pre>
 *
 * @since PRISM 0.1
 */
public final class VectorEnvelopeCodec {
  private final JsonSupport json = new JsonSupport();

  /**
   * Serializes a vector.
   *
   * @param vector vector
   * @return UTF-8 JSON
   */
  public byte[] encode(EncodedVector vector) {
    return json.write(JsonViews.vector(vector));
  }

  /**
   * Parses an envelope.
   *
   * @param blob UTF-8 JSON
   * @return vector; its layout is checked later by the codec
   * @throws DecodeMismatchException if the envelope is malformed
   */
  public EncodedVector decode(byte[] blob) throws DecodeMismatchException {
    try {
      Map<String, Object> root = json.parseObject(blob);
      List<Object> rawValues = JsonSupport.asArray("values", root.get("values"));
      long[] values = new long[rawValues.size()];
      for (int i = 0; i < values.length; i++) {
        Object value = rawValues.get(i);
        if (!(value instanceof Integer || value instanceof Long)) {
          throw new IllegalArgumentException("values[" + i + "] must be a 64-bit integer");
        }
        values[i] = ((Number) value).longValue();
      }
      Map<String, Object> meta = JsonSupport.asObject("metadata", root.get("metadata"));
      VectorMetadata metadata = new VectorMetadata(
          JsonSupport.requireLong(meta, "scaling_factor"),
          Math.toIntExact(JsonSupport.requireLong(meta, "bucket_count")),
          JsonSupport.requireDouble(meta, "bucket_width"),
          BucketPolicy.parse(JsonSupport.requireString(meta, "bucket_policy")),
          DispersionConvention.valueOf(JsonSupport.requireString(meta, "dispersion")),
          Instant.parse(JsonSupport.requireString(meta, "source_timestamp")),
          AggregateWindow.parse(JsonSupport.requireString(meta, "window")),
          JsonSupport.requireString(meta, "source"),
          Math.toIntExact(JsonSupport.requireLong(meta, "layout_version")));
      return new EncodedVector(values, metadata);
    } catch (IllegalArgumentException | ArithmeticException | DateTimeParseException ex) {
      throw new DecodeMismatchException("malformed vector envelope: " + ex.getMessage(), ex);
    }
  }
}
