package ca.gc.cra.prism.application.json;

import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.job.PipelineJob;
import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.summary.Summary;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.domain.vector.VectorMetadata;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain values onto JSON-ready object graphs for {@link JsonSupport#write(Object)}.
 *
 * @since PRISM 0.1
 */
public final class JsonViews {
  private JsonViews() {}

  /**
   * Plaintext aggregate with derived statistics.
   *
   * @param aggregate aggregate
   * @return ordered map
   */
  public static Map<String, Object> aggregate(AggregateRecord aggregate) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("tx_count", aggregate.txCount());
    view.put("shielded_count", aggregate.shieldedCount());
    view.put("total_fees", aggregate.totalFees());
    view.put("fee_sum_sq", aggregate.feeSumSq());
    Map<String, Object> histogram = new LinkedHashMap<>();
    aggregate.feeHistogram().forEach((bucket, count) -> histogram.put(String.valueOf(bucket), count));
    view.put("fee_histogram", histogram);
    view.put("bucket_policy", aggregate.histogramSpec().policy().name());
    view.put("bucket_count", aggregate.histogramSpec().bucketCount());
    view.put("bucket_width", aggregate.histogramSpec().bucketWidth());
    view.put("window", aggregate.window().label());
    view.put("timestamp", aggregate.timestamp().toString());
    view.put("source", aggregate.source());
    view.put("shielded_ratio", aggregate.shieldedRatio());
    view.put("avg_fee", aggregate.averageFee());
    view.put("fee_variance", aggregate.feeVariance());
    view.put("fee_std_dev", aggregate.feeStdDev());
    return view;
  }

  /**
   * Vector metadata in wire form.
   *
   * @param metadata metadata
   * @return ordered map
   */
  public static Map<String, Object> metadata(VectorMetadata metadata) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("layout_version", metadata.layoutVersion());
    view.put("scaling_factor", metadata.scalingFactor());
    view.put("bucket_count", metadata.bucketCount());
    view.put("bucket_width", metadata.bucketWidth());
    view.put("bucket_policy", metadata.bucketPolicy().name());
    view.put("dispersion", metadata.dispersion().name());
    view.put("source_timestamp", metadata.sourceTimestamp().toString());
    view.put("window", metadata.window().label());
    view.put("source", metadata.source());
    return view;
  }

  /**
   * Encoded vector with its metadata.
   *
   * @param vector vector
   * @return ordered map
   */
  public static Map<String, Object> vector(EncodedVector vector) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("values", vector.values());
    view.put("metadata", metadata(vector.metadata()));
    return view;
  }

  /**
   * Summary output.
   *
   * @param summary summary
   * @return ordered map
   */
  public static Map<String, Object> summary(Summary summary) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("embedding", new LinkedHashMap<>(summary.embedding()));
    view.put("text", summary.text());
    return view;
  }

  /**
   * Job status snapshot.
   *
   * @param job job
   * @return ordered map
   */
  public static Map<String, Object> job(PipelineJob job) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("job_key", job.jobKey());
    view.put("stage", job.stage().name());
    job.failedStage().ifPresent(stage -> view.put("failed_stage", stage.name()));
    view.put("attempts", job.attempts());
    view.put("last_error", job.lastError().orElse(null));
    view.put("result_ref", job.resultRef().orElse(null));
    view.put("block_range", job.params().range().toString());
    view.put("window", job.params().window().label());
    view.put("created_at", job.createdAt().toString());
    view.put("updated_at", job.updatedAt().toString());
    return view;
  }

  /**
   * Stored result listing entry.
   *
   * @param summary result summary
   * @return ordered map
   */
  public static Map<String, Object> resultSummary(ResultSummary summary) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("key", summary.key());
    view.put("reference_id", summary.referenceId());
    view.put("payload_size", summary.payloadSize());
    view.put("metadata", new LinkedHashMap<>(summary.metadata()));
    view.put("source_url", summary.provenance().sourceUrl());
    view.put("block_range", summary.provenance().blockRange().toString());
    view.put("submitted_at", summary.provenance().submittedAt().toString());
    view.put("stored_at", summary.storedAt().toString());
    return view;
  }
}
