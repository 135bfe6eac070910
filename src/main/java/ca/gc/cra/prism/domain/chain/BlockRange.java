package ca.gc.cra.prism.domain.chain;

/**
 * Inclusive range of block heights fetched for one aggregation job.
 *
 * @param start first block height (inclusive); must be non-negative
 * @param end last block height (inclusive); must be {@code >= start}
 * @since PRISM 0.1
 */
public record BlockRange(long start, long end) {
  public BlockRange {
    if (start < 0) {
      throw new IllegalArgumentException("start must be non-negative (was " + start + ")");
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start (was " + start + ".." + end + ")");
    }
  }

  /**
   * Number of blocks covered by the range.
   *
   * @return block count, at least one
   */
  public long size() {
    return end - start + 1;
  }

  /**
   * Returns {@code true} when {@code height} lies inside the range.
   *
   * @param height candidate block height
   * @return whether the height is covered
   */
  public boolean contains(long height) {
    return height >= start && height <= end;
  }

  /**
   * Parses {@code "start-end"} or {@code "start..end"} notation.
   *
   * @param raw textual range
   * @return parsed range
   * @throws IllegalArgumentException if the text is malformed
   */
  public static BlockRange parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("block range must not be blank");
    }
    String text = raw.trim();
    String[] parts = text.contains("..") ? text.split("\\.\\.", 2) : text.split("-", 2);
    if (parts.length != 2) {
      throw new IllegalArgumentException("block range must look like START-END (was " + raw + ")");
    }
    try {
      return new BlockRange(Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("block range bounds must be integers (was " + raw + ")", ex);
    }
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
