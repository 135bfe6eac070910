package ca.gc.cra.prism.domain.vector;

/**
 * Which fee dispersion statistic a decoded vector reports under {@code fee_variance}.
 *
 * <p>PRISM always reports {@link #VARIANCE}; the value is carried in metadata so consumers of stored
 * vectors do not confuse it with a standard deviation.</p>
 *
 * @since PRISM 0.1
 */
public enum DispersionConvention {
  VARIANCE,
  STD_DEV
}
