package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nullable;

import net.jcip.annotations.Immutable;

/**
 * How an {@link Aggregation} runs: whether results are grouped by key, and whether the units are partitioned into
 * independently runnable aggregations and on which argument.
 */
@Immutable
public final class AggregationOptions implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Grouped, not partitioned. */
  public static final AggregationOptions DEFAULT = new AggregationOptions(true, false, null);

  /** Whether results are grouped by key. */
  private final boolean concat;
  /** Whether units are partitioned. */
  private final boolean parallel;
  /** The argument to partition on, or null for the specializer's default. */
  @Nullable private final String partitionKey;

  /**
   * @param concat whether results are grouped by key.
   * @param parallel whether units are partitioned.
   * @param partitionKey the argument to partition on, or null for the specializer's default.
   */
  public AggregationOptions(
      final boolean concat, final boolean parallel, @Nullable final String partitionKey) {
    this.concat = concat;
    this.parallel = parallel;
    this.partitionKey = partitionKey;
  }

  /**
   * @return whether results are grouped by key.
   */
  public boolean isConcat() {
    return concat;
  }

  /**
   * @return whether units are partitioned.
   */
  public boolean isParallel() {
    return parallel;
  }

  /**
   * @return the argument to partition on, or null for the specializer's default.
   */
  @Nullable
  public String getPartitionKey() {
    return partitionKey;
  }

  /**
   * @param concat whether results are grouped by key.
   * @return these options with the given grouping.
   */
  public AggregationOptions withConcat(final boolean concat) {
    return new AggregationOptions(concat, parallel, partitionKey);
  }

  /**
   * @param partitionKey the argument to partition on, or null for the specializer's default.
   * @return these options, partitioned on the given argument.
   */
  public AggregationOptions partitionedBy(@Nullable final String partitionKey) {
    return new AggregationOptions(concat, true, partitionKey);
  }

  /**
   * @return these options without partitioning.
   */
  public AggregationOptions sequential() {
    return new AggregationOptions(concat, false, null);
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof AggregationOptions)) {
      return false;
    }
    AggregationOptions other = (AggregationOptions) o;
    return concat == other.concat
        && parallel == other.parallel
        && Objects.equals(partitionKey, other.partitionKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(concat, parallel, partitionKey);
  }

  @Override
  public String toString() {
    return "concat=" + concat + ", parallel=" + parallel + ", partitionKey=" + partitionKey;
  }
}
