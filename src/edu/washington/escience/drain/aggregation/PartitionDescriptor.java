package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * Names one partition of an argument space: the units whose {@code key} argument equals {@code value}.
 */
@Immutable
public final class PartitionDescriptor implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The argument partitioned on. */
  private final String key;
  /** The value of this partition. */
  private final Object value;

  /**
   * @param key the argument partitioned on.
   * @param value the value of this partition.
   */
  public PartitionDescriptor(final String key, final Object value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
  }

  /**
   * @return the argument partitioned on.
   */
  public String getKey() {
    return key;
  }

  /**
   * @return the value of this partition.
   */
  public Object getValue() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof PartitionDescriptor)) {
      return false;
    }
    PartitionDescriptor other = (PartitionDescriptor) o;
    return key.equals(other.key) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
