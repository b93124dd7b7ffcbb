package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.util.DrainUtils;
import net.jcip.annotations.Immutable;

/**
 * The key of a result group: the values of a unit's concat arguments. Keys are equal when their rendered forms are
 * equal, which is how groups are named in results and in joined column prefixes.
 */
@Immutable
public final class ConcatKey implements Serializable, Comparable<ConcatKey> {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Joins rendered values. */
  private static final Joiner JOINER = Joiner.on(DrainConstants.CONCAT_SEPARATOR);

  /** The values, in argument order. */
  private final ImmutableList<Object> values;
  /** The rendered key. */
  private final String text;

  /**
   * @param values the values, in argument order.
   */
  public ConcatKey(final List<?> values) {
    this.values = ImmutableList.copyOf(values);
    String[] parts = new String[values.size()];
    for (int i = 0; i < parts.length; ++i) {
      parts[i] = DrainUtils.toKeyString(values.get(i));
    }
    text = JOINER.join(parts);
  }

  /**
   * @param unit a unit.
   * @param concatArgs the arguments forming the key.
   * @return the key of the unit.
   */
  public static ConcatKey of(final AggregationUnit unit, final List<String> concatArgs) {
    return new ConcatKey(unit.project(concatArgs));
  }

  /**
   * @return the values, in argument order.
   */
  public List<Object> getValues() {
    return values;
  }

  @Override
  public int compareTo(final ConcatKey o) {
    return text.compareTo(o.text);
  }

  @Override
  public boolean equals(final Object o) {
    return (o instanceof ConcatKey) && text.equals(((ConcatKey) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
