package edu.washington.escience.drain.aggregation;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.util.DrainUtils;
import net.jcip.annotations.Immutable;

/**
 * One axis of an {@link ArgumentSpace}. Usually an axis is a single argument ranging over a list of values; a joint
 * axis covers several arguments whose values vary together, such as an index and the deltas declared for it.
 */
@Immutable
public final class Dimension {
  /** The arguments this axis assigns. */
  private final ImmutableList<String> names;
  /** The points of this axis, each assigning one value per name. */
  private final ImmutableList<ImmutableList<Object>> values;

  /**
   * @param names the arguments this axis assigns.
   * @param values the points of this axis.
   */
  private Dimension(
      final ImmutableList<String> names, final ImmutableList<ImmutableList<Object>> values) {
    this.names = names;
    this.values = values;
  }

  /**
   * @param name the argument.
   * @param values the values it ranges over.
   * @return a single-argument axis.
   */
  public static Dimension of(final String name, final List<?> values) {
    DrainUtils.checkHasNoNulls(values, "values of " + name);
    ImmutableList.Builder<ImmutableList<Object>> points = ImmutableList.builder();
    for (Object v : values) {
      points.add(ImmutableList.of(v));
    }
    return new Dimension(ImmutableList.of(name), points.build());
  }

  /**
   * @param names the arguments.
   * @param tuples the points, each with one value per argument.
   * @return a joint axis.
   */
  public static Dimension joint(final List<String> names, final List<? extends List<?>> tuples) {
    ImmutableList.Builder<ImmutableList<Object>> points = ImmutableList.builder();
    for (List<?> tuple : tuples) {
      Preconditions.checkArgument(
          tuple.size() == names.size(), "point %s does not match arguments %s", tuple, names);
      points.add(ImmutableList.copyOf(tuple));
    }
    return new Dimension(ImmutableList.copyOf(names), points.build());
  }

  /**
   * @return the arguments this axis assigns.
   */
  public ImmutableList<String> getNames() {
    return names;
  }

  /**
   * @return the points of this axis.
   */
  public ImmutableList<ImmutableList<Object>> getValues() {
    return values;
  }

  /**
   * @return the number of points.
   */
  public int size() {
    return values.size();
  }
}
