package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.jcip.annotations.Immutable;

/**
 * One point of an {@link ArgumentSpace}: the argument values that identify a single (sub-table, index) combination to
 * aggregate. Arguments keep the order of the dimensions that produced them.
 */
@Immutable
public final class AggregationUnit implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Argument names to values. */
  private final ImmutableMap<String, Object> arguments;

  /**
   * @param arguments argument names to values, in dimension order.
   */
  public AggregationUnit(final Map<String, ?> arguments) {
    this.arguments = ImmutableMap.copyOf(arguments);
  }

  /**
   * @param name an argument name.
   * @param value its value.
   * @return a unit with a single argument.
   */
  public static AggregationUnit of(final String name, final Object value) {
    return new AggregationUnit(ImmutableMap.of(name, value));
  }

  /**
   * @param name an argument name.
   * @return true if this unit has that argument.
   */
  public boolean has(final String name) {
    return arguments.containsKey(name);
  }

  /**
   * @param name an argument name.
   * @return the value of the argument.
   * @throws IllegalArgumentException if this unit has no such argument.
   */
  public Object get(final String name) {
    Object ret = arguments.get(name);
    Preconditions.checkArgument(ret != null, "unit %s has no argument %s", this, name);
    return ret;
  }

  /**
   * @return the argument names, in order.
   */
  public Set<String> getNames() {
    return arguments.keySet();
  }

  /**
   * @param names some argument names.
   * @return the values of those arguments, in the given order.
   */
  public ImmutableList<Object> project(final List<String> names) {
    ImmutableList.Builder<Object> ret = ImmutableList.builder();
    for (String name : names) {
      ret.add(get(name));
    }
    return ret.build();
  }

  /**
   * @param names some argument names.
   * @return a unit with only those arguments, in the given order.
   */
  public AggregationUnit restrict(final List<String> names) {
    ImmutableMap.Builder<String, Object> ret = ImmutableMap.builder();
    for (String name : names) {
      ret.put(name, get(name));
    }
    return new AggregationUnit(ret.build());
  }

  @Override
  public boolean equals(final Object o) {
    return (o instanceof AggregationUnit) && arguments.equals(((AggregationUnit) o).arguments);
  }

  @Override
  public int hashCode() {
    return arguments.hashCode();
  }

  @Override
  public String toString() {
    return arguments.toString();
  }
}
