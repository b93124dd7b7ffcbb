package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import edu.washington.escience.drain.ConfigurationException;
import net.jcip.annotations.Immutable;

/**
 * The combinatorial space of an aggregation: the cartesian product of its {@link Dimension}s. Units are enumerated
 * with the first dimension outermost and the last innermost.
 */
@Immutable
public final class ArgumentSpace {
  /** The axes, outer to inner. */
  private final ImmutableList<Dimension> dimensions;
  /** The argument names, in dimension order. */
  private final ImmutableList<String> names;

  /**
   * @param dimensions the axes, outer to inner.
   * @throws ConfigurationException if two axes assign the same argument or an axis repeats a point.
   */
  public ArgumentSpace(final List<Dimension> dimensions) throws ConfigurationException {
    this.dimensions = ImmutableList.copyOf(dimensions);
    ImmutableList.Builder<String> allNames = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    for (Dimension d : dimensions) {
      for (String name : d.getNames()) {
        if (!seen.add(name)) {
          throw new ConfigurationException("argument " + name + " is declared twice");
        }
        allNames.add(name);
      }
      Set<List<Object>> points = new HashSet<>();
      for (List<Object> point : d.getValues()) {
        if (!points.add(point)) {
          throw new ConfigurationException("axis " + d.getNames() + " repeats the point " + point);
        }
      }
    }
    names = allNames.build();
  }

  /**
   * @param dimensions the axes, outer to inner.
   * @return the space.
   * @throws ConfigurationException if two axes assign the same argument or an axis repeats a point.
   */
  public static ArgumentSpace of(final Dimension... dimensions) throws ConfigurationException {
    return new ArgumentSpace(ImmutableList.copyOf(dimensions));
  }

  /**
   * @return the names of the arguments that vary, in order.
   */
  public List<String> getDimensions() {
    return names;
  }

  /**
   * @return the number of units, the product of the sizes of the axes.
   */
  public int size() {
    int ret = 1;
    for (Dimension d : dimensions) {
      ret *= d.size();
    }
    return ret;
  }

  /**
   * @return every unit of the space, first axis outermost.
   */
  public List<AggregationUnit> getUnits() {
    List<List<ImmutableList<Object>>> axes = new ArrayList<>();
    for (Dimension d : dimensions) {
      axes.add(d.getValues());
    }
    List<AggregationUnit> ret = new ArrayList<>(size());
    for (List<ImmutableList<Object>> point : Lists.cartesianProduct(axes)) {
      Map<String, Object> arguments = new LinkedHashMap<>();
      for (int i = 0; i < point.size(); ++i) {
        List<String> axisNames = dimensions.get(i).getNames();
        for (int j = 0; j < axisNames.size(); ++j) {
          arguments.put(axisNames.get(j), point.get(i).get(j));
        }
      }
      ret.add(new AggregationUnit(arguments));
    }
    return ret;
  }
}
