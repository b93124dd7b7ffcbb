package edu.washington.escience.drain.aggregation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.IndexLookupException;
import edu.washington.escience.drain.UnimplementedHookException;
import edu.washington.escience.drain.agg.Aggregate;
import edu.washington.escience.drain.agg.Aggregator;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.TableSource;

/**
 * Aggregates the whole input by each of a set of indexes. The only dimension is {@code index}; one aggregator serves
 * every unit, and every index gets its own result group.
 */
public final class SimpleSpecializer extends AbstractSpecializer {
  /** The index registry, in declaration order. */
  private final ImmutableMap<String, IndexSpec> indexes;
  /** The aggregates to compute, or null if none were supplied. */
  @Nullable private final ImmutableList<Aggregate> aggregates;

  /**
   * @param input the input data.
   * @param indexes maps each index name to its physical index.
   * @param aggregates the aggregates to compute. If null, building an aggregator fails.
   * @throws ConfigurationException if no index is given.
   */
  public SimpleSpecializer(
      final TableSource input,
      final Map<String, IndexSpec> indexes,
      @Nullable final List<? extends Aggregate> aggregates)
      throws ConfigurationException {
    super(
        input,
        ArgumentSpace.of(Dimension.of(DrainConstants.INDEX, ImmutableList.copyOf(indexes.keySet()))),
        ImmutableList.<String>of(),
        ImmutableList.of(DrainConstants.INDEX),
        ImmutableList.<String>of());
    if (indexes.isEmpty()) {
      throw new ConfigurationException("a simple aggregation needs at least one index");
    }
    this.indexes = ImmutableMap.copyOf(indexes);
    this.aggregates = aggregates == null ? null : ImmutableList.<Aggregate>copyOf(aggregates);
  }

  /**
   * Aggregate by single columns, each index named after its column.
   *
   * @param input the input data.
   * @param columns the grouping columns.
   * @param aggregates the aggregates to compute.
   * @return the specializer.
   * @throws ConfigurationException if no column is given.
   */
  public static SimpleSpecializer ofIndexNames(
      final TableSource input, final List<String> columns, final List<? extends Aggregate> aggregates)
      throws ConfigurationException {
    Map<String, IndexSpec> indexes = new LinkedHashMap<>();
    for (String column : columns) {
      indexes.put(column, IndexSpec.of(column));
    }
    return new SimpleSpecializer(input, indexes, aggregates);
  }

  @Override
  public Aggregator buildAggregator(final AggregationUnit arguments) throws DrainException {
    if (aggregates == null) {
      throw new UnimplementedHookException("aggregates", SimpleSpecializer.class);
    }
    return new Aggregator(getInputTable(), aggregates);
  }

  @Override
  public IndexSpec getIndex(final String name) throws IndexLookupException {
    IndexSpec ret = indexes.get(name);
    if (ret == null) {
      throw new IndexLookupException(name);
    }
    return ret;
  }

  @Override
  public String getDefaultPartitionKey() {
    return DrainConstants.INDEX;
  }

  @Override
  public Specializer narrow(final String key, final Object value) throws ConfigurationException {
    if (!DrainConstants.INDEX.equals(key)) {
      throw new ConfigurationException(
          "a simple aggregation can only be partitioned by " + DrainConstants.INDEX + ", not " + key);
    }
    Preconditions.checkArgument(indexes.containsKey(value), "unknown index %s", value);
    return new SimpleSpecializer(
        getInput(), ImmutableMap.of((String) value, indexes.get(value)), aggregates);
  }
}
