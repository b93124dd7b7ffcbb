package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.agg.Aggregator;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.util.DrainUtils;

/**
 * Runs every unit of a specializer in order and assembles the partial results.
 */
public final class ResultAssembler {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ResultAssembler.class);

  /** Supplies the units and their aggregators. */
  private final Specializer specializer;
  /** Whether to group partial results by key. */
  private final boolean concat;
  /** This run's aggregators. */
  private final AggregatorCache cache;

  /**
   * @param specializer supplies the units and their aggregators.
   * @param concat whether to group partial results by key.
   */
  public ResultAssembler(final Specializer specializer, final boolean concat) {
    this.specializer = Objects.requireNonNull(specializer, "specializer");
    this.concat = concat;
    cache = new AggregatorCache(specializer);
  }

  /**
   * @return the aggregators of this run.
   */
  public AggregatorCache getCache() {
    return cache;
  }

  /**
   * Aggregate one unit: apply its aggregator to its index, then add each insert argument as an outer index level.
   *
   * @param unit the unit.
   * @return the partial result.
   * @throws DrainException if the unit cannot be aggregated.
   */
  public Table aggregate(final AggregationUnit unit) throws DrainException {
    LOGGER.info("Aggregating {}", unit);
    Aggregator aggregator = cache.get(unit);
    IndexSpec index = specializer.getIndex(String.valueOf(unit.get(DrainConstants.INDEX)));
    Table ret = aggregator.aggregate(index);
    for (String name : specializer.getInsertArgs()) {
      Object value = unit.get(name);
      Type type = Type.fromJavaType(value.getClass());
      if (type == null) {
        type = Type.STRING_TYPE;
        value = DrainUtils.toKeyString(value);
      }
      try {
        ret = ret.appendIndexLevel(name, type, value);
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("cannot insert argument " + name + " into the index", e);
      }
    }
    return ret;
  }

  /**
   * Aggregate every unit. When grouping, the partial results of units with equal keys are stacked in unit order, and
   * groups appear in order of their first unit.
   *
   * @return the result.
   * @throws DrainException if any unit fails or a group's members do not share a schema.
   */
  public AggregationResult assemble() throws DrainException {
    List<AggregationUnit> units = specializer.getArgumentSpace().getUnits();
    if (!concat) {
      List<Table> tables = new ArrayList<>(units.size());
      for (AggregationUnit unit : units) {
        tables.add(aggregate(unit));
      }
      return AggregationResult.ungrouped(tables);
    }

    Map<String, List<Table>> buckets = new LinkedHashMap<>();
    for (AggregationUnit unit : units) {
      String key = ConcatKey.of(unit, specializer.getConcatArgs()).toString();
      List<Table> bucket = buckets.get(key);
      if (bucket == null) {
        bucket = new ArrayList<>();
        buckets.put(key, bucket);
      }
      bucket.add(aggregate(unit));
    }
    Map<String, Table> groups = new LinkedHashMap<>();
    for (Map.Entry<String, List<Table>> bucket : buckets.entrySet()) {
      groups.put(bucket.getKey(), Table.stack(bucket.getValue()));
    }
    LOGGER.debug(
        "Assembled {} units into {} groups using {} aggregators",
        units.size(),
        groups.size(),
        cache.getNumConstructed());
    return AggregationResult.grouped(groups);
  }
}
