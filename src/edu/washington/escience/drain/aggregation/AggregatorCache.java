package edu.washington.escience.drain.aggregation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.agg.Aggregator;

/**
 * Builds each aggregator a run needs exactly once. Units are keyed by their values of the specializer's aggregator
 * arguments; units agreeing on those values share one aggregator. Entries are never evicted, so a cache should live no
 * longer than one run.
 */
public final class AggregatorCache {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregatorCache.class);

  /** Builds the aggregators. */
  private final Specializer specializer;
  /** The aggregators built so far. */
  private final Map<List<Object>, Aggregator> aggregators = new HashMap<>();

  /**
   * @param specializer builds the aggregators.
   */
  public AggregatorCache(final Specializer specializer) {
    this.specializer = Objects.requireNonNull(specializer, "specializer");
  }

  /**
   * @param unit a unit of the specializer's argument space.
   * @return the aggregator for that unit.
   * @throws DrainException if the aggregator cannot be built.
   */
  public Aggregator get(final AggregationUnit unit) throws DrainException {
    List<String> args = specializer.getAggregatorArgs();
    List<Object> key = unit.project(args);
    Aggregator ret = aggregators.get(key);
    if (ret != null) {
      LOGGER.debug("Reusing aggregator for {}", key);
      return ret;
    }
    LOGGER.debug("Building aggregator for {}", key);
    ret = specializer.buildAggregator(unit.restrict(args));
    aggregators.put(key, ret);
    return ret;
  }

  /**
   * @return how many aggregators were built.
   */
  public int getNumConstructed() {
    return aggregators.size();
  }
}
