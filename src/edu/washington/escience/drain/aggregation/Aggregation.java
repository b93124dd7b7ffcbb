package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableSource;

/**
 * An aggregation over the argument space of a {@link Specializer}. Unpartitioned, it aggregates every unit itself;
 * partitioned, it splits its units into one aggregation per value of the partition key, has an
 * {@link AggregationRunner} run them, and merges their results. The result is computed once.
 */
public final class Aggregation {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregation.class);

  /** Supplies the units. */
  private final Specializer specializer;
  /** How to run. */
  private final AggregationOptions options;
  /** Runs partitions. */
  private final AggregationRunner runner;
  /** The partitions, once built. */
  private List<Aggregation> partitions;
  /** The result, once computed. */
  private AggregationResult result;

  /**
   * @param specializer supplies the units.
   * @param options how to run.
   * @param runner runs partitions.
   */
  public Aggregation(
      final Specializer specializer,
      final AggregationOptions options,
      final AggregationRunner runner) {
    this.specializer = Objects.requireNonNull(specializer, "specializer");
    this.options = Objects.requireNonNull(options, "options");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  /**
   * @param specializer supplies the units.
   * @param options how to run. Partitions run in the calling thread.
   */
  public Aggregation(final Specializer specializer, final AggregationOptions options) {
    this(specializer, options, DirectRunner.INSTANCE);
  }

  /**
   * @return the specializer.
   */
  public Specializer getSpecializer() {
    return specializer;
  }

  /**
   * @return the options.
   */
  public AggregationOptions getOptions() {
    return options;
  }

  /**
   * @return the argument partitioned on, whether or not this aggregation is partitioned.
   */
  public String getPartitionKey() {
    String key = options.getPartitionKey();
    return key != null ? key : specializer.getDefaultPartitionKey();
  }

  /**
   * The upstream steps of this aggregation: its partitions when partitioned, otherwise its input.
   *
   * @return the partitions, or an empty list when not partitioned.
   * @throws DrainException if the specializer cannot be partitioned on the partition key.
   */
  public synchronized List<Aggregation> getPartitions() throws DrainException {
    if (!options.isParallel()) {
      return ImmutableList.of();
    }
    if (partitions == null) {
      List<PartitionDescriptor> descriptors = Fanout.partition(specializer, getPartitionKey());
      LOGGER.info("Fanning out into {} partitions by {}", descriptors.size(), getPartitionKey());
      List<Aggregation> ret = new ArrayList<>(descriptors.size());
      for (Specializer narrowed : Fanout.narrow(specializer, descriptors)) {
        ret.add(new Aggregation(narrowed, options.sequential(), runner));
      }
      partitions = ImmutableList.copyOf(ret);
    }
    return partitions;
  }

  /**
   * @return the source of this aggregation's data.
   */
  public TableSource getInput() {
    return specializer.getInput();
  }

  /**
   * @return the result of the aggregation.
   * @throws DrainException if any unit fails or the partition results cannot be merged.
   */
  public synchronized AggregationResult getResult() throws DrainException {
    if (result == null) {
      if (options.isParallel()) {
        result = Fanout.fanin(runner.run(getPartitions()));
      } else {
        result = new ResultAssembler(specializer, options.isConcat()).assemble();
      }
    }
    return result;
  }

  /**
   * Join the grouped result of this aggregation into a table.
   *
   * @param left the table to extend.
   * @return the table with one block of prefixed columns per result key.
   * @throws DrainException if the aggregation fails or its result cannot be joined.
   */
  public Table join(final Table left) throws DrainException {
    return Joiner.join(left, getResult());
  }
}
