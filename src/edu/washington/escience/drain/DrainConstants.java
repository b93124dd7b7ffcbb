package edu.washington.escience.drain;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * This class holds the constants for drain aggregations.
 */
public final class DrainConstants {
  /**
   * Argument naming the index a unit aggregates over. Its values are keys of an index registry.
   */
  public static final String INDEX = "index";

  /**
   * Argument holding the end date of a unit's time window.
   */
  public static final String DATE = "date";

  /**
   * Argument holding the length of a unit's time window.
   */
  public static final String DELTA = "delta";

  /**
   * Separator between the values that make up a result key, and between a result key and a column name when joining.
   */
  public static final String CONCAT_SEPARATOR = "_";

  /** Default aggregator arguments of a space-time aggregation. */
  public static final List<String> DEFAULT_SPACETIME_AGGREGATOR_ARGS = ImmutableList.of(DATE, DELTA);

  /** Default concat arguments of a space-time aggregation. */
  public static final List<String> DEFAULT_SPACETIME_CONCAT_ARGS = ImmutableList.of(INDEX, DELTA);

  /** Insert arguments of a space-time aggregation. */
  public static final List<String> SPACETIME_INSERT_ARGS = ImmutableList.of(DATE);

  /** Delta text meaning "no lower bound". */
  public static final String DELTA_ALL = "all";

  /** Utility class. */
  private DrainConstants() {}
}
