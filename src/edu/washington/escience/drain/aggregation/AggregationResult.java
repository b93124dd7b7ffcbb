package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.drain.storage.Table;
import net.jcip.annotations.Immutable;

/**
 * The output of an aggregation. Grouped results map each result key to the stacked tables of its units; ungrouped
 * results list one table per unit in unit order.
 */
@Immutable
public final class AggregationResult implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The groups, or null if ungrouped. */
  private final ImmutableMap<String, Table> groups;
  /** The unit tables, or null if grouped. */
  private final ImmutableList<Table> tables;

  /**
   * @param groups the groups, or null.
   * @param tables the unit tables, or null.
   */
  private AggregationResult(final ImmutableMap<String, Table> groups, final ImmutableList<Table> tables) {
    this.groups = groups;
    this.tables = tables;
  }

  /**
   * @param groups the tables by result key, in order.
   * @return a grouped result.
   */
  public static AggregationResult grouped(final Map<String, Table> groups) {
    return new AggregationResult(ImmutableMap.copyOf(groups), null);
  }

  /**
   * @param tables the unit tables, in order.
   * @return an ungrouped result.
   */
  public static AggregationResult ungrouped(final List<Table> tables) {
    return new AggregationResult(null, ImmutableList.copyOf(tables));
  }

  /**
   * @return whether the result is grouped by key.
   */
  public boolean isGrouped() {
    return groups != null;
  }

  /**
   * @return the tables by result key.
   */
  public Map<String, Table> getGroups() {
    Preconditions.checkState(isGrouped(), "result is not grouped");
    return groups;
  }

  /**
   * @return the unit tables.
   */
  public List<Table> getTables() {
    Preconditions.checkState(!isGrouped(), "result is grouped");
    return tables;
  }

  /**
   * @return the number of groups or tables.
   */
  public int size() {
    return isGrouped() ? groups.size() : tables.size();
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof AggregationResult)) {
      return false;
    }
    AggregationResult other = (AggregationResult) o;
    return isGrouped() ? groups.equals(other.groups) : tables.equals(other.tables);
  }

  @Override
  public int hashCode() {
    return isGrouped() ? groups.hashCode() : tables.hashCode();
  }

  @Override
  public String toString() {
    return isGrouped() ? "grouped " + groups.keySet() : "ungrouped (" + tables.size() + " tables)";
  }
}
