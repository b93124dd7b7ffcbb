package edu.washington.escience.drain.agg;

import java.io.Serializable;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.util.DrainUtils;
import net.jcip.annotations.Immutable;

/**
 * The physical form of an aggregation index: the ordered columns whose values identify a group. Aggregated tables are
 * indexed by these columns, under the same names.
 */
@Immutable
public final class IndexSpec implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The grouping columns. */
  private final ImmutableList<String> columns;

  /**
   * @param columns the grouping columns. There must be at least one.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public IndexSpec(final List<String> columns) {
    DrainUtils.checkHasNoNulls(columns, "columns");
    Preconditions.checkArgument(!columns.isEmpty(), "an index needs at least one column");
    this.columns = ImmutableList.copyOf(columns);
  }

  /**
   * @param columns the grouping columns.
   * @return the index over those columns.
   */
  public static IndexSpec of(final String... columns) {
    return new IndexSpec(ImmutableList.copyOf(columns));
  }

  /**
   * @return the grouping columns.
   */
  @JsonValue
  public List<String> getColumns() {
    return columns;
  }

  @Override
  public boolean equals(final Object o) {
    return (o instanceof IndexSpec) && columns.equals(((IndexSpec) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return Joiner.on(',').join(columns);
  }
}
