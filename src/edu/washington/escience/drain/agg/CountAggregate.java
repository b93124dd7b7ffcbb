package edu.washington.escience.drain.agg;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * Counts the rows of a group. Without a column every row counts; with a column a row counts when its value is present
 * and not <code>false</code>, or, if <code>equalTo</code> is set, when its value equals it. Optionally also emits the
 * count as a proportion of the group's size.
 */
public final class CountAggregate implements Aggregate {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The column being counted, or null to count rows. */
  @JsonProperty private final String column;
  /** The value a counted cell must equal, or null. */
  @JsonProperty private final Object equalTo;
  /** The output name prefix, or null to use the column name. */
  @JsonProperty private final String name;
  /** Whether to also emit the proportion. */
  @JsonProperty private final boolean prop;

  /**
   * @param column the column being counted, or null to count rows.
   * @param equalTo the value a counted cell must equal, or null.
   * @param name the output name prefix, or null to use the column name.
   * @param prop whether to also emit the proportion.
   */
  @JsonCreator
  public CountAggregate(
      @Nullable @JsonProperty("column") final String column,
      @Nullable @JsonProperty("equalTo") final Object equalTo,
      @Nullable @JsonProperty("name") final String name,
      @Nullable @JsonProperty("prop") final Boolean prop) {
    this.column = column;
    this.equalTo = TupleUtils.normalize(equalTo);
    this.name = name;
    this.prop = MoreObjects.firstNonNull(prop, Boolean.FALSE);
    Preconditions.checkArgument(
        column != null || equalTo == null, "equalTo needs a column to compare");
    Preconditions.checkArgument(
        column != null || name != null || !this.prop, "a proportion of all rows needs a name");
  }

  /**
   * @return an aggregate counting every row, named <code>count</code>.
   */
  public static CountAggregate rows() {
    return new CountAggregate(null, null, null, false);
  }

  /**
   * @param column the column to count.
   * @return an aggregate counting present, non-false values, named <code>column_count</code>.
   */
  public static CountAggregate of(final String column) {
    return new CountAggregate(column, null, null, false);
  }

  /**
   * @param column the column to compare.
   * @param equalTo the value to look for.
   * @param name the output name prefix.
   * @param prop whether to also emit the proportion.
   * @return an aggregate counting the rows whose column equals the value.
   */
  public static CountAggregate ofValue(
      final String column, final Object equalTo, final String name, final boolean prop) {
    return new CountAggregate(column, equalTo, name, prop);
  }

  /**
   * @return the prefix of the output names, or null when the output is the bare <code>count</code>.
   */
  private String getBaseName() {
    return name != null ? name : column;
  }

  @Override
  public Schema getOutputSchema(final Table input) throws ConfigurationException {
    if (column != null && !input.hasField(column)) {
      throw new ConfigurationException("cannot count missing column " + column);
    }
    String base = getBaseName();
    if (base == null) {
      return Schema.ofFields(Type.LONG_TYPE, "count");
    }
    if (prop) {
      return Schema.ofFields(
          Type.LONG_TYPE, base + "_count", Type.DOUBLE_TYPE, base + "_prop");
    }
    return Schema.ofFields(Type.LONG_TYPE, base + "_count");
  }

  @Override
  public List<Object> evaluate(final Table input, final int[] rows) {
    long count = 0;
    if (column == null) {
      count = rows.length;
    } else {
      List<Object> values = input.getField(column);
      for (int row : rows) {
        if (counts(values.get(row))) {
          ++count;
        }
      }
    }
    if (!prop) {
      return ImmutableList.<Object>of(count);
    }
    Double proportion = rows.length == 0 ? null : ((double) count) / rows.length;
    return Arrays.<Object>asList(count, proportion);
  }

  /**
   * @param value a cell.
   * @return whether the cell is counted.
   */
  private boolean counts(final Object value) {
    if (value == null) {
      return false;
    }
    if (equalTo != null) {
      Object v = TupleUtils.normalize(value);
      if (v instanceof Number && equalTo instanceof Number) {
        return TupleUtils.compareValues(v, equalTo) == 0;
      }
      return v.equals(equalTo);
    }
    return !Boolean.FALSE.equals(value);
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof CountAggregate)) {
      return false;
    }
    CountAggregate other = (CountAggregate) o;
    return Objects.equals(column, other.column)
        && Objects.equals(equalTo, other.equalTo)
        && Objects.equals(name, other.name)
        && prop == other.prop;
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, equalTo, name, prop);
  }
}
