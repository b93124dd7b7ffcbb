package edu.washington.escience.drain.agg;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * A single built-in statistic of one column. Missing values are ignored.
 */
public final class PrimitiveAggregate implements Aggregate {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * The different aggregations that can be used when aggregating built-in types.
   */
  public enum AggregationOp {
    /** COUNT. Applies to all types. Result is always of type {@link Type#LONG_TYPE}. */
    COUNT,
    /** MIN. Applies to all types. Result is same as input type. */
    MIN,
    /** MAX. Applies to all types. Result is same as input type. */
    MAX,
    /** SUM. Applies to numeric types. Result is coerced to the largest compatible numeric type (long or double). */
    SUM,
    /** AVG. Applies to numeric types. Result is always {@link Type#DOUBLE_TYPE}. */
    AVG
  };

  /** The column to aggregate on. */
  @JsonProperty private final String column;
  /** The aggregate operation. */
  @JsonProperty private final AggregationOp op;

  /**
   * @param column the column to aggregate on.
   * @param op the aggregate operation.
   */
  @JsonCreator
  public PrimitiveAggregate(
      @JsonProperty(value = "column", required = true) final String column,
      @JsonProperty(value = "op", required = true) final AggregationOp op) {
    this.column = Objects.requireNonNull(column, "column");
    this.op = Objects.requireNonNull(op, "op");
  }

  /**
   * @return the output column name, e.g. <code>sum_arrests</code>.
   */
  public String getOutputName() {
    return op.toString().toLowerCase() + "_" + column;
  }

  @Override
  public Schema getOutputSchema(final Table input) throws ConfigurationException {
    if (!input.hasField(column)) {
      throw new ConfigurationException("cannot aggregate missing column " + column);
    }
    Type inputType = input.getFieldType(column);
    switch (op) {
      case COUNT:
        return Schema.ofFields(Type.LONG_TYPE, getOutputName());
      case MIN:
      case MAX:
        if (inputType == Type.BOOLEAN_TYPE) {
          throw new ConfigurationException(op + " does not apply to " + inputType);
        }
        return Schema.ofFields(inputType, getOutputName());
      case SUM:
        checkNumeric(inputType);
        return Schema.ofFields(
            inputType == Type.DOUBLE_TYPE ? Type.DOUBLE_TYPE : Type.LONG_TYPE, getOutputName());
      case AVG:
        checkNumeric(inputType);
        return Schema.ofFields(Type.DOUBLE_TYPE, getOutputName());
      default:
        throw new IllegalStateException("unknown op " + op);
    }
  }

  /**
   * @param inputType the type of the aggregated column.
   * @throws ConfigurationException if the type cannot be summed.
   */
  private void checkNumeric(final Type inputType) throws ConfigurationException {
    if (!inputType.isNumeric()) {
      throw new ConfigurationException(op + " does not apply to " + inputType);
    }
  }

  @Override
  public List<Object> evaluate(final Table input, final int[] rows) {
    List<Object> values = input.getField(column);
    long count = 0;
    Object extreme = null;
    long longSum = 0;
    double doubleSum = 0;
    boolean isDouble = input.getFieldType(column) == Type.DOUBLE_TYPE;
    for (int row : rows) {
      Object v = values.get(row);
      if (v == null) {
        continue;
      }
      ++count;
      switch (op) {
        case MIN:
          if (extreme == null || TupleUtils.compareValues(v, extreme) < 0) {
            extreme = v;
          }
          break;
        case MAX:
          if (extreme == null || TupleUtils.compareValues(v, extreme) > 0) {
            extreme = v;
          }
          break;
        case SUM:
        case AVG:
          if (isDouble) {
            doubleSum += ((Number) v).doubleValue();
          } else {
            longSum += ((Number) v).longValue();
          }
          break;
        default:
          break;
      }
    }
    Object result;
    switch (op) {
      case COUNT:
        result = count;
        break;
      case MIN:
      case MAX:
        result = extreme;
        break;
      case SUM:
        if (count == 0) {
          result = null;
        } else {
          result = isDouble ? (Object) doubleSum : (Object) longSum;
        }
        break;
      case AVG:
        result = count == 0 ? null : (isDouble ? doubleSum : (double) longSum) / count;
        break;
      default:
        throw new IllegalStateException("unknown op " + op);
    }
    return Collections.singletonList(result);
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof PrimitiveAggregate)) {
      return false;
    }
    PrimitiveAggregate other = (PrimitiveAggregate) o;
    return column.equals(other.column) && op == other.op;
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, op);
  }
}
