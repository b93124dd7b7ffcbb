package edu.washington.escience.drain.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;

import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;

/**
 * Builds a {@link Table} one row at a time. Values are checked against the column types; integral values are widened
 * into {@link Type#LONG_TYPE} and {@link Type#DOUBLE_TYPE} columns, and any number into a {@link Type#DOUBLE_TYPE}
 * column.
 */
public final class TableBuilder {
  /** Names and types of the index levels. */
  private final Schema indexSchema;
  /** Names and types of the value columns. */
  private final Schema schema;
  /** Index level data. */
  private final List<List<Object>> indexColumns;
  /** Value column data. */
  private final List<List<Object>> columns;
  /** Rows added so far. */
  private int numTuples;

  /**
   * @param schema the value columns; the table will have no index levels.
   */
  public TableBuilder(final Schema schema) {
    this(Schema.EMPTY_SCHEMA, schema);
  }

  /**
   * @param indexSchema the index levels.
   * @param schema the value columns.
   */
  public TableBuilder(final Schema indexSchema, final Schema schema) {
    this.indexSchema = Objects.requireNonNull(indexSchema, "indexSchema");
    this.schema = Objects.requireNonNull(schema, "schema");
    indexColumns = new ArrayList<>();
    for (int i = 0; i < indexSchema.numColumns(); ++i) {
      indexColumns.add(new ArrayList<>());
    }
    columns = new ArrayList<>();
    for (int i = 0; i < schema.numColumns(); ++i) {
      columns.add(new ArrayList<>());
    }
  }

  /**
   * Add a row given as the values of every index level followed by the values of every column.
   *
   * @param values the row.
   * @return this builder.
   */
  public TableBuilder addRow(final Object... values) {
    int numLevels = indexSchema.numColumns();
    Preconditions.checkArgument(
        values.length == numLevels + schema.numColumns(),
        "expected %s values, got %s",
        numLevels + schema.numColumns(),
        values.length);
    for (int i = 0; i < numLevels; ++i) {
      indexColumns.get(i).add(coerce(indexSchema.getColumnType(i), values[i]));
    }
    for (int i = 0; i < schema.numColumns(); ++i) {
      columns.get(i).add(coerce(schema.getColumnType(i), values[numLevels + i]));
    }
    ++numTuples;
    return this;
  }

  /**
   * Add a row given as separate index and value lists.
   *
   * @param index the values of every index level.
   * @param values the values of every column.
   * @return this builder.
   */
  public TableBuilder addRow(final List<?> index, final List<?> values) {
    List<Object> row = new ArrayList<>(index);
    row.addAll(values);
    return addRow(row.toArray());
  }

  /**
   * @return the number of rows added so far.
   */
  public int numTuples() {
    return numTuples;
  }

  /**
   * @return the built table.
   */
  public Table build() {
    return new Table(indexSchema, schema, indexColumns, columns, numTuples);
  }

  /**
   * Check a value against a type, widening numbers where that loses nothing.
   *
   * @param type the column type.
   * @param value the value.
   * @return the value to store.
   */
  static Object coerce(final Type type, final Object value) {
    if (type == Type.LONG_TYPE && value instanceof Integer) {
      return Long.valueOf((Integer) value);
    }
    if (type == Type.DOUBLE_TYPE && value instanceof Number && !(value instanceof Double)) {
      return ((Number) value).doubleValue();
    }
    Preconditions.checkArgument(type.isValid(value), "%s is not a valid %s", value, type);
    return value;
  }
}
