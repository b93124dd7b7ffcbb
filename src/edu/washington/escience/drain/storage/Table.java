package edu.washington.escience.drain.storage;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntPredicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import net.jcip.annotations.Immutable;

/**
 * An immutable, column-major table. A table has a (possibly empty) list of index levels that identify each row, and a
 * list of value columns. Any cell may be <code>null</code>, which stands for a missing value. All operations return new
 * tables.
 */
@Immutable
public final class Table implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Names and types of the index levels. */
  private final Schema indexSchema;
  /** Names and types of the value columns. */
  private final Schema schema;
  /** Index level data, one list per level. */
  private final ImmutableList<List<Object>> indexColumns;
  /** Value column data, one list per column. */
  private final ImmutableList<List<Object>> columns;
  /** Number of rows. */
  private final int numTuples;

  /**
   * Construct a table from already validated columns.
   *
   * @param indexSchema the index levels.
   * @param schema the value columns.
   * @param indexColumns data of the index levels.
   * @param columns data of the value columns.
   * @param numTuples the number of rows.
   */
  Table(
      final Schema indexSchema,
      final Schema schema,
      final List<List<Object>> indexColumns,
      final List<List<Object>> columns,
      final int numTuples) {
    this.indexSchema = Objects.requireNonNull(indexSchema, "indexSchema");
    this.schema = Objects.requireNonNull(schema, "schema");
    /* index levels and value columns share one namespace */
    Schema.merge(indexSchema, schema);
    Preconditions.checkArgument(
        indexColumns.size() == indexSchema.numColumns(), "index data does not match index schema");
    Preconditions.checkArgument(
        columns.size() == schema.numColumns(), "column data does not match schema");
    this.indexColumns = freeze(indexColumns, numTuples);
    this.columns = freeze(columns, numTuples);
    this.numTuples = numTuples;
  }

  /**
   * @param data column data.
   * @param numTuples expected length of every column.
   * @return an immutable copy.
   */
  private static ImmutableList<List<Object>> freeze(
      final List<List<Object>> data, final int numTuples) {
    ImmutableList.Builder<List<Object>> ret = ImmutableList.builder();
    for (List<Object> column : data) {
      Preconditions.checkArgument(
          column.size() == numTuples,
          "column has %s values but table has %s rows",
          column.size(),
          numTuples);
      ret.add(Collections.unmodifiableList(new ArrayList<>(column)));
    }
    return ret.build();
  }

  /**
   * @return the schema of the value columns.
   */
  public Schema getSchema() {
    return schema;
  }

  /**
   * @return the schema of the index levels.
   */
  public Schema getIndexSchema() {
    return indexSchema;
  }

  /**
   * @return the number of rows.
   */
  public int numTuples() {
    return numTuples;
  }

  /**
   * @return the number of value columns.
   */
  public int numColumns() {
    return schema.numColumns();
  }

  /**
   * @return the number of index levels.
   */
  public int numIndexLevels() {
    return indexSchema.numColumns();
  }

  /**
   * @param column the position of a value column.
   * @param row the row.
   * @return the value, possibly null.
   */
  public Object getObject(final int column, final int row) {
    return columns.get(column).get(row);
  }

  /**
   * @param level the position of an index level.
   * @param row the row.
   * @return the value of that level, possibly null.
   */
  public Object getIndexValue(final int level, final int row) {
    return indexColumns.get(level).get(row);
  }

  /**
   * @param name the name of an index level or a value column.
   * @return true if the table has a level or column with that name.
   */
  public boolean hasField(final String name) {
    return indexSchema.contains(name) || schema.contains(name);
  }

  /**
   * @param name the name of an index level or a value column.
   * @return its type.
   * @throws NoSuchElementException if there is no such level or column.
   */
  public Type getFieldType(final String name) {
    if (indexSchema.contains(name)) {
      return indexSchema.getColumnType(name);
    }
    return schema.getColumnType(name);
  }

  /**
   * Look up a field by name. Index levels are searched before value columns.
   *
   * @param name the name of an index level or a value column.
   * @return all values of that field, in row order.
   * @throws NoSuchElementException if there is no such level or column.
   */
  public List<Object> getField(final String name) {
    if (indexSchema.contains(name)) {
      return indexColumns.get(indexSchema.columnNameToIndex(name));
    }
    return columns.get(schema.columnNameToIndex(name));
  }

  /**
   * @param name the name of a value column.
   * @return its values, in row order.
   * @throws NoSuchElementException if there is no such column.
   */
  public List<Object> getColumn(final String name) {
    return columns.get(schema.columnNameToIndex(name));
  }

  /**
   * @param row the row.
   * @return the values of every index level for that row.
   */
  public List<Object> getIndexKey(final int row) {
    Object[] key = new Object[indexColumns.size()];
    for (int i = 0; i < key.length; ++i) {
      key[i] = indexColumns.get(i).get(row);
    }
    return Collections.unmodifiableList(Arrays.asList(key));
  }

  /**
   * Append an index level holding the same value for every row. Existing levels keep their order and the new level
   * becomes the outermost.
   *
   * @param name the name of the new level.
   * @param type the type of the new level.
   * @param value the value of the new level.
   * @return the new table.
   */
  public Table appendIndexLevel(final String name, final Type type, final Object value) {
    Preconditions.checkArgument(type.isValid(value), "%s is not a valid %s", value, type);
    List<List<Object>> newIndex = new ArrayList<>(indexColumns);
    newIndex.add(Collections.nCopies(numTuples, value));
    return new Table(
        Schema.appendColumn(indexSchema, type, name), schema, newIndex, columns, numTuples);
  }

  /**
   * @param prefix a prefix.
   * @return a table whose value columns are all renamed to start with the prefix.
   */
  public Table prefixColumns(final String prefix) {
    return new Table(indexSchema, schema.prefixNames(prefix), indexColumns, columns, numTuples);
  }

  /**
   * Replace the values of a value column.
   *
   * @param name the name of the column.
   * @param values the new values, one per row.
   * @return the new table.
   */
  public Table withColumn(final String name, final List<?> values) {
    int c = schema.columnNameToIndex(name);
    Preconditions.checkArgument(values.size() == numTuples, "expected %s values", numTuples);
    Type type = schema.getColumnType(c);
    for (Object v : values) {
      Preconditions.checkArgument(type.isValid(v), "%s is not a valid %s", v, type);
    }
    List<List<Object>> newColumns = new ArrayList<>(columns);
    newColumns.set(c, new ArrayList<Object>(values));
    return new Table(indexSchema, schema, indexColumns, newColumns, numTuples);
  }

  /**
   * Append value columns after the existing ones.
   *
   * @param extraSchema the names and types of the new columns.
   * @param extraColumns the data of the new columns.
   * @return the new table.
   */
  public Table appendColumns(final Schema extraSchema, final List<List<Object>> extraColumns) {
    Preconditions.checkArgument(extraColumns.size() == extraSchema.numColumns());
    for (int c = 0; c < extraColumns.size(); ++c) {
      Type type = extraSchema.getColumnType(c);
      for (Object v : extraColumns.get(c)) {
        Preconditions.checkArgument(type.isValid(v), "%s is not a valid %s", v, type);
      }
    }
    List<List<Object>> newColumns = new ArrayList<>(columns);
    newColumns.addAll(extraColumns);
    return new Table(
        indexSchema, Schema.merge(schema, extraSchema), indexColumns, newColumns, numTuples);
  }

  /**
   * @param rows the rows to keep, in the order they should appear.
   * @return the new table.
   */
  public Table selectRows(final int[] rows) {
    return new Table(
        indexSchema, schema, select(indexColumns, rows), select(columns, rows), rows.length);
  }

  /**
   * @param data column data.
   * @param rows rows to keep.
   * @return the selected data.
   */
  private static List<List<Object>> select(final List<List<Object>> data, final int[] rows) {
    List<List<Object>> ret = new ArrayList<>(data.size());
    for (List<Object> column : data) {
      List<Object> selected = new ArrayList<>(rows.length);
      for (int row : rows) {
        selected.add(column.get(row));
      }
      ret.add(selected);
    }
    return ret;
  }

  /**
   * @param predicate decides, by row position, whether a row is kept.
   * @return the table of kept rows, in their original order.
   */
  public Table filter(final IntPredicate predicate) {
    List<Integer> keep = new ArrayList<>();
    for (int row = 0; row < numTuples; ++row) {
      if (predicate.test(row)) {
        keep.add(row);
      }
    }
    return selectRows(Ints.toArray(keep));
  }

  /**
   * Split the rows of this table by the values of some index levels. This inverts {@link #stack} along index levels
   * whose value is constant within every stacked member.
   *
   * @param levels names of index levels.
   * @return for each distinct combination of level values, in order of first appearance, the rows having it.
   */
  public Map<List<Object>, Table> partitionBy(final String... levels) {
    int[] positions = new int[levels.length];
    for (int i = 0; i < levels.length; ++i) {
      positions[i] = indexSchema.columnNameToIndex(levels[i]);
    }
    Map<List<Object>, List<Integer>> rowsByKey = new LinkedHashMap<>();
    for (int row = 0; row < numTuples; ++row) {
      Object[] key = new Object[positions.length];
      for (int i = 0; i < positions.length; ++i) {
        key[i] = indexColumns.get(positions[i]).get(row);
      }
      List<Object> k = Collections.unmodifiableList(Arrays.asList(key));
      List<Integer> rows = rowsByKey.get(k);
      if (rows == null) {
        rows = new ArrayList<>();
        rowsByKey.put(k, rows);
      }
      rows.add(row);
    }
    Map<List<Object>, Table> ret = new LinkedHashMap<>();
    for (Map.Entry<List<Object>, List<Integer>> e : rowsByKey.entrySet()) {
      ret.put(e.getKey(), selectRows(Ints.toArray(e.getValue())));
    }
    return ret;
  }

  /**
   * Stack tables on top of each other. Every member must have exactly the same index and value schemas; rows are kept
   * in member order and are never de-duplicated.
   *
   * @param tables the tables to stack; there must be at least one.
   * @return the stacked table.
   * @throws ConfigurationException if the members do not share one schema.
   */
  public static Table stack(final List<Table> tables) throws ConfigurationException {
    Preconditions.checkArgument(!tables.isEmpty(), "cannot stack zero tables");
    Table first = tables.get(0);
    if (tables.size() == 1) {
      return first;
    }
    List<List<Object>> index = newColumns(first.numIndexLevels());
    List<List<Object>> values = newColumns(first.numColumns());
    int numTuples = 0;
    for (Table t : tables) {
      if (!t.indexSchema.equals(first.indexSchema) || !t.schema.equals(first.schema)) {
        throw new ConfigurationException(
            "cannot stack table with index ["
                + t.indexSchema
                + "] and columns ["
                + t.schema
                + "] onto table with index ["
                + first.indexSchema
                + "] and columns ["
                + first.schema
                + "]");
      }
      for (int i = 0; i < index.size(); ++i) {
        index.get(i).addAll(t.indexColumns.get(i));
      }
      for (int i = 0; i < values.size(); ++i) {
        values.get(i).addAll(t.columns.get(i));
      }
      numTuples += t.numTuples;
    }
    return new Table(first.indexSchema, first.schema, index, values, numTuples);
  }

  /**
   * @param n number of columns.
   * @return n empty, growable columns.
   */
  private static List<List<Object>> newColumns(final int n) {
    List<List<Object>> ret = new ArrayList<>(n);
    for (int i = 0; i < n; ++i) {
      ret.add(new ArrayList<>());
    }
    return ret;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Table)) {
      return false;
    }
    Table other = (Table) o;
    return numTuples == other.numTuples
        && indexSchema.equals(other.indexSchema)
        && schema.equals(other.schema)
        && indexColumns.equals(other.indexColumns)
        && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indexSchema, schema, indexColumns, columns);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("index [").append(indexSchema).append("] columns [").append(schema).append("]");
    for (int row = 0; row < numTuples; ++row) {
      sb.append('\n');
      for (List<Object> level : indexColumns) {
        sb.append(level.get(row)).append('|');
      }
      for (int c = 0; c < columns.size(); ++c) {
        if (c > 0) {
          sb.append(',');
        }
        sb.append(columns.get(c).get(row));
      }
    }
    return sb.toString();
  }
}
