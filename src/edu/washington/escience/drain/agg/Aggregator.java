package edu.washington.escience.drain.agg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableBuilder;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * Applies a fixed list of {@link Aggregate}s to a fixed table, grouping by whichever index it is asked for. The output
 * schema is checked once, at construction, so an aggregator can be reused across indexes.
 */
public final class Aggregator {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

  /** The table being aggregated. */
  private final Table table;
  /** The aggregates to compute. */
  private final List<Aggregate> aggregates;
  /** The columns emitted by the aggregates. */
  private final Schema outputSchema;

  /**
   * @param table the table being aggregated.
   * @param aggregates the aggregates to compute.
   * @throws ConfigurationException if an aggregate does not apply to the table.
   */
  public Aggregator(final Table table, final List<? extends Aggregate> aggregates)
      throws ConfigurationException {
    this.table = Objects.requireNonNull(table, "table");
    this.aggregates = ImmutableList.copyOf(aggregates);
    Schema schema = Schema.EMPTY_SCHEMA;
    for (Aggregate agg : this.aggregates) {
      try {
        schema = Schema.merge(schema, agg.getOutputSchema(table));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("aggregates emit conflicting columns", e);
      }
    }
    outputSchema = schema;
  }

  /**
   * @return the columns emitted by the aggregates.
   */
  public Schema getOutputSchema() {
    return outputSchema;
  }

  /**
   * Group the table by the index columns and compute every aggregate for every group. Rows with a missing index value
   * belong to no group. Groups are emitted in ascending key order.
   *
   * @param index the grouping columns.
   * @return a table indexed by the grouping columns whose columns are the aggregate outputs.
   * @throws ConfigurationException if the table lacks an index column.
   */
  public Table aggregate(final IndexSpec index) throws ConfigurationException {
    List<String> keyNames = index.getColumns();
    List<Type> keyTypes = new ArrayList<>();
    List<List<Object>> keyFields = new ArrayList<>();
    for (String name : keyNames) {
      if (!table.hasField(name)) {
        throw new ConfigurationException("cannot group by missing column " + name);
      }
      keyTypes.add(table.getFieldType(name));
      keyFields.add(table.getField(name));
    }

    Map<List<Object>, List<Integer>> groups =
        new TreeMap<List<Object>, List<Integer>>(TupleUtils.KEY_ORDER);
    for (int row = 0; row < table.numTuples(); ++row) {
      Object[] key = new Object[keyFields.size()];
      boolean missing = false;
      for (int i = 0; i < key.length; ++i) {
        key[i] = keyFields.get(i).get(row);
        missing |= key[i] == null;
      }
      if (missing) {
        continue;
      }
      List<Object> k = Collections.unmodifiableList(Arrays.asList(key));
      List<Integer> rows = groups.get(k);
      if (rows == null) {
        rows = new ArrayList<>();
        groups.put(k, rows);
      }
      rows.add(row);
    }

    TableBuilder builder = new TableBuilder(new Schema(keyTypes, keyNames), outputSchema);
    for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
      int[] rows = Ints.toArray(group.getValue());
      List<Object> values = new ArrayList<>(outputSchema.numColumns());
      for (Aggregate agg : aggregates) {
        values.addAll(agg.evaluate(table, rows));
      }
      builder.addRow(group.getKey(), values);
    }
    LOGGER.debug(
        "Aggregated {} rows into {} groups of {}", table.numTuples(), groups.size(), index);
    return builder.build();
  }

  @Override
  public String toString() {
    return "Aggregator(" + table.numTuples() + " rows -> " + outputSchema + ")";
  }
}
