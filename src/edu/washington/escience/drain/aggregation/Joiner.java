package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.JoinKeyException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * Left-joins the groups of an aggregation result into a table. Each group's columns are prefixed with its key and a
 * separator, and matched to the table's rows on the group's index levels, which the table must have as index levels or
 * columns of the same names. The table keeps its rows and their order; unmatched rows get missing values.
 */
public final class Joiner {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Joiner.class);

  /** Utility classes cannot be constructed. */
  private Joiner() {}

  /**
   * @param left the table to extend.
   * @param result a grouped aggregation result.
   * @return the table followed by one block of prefixed columns per group, in result order.
   * @throws ConfigurationException if the result is not grouped or a joined column name is already taken.
   * @throws JoinKeyException if the table lacks a group's index level, or a group has a repeated index key.
   */
  public static Table join(final Table left, final AggregationResult result)
      throws ConfigurationException, JoinKeyException {
    if (!result.isGrouped()) {
      throw new ConfigurationException("only grouped aggregation results can be joined");
    }
    Table ret = left;
    for (Map.Entry<String, Table> group : result.getGroups().entrySet()) {
      ret = joinGroup(ret, group.getKey(), group.getValue());
    }
    return ret;
  }

  /**
   * @param left the table to extend.
   * @param key the group's key.
   * @param group the group's table.
   * @return the table followed by the group's prefixed columns.
   * @throws ConfigurationException if a joined column name is already taken.
   * @throws JoinKeyException if the table lacks an index level of the group, or the group repeats an index key.
   */
  private static Table joinGroup(final Table left, final String key, final Table group)
      throws ConfigurationException, JoinKeyException {
    Schema groupIndex = group.getIndexSchema();
    List<List<Object>> leftKeyFields = new ArrayList<>(groupIndex.numColumns());
    for (String level : groupIndex.getColumnNames()) {
      if (!left.hasField(level)) {
        throw new JoinKeyException(
            "cannot join result " + key + ": the table has no index level or column " + level);
      }
      leftKeyFields.add(left.getField(level));
    }

    Map<List<Object>, Integer> rowByKey = new HashMap<>();
    for (int row = 0; row < group.numTuples(); ++row) {
      List<Object> k = TupleUtils.normalizeAll(group.getIndexKey(row));
      if (rowByKey.put(k, row) != null) {
        throw new JoinKeyException("cannot join result " + key + ": index key " + k + " is repeated");
      }
    }

    Table prefixed = group.prefixColumns(key + DrainConstants.CONCAT_SEPARATOR);
    Schema extraSchema = prefixed.getSchema();
    for (String name : extraSchema.getColumnNames()) {
      if (left.hasField(name)) {
        throw new ConfigurationException("cannot join result " + key + ": column " + name + " exists");
      }
    }
    List<List<Object>> extraColumns = new ArrayList<>(extraSchema.numColumns());
    for (int c = 0; c < extraSchema.numColumns(); ++c) {
      extraColumns.add(new ArrayList<>(left.numTuples()));
    }
    int matched = 0;
    for (int row = 0; row < left.numTuples(); ++row) {
      List<Object> k = new ArrayList<>(leftKeyFields.size());
      for (List<Object> field : leftKeyFields) {
        k.add(TupleUtils.normalize(field.get(row)));
      }
      Integer match = rowByKey.get(k);
      if (match != null) {
        ++matched;
      }
      for (int c = 0; c < extraColumns.size(); ++c) {
        extraColumns.get(c).add(match == null ? null : prefixed.getObject(c, match));
      }
    }
    LOGGER.debug("Joined {}: {} of {} rows matched", key, matched, left.numTuples());
    return left.appendColumns(extraSchema, extraColumns);
  }
}
