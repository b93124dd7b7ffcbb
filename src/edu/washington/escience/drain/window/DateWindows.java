package edu.washington.escience.drain.window;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.storage.Table;

/**
 * Selects the rows of a table that fall inside a time window, and hides values that were not yet known at a given
 * date.
 */
public final class DateWindows {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DateWindows.class);

  /** Utility classes cannot be constructed. */
  private DateWindows() {}

  /**
   * Keep the rows whose timestamp <code>ts</code> satisfies <code>date - delta &lt;= ts &lt; date</code>. An unbounded
   * delta keeps every row with <code>ts &lt; date</code>. Rows without a timestamp are dropped.
   *
   * @param table the table.
   * @param column the timestamp column.
   * @param date the end of the window, exclusive.
   * @param delta the length of the window.
   * @return the rows inside the window.
   * @throws ConfigurationException if the column is missing or is not a date-time.
   */
  public static Table select(
      final Table table, final String column, final DateTime date, final Delta delta)
      throws ConfigurationException {
    final List<Object> timestamps = getDateField(table, column);
    final DateTime start = delta.getStart(date);
    Table ret =
        table.filter(
            row -> {
              DateTime ts = (DateTime) timestamps.get(row);
              if (ts == null || !ts.isBefore(date)) {
                return false;
              }
              return start == null || !ts.isBefore(start);
            });
    LOGGER.debug(
        "Selected {} of {} rows in window {} ending {}",
        ret.numTuples(),
        table.numTuples(),
        delta,
        date);
    return ret;
  }

  /**
   * Null out values that depend on an event not yet observed at <code>date</code>. For each date column, every row
   * whose date is missing or not before <code>date</code> has its dependent columns set to null.
   *
   * @param table the table.
   * @param censorColumns maps a date column to the columns whose values depend on it.
   * @param date the reference date.
   * @return the censored table.
   * @throws ConfigurationException if a named column is missing or a date column is not a date-time.
   */
  public static Table censor(
      final Table table, final Map<String, List<String>> censorColumns, final DateTime date)
      throws ConfigurationException {
    Table ret = table;
    for (Map.Entry<String, List<String>> entry : censorColumns.entrySet()) {
      List<Object> dates = getDateField(table, entry.getKey());
      for (String dependent : entry.getValue()) {
        if (!ret.getSchema().contains(dependent)) {
          throw new ConfigurationException("cannot censor missing column " + dependent);
        }
        List<Object> values = new ArrayList<>(ret.getColumn(dependent));
        for (int row = 0; row < values.size(); ++row) {
          DateTime known = (DateTime) dates.get(row);
          if (known == null || !known.isBefore(date)) {
            values.set(row, null);
          }
        }
        ret = ret.withColumn(dependent, values);
      }
    }
    return ret;
  }

  /**
   * @param table a table.
   * @param column the name of a date-time field.
   * @return the values of the field.
   * @throws ConfigurationException if the field is missing or is not a date-time.
   */
  private static List<Object> getDateField(final Table table, final String column)
      throws ConfigurationException {
    if (!table.hasField(column)) {
      throw new ConfigurationException("no date column " + column);
    }
    if (table.getFieldType(column) != Type.DATETIME_TYPE) {
      throw new ConfigurationException(
          "column " + column + " is a " + table.getFieldType(column) + ", not a date");
    }
    return table.getField(column);
  }
}
