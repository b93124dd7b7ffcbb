package edu.washington.escience.drain;

import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.agg.Aggregate;
import edu.washington.escience.drain.agg.CountAggregate;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableBuilder;
import edu.washington.escience.drain.storage.TableSource;

/**
 * A small table of crimes shared by the tests.
 */
public final class CrimeFixtures {
  /** The first aggregation date. */
  public static final DateTime DEC_30 = new DateTime(2015, 12, 30, 0, 0, DateTimeZone.UTC);
  /** The second aggregation date. */
  public static final DateTime DEC_31 = new DateTime(2015, 12, 31, 0, 0, DateTimeZone.UTC);

  /** Columns of the crime table. */
  public static final Schema SCHEMA =
      Schema.ofFields(
          "Date", Type.DATETIME_TYPE,
          "District", Type.INT_TYPE,
          "CommunityArea", Type.INT_TYPE,
          "PrimaryType", Type.STRING_TYPE,
          "Arrest", Type.BOOLEAN_TYPE,
          "ArrestDate", Type.DATETIME_TYPE);

  /** Utility class. */
  private CrimeFixtures() {}

  /**
   * @param year year.
   * @param month month.
   * @param day day.
   * @param hour hour.
   * @return the UTC instant.
   */
  public static DateTime at(final int year, final int month, final int day, final int hour) {
    return new DateTime(year, month, day, hour, 0, DateTimeZone.UTC);
  }

  /**
   * Every crime is in district 1 and community area 10.
   *
   * @return the crimes.
   */
  public static Table crimes() {
    return new TableBuilder(SCHEMA)
        .addRow(at(2015, 12, 28, 12), 1, 10, "BATTERY", true, at(2015, 12, 28, 13))
        .addRow(at(2015, 12, 29, 18), 1, 10, "THEFT", true, at(2015, 12, 30, 9))
        .addRow(at(2015, 12, 30, 6), 1, 10, "BATTERY", false, null)
        .addRow(at(2015, 12, 30, 20), 1, 10, "THEFT", false, null)
        .addRow(at(2016, 1, 2, 0), 1, 10, "THEFT", true, at(2016, 1, 2, 1))
        .build();
  }

  /**
   * @return a source of {@link #crimes()}.
   */
  public static TableSource source() {
    final Table crimes = crimes();
    return () -> crimes;
  }

  /**
   * @return row counts, arrest counts and theft counts with proportions.
   */
  public static List<Aggregate> aggregates() {
    return ImmutableList.<Aggregate>of(
        CountAggregate.rows(),
        CountAggregate.of("Arrest"),
        CountAggregate.ofValue("PrimaryType", "THEFT", "theft", true));
  }
}
