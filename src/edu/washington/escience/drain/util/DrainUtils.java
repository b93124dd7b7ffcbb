package edu.washington.escience.drain.util;

import java.util.Objects;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import com.google.common.base.Preconditions;

/**
 * Generic utilities for drain.
 */
public final class DrainUtils {
  /** Format of a date-time that falls on midnight. */
  private static final DateTimeFormatter DATE_FORMAT = ISODateTimeFormat.date();
  /** Format of any other date-time. */
  private static final DateTimeFormatter DATETIME_FORMAT = ISODateTimeFormat.dateTime();

  /**
   * Utility classes should not be instantiated.
   */
  private DrainUtils() {}

  /**
   * Throws a {@link NullPointerException} if the specified iterable contains a null value.
   *
   * @param <T> any object type that extends Iterable
   * @param iter the iterable
   * @param message a message to be included with the exception
   * @return the iterable.
   */
  public static <T extends Iterable<?>> T checkHasNoNulls(final T iter, final String message) {
    Objects.requireNonNull(iter, message);
    int i = 0;
    for (Object o : iter) {
      Preconditions.checkNotNull(o, "%s [element %s]", message, i);
      ++i;
    }
    return iter;
  }

  /**
   * Render a value the way it appears inside result keys and column prefixes. Date-times at midnight render as an ISO
   * date, other date-times as a full ISO date-time, everything else through {@link String#valueOf(Object)}.
   *
   * @param value the value.
   * @return its key form.
   */
  public static String toKeyString(final Object value) {
    if (value instanceof DateTime) {
      DateTime dt = (DateTime) value;
      if (dt.getMillisOfDay() == 0) {
        return DATE_FORMAT.print(dt);
      }
      return DATETIME_FORMAT.print(dt);
    }
    return String.valueOf(value);
  }
}
