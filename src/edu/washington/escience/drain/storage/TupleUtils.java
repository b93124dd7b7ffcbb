package edu.washington.escience.drain.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.google.common.collect.Ordering;

/**
 * Utility functions for comparing and hashing the values of table rows.
 */
public final class TupleUtils {

  /** Orders single values: nulls first, numbers numerically, everything else by its natural order. */
  public static final Comparator<Object> VALUE_ORDER = new Comparator<Object>() {
    @Override
    public int compare(final Object a, final Object b) {
      return compareValues(a, b);
    }
  };

  /** Orders row keys lexicographically using {@link #VALUE_ORDER}. */
  public static final Ordering<Iterable<Object>> KEY_ORDER =
      Ordering.from(VALUE_ORDER).lexicographical();

  /** Utility classes cannot be constructed. */
  private TupleUtils() {}

  /**
   * Bring a value to a canonical form so that equal values of different widths compare equal: integral numbers
   * become {@link Long}s and date-times are moved to UTC.
   *
   * @param value a value, possibly null.
   * @return its canonical form.
   */
  public static Object normalize(final Object value) {
    if (value instanceof Integer) {
      return Long.valueOf((Integer) value);
    }
    if (value instanceof DateTime) {
      return ((DateTime) value).toDateTime(DateTimeZone.UTC);
    }
    return value;
  }

  /**
   * @param values some values.
   * @return an unmodifiable list of their canonical forms.
   */
  public static List<Object> normalizeAll(final List<?> values) {
    List<Object> ret = new ArrayList<>(values.size());
    for (Object v : values) {
      ret.add(normalize(v));
    }
    return Collections.unmodifiableList(ret);
  }

  /**
   * Compare two values: nulls sort first, numbers are compared numerically.
   *
   * @param a a value.
   * @param b another value.
   * @return the comparison, with {@link Comparable#compareTo} semantics.
   */
  @SuppressWarnings("unchecked")
  public static int compareValues(final Object a, final Object b) {
    if (a == b) {
      return 0;
    }
    if (a == null) {
      return -1;
    }
    if (b == null) {
      return 1;
    }
    if (a instanceof Number && b instanceof Number) {
      if ((a instanceof Double) || (b instanceof Double)) {
        return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      }
      return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
    }
    return ((Comparable<Object>) a).compareTo(b);
  }
}
