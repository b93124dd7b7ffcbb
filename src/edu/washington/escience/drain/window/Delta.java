package edu.washington.escience.drain.window;

import java.io.Serializable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.joda.time.DateTime;
import org.joda.time.Period;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import edu.washington.escience.drain.DrainConstants;
import net.jcip.annotations.Immutable;

/**
 * The length of a lookback window, written as a count and a unit: <code>12h</code>, <code>2d</code>, <code>1w</code>,
 * <code>6m</code> (months), <code>1y</code>, or <code>all</code> for a window with no start. A delta prints as the
 * text it was parsed from, which is how it appears in result keys.
 */
@Immutable
public final class Delta implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Count followed by a one-letter unit. */
  private static final Pattern DELTA_PATTERN = Pattern.compile("^(\\d+)([hdwmy])$");

  /** The source text. */
  private final String text;
  /** The window length, null when unbounded. */
  @Nullable private final Period period;

  /**
   * @param text the source text.
   * @param period the window length, null when unbounded.
   */
  private Delta(final String text, @Nullable final Period period) {
    this.text = text;
    this.period = period;
  }

  /**
   * @param text a delta such as <code>24h</code> or <code>all</code>.
   * @return the parsed delta.
   * @throws IllegalArgumentException if the text is not a delta.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Delta parse(final String text) {
    Objects.requireNonNull(text, "text");
    if (DrainConstants.DELTA_ALL.equals(text)) {
      return new Delta(text, null);
    }
    Matcher m = DELTA_PATTERN.matcher(text);
    Preconditions.checkArgument(m.matches(), "invalid delta %s", text);
    int n = Integer.parseInt(m.group(1));
    Period period;
    switch (m.group(2).charAt(0)) {
      case 'h':
        period = Period.hours(n);
        break;
      case 'd':
        period = Period.days(n);
        break;
      case 'w':
        period = Period.weeks(n);
        break;
      case 'm':
        period = Period.months(n);
        break;
      case 'y':
        period = Period.years(n);
        break;
      default:
        throw new IllegalArgumentException("invalid delta unit in " + text);
    }
    return new Delta(text, period);
  }

  /**
   * @return true if the window reaches back without limit.
   */
  public boolean isUnbounded() {
    return period == null;
  }

  /**
   * @param end the end of a window.
   * @return the first instant inside a window of this length ending at <code>end</code>, or null when unbounded.
   */
  @Nullable
  public DateTime getStart(final DateTime end) {
    if (period == null) {
      return null;
    }
    return end.minus(period);
  }

  @Override
  public boolean equals(final Object o) {
    return (o instanceof Delta) && text.equals(((Delta) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return text;
  }
}
