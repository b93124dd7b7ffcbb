package edu.washington.escience.drain.select;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * Selects the highest (or lowest) scoring rows of a scored table: either a fixed number of them, or a proportion of a
 * base count. Rows may first be filtered, and rows without an outcome dropped. Ties keep their order and missing scores
 * sort last.
 */
public final class TopSelection {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(TopSelection.class);

  /**
   * What a proportion is a proportion of.
   */
  public enum ProportionBase {
    /** Rows with an outcome. */
    NOTNULL,
    /** The sum of the outcome, i.e. the number of true outcomes. */
    TRUE,
    /** All rows. */
    ALL
  }

  /**
   * Decides whether a row takes part in a selection.
   */
  public interface RowPredicate {
    /**
     * @param table the table.
     * @param row the row.
     * @return whether the row is kept.
     */
    boolean test(Table table, int row);
  }

  /** Filters rows before selecting, or null. */
  @Nullable private final RowPredicate query;
  /** Whether to drop rows without an outcome. */
  private final boolean dropMissing;
  /** The outcome column. */
  private final String outcome;
  /** The score column. */
  private final String score;
  /** How many rows to select, or null. */
  @Nullable private final Integer k;
  /** What proportion of rows to select, or null. */
  @Nullable private final Double p;
  /** What the proportion is of. */
  private final ProportionBase pOf;
  /** Whether the lowest scores are selected. */
  private final boolean ascending;

  /**
   * @param builder the configuration.
   */
  private TopSelection(final Builder builder) {
    query = builder.query;
    dropMissing = builder.dropMissing;
    outcome = builder.outcome;
    score = builder.score;
    k = builder.k;
    p = builder.p;
    pOf = builder.pOf;
    ascending = builder.ascending;
  }

  /**
   * @return a builder with outcome column <code>true</code>, score column <code>score</code>, proportions of rows with
   *         an outcome, and highest scores first.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param table a scored table.
   * @return the selected rows, best first, or the filtered rows in their original order if neither a count nor a
   *         proportion was given.
   * @throws ConfigurationException if the score column is missing, or the outcome column is missing when missing
   *           outcomes are dropped or a proportion is taken of outcomes.
   */
  public Table select(final Table table) throws ConfigurationException {
    Table y = table;
    if (query != null) {
      final Table filtered = y;
      y = y.filter(row -> query.test(filtered, row));
    }
    if (dropMissing) {
      final List<Object> outcomes = getOutcomes(y);
      y = y.filter(row -> outcomes.get(row) != null);
    }

    Integer limit = k;
    if (p != null) {
      limit = (int) Math.floor(p * getBase(y));
    }
    if (limit == null) {
      return y;
    }
    if (!y.hasField(score)) {
      throw new ConfigurationException("no score column " + score);
    }

    final List<Object> scores = y.getField(score);
    List<Integer> rows = new ArrayList<>(y.numTuples());
    for (int row = 0; row < y.numTuples(); ++row) {
      rows.add(row);
    }
    Comparator<Integer> byScore =
        (a, b) -> {
          Object sa = scores.get(a);
          Object sb = scores.get(b);
          if (sa == null || sb == null) {
            return sa == null ? (sb == null ? 0 : 1) : -1;
          }
          int c = TupleUtils.compareValues(sa, sb);
          return ascending ? c : -c;
        };
    Collections.sort(rows, byScore);
    List<Integer> top = rows.subList(0, Math.min(limit, rows.size()));
    LOGGER.debug("Selected {} of {} rows by {}", top.size(), y.numTuples(), score);
    return y.selectRows(Ints.toArray(top));
  }

  /**
   * @param y a table.
   * @return its outcome column.
   * @throws ConfigurationException if the table has no outcome column.
   */
  private List<Object> getOutcomes(final Table y) throws ConfigurationException {
    if (!y.hasField(outcome)) {
      throw new ConfigurationException("no outcome column " + outcome);
    }
    return y.getField(outcome);
  }

  /**
   * @param y the filtered table.
   * @return the count a proportion is relative to.
   * @throws ConfigurationException if the base needs the outcome column and the table has none.
   */
  private double getBase(final Table y) throws ConfigurationException {
    if (pOf == ProportionBase.ALL) {
      return y.numTuples();
    }
    List<Object> outcomes = getOutcomes(y);
    switch (pOf) {
      case NOTNULL:
        int notNull = 0;
        for (Object o : outcomes) {
          if (o != null) {
            ++notNull;
          }
        }
        return notNull;
      case TRUE:
        double sum = 0;
        for (Object o : outcomes) {
          if (o instanceof Boolean) {
            sum += (Boolean) o ? 1 : 0;
          } else if (o instanceof Number) {
            sum += ((Number) o).doubleValue();
          }
        }
        return sum;
      default:
        throw new IllegalStateException("unknown proportion base " + pOf);
    }
  }

  /**
   * Collects the configuration of a {@link TopSelection}.
   */
  public static final class Builder {
    /** Row filter. */
    private RowPredicate query;
    /** Whether to drop rows without an outcome. */
    private boolean dropMissing;
    /** The outcome column. */
    private String outcome = "true";
    /** The score column. */
    private String score = "score";
    /** Row count. */
    private Integer k;
    /** Row proportion. */
    private Double p;
    /** Proportion base. */
    private ProportionBase pOf = ProportionBase.NOTNULL;
    /** Sort direction. */
    private boolean ascending;

    /** Use {@link TopSelection#builder()}. */
    private Builder() {}

    /**
     * @param query keeps the rows that take part.
     * @return this builder.
     */
    public Builder query(final RowPredicate query) {
      this.query = query;
      return this;
    }

    /**
     * @param dropMissing whether to drop rows without an outcome.
     * @return this builder.
     */
    public Builder dropMissing(final boolean dropMissing) {
      this.dropMissing = dropMissing;
      return this;
    }

    /**
     * @param outcome the outcome column.
     * @return this builder.
     */
    public Builder outcome(final String outcome) {
      this.outcome = Objects.requireNonNull(outcome, "outcome");
      return this;
    }

    /**
     * @param score the score column.
     * @return this builder.
     */
    public Builder score(final String score) {
      this.score = Objects.requireNonNull(score, "score");
      return this;
    }

    /**
     * @param k how many rows to select.
     * @return this builder.
     */
    public Builder k(final int k) {
      Preconditions.checkArgument(k >= 0, "k must be non-negative");
      this.k = k;
      return this;
    }

    /**
     * @param p what proportion of rows to select.
     * @return this builder.
     */
    public Builder p(final double p) {
      Preconditions.checkArgument(p >= 0 && p <= 1, "p must be between 0 and 1");
      this.p = p;
      return this;
    }

    /**
     * @param pOf what the proportion is of.
     * @return this builder.
     */
    public Builder pOf(final ProportionBase pOf) {
      this.pOf = Objects.requireNonNull(pOf, "pOf");
      return this;
    }

    /**
     * @param ascending whether the lowest scores are selected.
     * @return this builder.
     */
    public Builder ascending(final boolean ascending) {
      this.ascending = ascending;
      return this;
    }

    /**
     * @return the selection.
     * @throws ConfigurationException if both a count and a proportion were given.
     */
    public TopSelection build() throws ConfigurationException {
      if (k != null && p != null) {
        throw new ConfigurationException("cannot select both the top " + k + " and the top " + p);
      }
      return new TopSelection(this);
    }
  }
}
