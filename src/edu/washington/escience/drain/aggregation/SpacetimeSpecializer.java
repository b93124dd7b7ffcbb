package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.IndexLookupException;
import edu.washington.escience.drain.UnimplementedHookException;
import edu.washington.escience.drain.agg.Aggregator;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableSource;
import edu.washington.escience.drain.window.DateWindows;
import edu.washington.escience.drain.window.Delta;

/**
 * Aggregates windows of the input ending at each of a set of dates, over each index of a set of spacedeltas and each of
 * that spacedelta's window lengths. Units range over {@code date}, then spacedelta, then {@code delta}.
 *
 * <p>
 * By default an aggregator depends on the date and delta only, results are grouped by index and delta, and the date
 * becomes an extra index level so that the dates of one group stack together.
 */
public final class SpacetimeSpecializer extends AbstractSpecializer {
  /** The spacedeltas, by index name, in declaration order. */
  private final ImmutableMap<String, Spacedelta> spacedeltas;
  /** The window end dates. */
  private final ImmutableList<DateTime> dates;
  /** The timestamp column windows select on. */
  private final String dateColumn;
  /** Maps a date column to the columns censored by it. */
  private final ImmutableMap<String, List<String>> censorColumns;
  /** Supplies the aggregates of a window. */
  @Nullable private final AggregateProvider aggregateProvider;
  /** Narrows a window to one index. */
  @Nullable private final IndexSliceHook indexSliceHook;

  /**
   * @param builder the configuration.
   * @throws ConfigurationException if the configuration is inconsistent.
   */
  private SpacetimeSpecializer(final Builder builder) throws ConfigurationException {
    super(
        builder.input,
        buildArgumentSpace(builder.spacedeltas, builder.dates),
        builder.aggregatorArgs,
        builder.concatArgs,
        DrainConstants.SPACETIME_INSERT_ARGS);
    for (String required : DrainConstants.DEFAULT_SPACETIME_AGGREGATOR_ARGS) {
      if (!builder.aggregatorArgs.contains(required)) {
        throw new ConfigurationException(
            "aggregator arguments " + builder.aggregatorArgs + " must include " + required);
      }
    }
    spacedeltas = ImmutableMap.copyOf(builder.spacedeltas);
    dates = ImmutableList.copyOf(builder.dates);
    dateColumn = builder.dateColumn;
    censorColumns = ImmutableMap.copyOf(builder.censorColumns);
    aggregateProvider = builder.aggregateProvider;
    indexSliceHook = builder.indexSliceHook;
  }

  /**
   * @param spacedeltas the spacedeltas.
   * @param dates the window end dates.
   * @return the argument space: dates crossed with every (index, delta) pair.
   * @throws ConfigurationException if there are no dates or no spacedeltas.
   */
  private static ArgumentSpace buildArgumentSpace(
      final Map<String, Spacedelta> spacedeltas, final List<DateTime> dates)
      throws ConfigurationException {
    if (dates.isEmpty()) {
      throw new ConfigurationException("a space-time aggregation needs at least one date");
    }
    if (spacedeltas.isEmpty()) {
      throw new ConfigurationException("a space-time aggregation needs at least one spacedelta");
    }
    List<List<Object>> pairs = new ArrayList<>();
    for (Map.Entry<String, Spacedelta> entry : spacedeltas.entrySet()) {
      for (Delta delta : entry.getValue().getDeltas()) {
        pairs.add(ImmutableList.<Object>of(entry.getKey(), delta));
      }
    }
    return ArgumentSpace.of(
        Dimension.of(DrainConstants.DATE, dates),
        Dimension.joint(ImmutableList.of(DrainConstants.INDEX, DrainConstants.DELTA), pairs));
  }

  /**
   * @return a new builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return a builder holding this specializer's configuration.
   */
  public Builder toBuilder() {
    Builder ret = new Builder();
    ret.input = getInput();
    ret.spacedeltas.putAll(spacedeltas);
    ret.dates.addAll(dates);
    ret.dateColumn = dateColumn;
    ret.censorColumns.putAll(censorColumns);
    ret.aggregatorArgs = getAggregatorArgs();
    ret.concatArgs = getConcatArgs();
    ret.aggregateProvider = aggregateProvider;
    ret.indexSliceHook = indexSliceHook;
    return ret;
  }

  /**
   * @return the spacedeltas, by index name.
   */
  public Map<String, Spacedelta> getSpacedeltas() {
    return spacedeltas;
  }

  /**
   * @return the window end dates.
   */
  public List<DateTime> getDates() {
    return dates;
  }

  /**
   * Select the rows of the input inside a window and censor the values not yet known at its end.
   *
   * @param date the end of the window.
   * @param delta the length of the window.
   * @return the window's rows.
   * @throws DrainException if the input fails or the windowing columns are wrong.
   */
  public Table getData(final DateTime date, final Delta delta) throws DrainException {
    Table windowed = DateWindows.select(getInputTable(), dateColumn, date, delta);
    return DateWindows.censor(windowed, censorColumns, date);
  }

  @Override
  public Aggregator buildAggregator(final AggregationUnit arguments) throws DrainException {
    if (aggregateProvider == null) {
      throw new UnimplementedHookException("getAggregates", SpacetimeSpecializer.class);
    }
    DateTime date = (DateTime) arguments.get(DrainConstants.DATE);
    Delta delta = (Delta) arguments.get(DrainConstants.DELTA);
    Table data = getData(date, delta);
    if (arguments.has(DrainConstants.INDEX)) {
      if (indexSliceHook == null) {
        throw new UnimplementedHookException("index-aware getData", SpacetimeSpecializer.class);
      }
      data = indexSliceHook.slice(data, (String) arguments.get(DrainConstants.INDEX));
    }
    return new Aggregator(data, aggregateProvider.getAggregates(date, delta));
  }

  @Override
  public IndexSpec getIndex(final String name) throws IndexLookupException {
    Spacedelta ret = spacedeltas.get(name);
    if (ret == null) {
      throw new IndexLookupException(name);
    }
    return ret.getIndex();
  }

  @Override
  public String getDefaultPartitionKey() {
    return DrainConstants.DATE;
  }

  @Override
  public Specializer narrow(final String key, final Object value) throws ConfigurationException {
    Builder builder = toBuilder();
    if (DrainConstants.DATE.equals(key)) {
      Preconditions.checkArgument(dates.contains(value), "unknown date %s", value);
      builder.dates.clear();
      builder.dates.add((DateTime) value);
    } else if (DrainConstants.INDEX.equals(key)) {
      Preconditions.checkArgument(spacedeltas.containsKey(value), "unknown index %s", value);
      builder.spacedeltas.clear();
      builder.spacedeltas.put((String) value, spacedeltas.get(value));
    } else {
      throw new ConfigurationException(
          "a space-time aggregation can only be partitioned by "
              + DrainConstants.DATE
              + " or "
              + DrainConstants.INDEX
              + ", not "
              + key);
    }
    return builder.build();
  }

  /**
   * Collects the configuration of a {@link SpacetimeSpecializer}.
   */
  public static final class Builder {
    /** The input data. */
    private TableSource input;
    /** The spacedeltas, by index name. */
    private final Map<String, Spacedelta> spacedeltas = new LinkedHashMap<>();
    /** The window end dates. */
    private final List<DateTime> dates = new ArrayList<>();
    /** The timestamp column. */
    private String dateColumn;
    /** The censored columns, by date column. */
    private final Map<String, List<String>> censorColumns = new LinkedHashMap<>();
    /** Arguments an aggregator depends on. */
    private List<String> aggregatorArgs = DrainConstants.DEFAULT_SPACETIME_AGGREGATOR_ARGS;
    /** Arguments forming the result key. */
    private List<String> concatArgs = DrainConstants.DEFAULT_SPACETIME_CONCAT_ARGS;
    /** The aggregate hook. */
    private AggregateProvider aggregateProvider;
    /** The index slice hook. */
    private IndexSliceHook indexSliceHook;

    /** Use {@link SpacetimeSpecializer#builder()}. */
    private Builder() {}

    /**
     * @param input the input data.
     * @return this builder.
     */
    public Builder input(final TableSource input) {
      this.input = input;
      return this;
    }

    /**
     * @param name the index name units refer to.
     * @param spacedelta the index and its window lengths.
     * @return this builder.
     */
    public Builder spacedelta(final String name, final Spacedelta spacedelta) {
      Preconditions.checkArgument(
          !spacedeltas.containsKey(name), "spacedelta %s is declared twice", name);
      spacedeltas.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(spacedelta));
      return this;
    }

    /**
     * @param dates window end dates to add.
     * @return this builder.
     */
    public Builder dates(final List<DateTime> dates) {
      for (DateTime date : dates) {
        this.dates.add(Objects.requireNonNull(date, "date"));
      }
      return this;
    }

    /**
     * @param dates window end dates to add.
     * @return this builder.
     */
    public Builder dates(final DateTime... dates) {
      return dates(ImmutableList.copyOf(dates));
    }

    /**
     * @param dateColumn the timestamp column windows select on.
     * @return this builder.
     */
    public Builder dateColumn(final String dateColumn) {
      this.dateColumn = dateColumn;
      return this;
    }

    /**
     * @param censorColumns maps a date column to the columns that depend on it.
     * @return this builder.
     */
    public Builder censorColumns(final Map<String, List<String>> censorColumns) {
      for (Map.Entry<String, List<String>> entry : censorColumns.entrySet()) {
        this.censorColumns.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
      return this;
    }

    /**
     * @param aggregatorArgs arguments an aggregator depends on. Must include date and delta.
     * @return this builder.
     */
    public Builder aggregatorArgs(final List<String> aggregatorArgs) {
      this.aggregatorArgs = ImmutableList.copyOf(aggregatorArgs);
      return this;
    }

    /**
     * @param concatArgs arguments forming the result key.
     * @return this builder.
     */
    public Builder concatArgs(final List<String> concatArgs) {
      this.concatArgs = ImmutableList.copyOf(concatArgs);
      return this;
    }

    /**
     * @param aggregateProvider supplies the aggregates of each window.
     * @return this builder.
     */
    public Builder aggregates(final AggregateProvider aggregateProvider) {
      this.aggregateProvider = aggregateProvider;
      return this;
    }

    /**
     * @param indexSliceHook narrows each window to one index.
     * @return this builder.
     */
    public Builder indexSlice(final IndexSliceHook indexSliceHook) {
      this.indexSliceHook = indexSliceHook;
      return this;
    }

    /**
     * @return the specializer.
     * @throws ConfigurationException if the configuration is inconsistent.
     */
    public SpacetimeSpecializer build() throws ConfigurationException {
      if (input == null) {
        throw new ConfigurationException("a space-time aggregation needs an input");
      }
      if (dateColumn == null) {
        throw new ConfigurationException("a space-time aggregation needs a date column");
      }
      return new SpacetimeSpecializer(this);
    }
  }
}
