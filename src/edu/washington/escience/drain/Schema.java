package edu.washington.escience.drain;

import java.io.Serializable;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.util.DrainUtils;
import net.jcip.annotations.Immutable;

/**
 * Schema describes the names and types of a list of columns, either the value columns or the index levels of a
 * {@link edu.washington.escience.drain.storage.Table}.
 */
@Immutable
public final class Schema implements Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * The regular expression specifying what names are valid. Besides word characters, names may contain the characters
   * of rendered dates and deltas, since joined columns are prefixed with result keys.
   */
  public static final String VALID_NAME_REGEX = "^\\w[\\w.:+\\-]*$";
  /** The regular expression matcher for {@link #VALID_NAME_REGEX}. */
  private static final Pattern VALID_NAME_PATTERN = Pattern.compile(VALID_NAME_REGEX);

  /**
   * Validate a potential column name for use in a Schema. Valid names are given by {@link #VALID_NAME_REGEX}.
   *
   * @param name the candidate column name.
   * @return the supplied name, if it is valid.
   * @throws IllegalArgumentException if the name does not match the regex {@link #VALID_NAME_REGEX}.
   */
  private static String checkName(final String name) {
    Objects.requireNonNull(name, "name");
    Preconditions.checkArgument(
        VALID_NAME_PATTERN.matcher(name).matches(),
        "supplied column name %s does not match the valid name regex %s",
        name,
        VALID_NAME_REGEX);
    return name;
  }

  /**
   * Create a new Schema using an existing Schema and a new column.
   *
   * @param schema the existing schema.
   * @param type the type of the new column.
   * @param name the name of the new column.
   * @return the new Schema.
   */
  public static Schema appendColumn(final Schema schema, final Type type, final String name) {
    List<Type> types =
        ImmutableList.<Type>builder().addAll(schema.getColumnTypes()).add(type).build();
    List<String> names =
        ImmutableList.<String>builder().addAll(schema.getColumnNames()).add(name).build();
    return new Schema(types, names);
  }

  /**
   * Merge two Schemas into one. The result has the columns of the first concatenated with the columns of the second.
   *
   * @param first The Schema with the first columns of the new Schema.
   * @param second The Schema with the last columns of the Schema.
   * @return the new Schema.
   * @throws IllegalArgumentException if the two schemas share a column name.
   */
  public static Schema merge(final Schema first, final Schema second) {
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    types.addAll(first.getColumnTypes()).addAll(second.getColumnTypes());
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    names.addAll(first.getColumnNames()).addAll(second.getColumnNames());
    return new Schema(types.build(), names.build());
  }

  /**
   * @param types the column types.
   * @param names the column names, one per type.
   * @return the schema.
   */
  public static Schema of(final List<Type> types, final List<String> names) {
    return new Schema(types, names);
  }

  /** Column types, in order. */
  private final List<Type> columnTypes;

  /** Column names, parallel to the types. */
  private final List<String> columnNames;

  /**
   * @param columnTypes the column types.
   * @param columnNames the column names, one per type. Names must be valid and distinct.
   */
  public Schema(final List<Type> columnTypes, final List<String> columnNames) {
    Objects.requireNonNull(columnTypes, "columnTypes");
    Objects.requireNonNull(columnNames, "columnNames");
    if (columnTypes.size() != columnNames.size()) {
      throw new IllegalArgumentException(
          "schema has " + columnTypes.size() + " types but " + columnNames.size() + " names");
    }
    DrainUtils.checkHasNoNulls(columnTypes, "columnTypes may not contain null elements");
    DrainUtils.checkHasNoNulls(columnNames, "columnNames may not contain null elements");
    HashSet<String> uniqueNames = new HashSet<>();
    for (String name : columnNames) {
      checkName(name);
      if (!uniqueNames.add(name)) {
        throw new IllegalArgumentException("schema has duplicated column name " + name);
      }
    }
    this.columnTypes = ImmutableList.copyOf(columnTypes);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schema)) {
      return false;
    }
    final Schema other = (Schema) o;
    return columnTypes.equals(other.columnTypes) && columnNames.equals(other.columnNames);
  }

  /**
   * Find the index of the column with a given name.
   *
   * @param name name of the column.
   * @return the index of the column that is first to have the given name.
   * @throws NoSuchElementException if no column with a matching name is found.
   */
  public int columnNameToIndex(final String name) {
    final int ret = columnNames.indexOf(name);
    if (ret == -1) {
      throw new NoSuchElementException("No column named " + name + " found");
    }
    return ret;
  }

  /**
   * @param name name of a column.
   * @return true if this schema has a column with that name.
   */
  public boolean contains(final String name) {
    return columnNames.contains(name);
  }

  /**
   * @param prefix a prefix.
   * @return a schema with the same types whose every column name starts with the prefix.
   */
  public Schema prefixNames(final String prefix) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (String name : columnNames) {
      names.add(prefix + name);
    }
    return new Schema(columnTypes, names.build());
  }

  /**
   * @param index a column position.
   * @return the name of that column.
   */
  public String getColumnName(final int index) {
    return columnNames.get(index);
  }

  /**
   * @return the column names, in order.
   */
  public List<String> getColumnNames() {
    return columnNames;
  }

  /**
   * @param index a column position.
   * @return the type of that column.
   */
  public Type getColumnType(final int index) {
    return columnTypes.get(index);
  }

  /**
   * @param name the name of a column.
   * @return the type of the named column.
   * @throws NoSuchElementException if no column with a matching name is found.
   */
  public Type getColumnType(final String name) {
    return columnTypes.get(columnNameToIndex(name));
  }

  /**
   * @return the column types, in order.
   */
  public List<Type> getColumnTypes() {
    return columnTypes;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(new Object[] {columnNames, columnTypes});
  }

  /**
   * @return the number of columns in this Schema
   */
  public int numColumns() {
    return columnTypes.size();
  }

  /**
   * @return the columns as <code>name (TYPE)</code>, comma separated.
   */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < columnTypes.size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columnNames.get(i)).append(" (").append(columnTypes.get(i)).append(')');
    }
    return sb.toString();
  }

  /**
   * The empty schema.
   */
  public static final Schema EMPTY_SCHEMA =
      Schema.of(ImmutableList.<Type>of(), ImmutableList.<String>of());

  /**
   * Construct a Schema from a list of {@link Type} and {@link String} objects. The types and names may be interleaved
   * in any order; ordering within types and within names is preserved.
   *
   * @param fields any number of {@link Type} or {@link String} objects.
   * @return the {@link Schema} containing these objects.
   */
  public static Schema ofFields(final Object... fields) {
    ImmutableList.Builder<Type> typesB = ImmutableList.builder();
    ImmutableList.Builder<String> namesB = ImmutableList.builder();
    for (Object o : fields) {
      Objects.requireNonNull(o, "field cannot be null");
      if (o instanceof Type) {
        typesB.add((Type) o);
      } else if (o instanceof String) {
        namesB.add((String) o);
      } else {
        throw new IllegalArgumentException(
            "fields must be either "
                + Type.class.getCanonicalName()
                + " or "
                + String.class.getCanonicalName()
                + ", not "
                + o.getClass().getCanonicalName());
      }
    }
    return Schema.of(typesB.build(), namesB.build());
  }
}
