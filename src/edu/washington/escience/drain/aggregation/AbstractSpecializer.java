package edu.washington.escience.drain.aggregation;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableSource;

/**
 * Holds and checks the argument declarations shared by every {@link Specializer}.
 */
public abstract class AbstractSpecializer implements Specializer {
  /** The input data. */
  private final TableSource input;
  /** The space of units. */
  private final ArgumentSpace argumentSpace;
  /** Arguments an aggregator depends on. */
  private final ImmutableList<String> aggregatorArgs;
  /** Arguments forming the result key. */
  private final ImmutableList<String> concatArgs;
  /** Arguments inserted as index levels. */
  private final ImmutableList<String> insertArgs;

  /**
   * @param input the input data.
   * @param argumentSpace the space of units.
   * @param aggregatorArgs arguments an aggregator depends on.
   * @param concatArgs arguments forming the result key.
   * @param insertArgs arguments inserted as index levels.
   * @throws ConfigurationException if the argument lists are inconsistent with the space or with each other.
   */
  protected AbstractSpecializer(
      final TableSource input,
      final ArgumentSpace argumentSpace,
      final List<String> aggregatorArgs,
      final List<String> concatArgs,
      final List<String> insertArgs)
      throws ConfigurationException {
    this.input = Objects.requireNonNull(input, "input");
    this.argumentSpace = Objects.requireNonNull(argumentSpace, "argumentSpace");
    this.aggregatorArgs = ImmutableList.copyOf(aggregatorArgs);
    this.concatArgs = ImmutableList.copyOf(concatArgs);
    this.insertArgs = ImmutableList.copyOf(insertArgs);

    List<String> dimensions = argumentSpace.getDimensions();
    if (!dimensions.contains(DrainConstants.INDEX)) {
      throw new ConfigurationException(
          "argument space " + dimensions + " has no " + DrainConstants.INDEX + " dimension");
    }
    checkDeclared("aggregator", this.aggregatorArgs, dimensions);
    checkDeclared("concat", this.concatArgs, dimensions);
    checkDeclared("insert", this.insertArgs, dimensions);
    for (String name : this.insertArgs) {
      if (this.concatArgs.contains(name)) {
        throw new ConfigurationException(
            "argument " + name + " cannot both split result groups and be inserted into them");
      }
    }
  }

  /**
   * @param role what the arguments are used for, for error messages.
   * @param args the arguments.
   * @param dimensions the declared dimensions.
   * @throws ConfigurationException if an argument is undeclared or repeated.
   */
  private static void checkDeclared(
      final String role, final List<String> args, final List<String> dimensions)
      throws ConfigurationException {
    Set<String> seen = new HashSet<>();
    for (String name : args) {
      if (!dimensions.contains(name)) {
        throw new ConfigurationException(
            role + " argument " + name + " is not one of the dimensions " + dimensions);
      }
      if (!seen.add(name)) {
        throw new ConfigurationException(role + " argument " + name + " is repeated");
      }
    }
  }

  @Override
  public final TableSource getInput() {
    return input;
  }

  /**
   * @return the table produced by the input.
   * @throws DrainException if the input fails.
   */
  protected final Table getInputTable() throws DrainException {
    return input.getResult();
  }

  @Override
  public final ArgumentSpace getArgumentSpace() {
    return argumentSpace;
  }

  @Override
  public final List<String> getAggregatorArgs() {
    return aggregatorArgs;
  }

  @Override
  public final List<String> getConcatArgs() {
    return concatArgs;
  }

  @Override
  public final List<String> getInsertArgs() {
    return insertArgs;
  }
}
