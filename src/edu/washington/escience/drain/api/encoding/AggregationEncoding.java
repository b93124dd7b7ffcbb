package edu.washington.escience.drain.api.encoding;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.base.MoreObjects;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.aggregation.Aggregation;
import edu.washington.escience.drain.aggregation.AggregationOptions;
import edu.washington.escience.drain.aggregation.AggregationRunner;
import edu.washington.escience.drain.aggregation.Specializer;
import edu.washington.escience.drain.storage.TableSource;

/**
 * A JSON-able description of an aggregation. To add a new kind, create an encoding class that extends
 * AggregationEncoding and add it to the list of JsonSubTypes below.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @Type(name = "Simple", value = SimpleAggregationEncoding.class),
  @Type(name = "Spacetime", value = SpacetimeAggregationEncoding.class)
})
public abstract class AggregationEncoding extends DrainApiEncoding {
  /** Whether results are grouped by key. Defaults to true. */
  public Boolean concat;
  /** Whether units are partitioned. Defaults to false. */
  public Boolean parallel;
  /** The argument to partition on. Defaults to the kind's natural key. */
  public String partitionKey;

  /**
   * @param input the data to aggregate.
   * @return the specializer described by this encoding.
   * @throws ConfigurationException if the description is inconsistent.
   */
  public abstract Specializer constructSpecializer(TableSource input) throws ConfigurationException;

  /**
   * @return the options described by this encoding.
   */
  public AggregationOptions getOptions() {
    return new AggregationOptions(
        MoreObjects.firstNonNull(concat, Boolean.TRUE),
        MoreObjects.firstNonNull(parallel, Boolean.FALSE),
        partitionKey);
  }

  /**
   * Validate this encoding and build the aggregation it describes.
   *
   * @param input the data to aggregate.
   * @param runner runs partitions.
   * @return the aggregation.
   * @throws ConfigurationException if the description is incomplete or inconsistent.
   */
  public Aggregation construct(final TableSource input, final AggregationRunner runner)
      throws ConfigurationException {
    validate();
    return new Aggregation(constructSpecializer(input), getOptions(), runner);
  }
}
