package edu.washington.escience.drain.agg;

import java.io.Serializable;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.storage.Table;

/**
 * An aggregate statistic over a group of rows. One aggregate may emit several columns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @Type(value = CountAggregate.class, name = "Count"),
  @Type(value = PrimitiveAggregate.class, name = "Primitive")
})
public interface Aggregate extends Serializable {
  /**
   * @param input the table that will be aggregated.
   * @return the names and types of the columns this aggregate emits.
   * @throws ConfigurationException if the input lacks a column this aggregate needs, or has a column of the wrong type.
   */
  @Nonnull
  Schema getOutputSchema(Table input) throws ConfigurationException;

  /**
   * @param input the table being aggregated.
   * @param rows the rows of one group.
   * @return one value per output column.
   */
  @Nonnull
  List<Object> evaluate(Table input, int[] rows);
}
