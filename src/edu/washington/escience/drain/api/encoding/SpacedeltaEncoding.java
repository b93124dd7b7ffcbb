package edu.washington.escience.drain.api.encoding;

import java.util.List;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.aggregation.Spacedelta;
import edu.washington.escience.drain.window.Delta;

/** JSON wrapper for a spacedelta. */
public class SpacedeltaEncoding extends DrainApiEncoding {
  /** The grouping columns. */
  @Required public IndexSpec index;
  /** The window lengths. */
  @Required public List<Delta> deltas;

  @Override
  protected void validateExtra() throws ConfigurationException {
    if (deltas.isEmpty()) {
      throw new ConfigurationException("a spacedelta needs at least one delta");
    }
  }

  /**
   * @return the spacedelta.
   */
  public Spacedelta construct() {
    return new Spacedelta(index, deltas);
  }
}
