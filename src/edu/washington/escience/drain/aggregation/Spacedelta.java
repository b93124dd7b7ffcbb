package edu.washington.escience.drain.aggregation;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.util.DrainUtils;
import edu.washington.escience.drain.window.Delta;
import net.jcip.annotations.Immutable;

/**
 * One index together with the window lengths to aggregate it over.
 */
@Immutable
public final class Spacedelta implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The physical index. */
  private final IndexSpec index;
  /** The window lengths. */
  private final ImmutableList<Delta> deltas;

  /**
   * @param index the physical index.
   * @param deltas the window lengths. There must be at least one.
   */
  public Spacedelta(final IndexSpec index, final List<Delta> deltas) {
    this.index = Objects.requireNonNull(index, "index");
    DrainUtils.checkHasNoNulls(deltas, "deltas");
    Preconditions.checkArgument(!deltas.isEmpty(), "a spacedelta needs at least one delta");
    this.deltas = ImmutableList.copyOf(deltas);
  }

  /**
   * @param index the physical index.
   * @param deltas the window lengths, as text.
   * @return the spacedelta.
   */
  public static Spacedelta of(final IndexSpec index, final String... deltas) {
    ImmutableList.Builder<Delta> parsed = ImmutableList.builder();
    for (String d : deltas) {
      parsed.add(Delta.parse(d));
    }
    return new Spacedelta(index, parsed.build());
  }

  /**
   * @return the physical index.
   */
  public IndexSpec getIndex() {
    return index;
  }

  /**
   * @return the window lengths.
   */
  public List<Delta> getDeltas() {
    return deltas;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof Spacedelta)) {
      return false;
    }
    Spacedelta other = (Spacedelta) o;
    return index.equals(other.index) && deltas.equals(other.deltas);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, deltas);
  }

  @Override
  public String toString() {
    return "(" + index + ", " + deltas + ")";
  }
}
