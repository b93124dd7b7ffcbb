package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TupleUtils;

/**
 * Splits an argument space into independently runnable partitions and merges their results.
 */
public final class Fanout {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Fanout.class);

  /** Utility classes cannot be constructed. */
  private Fanout() {}

  /**
   * @param specializer the specializer whose units are partitioned.
   * @param key the argument to partition on.
   * @return one descriptor per distinct value of the argument, in unit order.
   * @throws ConfigurationException if the argument is not a dimension of the specializer.
   */
  public static List<PartitionDescriptor> partition(final Specializer specializer, final String key)
      throws ConfigurationException {
    if (!specializer.getArgumentSpace().getDimensions().contains(key)) {
      throw new ConfigurationException(
          "cannot partition on "
              + key
              + ", which is not one of "
              + specializer.getArgumentSpace().getDimensions());
    }
    Set<Object> values = new LinkedHashSet<>();
    for (AggregationUnit unit : specializer.getArgumentSpace().getUnits()) {
      values.add(unit.get(key));
    }
    ImmutableList.Builder<PartitionDescriptor> ret = ImmutableList.builder();
    for (Object value : values) {
      ret.add(new PartitionDescriptor(key, value));
    }
    return ret.build();
  }

  /**
   * @param specializer the specializer whose units are partitioned.
   * @param partitions the partitions.
   * @return one narrowed specializer per partition, in order.
   * @throws ConfigurationException if the specializer cannot be partitioned on a descriptor's key.
   */
  public static List<Specializer> narrow(
      final Specializer specializer, final List<PartitionDescriptor> partitions)
      throws ConfigurationException {
    List<Specializer> ret = new ArrayList<>(partitions.size());
    for (PartitionDescriptor partition : partitions) {
      ret.add(specializer.narrow(partition.getKey(), partition.getValue()));
    }
    return ret;
  }

  /**
   * Merge the results of partitions. Ungrouped results are concatenated in partition order. Grouped results are merged
   * by key; when several partitions produce the same key, their tables are stacked in partition order, provided no two
   * of them share an index key.
   *
   * @param results the results of every partition, in partition order.
   * @return the merged result.
   * @throws ConfigurationException if grouped and ungrouped results are mixed, a key's tables overlap, or a key's
   *           tables do not share a schema.
   */
  public static AggregationResult fanin(final List<AggregationResult> results)
      throws ConfigurationException {
    Preconditions.checkArgument(!results.isEmpty(), "nothing to merge");
    boolean grouped = results.get(0).isGrouped();
    for (AggregationResult result : results) {
      if (result.isGrouped() != grouped) {
        throw new ConfigurationException("cannot merge grouped and ungrouped results");
      }
    }
    LOGGER.info("Merging {} partition results", results.size());

    if (!grouped) {
      List<Table> tables = new ArrayList<>();
      for (AggregationResult result : results) {
        tables.addAll(result.getTables());
      }
      return AggregationResult.ungrouped(tables);
    }

    Map<String, List<Table>> merged = new LinkedHashMap<>();
    for (AggregationResult result : results) {
      for (Map.Entry<String, Table> group : result.getGroups().entrySet()) {
        List<Table> members = merged.get(group.getKey());
        if (members == null) {
          members = new ArrayList<>();
          merged.put(group.getKey(), members);
        }
        members.add(group.getValue());
      }
    }
    Map<String, Table> groups = new LinkedHashMap<>();
    for (Map.Entry<String, List<Table>> entry : merged.entrySet()) {
      checkDisjoint(entry.getKey(), entry.getValue());
      groups.put(entry.getKey(), Table.stack(entry.getValue()));
    }
    return AggregationResult.grouped(groups);
  }

  /**
   * @param key the result key.
   * @param members the tables produced for that key by different partitions.
   * @throws ConfigurationException if two members share an index key.
   */
  private static void checkDisjoint(final String key, final List<Table> members)
      throws ConfigurationException {
    if (members.size() < 2) {
      return;
    }
    Set<List<Object>> seen = new HashSet<>();
    for (Table member : members) {
      Set<List<Object>> own = new HashSet<>();
      for (int row = 0; row < member.numTuples(); ++row) {
        own.add(TupleUtils.normalizeAll(member.getIndexKey(row)));
      }
      for (List<Object> indexKey : own) {
        if (!seen.add(indexKey)) {
          throw new ConfigurationException(
              "result key " + key + " is produced by several partitions for index " + indexKey);
        }
      }
    }
  }
}
