package edu.washington.escience.drain;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class SchemaTest {

  @Test
  public void testConstructionWithNames() {
    List<Type> types = ImmutableList.of(Type.INT_TYPE, Type.LONG_TYPE);
    List<String> names = ImmutableList.of("Mycol0", "Mycol1");
    Schema schema = new Schema(types, names);
    assertEquals(types, schema.getColumnTypes());
    assertEquals(types.size(), schema.numColumns());
    assertEquals(names, schema.getColumnNames());
  }

  @Test(expected = NullPointerException.class)
  public void testConstructionNullTypeInTypes() {
    List<Type> types = Lists.newLinkedList();
    types.add(Type.INT_TYPE);
    types.add(null);
    new Schema(types, ImmutableList.of("Mycol0", "Mycol1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testConstructionDuplicateNames() {
    Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "Mycol0", "Mycol0");
  }

  @Test
  public void testOfFields() {
    Schema schema =
        new Schema(ImmutableList.of(Type.INT_TYPE, Type.LONG_TYPE), ImmutableList.of("a", "b"));
    assertEquals(schema, Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "a", "b"));
    assertEquals(schema, Schema.ofFields("a", Type.INT_TYPE, "b", Type.LONG_TYPE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOfFieldsTooFewNames() {
    Schema.ofFields(Type.INT_TYPE, Type.LONG_TYPE, "Mycol0");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOfFieldsBadType() {
    Schema.ofFields(Type.INT_TYPE, 1, "Mycol0");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadNameWithSpace() {
    Schema.ofFields(Type.INT_TYPE, " Mycol0");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadNameHasSymbol() {
    Schema.ofFields(Type.INT_TYPE, "col$0");
  }

  @Test
  public void testResultKeyNamesAreValid() {
    Schema schema =
        Schema.ofFields(
            Type.LONG_TYPE, "district_12h_count", Type.LONG_TYPE, "2015-12-30T12:00:00.000Z_count");
    assertEquals(2, schema.numColumns());
  }

  @Test
  public void testMergeAndAppend() {
    Schema first = Schema.ofFields(Type.INT_TYPE, "a");
    Schema merged = Schema.merge(first, Schema.ofFields(Type.STRING_TYPE, "b"));
    assertEquals(ImmutableList.of("a", "b"), merged.getColumnNames());
    Schema appended = Schema.appendColumn(merged, Type.DOUBLE_TYPE, "c");
    assertEquals(Type.DOUBLE_TYPE, appended.getColumnType("c"));
    assertEquals(2, appended.columnNameToIndex("c"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMergeRejectsDuplicates() {
    Schema.merge(Schema.ofFields(Type.INT_TYPE, "a"), Schema.ofFields(Type.LONG_TYPE, "a"));
  }

  @Test
  public void testPrefixNamesAndContains() {
    Schema schema = Schema.ofFields(Type.LONG_TYPE, "count").prefixNames("district_12h_");
    assertTrue(schema.contains("district_12h_count"));
    assertFalse(schema.contains("count"));
    assertEquals(Type.LONG_TYPE, schema.getColumnType(0));
  }
}
