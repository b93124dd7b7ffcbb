package edu.washington.escience.drain.window;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.washington.escience.drain.CrimeFixtures;

public class DeltaTest {

  @Test
  public void testUnits() {
    assertEquals(CrimeFixtures.at(2015, 12, 30, 12), Delta.parse("12h").getStart(CrimeFixtures.DEC_31));
    assertEquals(CrimeFixtures.at(2015, 12, 29, 0), Delta.parse("2d").getStart(CrimeFixtures.DEC_31));
    assertEquals(CrimeFixtures.at(2015, 12, 17, 0), Delta.parse("2w").getStart(CrimeFixtures.DEC_31));
    assertEquals(CrimeFixtures.at(2015, 11, 30, 0), Delta.parse("1m").getStart(CrimeFixtures.DEC_30));
    assertEquals(CrimeFixtures.at(2014, 12, 31, 0), Delta.parse("1y").getStart(CrimeFixtures.DEC_31));
  }

  @Test
  public void testAll() {
    Delta all = Delta.parse("all");
    assertTrue(all.isUnbounded());
    assertNull(all.getStart(CrimeFixtures.DEC_31));
    assertFalse(Delta.parse("1d").isUnbounded());
  }

  @Test
  public void testTextIsKept() {
    assertEquals("24h", Delta.parse("24h").toString());
    assertEquals(Delta.parse("24h"), Delta.parse("24h"));
    assertNotEquals(Delta.parse("24h"), Delta.parse("1d"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownUnit() {
    Delta.parse("3s");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoCount() {
    Delta.parse("d");
  }
}
