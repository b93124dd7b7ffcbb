package edu.washington.escience.drain.window;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.CrimeFixtures;
import edu.washington.escience.drain.storage.Table;

public class DateWindowsTest {

  @Test
  public void testSelectIsHalfOpen() throws Exception {
    Table crimes = CrimeFixtures.crimes();
    Table day = DateWindows.select(crimes, "Date", CrimeFixtures.DEC_31, Delta.parse("1d"));
    assertEquals(
        ImmutableList.of((Object) CrimeFixtures.at(2015, 12, 30, 6), CrimeFixtures.at(2015, 12, 30, 20)),
        day.getColumn("Date"));

    /* a window starting exactly on an event includes it */
    Table halfDay = DateWindows.select(crimes, "Date", CrimeFixtures.at(2015, 12, 30, 18), Delta.parse("12h"));
    assertEquals(ImmutableList.of((Object) CrimeFixtures.at(2015, 12, 30, 6)), halfDay.getColumn("Date"));

    /* and one ending exactly on an event excludes it */
    Table before = DateWindows.select(crimes, "Date", CrimeFixtures.at(2015, 12, 30, 20), Delta.parse("1h"));
    assertEquals(0, before.numTuples());
  }

  @Test
  public void testSelectAll() throws Exception {
    Table all = DateWindows.select(CrimeFixtures.crimes(), "Date", CrimeFixtures.DEC_31, Delta.parse("all"));
    assertEquals(4, all.numTuples());
  }

  @Test
  public void testCensor() throws Exception {
    Map<String, List<String>> censor = ImmutableMap.<String, List<String>>of("ArrestDate", ImmutableList.of("Arrest"));
    Table censored = DateWindows.censor(CrimeFixtures.crimes(), censor, CrimeFixtures.DEC_30);
    List<Object> arrests = censored.getColumn("Arrest");
    assertEquals(Boolean.TRUE, arrests.get(0));
    /* arrested after the reference date */
    assertNull(arrests.get(1));
    /* never arrested */
    assertNull(arrests.get(2));
    assertNull(arrests.get(3));
    assertEquals(CrimeFixtures.crimes().getColumn("PrimaryType"), censored.getColumn("PrimaryType"));
  }

  @Test(expected = ConfigurationException.class)
  public void testSelectOnNonDate() throws Exception {
    DateWindows.select(CrimeFixtures.crimes(), "District", CrimeFixtures.DEC_31, Delta.parse("1d"));
  }

  @Test(expected = ConfigurationException.class)
  public void testCensorMissingColumn() throws Exception {
    DateWindows.censor(
        CrimeFixtures.crimes(),
        ImmutableMap.<String, List<String>>of("ArrestDate", ImmutableList.of("Beat")),
        CrimeFixtures.DEC_30);
  }
}
