package br.lncc.dfense.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import br.lncc.dfense.helper.ArrayHelper;
import br.lncc.dfense.helper.InvalidSeriesArgumentException;
import br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class RegionalSeriesProcessorTest {
  private static final String[] REGIONS = {"rio_de_janeiro", "sao_paulo"};
  private static final int WEEKS = 104;

  private RegionalSeriesProcessor processor;

  @Before
  public void setUp() {
    processor = new RegionalSeriesProcessor();
  }

  @After
  public void tearDown() {
    processor.close();
  }

  /** Reads one weekly file into a series per field, skipping the epiweek column. */
  private static Map<SurveillanceField, double[]> readRegion(String region) throws IOException {
    InputStream in = RegionalSeriesProcessorTest.class.getResourceAsStream(
        "/series/" + region + ".csv");
    assertNotNull("missing fixture for " + region, in);

    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String[] header = reader.readLine().split(",");
      List<DoubleArrayList> columns = new ArrayList<>();
      for (int i = 1; i < header.length; i++) {
        columns.add(new DoubleArrayList());
      }
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) {
          continue;
        }
        String[] cells = line.split(",");
        for (int i = 1; i < cells.length; i++) {
          columns.get(i - 1).add(Double.parseDouble(cells[i]));
        }
      }

      Map<SurveillanceField, double[]> series = new EnumMap<>(SurveillanceField.class);
      for (int i = 1; i < header.length; i++) {
        series.put(SurveillanceField.fromColumnName(header[i]), columns.get(i - 1).toDoubleArray());
      }
      return series;
    }
  }

  private static Map<SeriesKey, double[]> readBatch() throws IOException {
    Map<SeriesKey, double[]> batch = new LinkedHashMap<>();
    for (String region : REGIONS) {
      for (Map.Entry<SurveillanceField, double[]> e : readRegion(region).entrySet()) {
        batch.put(new SeriesKey(region, e.getKey()), e.getValue());
      }
    }
    return batch;
  }

  @Test
  public void testFixtureBatch() throws IOException {
    Map<SeriesKey, double[]> batch = readBatch();
    assertEquals(REGIONS.length * SurveillanceField.values().length, batch.size());

    Map<SeriesKey, ProcessedSeries> results = processor.process(batch);

    assertEquals(new ArrayList<>(batch.keySet()), new ArrayList<>(results.keySet()));
    for (Map.Entry<SeriesKey, ProcessedSeries> e : results.entrySet()) {
      ProcessedSeries result = e.getValue();
      assertTrue(e.getKey() + " failed", result.isSuccess());
      assertTrue(result.getRank() >= 1);
      assertEquals(WEEKS, result.getValues().length);
      for (double v : result.getValues()) {
        assertTrue(Double.compare(v, 0.0) >= 0);
        if (e.getKey().getField().isIntegerValued()) {
          assertEquals(Math.rint(v), v, 0.0);
        }
      }
    }
  }

  @Test
  public void testTemperatureLevelIsKept() throws IOException {
    double[] raw = readRegion("rio_de_janeiro").get(SurveillanceField.TEMP_MED);
    SeriesKey key = new SeriesKey("rio_de_janeiro", SurveillanceField.TEMP_MED);
    double[] smoothed = processor.processSeries(key, raw).getValues();
    assertEquals(mean(raw), mean(smoothed), 0.5);
  }

  @Test
  public void testRainyDaysAreRounded() throws IOException {
    double[] raw = readRegion("rio_de_janeiro").get(SurveillanceField.RAINY_DAYS);
    SeriesKey key = new SeriesKey("rio_de_janeiro", SurveillanceField.RAINY_DAYS);
    ProcessedSeries result = processor.processSeries(key, raw);

    double[] expected = new SmoothingPipeline()
        .smooth(new SvdDenoiser().denoise(raw).getSeries(), false);
    ArrayHelper.roundHalfAwayFromZero(expected);
    ArrayHelper.clipNegative(expected);

    assertTrue(result.isSuccess());
    assertArrayEquals(expected, result.getValues(), 0.0);
    for (double v : result.getValues()) {
      assertEquals(Math.rint(v), v, 0.0);
    }
  }

  @Test
  public void testMatchesSequentialStages() throws IOException {
    double[] raw = readRegion("sao_paulo").get(SurveillanceField.CASES);
    double[] expected = new SmoothingPipeline()
        .smooth(new SvdDenoiser().denoise(raw).getSeries(), true);

    Map<SeriesKey, double[]> batch = new LinkedHashMap<>();
    SeriesKey key = new SeriesKey("sao_paulo", SurveillanceField.CASES);
    batch.put(key, raw);
    assertArrayEquals(expected, processor.process(batch).get(key).getValues(), 0.0);
  }

  @Test
  public void testFailuresAreIsolated() {
    double[] longSeries = new double[60];
    for (int i = 0; i < longSeries.length; i++) {
      longSeries[i] = 20 + 5 * Math.sin(i / 4.0);
    }
    SeriesKey good = new SeriesKey("a", SurveillanceField.TEMP_MAX);
    SeriesKey tooShort = new SeriesKey("b", SurveillanceField.TEMP_MAX);
    SeriesKey empty = new SeriesKey("c", SurveillanceField.CASES);

    Map<SeriesKey, double[]> batch = new LinkedHashMap<>();
    batch.put(good, longSeries);
    batch.put(tooShort, new double[] {1, 2, 3});
    batch.put(empty, new double[0]);

    Map<SeriesKey, ProcessedSeries> results = processor.process(batch);
    assertTrue(results.get(good).isSuccess());
    assertFalse(results.get(tooShort).isSuccess());
    assertEquals(Reason.INVALID_WINDOW,
        ((InvalidSeriesArgumentException) results.get(tooShort).getFailure()).getReason());
    assertEquals(Reason.INVALID_SERIES,
        ((InvalidSeriesArgumentException) results.get(empty).getFailure()).getReason());
  }

  @Test(expected = IllegalStateException.class)
  public void testFailedResultHasNoValues() {
    SeriesKey key = new SeriesKey("b", SurveillanceField.CASES);
    processor.processSeries(key, new double[] {1, 2, 3}).getValues();
  }

  @Test
  public void testCustomArgs() {
    double[] x = new double[20];
    for (int i = 0; i < x.length; i++) {
      x[i] = i % 2 == 0 ? 10 : 12;
    }
    try (RegionalSeriesProcessor small = new RegionalSeriesProcessor(
        new SvdDenoiser.Args(4, OptionalInt.of(4)), new SmoothingPipeline.Args(1, 0, 1.0), 2)) {
      // full rank, unit filter, unit step: nothing changes
      ProcessedSeries result =
          small.processSeries(new SeriesKey("x", SurveillanceField.PRECIP_TOT), x);
      assertEquals(4, result.getRank());
      assertArrayEquals(x, result.getValues(), 1e-9);
    }
  }

  @Test
  public void testFieldLookup() {
    assertEquals(SurveillanceField.PRECIP_TOT, SurveillanceField.fromColumnName("precip_tot"));
    assertEquals(SurveillanceField.REL_HUMID_MED,
        SurveillanceField.fromColumnName("rel_humid_med"));
    assertEquals(SurveillanceField.THERMAL_RANGE, SurveillanceField.fromColumnName("thermal_range"));
    assertTrue(SurveillanceField.CASES.isIntegerValued());
    assertTrue(SurveillanceField.RAINY_DAYS.isIntegerValued());
    assertFalse(SurveillanceField.PRESSURE_MED.isIntegerValued());
    assertFalse(SurveillanceField.TEMP_MIN.isIntegerValued());
    assertEquals("rj/cases", new SeriesKey("rj", SurveillanceField.CASES).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownField() {
    SurveillanceField.fromColumnName("wind_speed");
  }

  private static double mean(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }
}
