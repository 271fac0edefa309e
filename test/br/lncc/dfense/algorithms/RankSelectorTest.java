package br.lncc.dfense.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import br.lncc.dfense.helper.InvalidSeriesArgumentException;
import br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason;
import br.lncc.dfense.spectral.SpectralDecomposition;
import br.lncc.dfense.spectral.SpectralThreshold;
import br.lncc.dfense.timeseries.HankelEmbedding;

import java.util.OptionalInt;

import org.junit.Test;

public class RankSelectorTest {

  @Test
  public void testSingleDominantValue() {
    // threshold = 2.858 * median(1) = 2.858
    assertEquals(1, RankSelector.select(1.0, new double[] {10, 1, 1, 1, 0.5}));
  }

  @Test
  public void testTwoDominantValues() {
    assertEquals(2, RankSelector.select(1.0, new double[] {10, 5, 1, 1, 1}));
  }

  @Test
  public void testFlatSpectrumIsNoise() {
    assertEquals(0, RankSelector.select(0.5, new double[] {2, 2, 2, 2}));
  }

  @Test
  public void testValueOnThresholdIsDropped() {
    double omega = SpectralThreshold.unknownNoiseCoefficient(1.0);
    assertEquals(0, RankSelector.select(1.0, new double[] {omega, 1, 1}));
  }

  @Test
  public void testSuppliedRankWins() {
    SpectralDecomposition svd =
        SpectralDecomposition.of(HankelEmbedding.embed(new double[] {1, 2, 3, 4, 5, 6}, 3));
    assertEquals(3, RankSelector.select(svd, 3, OptionalInt.of(3)));
    assertEquals(1, RankSelector.select(svd, 3, OptionalInt.empty()));
  }

  @Test
  public void testSuppliedRankChecked() {
    SpectralDecomposition svd =
        SpectralDecomposition.of(HankelEmbedding.embed(new double[] {1, 2, 3, 4, 5, 6}, 3));
    for (int rank : new int[] {0, -1, 4}) {
      try {
        RankSelector.select(svd, 3, OptionalInt.of(rank));
        fail("accepted rank " + rank);
      } catch (InvalidSeriesArgumentException e) {
        assertEquals(Reason.INVALID_RANK, e.getReason());
      }
    }
  }
}
