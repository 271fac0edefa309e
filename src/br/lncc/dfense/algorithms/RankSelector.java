/*
 * Copyright (c) 2024 DFENSE Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package br.lncc.dfense.algorithms;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_RANK;

import br.lncc.dfense.helper.InvalidSeriesArgumentException;
import br.lncc.dfense.spectral.SpectralDecomposition;
import br.lncc.dfense.spectral.SpectralThreshold;

import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how many singular triplets of a Hankel matrix carry signal.
 *
 * <p>A caller supplied rank is validated against the window length and used
 * as is. Otherwise the rank is the number of singular values strictly above
 * omega(beta) times their median. That count may be zero, in which case the
 * whole series is treated as noise.
 */
public final class RankSelector {
  private static final Logger logger = LoggerFactory.getLogger(RankSelector.class);

  private RankSelector() {}

  /** Rejects ranks outside [1, window]. */
  public static void checkRank(int rank, int window) {
    InvalidSeriesArgumentException.check(rank >= 1 && rank <= window, INVALID_RANK,
        "rank (%d) must be between 1 and the window length (%d)", rank, window);
  }

  public static int select(SpectralDecomposition decomposition, int window, OptionalInt rank) {
    if (rank.isPresent()) {
      checkRank(rank.getAsInt(), window);
      return rank.getAsInt();
    }
    return select(decomposition.aspectRatio(), decomposition.getSingularValues());
  }

  /** Number of singular values above the unknown-noise threshold. */
  public static int select(double beta, double[] singularValues) {
    double threshold = SpectralThreshold.threshold(beta, singularValues);
    int rank = 0;
    for (double s : singularValues) {
      if (s > threshold) {
        rank++;
      }
    }

    if (rank == 0) {
      logger.warn("No singular value exceeds the threshold {} (beta={}); "
          + "the series is reconstructed as zeros", threshold, beta);
    } else {
      logger.debug("Selected rank {} of {} with threshold {} (beta={})",
          rank, singularValues.length, threshold, beta);
    }
    return rank;
  }
}
