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

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_WINDOW;

import br.lncc.dfense.helper.ArrayHelper;
import br.lncc.dfense.helper.InvalidSeriesArgumentException;
import br.lncc.dfense.spectral.SpectralDecomposition;
import br.lncc.dfense.timeseries.DiagonalAverager;
import br.lncc.dfense.timeseries.HankelEmbedding;

import java.util.OptionalInt;

import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes noise from a series with a truncated SVD of its Hankel matrix
 * (singular spectrum analysis with an automatic rank).
 *
 * <ol>
 *   <li>embed the series into an (N - w + 1) x w Hankel matrix;</li>
 *   <li>decompose it and keep the top r singular triplets, r given by the
 *       caller or picked by the Gavish-Donoho threshold;</li>
 *   <li>average the anti-diagonals of the low rank matrix back into a series.</li>
 * </ol>
 *
 * <p>Instances hold only their immutable {@link Args} and may be shared
 * between threads.
 */
public final class SvdDenoiser {
  private static final Logger logger = LoggerFactory.getLogger(SvdDenoiser.class);

  /** One year of weekly samples. */
  public static final int DEFAULT_WINDOW = 52;

  public static final class Args {
    /** Hankel window length (number of columns). */
    final int window;

    /** Truncation rank; empty to select it from the spectrum. */
    final OptionalInt rank;

    public Args() {
      this(DEFAULT_WINDOW, OptionalInt.empty());
    }

    public Args(int window) {
      this(window, OptionalInt.empty());
    }

    public Args(int window, OptionalInt rank) {
      InvalidSeriesArgumentException.check(window >= 1, INVALID_WINDOW,
          "window (%d) must be positive", window);
      if (rank.isPresent()) {
        RankSelector.checkRank(rank.getAsInt(), window);
      }
      this.window = window;
      this.rank = rank;
    }

    public int getWindow() {
      return window;
    }

    public OptionalInt getRank() {
      return rank;
    }
  }

  private final Args args;

  public SvdDenoiser() {
    this(new Args());
  }

  public SvdDenoiser(Args args) {
    this.args = args;
  }

  public Args getArgs() {
    return args;
  }

  /** Denoises one series. */
  public static DenoiseResult denoise(double[] series, int window, OptionalInt rank) {
    return new SvdDenoiser(new Args(window, rank)).denoise(series);
  }

  /**
   * Denoises one series with this instance's window and rank.
   *
   * @return the denoised series, same length as the input, and the rank used
   */
  public DenoiseResult denoise(double[] series) {
    ArrayHelper.checkSeries(series);
    HankelEmbedding.checkWindow(series.length, args.window);

    DenseMatrix64F hankel = HankelEmbedding.embed(series, args.window);
    SpectralDecomposition decomposition = SpectralDecomposition.of(hankel);
    int rank = RankSelector.select(decomposition, args.window, args.rank);

    DenseMatrix64F denoised = decomposition.reconstruct(rank);
    double[] result = DiagonalAverager.average(denoised, series.length);

    logger.debug("Denoised {} samples with window {} at rank {}", series.length, args.window, rank);
    return new DenoiseResult(result, rank);
  }
}
