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

import com.google.common.base.Preconditions;

/**
 * Outcome of processing one series in a batch: either the smoothed values and
 * the denoising rank, or the failure that stopped it.
 */
public final class ProcessedSeries {
  private final SeriesKey key;
  private final double[] values;
  private final int rank;
  private final RuntimeException failure;

  private ProcessedSeries(SeriesKey key, double[] values, int rank, RuntimeException failure) {
    this.key = key;
    this.values = values;
    this.rank = rank;
    this.failure = failure;
  }

  public static ProcessedSeries success(SeriesKey key, double[] values, int rank) {
    return new ProcessedSeries(key, Preconditions.checkNotNull(values), rank, null);
  }

  public static ProcessedSeries failure(SeriesKey key, RuntimeException failure) {
    return new ProcessedSeries(key, null, -1, Preconditions.checkNotNull(failure));
  }

  public SeriesKey getKey() {
    return key;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /** The smoothed series; only for successful results. */
  public double[] getValues() {
    Preconditions.checkState(isSuccess(), "%s failed", key);
    return values;
  }

  /** The truncation rank used by the denoiser; only for successful results. */
  public int getRank() {
    Preconditions.checkState(isSuccess(), "%s failed", key);
    return rank;
  }

  public RuntimeException getFailure() {
    return failure;
  }
}
