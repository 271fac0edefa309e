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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Denoises and smooths every (region, field) series of a batch.
 *
 * <p>Series share no state, so each one is an independent task on a private
 * thread pool. A series that fails validation or numerically is reported in
 * its {@link ProcessedSeries} and the rest of the batch carries on.
 */
public class RegionalSeriesProcessor implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RegionalSeriesProcessor.class);

  private final SvdDenoiser denoiser;
  private final SmoothingPipeline smoother;
  private final int threadPoolSize;
  private ForkJoinPool forkJoinPool;

  public RegionalSeriesProcessor() {
    this(new SvdDenoiser.Args(), new SmoothingPipeline.Args(),
        Runtime.getRuntime().availableProcessors());
  }

  public RegionalSeriesProcessor(SvdDenoiser.Args denoiserArgs,
      SmoothingPipeline.Args smoothingArgs, int threadPoolSize) {
    Preconditions.checkArgument(threadPoolSize >= 1, "threadPoolSize must be positive");
    this.denoiser = new SvdDenoiser(denoiserArgs);
    this.smoother = new SmoothingPipeline(smoothingArgs);
    this.threadPoolSize = threadPoolSize;
  }

  /**
   * Processes a single series: SVD denoising, then smoothing with rounding for
   * integer valued fields. Never throws for bad input; the failure is
   * returned instead.
   */
  public ProcessedSeries processSeries(SeriesKey key, double[] values) {
    try {
      DenoiseResult denoised = denoiser.denoise(values);
      double[] smoothed = smoother.smooth(denoised.getSeries(), key.getField().isIntegerValued());
      return ProcessedSeries.success(key, smoothed, denoised.getRank());
    } catch (RuntimeException e) {
      logger.error("Failed to process {}: {}", key, e.getMessage(), e);
      return ProcessedSeries.failure(key, e);
    }
  }

  /**
   * Processes all series of the batch in parallel.
   *
   * @return one result per input key, in the iteration order of the input
   */
  public Map<SeriesKey, ProcessedSeries> process(Map<SeriesKey, double[]> batch) {
    List<Map.Entry<SeriesKey, double[]>> entries = new ArrayList<>(batch.entrySet());
    List<ProcessedSeries> results = submitAndJoin(() -> entries.parallelStream()
        .map(e -> processSeries(e.getKey(), e.getValue()))
        .collect(Collectors.toList()));

    Map<SeriesKey, ProcessedSeries> byKey = new LinkedHashMap<>();
    int failed = 0;
    for (ProcessedSeries result : results) {
      byKey.put(result.getKey(), result);
      if (!result.isSuccess()) {
        failed++;
      }
    }
    logger.info("Processed {} series, {} failed", results.size(), failed);
    return byKey;
  }

  private <T> T submitAndJoin(Callable<T> callable) {
    ForkJoinPool pool;
    synchronized (this) {
      if (forkJoinPool == null) {
        forkJoinPool = new ForkJoinPool(threadPoolSize);
      }
      pool = forkJoinPool;
    }
    return pool.submit(callable).join();
  }

  @Override
  public synchronized void close() {
    if (forkJoinPool != null) {
      forkJoinPool.shutdown();
      forkJoinPool = null;
    }
  }
}
