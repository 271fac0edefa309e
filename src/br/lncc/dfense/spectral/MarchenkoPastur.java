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

package br.lncc.dfense.spectral;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_ASPECT_RATIO;

import br.lncc.dfense.helper.InvalidSeriesArgumentException;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.integration.LegendreGaussIntegrator;
import org.apache.commons.math.analysis.integration.UnivariateRealIntegrator;

/**
 * The Marchenko-Pastur law: the limiting distribution of the eigenvalues of
 * X'X / n for an m x n matrix X of i.i.d. unit variance noise, with aspect
 * ratio beta = m / n.
 *
 * <p>The density is supported on [(1 - sqrt(beta))^2, (1 + sqrt(beta))^2] and
 * reads sqrt((top - t)(t - bot)) / (2 pi beta t) inside it.
 *
 * <p>Reference: M. Gavish and D. L. Donoho, The Optimal Hard Threshold for
 * Singular Values is 4/sqrt(3), IEEE Trans. Inf. Theory 60(8):5040-5053, 2014.
 */
public class MarchenkoPastur {
  /** The median search stops once the bracket is this narrow. */
  static final double MEDIAN_TOLERANCE = 0.001;
  /** Points evaluated per bisection round, bracket ends included. */
  static final int GRID_POINTS = 5;

  private static final int GAUSS_POINTS = 5;
  private static final int MAX_ITERATIONS = 64;
  private static final double RELATIVE_ACCURACY = 1.0e-10;
  private static final double ABSOLUTE_ACCURACY = 1.0e-14;

  private final double beta;
  private final double bottom;
  private final double top;

  public MarchenkoPastur(double beta) {
    InvalidSeriesArgumentException.check(beta > 0.0 && beta <= 1.0, INVALID_ASPECT_RATIO,
        "aspect ratio %s is outside (0, 1]", beta);
    this.beta = beta;
    double root = Math.sqrt(beta);
    this.bottom = (1.0 - root) * (1.0 - root);
    this.top = (1.0 + root) * (1.0 + root);
  }

  public double getBeta() {
    return beta;
  }

  public double getBottom() {
    return bottom;
  }

  public double getTop() {
    return top;
  }

  /** The density at t; zero outside the open support. */
  public double density(double t) {
    double q = (top - t) * (t - bottom);
    if (q <= 0.0) {
      return 0.0;
    }
    return Math.sqrt(q) / (beta * t) / (2.0 * Math.PI);
  }

  /** Probability mass above x0. */
  public double upperTail(double x0) {
    return upperTail(x0, 0.0);
  }

  /**
   * The integral of t^gamma times the density from x0 to the top of the support.
   * With gamma = 0 this is the probability mass above x0.
   *
   * <p>The integral is taken over the angle theta where
   * t = (top + bot) / 2 - (top - bot) / 2 cos(theta). The square root then
   * becomes (top - bot) / 2 sin(theta) and cancels against dt, so the
   * integrand is smooth on the whole support, including the pole of 1/t at
   * t = 0 when beta = 1.
   */
  public double upperTail(double x0, final double gamma) {
    if (x0 >= top) {
      return 0.0;
    }
    final double center = (top + bottom) / 2.0;
    final double halfWidth = (top - bottom) / 2.0;
    double theta0 = x0 <= bottom ? 0.0 : Math.acos((center - x0) / halfWidth);
    if (theta0 >= Math.PI) {
      return 0.0;
    }

    UnivariateRealFunction integrand = new UnivariateRealFunction() {
      @Override
      public double value(double theta) {
        double t = center - halfWidth * Math.cos(theta);
        if (t <= 0.0) {
          return 0.0;
        }
        double sin = Math.sin(theta);
        double value = halfWidth * halfWidth * sin * sin / (2.0 * Math.PI * beta * t);
        return gamma == 0.0 ? value : Math.pow(t, gamma) * value;
      }
    };

    UnivariateRealIntegrator integrator =
        new LegendreGaussIntegrator(GAUSS_POINTS, MAX_ITERATIONS);
    integrator.setRelativeAccuracy(RELATIVE_ACCURACY);
    integrator.setAbsoluteAccuracy(ABSOLUTE_ACCURACY);
    try {
      return integrator.integrate(integrand, theta0, Math.PI);
    } catch (MathException e) {
      throw new IllegalStateException(
          String.format("Marchenko-Pastur tail integral failed for beta=%s, x0=%s", beta, x0), e);
    }
  }

  /** Probability mass at or below x. */
  public double cumulative(double x) {
    return 1.0 - upperTail(x);
  }

  /**
   * The median of the distribution, found by a coarse grid bisection.
   *
   * <p>Each round samples the cumulative distribution at 5 evenly spaced points
   * of [lo, hi], moves lo to the largest sample below one half and hi to the
   * smallest sample above it. The search ends when hi - lo <= 0.001 or when no
   * sample falls on either side, and returns the bracket midpoint. The grid and
   * tolerance fix the last digits of the threshold coefficient, so they must
   * not be swapped for a sharper root finder.
   */
  public double median() {
    double lo = bottom;
    double hi = top;
    boolean change = true;
    double[] x = new double[GRID_POINTS];
    while (change && hi - lo > MEDIAN_TOLERANCE) {
      change = false;
      for (int i = 0; i < GRID_POINTS; i++) {
        x[i] = lo + (hi - lo) * i / (GRID_POINTS - 1);
      }
      x[GRID_POINTS - 1] = hi;
      double newLo = Double.NEGATIVE_INFINITY;
      double newHi = Double.POSITIVE_INFINITY;
      for (int i = 0; i < GRID_POINTS; i++) {
        double y = cumulative(x[i]);
        if (y < 0.5) {
          newLo = Math.max(newLo, x[i]);
        }
        if (y > 0.5) {
          newHi = Math.min(newHi, x[i]);
        }
      }
      if (newLo != Double.NEGATIVE_INFINITY) {
        lo = newLo;
        change = true;
      }
      if (newHi != Double.POSITIVE_INFINITY) {
        hi = newHi;
        change = true;
      }
    }
    return (hi + lo) / 2.0;
  }
}
