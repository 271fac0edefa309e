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

package br.lncc.dfense.helper;

/**
 * Thrown when a series or an algorithm parameter is rejected before any
 * numerical work starts. The {@link Reason} tells callers which precondition
 * failed, so a batch driver can report it per series.
 */
public class InvalidSeriesArgumentException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    INVALID_SERIES,
    INVALID_WINDOW,
    INVALID_RANK,
    INVALID_ASPECT_RATIO,
    INVALID_SMOOTHING_CONFIG,
    INVALID_FILTER
  }

  private final Reason reason;

  public InvalidSeriesArgumentException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * Throws an exception with the given reason when the condition does not
   * hold. The message is only formatted on failure.
   */
  public static void check(boolean condition, Reason reason, String format, Object... args) {
    if (!condition) {
      throw new InvalidSeriesArgumentException(reason, String.format(format, args));
    }
  }
}
