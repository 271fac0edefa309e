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

import java.util.Objects;

/** Identifies one series of a batch: a region and one of its fields. */
public final class SeriesKey {
  private final String region;
  private final SurveillanceField field;

  public SeriesKey(String region, SurveillanceField field) {
    this.region = Preconditions.checkNotNull(region, "region");
    this.field = Preconditions.checkNotNull(field, "field");
  }

  public String getRegion() {
    return region;
  }

  public SurveillanceField getField() {
    return field;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesKey)) {
      return false;
    }
    SeriesKey other = (SeriesKey) o;
    return region.equals(other.region) && field == other.field;
  }

  @Override
  public int hashCode() {
    return Objects.hash(region, field);
  }

  @Override
  public String toString() {
    return region + "/" + field.getColumnName();
  }
}
