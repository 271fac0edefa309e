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

/**
 * The weekly surveillance and climate fields aggregated per region, with the
 * column names used by the aggregated data files.
 */
public enum SurveillanceField {
  CASES("cases", true),
  TEMP_MIN("temp_min", false),
  TEMP_MED("temp_med", false),
  TEMP_MAX("temp_max", false),
  PRECIP_MIN("precip_min", false),
  PRECIP_MED("precip_med", false),
  PRECIP_MAX("precip_max", false),
  PRECIP_TOT("precip_tot", false),
  PRESSURE_MIN("pressure_min", false),
  PRESSURE_MED("pressure_med", false),
  PRESSURE_MAX("pressure_max", false),
  REL_HUMID_MIN("rel_humid_min", false),
  REL_HUMID_MED("rel_humid_med", false),
  REL_HUMID_MAX("rel_humid_max", false),
  THERMAL_RANGE("thermal_range", false),
  /** Days with rain in the week, 0 to 7. */
  RAINY_DAYS("rainy_days", true);

  private final String columnName;
  private final boolean integerValued;

  SurveillanceField(String columnName, boolean integerValued) {
    this.columnName = columnName;
    this.integerValued = integerValued;
  }

  public String getColumnName() {
    return columnName;
  }

  /** True for counts (cases, rainy days), which are rounded after smoothing. */
  public boolean isIntegerValued() {
    return integerValued;
  }

  public static SurveillanceField fromColumnName(String columnName) {
    for (SurveillanceField field : values()) {
      if (field.columnName.equalsIgnoreCase(columnName)) {
        return field;
      }
    }
    throw new IllegalArgumentException("Unknown column: " + columnName);
  }
}
