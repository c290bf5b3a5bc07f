/*
 * Copyright (c) 2025 The findcont Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.findcont.modules.dataprocessing.contdet_amendmask;

/**
 * Empirically tuned thresholds of one decision rule. Poor atmospheric transmission raises all of
 * them.
 *
 * @param snr    minimum map SNR for a yes
 * @param floor  minimum significance in scaled MADs of the pixel level
 * @param cubeSnr cube SNR for YesCube (amend) or required for a yes (only extra), NaN if unused
 */
public record DecisionThresholds(double snr, double floor, double cubeSnr) {

  public static final DecisionThresholds AMEND_GOOD = new DecisionThresholds(6.0, 4.5, 7.5);
  public static final DecisionThresholds AMEND_POOR = new DecisionThresholds(7.0, 5.0, 8.5);
  public static final DecisionThresholds EXTRA_GOOD = new DecisionThresholds(5.0, 4.0, Double.NaN);
  public static final DecisionThresholds EXTRA_POOR = new DecisionThresholds(6.0, 4.5, Double.NaN);
  public static final DecisionThresholds ONLY_EXTRA_GOOD = new DecisionThresholds(5.5, 4.5, 5.0);
  public static final DecisionThresholds ONLY_EXTRA_POOR = new DecisionThresholds(6.5, 5.0, 6.0);

  public static DecisionThresholds of(DecisionRule rule, boolean goodAtmosphere) {
    return switch (rule) {
      case AMEND_MASK -> goodAtmosphere ? AMEND_GOOD : AMEND_POOR;
      case EXTRA_MASK -> goodAtmosphere ? EXTRA_GOOD : EXTRA_POOR;
      case ONLY_EXTRA_MASK -> goodAtmosphere ? ONLY_EXTRA_GOOD : ONLY_EXTRA_POOR;
    };
  }
}
