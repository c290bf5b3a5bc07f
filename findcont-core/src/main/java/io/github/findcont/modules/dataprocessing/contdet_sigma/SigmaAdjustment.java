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

package io.github.findcont.modules.dataprocessing.contdet_sigma;

import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassification;
import io.github.findcont.modules.dataprocessing.contdet_sigma.TrendRemover.Trend;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Final classifier pass of a sigma adjustment.
 *
 * @param classification final selection and its diagnostics
 * @param initialSigma   sigma of the first pass
 * @param factor         sigma multiplier of the corrective rerun, 1 for none
 * @param reruns         classifier passes after the first one
 * @param spectrum       spectrum of the final pass, detrended if a trend was removed
 * @param trend          the removed trend or null
 */
public record SigmaAdjustment(@NotNull ChannelClassification classification, double initialSigma,
                              double factor, int reruns, @NotNull Spectrum spectrum,
                              @Nullable Trend trend) {

  public double finalSigma() {
    return classification.sigma();
  }

  public boolean trendRemoved() {
    return trend != null;
  }
}
